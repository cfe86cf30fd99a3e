package personal.hatchery.reservation.certification.adapter.in.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.hatchery.reservation.certification.adapter.in.web.dto.AuthorizationResponse;
import personal.hatchery.reservation.certification.adapter.in.web.dto.CertificationResponse;
import personal.hatchery.reservation.certification.adapter.in.web.dto.GrantCertificationRequest;
import personal.hatchery.reservation.certification.application.port.in.CheckCertificationUseCase;
import personal.hatchery.reservation.certification.application.port.in.ManageCertificationUseCase;
import personal.hatchery.reservation.certification.domain.model.Certification;

/**
 * Certification API Controller
 * 장비별 사용자 인증 부여/회수/확인 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/resources/{resourceId}/certifications")
@RequiredArgsConstructor
public class CertificationController {

    private final ManageCertificationUseCase manageCertificationUseCase;
    private final CheckCertificationUseCase checkCertificationUseCase;

    /**
     * 인증 부여 (멱등)
     * PUT /api/v1/resources/{resourceId}/certifications/{userId}
     */
    @PutMapping("/{userId}")
    public ResponseEntity<CertificationResponse> grant(
            @PathVariable String resourceId,
            @PathVariable String userId,
            @RequestBody(required = false) GrantCertificationRequest request
    ) {
        log.info("Grant certification: resourceId={}, userId={}", resourceId, userId);

        Certification certification = manageCertificationUseCase.grant(
                userId, resourceId, request == null ? null : request.expiresAt());

        return ResponseEntity.ok(CertificationResponse.from(certification));
    }

    /**
     * 인증 회수
     * DELETE /api/v1/resources/{resourceId}/certifications/{userId}
     */
    @DeleteMapping("/{userId}")
    public ResponseEntity<Void> revoke(@PathVariable String resourceId, @PathVariable String userId) {
        log.info("Revoke certification: resourceId={}, userId={}", resourceId, userId);

        manageCertificationUseCase.revoke(userId, resourceId);
        return ResponseEntity.noContent().build();
    }

    /**
     * 예약 자격 확인
     * GET /api/v1/resources/{resourceId}/certifications/{userId}
     */
    @GetMapping("/{userId}")
    public ResponseEntity<AuthorizationResponse> check(@PathVariable String resourceId, @PathVariable String userId) {
        boolean authorized = checkCertificationUseCase.isAuthorized(userId, resourceId);
        return ResponseEntity.ok(new AuthorizationResponse(userId, resourceId, authorized));
    }
}
