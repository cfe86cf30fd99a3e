package personal.hatchery.reservation.certification.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.hatchery.reservation.certification.application.port.in.CheckCertificationUseCase;
import personal.hatchery.reservation.certification.application.port.in.ManageCertificationUseCase;
import personal.hatchery.reservation.certification.application.port.out.CertificationRepository;
import personal.hatchery.reservation.certification.domain.exception.CertificationNotApplicableException;
import personal.hatchery.reservation.certification.domain.model.Certification;
import personal.hatchery.reservation.resource.application.port.in.GetResourceUseCase;
import personal.hatchery.reservation.resource.domain.model.Resource;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Certification Gate Service
 * 인증 부여/회수 및 예약 자격 판단
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class CertificationGateService implements ManageCertificationUseCase, CheckCertificationUseCase {

    private final CertificationRepository certificationRepository;
    private final GetResourceUseCase getResourceUseCase;
    private final Clock clock;

    @Override
    @Transactional
    public Certification grant(String userId, String machineId, Instant expiresAt) {
        Resource resource = getResourceUseCase.getResource(machineId);
        if (!resource.isMachine()) {
            log.warn("Certification grant rejected for non-machine: resourceId={}, kind={}", machineId, resource.kind());
            throw new CertificationNotApplicableException(machineId, resource.kind());
        }

        Instant now = clock.instant();
        Optional<Certification> existing = certificationRepository.findByUserIdAndResourceId(userId, machineId);
        if (existing.isPresent()) {
            Certification current = existing.get();
            // 유효한 인증에 새 만료 시각 없이 다시 부여하면 no-op
            if (current.isValidAt(now) && (expiresAt == null || expiresAt.equals(current.expiresAt()))) {
                log.debug("Certification already granted (no-op): userId={}, resourceId={}", userId, machineId);
                return current;
            }

            Certification renewed = certificationRepository.save(current.renew(now, expiresAt));
            log.info("Certification renewed: userId={}, resourceId={}, previousExpiresAt={}, expiresAt={}",
                    userId, machineId, current.expiresAt(), expiresAt);
            return renewed;
        }

        // 동시 부여 경쟁은 (user_id, resource_id) 유니크 제약이 막는다
        Certification saved = certificationRepository.save(
                Certification.grant(userId, machineId, now, expiresAt));
        log.info("Certification granted: userId={}, resourceId={}, expiresAt={}", userId, machineId, expiresAt);
        return saved;
    }

    @Override
    @Transactional
    public boolean revoke(String userId, String machineId) {
        long deleted = certificationRepository.deleteByUserIdAndResourceId(userId, machineId);
        if (deleted == 0) {
            log.debug("Certification not present (no-op revoke): userId={}, resourceId={}", userId, machineId);
            return false;
        }

        log.info("Certification revoked: userId={}, resourceId={}", userId, machineId);
        return true;
    }

    @Override
    public boolean isAuthorized(String userId, String machineId) {
        Optional<Resource> resource = getResourceUseCase.findResource(machineId);
        if (resource.isEmpty()) {
            log.debug("Authorization check for unknown resource: resourceId={}", machineId);
            return false;
        }
        if (!resource.get().requiresCertification()) {
            return true;
        }

        Instant now = clock.instant();
        boolean authorized = certificationRepository.findByUserIdAndResourceId(userId, machineId)
                .map(certification -> certification.isValidAt(now))
                .orElse(false);

        log.debug("Certification check: userId={}, resourceId={}, authorized={}", userId, machineId, authorized);
        return authorized;
    }
}
