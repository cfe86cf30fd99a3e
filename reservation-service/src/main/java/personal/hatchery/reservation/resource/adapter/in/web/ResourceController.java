package personal.hatchery.reservation.resource.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.hatchery.reservation.resource.adapter.in.web.dto.RegisterResourceRequest;
import personal.hatchery.reservation.resource.adapter.in.web.dto.ResourceResponse;
import personal.hatchery.reservation.resource.adapter.in.web.dto.UpdateCapacityRequest;
import personal.hatchery.reservation.resource.adapter.in.web.dto.UpdateCertificationRequirementRequest;
import personal.hatchery.reservation.resource.application.port.in.GetResourceUseCase;
import personal.hatchery.reservation.resource.application.port.in.RegisterResourceUseCase;
import personal.hatchery.reservation.resource.application.port.in.UpdateResourceUseCase;
import personal.hatchery.reservation.resource.domain.model.ResourceKind;

import java.util.List;

/**
 * Resource API Controller
 * 자원 등록/조회/속성 변경 REST API (Catalog/Admin 협력자용)
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/resources")
@RequiredArgsConstructor
public class ResourceController {

    private final RegisterResourceUseCase registerResourceUseCase;
    private final GetResourceUseCase getResourceUseCase;
    private final UpdateResourceUseCase updateResourceUseCase;

    /**
     * 자원 등록
     * POST /api/v1/resources
     */
    @PostMapping
    public ResponseEntity<ResourceResponse> register(@Valid @RequestBody RegisterResourceRequest request) {
        log.info("Register resource: resourceId={}, kind={}", request.resourceId(), request.kind());

        String resourceId = registerResourceUseCase.register(request.toCommand());
        ResourceResponse response = ResourceResponse.from(getResourceUseCase.getResource(resourceId));

        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    /**
     * 자원 조회
     * GET /api/v1/resources/{resourceId}
     */
    @GetMapping("/{resourceId}")
    public ResponseEntity<ResourceResponse> getResource(@PathVariable String resourceId) {
        return ResponseEntity.ok(ResourceResponse.from(getResourceUseCase.getResource(resourceId)));
    }

    /**
     * 자원 목록 조회
     * GET /api/v1/resources?kind=MACHINE
     */
    @GetMapping
    public ResponseEntity<List<ResourceResponse>> getResources(@RequestParam(required = false) ResourceKind kind) {
        List<ResourceResponse> response = getResourceUseCase.getResources(kind).stream()
                .map(ResourceResponse::from)
                .toList();

        return ResponseEntity.ok(response);
    }

    /**
     * 수용 인원 변경
     * PATCH /api/v1/resources/{resourceId}/capacity
     */
    @PatchMapping("/{resourceId}/capacity")
    public ResponseEntity<ResourceResponse> updateCapacity(
            @PathVariable String resourceId,
            @Valid @RequestBody UpdateCapacityRequest request
    ) {
        log.info("Update capacity: resourceId={}, capacity={}", resourceId, request.capacity());

        return ResponseEntity.ok(ResourceResponse.from(
                updateResourceUseCase.updateCapacity(resourceId, request.capacity())));
    }

    /**
     * 인증 요구 여부 변경
     * PATCH /api/v1/resources/{resourceId}/certification-requirement
     */
    @PatchMapping("/{resourceId}/certification-requirement")
    public ResponseEntity<ResourceResponse> updateCertificationRequirement(
            @PathVariable String resourceId,
            @Valid @RequestBody UpdateCertificationRequirementRequest request
    ) {
        log.info("Update certification requirement: resourceId={}, required={}", resourceId, request.required());

        return ResponseEntity.ok(ResourceResponse.from(
                updateResourceUseCase.setCertificationRequired(resourceId, request.required())));
    }
}
