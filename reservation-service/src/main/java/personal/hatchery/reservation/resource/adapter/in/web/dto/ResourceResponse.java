package personal.hatchery.reservation.resource.adapter.in.web.dto;

import personal.hatchery.reservation.resource.domain.model.Resource;
import personal.hatchery.reservation.resource.domain.model.ResourceKind;

/**
 * 자원 조회/등록 응답 DTO
 */
public record ResourceResponse(
        String resourceId,
        String name,
        ResourceKind kind,
        int capacity,
        boolean certificationRequired,
        boolean approvalRequired
) {
    public static ResourceResponse from(Resource resource) {
        return new ResourceResponse(
                resource.id(),
                resource.name(),
                resource.kind(),
                resource.capacity(),
                resource.certificationRequired(),
                resource.approvalRequired()
        );
    }
}
