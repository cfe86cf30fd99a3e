package personal.hatchery.reservation.resource.application.port.in;

import personal.hatchery.common.exception.BusinessException;
import personal.hatchery.common.exception.ErrorCode;
import personal.hatchery.reservation.resource.domain.model.Resource;
import personal.hatchery.reservation.resource.domain.model.ResourceKind;

/**
 * Register Resource Command
 * 자원 등록 커맨드
 */
public record RegisterResourceCommand(
        String resourceId,
        String name,
        ResourceKind kind,
        int capacity,
        boolean certificationRequired,
        boolean approvalRequired
) {
    public RegisterResourceCommand {
        if (resourceId == null || resourceId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Resource ID cannot be null or blank");
        }
        if (kind == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Resource kind cannot be null");
        }
    }

    public Resource toResource() {
        String displayName = (name == null || name.isBlank()) ? resourceId : name;
        return new Resource(resourceId, displayName, kind, capacity, certificationRequired, approvalRequired);
    }
}
