package personal.hatchery.reservation.resource.domain.exception;

import personal.hatchery.common.exception.BusinessException;
import personal.hatchery.common.exception.ErrorCode;

/**
 * Resource Not Found Exception
 * 등록되지 않은 자원을 조회/수정할 때 발생
 */
public class ResourceNotFoundException extends BusinessException {
    public ResourceNotFoundException(String resourceId) {
        super(ErrorCode.RESOURCE_NOT_FOUND, String.format("Resource not found: resourceId=%s", resourceId));
    }
}
