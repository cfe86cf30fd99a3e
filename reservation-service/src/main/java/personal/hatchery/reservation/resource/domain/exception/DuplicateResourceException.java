package personal.hatchery.reservation.resource.domain.exception;

import personal.hatchery.common.exception.BusinessException;
import personal.hatchery.common.exception.ErrorCode;

/**
 * Duplicate Resource Exception
 * 이미 존재하는 식별자로 자원을 등록할 때 발생
 */
public class DuplicateResourceException extends BusinessException {
    public DuplicateResourceException(String resourceId) {
        super(ErrorCode.DUPLICATE_RESOURCE, String.format("Resource already exists: resourceId=%s", resourceId));
    }
}
