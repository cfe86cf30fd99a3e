package personal.hatchery.reservation.booking.domain.exception;

import personal.hatchery.common.exception.BusinessException;
import personal.hatchery.common.exception.ErrorCode;

/**
 * Resource Lock Lost Exception
 * 커밋 직전 자원 락 소유권이 확인되지 않을 때 발생 (cluster lease 만료 등, 503)
 * 커밋 전에 중단되므로 저장소와 인덱스에는 아무 변경도 적용되지 않는다.
 */
public class ResourceLockLostException extends BusinessException {
    public ResourceLockLostException(String resourceId) {
        super(ErrorCode.RESOURCE_LOCK_LOST,
                String.format("Resource lock no longer held before commit: resourceId=%s", resourceId));
    }
}
