package personal.hatchery.reservation.booking.domain.exception;

import personal.hatchery.common.exception.BusinessException;
import personal.hatchery.common.exception.ErrorCode;

import java.time.Duration;

/**
 * Resource Lock Timeout Exception
 * 자원 락을 대기 한도 내에 획득하지 못했을 때 발생 (정책 거절이 아닌 인프라 실패, 503)
 * 아무 변경도 적용되지 않은 상태이므로 재시도해도 안전하다.
 */
public class ResourceLockTimeoutException extends BusinessException {
    public ResourceLockTimeoutException(String resourceId, Duration waitTimeout) {
        super(ErrorCode.RESOURCE_LOCK_TIMEOUT,
                String.format("Resource lock not acquired: resourceId=%s, waitTimeout=%dms",
                        resourceId, waitTimeout.toMillis()));
    }
}
