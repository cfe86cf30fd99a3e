package personal.hatchery.reservation.booking.domain.model;

import java.time.Instant;

/**
 * Booking Request
 * 판정 대상 요청 {resource, requester, slot}
 * 구간 유효성은 ConflictDetector 가 판정하므로 원시 시각을 그대로 보관한다.
 */
public record BookingRequest(
        String resourceId,
        String requesterId,
        Instant start,
        Instant end
) {
    public boolean hasWellFormedSlot() {
        return TimeSlot.isWellFormed(start, end);
    }

    /**
     * @throws personal.hatchery.common.exception.BusinessException 구간이 올바르지 않을 때
     */
    public TimeSlot slot() {
        return TimeSlot.of(start, end);
    }
}
