package personal.hatchery.reservation.booking.domain.model;

import personal.hatchery.common.exception.BusinessException;
import personal.hatchery.common.exception.ErrorCode;

import java.time.Duration;
import java.time.Instant;

/**
 * TimeSlot Value Object
 * 반열림 구간 [start, end). start < end 를 항상 만족한다.
 */
public record TimeSlot(
        Instant start,
        Instant end
) {
    public TimeSlot {
        if (!isWellFormed(start, end)) {
            throw new BusinessException(ErrorCode.INVALID_SLOT,
                    String.format("Slot start must be before end: start=%s, end=%s", start, end));
        }
    }

    public static TimeSlot of(Instant start, Instant end) {
        return new TimeSlot(start, end);
    }

    /**
     * 구간 생성 가능 여부 (null 아님, start < end)
     */
    public static boolean isWellFormed(Instant start, Instant end) {
        return start != null && end != null && start.isBefore(end);
    }

    /**
     * 반열림 구간 겹침 판정: max(startA, startB) < min(endA, endB)
     * 끝과 시작이 맞닿은 구간은 겹치지 않는다.
     */
    public boolean overlaps(TimeSlot other) {
        return start.isBefore(other.end) && other.start.isBefore(end);
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }

    public Duration duration() {
        return Duration.between(start, end);
    }
}
