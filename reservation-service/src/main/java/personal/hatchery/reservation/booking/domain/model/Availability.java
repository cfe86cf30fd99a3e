package personal.hatchery.reservation.booking.domain.model;

import java.util.List;

/**
 * Availability Snapshot
 * 락 없이 조회한 가용성 (best-effort). 예약 보장이 아니며 구속력 있는 판정은 book 만 제공한다.
 *
 * @param occupied  구간과 겹치는 활성 예약 수
 * @param conflicts 겹치는 활성 예약 (시작 시각 순)
 */
public record Availability(
        String resourceId,
        TimeSlot slot,
        int capacity,
        int occupied,
        List<Reservation> conflicts
) {
    public Availability {
        conflicts = List.copyOf(conflicts);
    }

    public boolean available() {
        return occupied < capacity;
    }

    public int remaining() {
        return Math.max(0, capacity - occupied);
    }
}
