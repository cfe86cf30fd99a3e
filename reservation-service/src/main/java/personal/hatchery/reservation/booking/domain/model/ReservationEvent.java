package personal.hatchery.reservation.booking.domain.model;

import java.time.Instant;

/**
 * Reservation Event
 * 예약 상태 변경 알림 페이로드
 *
 * @param previousReservationId RESCHEDULED 일 때 대체된 예약 ID
 */
public record ReservationEvent(
        ReservationEventType type,
        Long reservationId,
        String resourceId,
        String requesterId,
        Instant start,
        Instant end,
        ReservationStatus status,
        Long previousReservationId,
        Instant occurredAt
) {
    public static ReservationEvent of(ReservationEventType type, Reservation reservation, Instant occurredAt) {
        return new ReservationEvent(
                type,
                reservation.id(),
                reservation.resourceId(),
                reservation.requesterId(),
                reservation.slot().start(),
                reservation.slot().end(),
                reservation.status(),
                reservation.rescheduledFromId(),
                occurredAt);
    }
}
