package personal.hatchery.reservation.booking.adapter.in.web.dto;

import personal.hatchery.reservation.booking.domain.model.RejectionReason;
import personal.hatchery.reservation.booking.domain.model.Reservation;
import personal.hatchery.reservation.booking.domain.model.ReservationStatus;

import java.time.Instant;

/**
 * 예약 조회 응답 DTO
 */
public record ReservationResponse(
        Long reservationId,
        String resourceId,
        String requesterId,
        Instant start,
        Instant end,
        ReservationStatus status,
        RejectionReason rejectionReason,
        Long rescheduledFromId,
        Instant createdAt
) {
    public static ReservationResponse from(Reservation reservation) {
        return new ReservationResponse(
                reservation.id(),
                reservation.resourceId(),
                reservation.requesterId(),
                reservation.slot().start(),
                reservation.slot().end(),
                reservation.status(),
                reservation.rejectionReason(),
                reservation.rescheduledFromId(),
                reservation.createdAt()
        );
    }
}
