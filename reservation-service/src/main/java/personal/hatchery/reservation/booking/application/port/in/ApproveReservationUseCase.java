package personal.hatchery.reservation.booking.application.port.in;

import personal.hatchery.reservation.booking.domain.model.Reservation;

/**
 * Approve Reservation UseCase (Input Port)
 * 승인 필요 자원(트레이너 등)의 대기 예약 승인
 */
public interface ApproveReservationUseCase {

    /**
     * PENDING -> CONFIRMED
     *
     * @throws personal.hatchery.reservation.booking.domain.exception.InvalidReservationStateException PENDING 이 아닐 때
     */
    Reservation approve(Long reservationId);
}
