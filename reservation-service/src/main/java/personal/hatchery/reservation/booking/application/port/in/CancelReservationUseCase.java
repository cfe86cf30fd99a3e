package personal.hatchery.reservation.booking.application.port.in;

import personal.hatchery.reservation.booking.domain.model.Reservation;

/**
 * Cancel Reservation UseCase (Input Port)
 */
public interface CancelReservationUseCase {

    /**
     * 예약 취소. 이미 취소된 예약은 그대로 반환한다 (멱등)
     *
     * @throws personal.hatchery.reservation.booking.domain.exception.ReservationNotFoundException 예약이 없을 때
     */
    Reservation cancel(Long reservationId);
}
