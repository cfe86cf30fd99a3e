package personal.hatchery.reservation.booking.domain.exception;

import personal.hatchery.common.exception.BusinessException;
import personal.hatchery.common.exception.ErrorCode;
import personal.hatchery.reservation.booking.domain.model.ReservationStatus;

/**
 * Invalid Reservation State Exception
 * 허용되지 않은 상태 전이를 시도할 때 발생 (예: CANCELLED 예약의 일정 변경)
 */
public class InvalidReservationStateException extends BusinessException {

    public InvalidReservationStateException(Long reservationId, ReservationStatus current) {
        super(ErrorCode.INVALID_RESERVATION_STATE,
                String.format("Reservation is not active: reservationId=%d, status=%s", reservationId, current));
    }

    public InvalidReservationStateException(Long reservationId, ReservationStatus current, ReservationStatus expected) {
        super(ErrorCode.INVALID_RESERVATION_STATE,
                String.format("Invalid reservation state: reservationId=%d, status=%s, expected=%s",
                        reservationId, current, expected));
    }
}
