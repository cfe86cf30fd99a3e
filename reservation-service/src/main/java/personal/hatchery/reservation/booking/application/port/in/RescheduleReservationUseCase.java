package personal.hatchery.reservation.booking.application.port.in;

import personal.hatchery.reservation.booking.domain.model.BookingResult;

import java.time.Instant;

/**
 * Reschedule Reservation UseCase (Input Port)
 */
public interface RescheduleReservationUseCase {

    /**
     * 일정 변경
     * 새 구간을 기존 예약을 제외하고 판정한다. 승인 시 기존 예약 취소와 대체 예약 저장이 한 트랜잭션으로 수행되며,
     * 거절 시 기존 예약은 변경되지 않는다.
     *
     * @throws personal.hatchery.reservation.booking.domain.exception.ReservationNotFoundException 예약이 없을 때
     * @throws personal.hatchery.reservation.booking.domain.exception.InvalidReservationStateException 취소된 예약일 때
     */
    BookingResult reschedule(Long reservationId, Instant newStart, Instant newEnd);
}
