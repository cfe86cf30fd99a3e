package personal.hatchery.reservation.booking.application.port.in;

import personal.hatchery.reservation.booking.domain.model.Reservation;

import java.time.Instant;
import java.util.List;

/**
 * Get Reservation UseCase (Input Port)
 * 예약 조회 유스케이스
 */
public interface GetReservationUseCase {

    Reservation getReservation(Long reservationId);

    /**
     * 자원의 활성 예약. from/to 가 모두 있으면 [from, to) 와 겹치는 것만
     */
    List<Reservation> getReservationsForResource(String resourceId, Instant from, Instant to);

    /**
     * 요청자의 전체 예약 (모든 상태, 최신순)
     */
    List<Reservation> getReservationsForRequester(String requesterId);
}
