package personal.hatchery.reservation.booking.application.port.out;

import personal.hatchery.reservation.booking.domain.model.Reservation;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Reservation Repository (Output Port)
 * 예약 영속성 포트. 예약 레코드의 정본
 */
public interface ReservationRepository {

    /**
     * 저장. ID 가 없으면 새 ID 를 할당한다 (재사용하지 않음)
     */
    Reservation save(Reservation reservation);

    Optional<Reservation> findById(Long reservationId);

    /**
     * 자원의 활성(PENDING/CONFIRMED) 예약
     */
    List<Reservation> findActiveByResourceId(String resourceId);

    /**
     * 자원의 활성 예약 중 [from, to) 와 겹치는 것
     */
    List<Reservation> findActiveOverlapping(String resourceId, Instant from, Instant to);

    /**
     * 전체 활성 예약 (인덱스 초기 적재용)
     */
    List<Reservation> findAllActive();

    /**
     * 요청자의 전체 예약 (모든 상태, 최신순)
     */
    List<Reservation> findByRequesterId(String requesterId);
}
