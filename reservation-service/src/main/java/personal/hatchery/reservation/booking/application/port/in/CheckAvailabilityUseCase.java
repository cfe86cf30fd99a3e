package personal.hatchery.reservation.booking.application.port.in;

import personal.hatchery.reservation.booking.domain.model.Availability;

import java.time.Instant;

/**
 * Check Availability UseCase (Input Port)
 */
public interface CheckAvailabilityUseCase {

    /**
     * 락 없이 조회한 가용성과 겹치는 예약 목록. 이후 예약 성공을 보장하지 않는다
     */
    Availability checkAvailability(String resourceId, Instant start, Instant end);
}
