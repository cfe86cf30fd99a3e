package personal.hatchery.reservation.booking.adapter.in.web.dto;

import personal.hatchery.reservation.booking.domain.model.Availability;

import java.time.Instant;
import java.util.List;

/**
 * 가용성 조회 응답 DTO
 */
public record AvailabilityResponse(
        String resourceId,
        Instant start,
        Instant end,
        boolean available,
        int capacity,
        int occupied,
        List<ReservationResponse> conflicts
) {
    public static AvailabilityResponse from(Availability availability) {
        return new AvailabilityResponse(
                availability.resourceId(),
                availability.slot().start(),
                availability.slot().end(),
                availability.available(),
                availability.capacity(),
                availability.occupied(),
                availability.conflicts().stream()
                        .map(ReservationResponse::from)
                        .toList()
        );
    }
}
