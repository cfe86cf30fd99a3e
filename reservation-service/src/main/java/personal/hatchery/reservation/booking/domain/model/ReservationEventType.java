package personal.hatchery.reservation.booking.domain.model;

/**
 * Reservation Event Type
 */
public enum ReservationEventType {
    BOOKED,
    APPROVED,
    CANCELLED,
    RESCHEDULED
}
