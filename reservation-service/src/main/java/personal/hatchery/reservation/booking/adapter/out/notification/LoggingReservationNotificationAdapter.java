package personal.hatchery.reservation.booking.adapter.out.notification;

import lombok.extern.slf4j.Slf4j;
import personal.hatchery.reservation.booking.application.port.out.ReservationNotificationPort;
import personal.hatchery.reservation.booking.domain.model.ReservationEvent;

/**
 * Logging Reservation Notification Adapter
 * 예약 이벤트를 로그로만 남긴다 (기본값, 로컬 개발)
 */
@Slf4j
public class LoggingReservationNotificationAdapter implements ReservationNotificationPort {

    @Override
    public void publishReservationEvent(ReservationEvent event) {
        log.info("Reservation event: type={}, reservationId={}, resourceId={}, requesterId={}, status={}, start={}, end={}",
                event.type(), event.reservationId(), event.resourceId(), event.requesterId(),
                event.status(), event.start(), event.end());
    }
}
