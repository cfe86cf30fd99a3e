package personal.hatchery.reservation.booking.application.port.out;

import personal.hatchery.reservation.booking.domain.model.ReservationEvent;

/**
 * Reservation Notification Port (Output Port)
 * 예약 상태 변경 알림. 락 해제 후 호출되며 실패해도 예약 결과를 되돌리지 않는다
 */
public interface ReservationNotificationPort {

    void publishReservationEvent(ReservationEvent event);
}
