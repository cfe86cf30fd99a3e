package personal.hatchery.reservation.booking.application.port.in;

import personal.hatchery.reservation.booking.domain.model.BookingResult;

/**
 * Book Reservation UseCase (Input Port)
 * 예약 유스케이스
 */
public interface BookReservationUseCase {

    /**
     * 예약
     * 자원 락 안에서 판정 후 확정(승인 필요 자원은 PENDING) 저장, 또는 거절 결과 반환
     *
     * @param command 예약 커맨드 (resourceId, requesterId, start, end)
     * @return 판정 결과와 예약 레코드
     * @throws personal.hatchery.reservation.booking.domain.exception.ResourceLockTimeoutException 락 대기 한도 초과 시 (503)
     */
    BookingResult book(BookReservationCommand command);
}
