package personal.hatchery.reservation.booking.domain.model;

/**
 * Reservation Status Enum
 * 예약 상태
 */
public enum ReservationStatus {
    /**
     * 대기 (판정 중이거나 승인 필요 자원의 승인 대기). 수용 인원을 점유한다
     */
    PENDING,

    /**
     * 확정
     */
    CONFIRMED,

    /**
     * 취소 (거절, 사용자 취소, 일정 변경으로 대체됨). 수용 인원을 점유하지 않는다
     */
    CANCELLED;

    public boolean isActive() {
        return this != CANCELLED;
    }
}
