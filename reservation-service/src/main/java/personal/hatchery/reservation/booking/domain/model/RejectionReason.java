package personal.hatchery.reservation.booking.domain.model;

/**
 * Rejection Reason Enum
 * 예약 거절 사유. 판정 순서대로 나열
 */
public enum RejectionReason {
    /**
     * 자원이 존재하지 않음
     */
    NOT_FOUND,

    /**
     * 시간 구간이 올바르지 않음 (start >= end)
     */
    INVALID_SLOT,

    /**
     * 인증 필요 장비에 대한 인증 없음
     */
    NOT_CERTIFIED,

    /**
     * 겹치는 예약 수가 수용 인원 이상
     */
    CAPACITY_EXCEEDED;

    /**
     * 거절 기록(CANCELLED 예약)을 남길 수 있는 사유인지
     * 자원과 구간이 유효해야 예약 레코드를 만들 수 있다.
     */
    public boolean isRecordable() {
        return this == NOT_CERTIFIED || this == CAPACITY_EXCEEDED;
    }
}
