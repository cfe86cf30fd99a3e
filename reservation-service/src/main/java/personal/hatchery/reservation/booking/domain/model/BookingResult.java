package personal.hatchery.reservation.booking.domain.model;

/**
 * Booking Result
 * 예약/일정 변경 요청의 결과
 *
 * @param decision    판정 결과
 * @param reservation 승인 시 확정(또는 승인 대기) 예약, 기록 가능한 거절 시 CANCELLED 감사 레코드, 그 외 null
 */
public record BookingResult(
        Decision decision,
        Reservation reservation
) {
    public static BookingResult admitted(Reservation reservation) {
        return new BookingResult(Decision.admit(), reservation);
    }

    public static BookingResult rejected(RejectionReason reason, Reservation auditRecord) {
        return new BookingResult(Decision.reject(reason), auditRecord);
    }

    public boolean isAdmitted() {
        return decision.admitted();
    }

    public RejectionReason rejectionReason() {
        return decision.reason();
    }
}
