package personal.hatchery.reservation.booking.adapter.in.web.dto;

import personal.hatchery.reservation.booking.domain.model.BookingResult;
import personal.hatchery.reservation.booking.domain.model.RejectionReason;

/**
 * 예약/일정 변경 결과 응답 DTO
 *
 * @param decision    ADMITTED | REJECTED
 * @param reason      거절 사유 (승인 시 null)
 * @param reservation 생성된 예약 또는 감사 레코드 (없으면 null)
 */
public record BookingResultResponse(
        String decision,
        RejectionReason reason,
        ReservationResponse reservation
) {
    public static final String ADMITTED = "ADMITTED";
    public static final String REJECTED = "REJECTED";

    public static BookingResultResponse from(BookingResult result) {
        return new BookingResultResponse(
                result.isAdmitted() ? ADMITTED : REJECTED,
                result.rejectionReason(),
                result.reservation() == null ? null : ReservationResponse.from(result.reservation())
        );
    }
}
