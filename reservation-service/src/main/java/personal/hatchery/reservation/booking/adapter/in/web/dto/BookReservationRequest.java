package personal.hatchery.reservation.booking.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import personal.hatchery.reservation.booking.application.port.in.BookReservationCommand;

import java.time.Instant;

/**
 * 예약 요청 DTO
 * start >= end 는 검증 오류가 아니라 INVALID_SLOT 거절 결과로 응답한다
 */
public record BookReservationRequest(
        @NotBlank(message = "자원 ID는 필수입니다.")
        String resourceId,

        @NotNull(message = "시작 시각은 필수입니다.")
        Instant start,

        @NotNull(message = "종료 시각은 필수입니다.")
        Instant end
) {
    public BookReservationCommand toCommand(String requesterId) {
        return new BookReservationCommand(resourceId, requesterId, start, end);
    }
}
