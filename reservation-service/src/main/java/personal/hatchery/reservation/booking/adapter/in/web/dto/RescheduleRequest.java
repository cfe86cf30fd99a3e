package personal.hatchery.reservation.booking.adapter.in.web.dto;

import jakarta.validation.constraints.NotNull;

import java.time.Instant;

/**
 * 일정 변경 요청 DTO
 */
public record RescheduleRequest(
        @NotNull(message = "시작 시각은 필수입니다.")
        Instant start,

        @NotNull(message = "종료 시각은 필수입니다.")
        Instant end
) {
}
