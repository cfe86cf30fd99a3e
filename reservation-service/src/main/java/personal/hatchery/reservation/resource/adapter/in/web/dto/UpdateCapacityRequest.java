package personal.hatchery.reservation.resource.adapter.in.web.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * 수용 인원 변경 요청 DTO
 */
public record UpdateCapacityRequest(
        @NotNull(message = "수용 인원은 필수입니다.")
        @Min(value = 1, message = "수용 인원은 1 이상이어야 합니다.")
        Integer capacity
) {
}
