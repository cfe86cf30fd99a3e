package personal.hatchery.reservation.resource.adapter.in.web.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import personal.hatchery.reservation.resource.application.port.in.RegisterResourceCommand;
import personal.hatchery.reservation.resource.domain.model.ResourceKind;

/**
 * 자원 등록 요청 DTO
 */
public record RegisterResourceRequest(
        @NotBlank(message = "자원 ID는 필수입니다.")
        @Size(max = 64, message = "자원 ID는 64자 이하여야 합니다.")
        String resourceId,

        @Size(max = 200, message = "자원 이름은 200자 이하여야 합니다.")
        String name,

        @NotNull(message = "자원 종류는 필수입니다.")
        ResourceKind kind,

        @NotNull(message = "수용 인원은 필수입니다.")
        @Min(value = 1, message = "수용 인원은 1 이상이어야 합니다.")
        Integer capacity,

        Boolean certificationRequired,

        Boolean approvalRequired
) {
    public RegisterResourceCommand toCommand() {
        return new RegisterResourceCommand(
                resourceId,
                name,
                kind,
                capacity,
                Boolean.TRUE.equals(certificationRequired),
                Boolean.TRUE.equals(approvalRequired));
    }
}
