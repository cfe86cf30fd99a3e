package personal.hatchery.reservation.resource.adapter.in.web.dto;

import jakarta.validation.constraints.NotNull;

/**
 * 인증 요구 여부 변경 요청 DTO
 */
public record UpdateCertificationRequirementRequest(
        @NotNull(message = "인증 요구 여부는 필수입니다.")
        Boolean required
) {
}
