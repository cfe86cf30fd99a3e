package personal.hatchery.reservation.certification.adapter.in.web.dto;

import java.time.Instant;

/**
 * 인증 부여 요청 DTO (본문 생략 가능)
 *
 * @param expiresAt 만료 시각 (ISO-8601, 생략 시 무기한)
 */
public record GrantCertificationRequest(
        Instant expiresAt
) {
}
