package personal.hatchery.reservation.certification.adapter.in.web.dto;

import personal.hatchery.reservation.certification.domain.model.Certification;

import java.time.Instant;

/**
 * 인증 응답 DTO
 */
public record CertificationResponse(
        String userId,
        String resourceId,
        Instant grantedAt,
        Instant expiresAt
) {
    public static CertificationResponse from(Certification certification) {
        return new CertificationResponse(
                certification.userId(),
                certification.resourceId(),
                certification.grantedAt(),
                certification.expiresAt()
        );
    }
}
