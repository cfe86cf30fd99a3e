package personal.hatchery.reservation.certification.domain.model;

import personal.hatchery.common.exception.BusinessException;
import personal.hatchery.common.exception.ErrorCode;

import java.time.Instant;

/**
 * Certification Domain Model
 * 사용자와 인증 필요 장비 간의 사용 허가 (불변)
 *
 * @param expiresAt 만료 시각 (null 이면 무기한)
 */
public record Certification(
        Long id,
        String userId,
        String resourceId,
        Instant grantedAt,
        Instant expiresAt
) {
    public Certification {
        if (userId == null || userId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "User ID cannot be null or blank");
        }
        if (resourceId == null || resourceId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Resource ID cannot be null or blank");
        }
        if (grantedAt == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Granted time cannot be null");
        }
        if (expiresAt != null && !expiresAt.isAfter(grantedAt)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Expiration must be after the grant time");
        }
    }

    /**
     * 인증 부여 (정적 팩토리 메서드)
     */
    public static Certification grant(String userId, String resourceId, Instant grantedAt, Instant expiresAt) {
        return new Certification(null, userId, resourceId, grantedAt, expiresAt);
    }

    /**
     * 같은 레코드(id 유지)로 재부여. 만료된 인증 갱신이나 만료 시각 연장에 쓴다
     */
    public Certification renew(Instant grantedAt, Instant expiresAt) {
        return new Certification(id, userId, resourceId, grantedAt, expiresAt);
    }

    /**
     * 주어진 시각에 유효한 인증인지 확인
     */
    public boolean isValidAt(Instant instant) {
        return expiresAt == null || instant.isBefore(expiresAt);
    }
}
