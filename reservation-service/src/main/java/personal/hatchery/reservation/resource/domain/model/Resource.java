package personal.hatchery.reservation.resource.domain.model;

import personal.hatchery.common.exception.BusinessException;
import personal.hatchery.common.exception.ErrorCode;

/**
 * Resource Domain Model
 * 예약 대상 자원 도메인 모델 (불변)
 * capacity / 인증 요구 여부 변경은 새 인스턴스를 반환하며 기존 예약에는 영향을 주지 않는다.
 */
public record Resource(
        String id,
        String name,
        ResourceKind kind,
        int capacity,
        boolean certificationRequired,
        boolean approvalRequired
) {
    public Resource {
        if (id == null || id.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Resource ID cannot be null or blank");
        }
        if (name == null || name.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Resource name cannot be null or blank");
        }
        if (kind == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Resource kind cannot be null");
        }
        if (capacity < 1) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Resource capacity must be positive: resourceId=%s, capacity=%d", id, capacity));
        }
    }

    /**
     * 예약 시 인증 확인이 필요한지 여부
     * certificationRequired 플래그는 MACHINE 에서만 의미가 있다.
     */
    public boolean requiresCertification() {
        return kind == ResourceKind.MACHINE && certificationRequired;
    }

    public boolean isMachine() {
        return kind == ResourceKind.MACHINE;
    }

    public boolean isExclusive() {
        return capacity == 1;
    }

    public Resource withCapacity(int newCapacity) {
        return new Resource(id, name, kind, newCapacity, certificationRequired, approvalRequired);
    }

    public Resource withCertificationRequired(boolean required) {
        return new Resource(id, name, kind, capacity, required, approvalRequired);
    }
}
