package personal.hatchery.reservation.booking.domain.model;

import personal.hatchery.common.exception.BusinessException;
import personal.hatchery.common.exception.ErrorCode;
import personal.hatchery.reservation.booking.domain.exception.InvalidReservationStateException;

import java.time.Instant;

/**
 * Reservation Domain Model
 * 예약 도메인 모델 (불변)
 * 시간 변경은 제자리 수정하지 않는다. 일정 변경은 새 예약을 만들고 기존 예약을 취소한다.
 *
 * @param rejectionReason   정책 거절로 기록된 예약의 사유 (그 외 null)
 * @param rescheduledFromId 이 예약이 대체한 이전 예약 ID (nullable)
 */
public record Reservation(
        Long id,
        String resourceId,
        String requesterId,
        TimeSlot slot,
        ReservationStatus status,
        RejectionReason rejectionReason,
        Long rescheduledFromId,
        Instant createdAt) {
    public Reservation {
        if (resourceId == null || resourceId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Resource ID cannot be null or blank");
        }
        if (requesterId == null || requesterId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Requester ID cannot be null or blank");
        }
        if (slot == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Time slot cannot be null");
        }
        if (status == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Reservation status cannot be null");
        }
        if (createdAt == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Creation time cannot be null");
        }
    }

    /**
     * 예약 생성 (정적 팩토리 메서드)
     *
     * @return 새로운 예약 (PENDING 상태, ID 미할당)
     */
    public static Reservation pending(String resourceId, String requesterId, TimeSlot slot, Instant now) {
        return new Reservation(null, resourceId, requesterId, slot, ReservationStatus.PENDING, null, null, now);
    }

    /**
     * 일정 변경용 대체 예약 생성 (PENDING 상태)
     */
    public Reservation replacementFor(TimeSlot newSlot, Instant now) {
        return new Reservation(null, resourceId, requesterId, newSlot, ReservationStatus.PENDING, null, id, now);
    }

    /**
     * 예약 확정 (PENDING -> CONFIRMED)
     */
    public Reservation confirm() {
        ensurePending();
        return withStatus(ReservationStatus.CONFIRMED, null);
    }

    /**
     * 정책 거절 (PENDING -> CANCELLED)
     * 감사 기록으로 남지만 수용 인원에는 포함되지 않는다.
     */
    public Reservation reject(RejectionReason reason) {
        ensurePending();
        return withStatus(ReservationStatus.CANCELLED, reason);
    }

    /**
     * 예약 취소 (PENDING/CONFIRMED -> CANCELLED)
     */
    public Reservation cancel() {
        ensureActive();
        return withStatus(ReservationStatus.CANCELLED, null);
    }

    public boolean isPending() {
        return status == ReservationStatus.PENDING;
    }

    public boolean isConfirmed() {
        return status == ReservationStatus.CONFIRMED;
    }

    public boolean isCancelled() {
        return status == ReservationStatus.CANCELLED;
    }

    /**
     * 수용 인원을 점유하는 상태인지 (PENDING 또는 CONFIRMED)
     */
    public boolean isActive() {
        return status.isActive();
    }

    // ========== Domain Validation Methods (Tell, Don't Ask) ==========

    /**
     * PENDING 상태 검증
     *
     * @throws InvalidReservationStateException PENDING 상태가 아닐 때
     */
    public void ensurePending() {
        if (!isPending()) {
            throw new InvalidReservationStateException(id, status, ReservationStatus.PENDING);
        }
    }

    /**
     * 활성 상태 검증 (CANCELLED 에서는 어떤 전이도 불가)
     *
     * @throws InvalidReservationStateException CANCELLED 상태일 때
     */
    public void ensureActive() {
        if (!isActive()) {
            throw new InvalidReservationStateException(id, status);
        }
    }

    private Reservation withStatus(ReservationStatus newStatus, RejectionReason reason) {
        return new Reservation(id, resourceId, requesterId, slot, newStatus, reason, rescheduledFromId, createdAt);
    }
}
