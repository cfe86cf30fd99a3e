package personal.hatchery.reservation.booking.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.hatchery.reservation.booking.domain.model.RejectionReason;
import personal.hatchery.reservation.booking.domain.model.Reservation;
import personal.hatchery.reservation.booking.domain.model.ReservationStatus;
import personal.hatchery.reservation.booking.domain.model.TimeSlot;

import java.time.Instant;

/**
 * Reservation JPA Entity
 * 예약 테이블 매핑
 * 겹침 조회용 (resource_id, slot_start, slot_end) 인덱스, 요청자 조회용 requester_id 인덱스
 */
@Entity
@Table(name = "reservations",
        indexes = {
                @Index(name = "idx_reservation_resource_slot", columnList = "resource_id, slot_start, slot_end"),
                @Index(name = "idx_reservation_requester", columnList = "requester_id")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ReservationEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "resource_id", nullable = false, length = 64)
    private String resourceId;

    @Column(name = "requester_id", nullable = false, length = 128)
    private String requesterId;

    @Column(name = "slot_start", nullable = false)
    private Instant slotStart;

    @Column(name = "slot_end", nullable = false)
    private Instant slotEnd;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ReservationStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "rejection_reason", length = 30)
    private RejectionReason rejectionReason;

    @Column(name = "rescheduled_from_id")
    private Long rescheduledFromId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    /**
     * 도메인 모델로부터 엔티티 생성
     */
    public static ReservationEntity fromDomain(Reservation reservation) {
        ReservationEntity entity = new ReservationEntity();
        entity.id = reservation.id();
        entity.resourceId = reservation.resourceId();
        entity.requesterId = reservation.requesterId();
        entity.slotStart = reservation.slot().start();
        entity.slotEnd = reservation.slot().end();
        entity.status = reservation.status();
        entity.rejectionReason = reservation.rejectionReason();
        entity.rescheduledFromId = reservation.rescheduledFromId();
        entity.createdAt = reservation.createdAt();
        return entity;
    }

    /**
     * 도메인 모델로 변환
     */
    public Reservation toDomain() {
        return new Reservation(id, resourceId, requesterId, TimeSlot.of(slotStart, slotEnd),
                status, rejectionReason, rescheduledFromId, createdAt);
    }

    /**
     * 상태 업데이트 (영속성 컨텍스트 내에서 사용). 시간 구간은 변경하지 않는다
     */
    public void updateStatus(ReservationStatus newStatus, RejectionReason reason) {
        this.status = newStatus;
        this.rejectionReason = reason;
    }
}
