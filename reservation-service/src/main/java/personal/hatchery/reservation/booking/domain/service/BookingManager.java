package personal.hatchery.reservation.booking.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import personal.hatchery.reservation.booking.application.port.out.ReservationRepository;
import personal.hatchery.reservation.booking.domain.model.RejectionReason;
import personal.hatchery.reservation.booking.domain.model.Reservation;

/**
 * Booking Domain Service (Transaction Manager)
 * 트랜잭션 범위 분리를 위한 실행 전용 서비스
 * 락 획득과 인덱스 갱신은 호출자(ReservationService)가 트랜잭션 밖에서 수행한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingManager {

    private final ReservationRepository reservationRepository;

    /**
     * 승인된 예약 저장 (PENDING -> CONFIRMED, 승인 필요 자원은 PENDING 유지)
     */
    @Transactional
    public Reservation commitAdmission(Reservation pending, boolean approvalRequired) {
        Reservation admitted = approvalRequired ? pending : pending.confirm();
        Reservation saved = reservationRepository.save(admitted);
        log.info("Reservation admitted: reservationId={}, resourceId={}, requesterId={}, status={}",
                saved.id(), saved.resourceId(), saved.requesterId(), saved.status());
        return saved;
    }

    /**
     * 정책 거절 감사 레코드 저장 (PENDING -> CANCELLED + 사유)
     */
    @Transactional
    public Reservation recordRejection(Reservation pending, RejectionReason reason) {
        Reservation saved = reservationRepository.save(pending.reject(reason));
        log.info("Reservation rejection recorded: reservationId={}, resourceId={}, reason={}",
                saved.id(), saved.resourceId(), reason);
        return saved;
    }

    @Transactional
    public Reservation commitCancellation(Reservation active) {
        Reservation saved = reservationRepository.save(active.cancel());
        log.info("Reservation cancelled: reservationId={}, resourceId={}", saved.id(), saved.resourceId());
        return saved;
    }

    @Transactional
    public Reservation commitApproval(Reservation pending) {
        Reservation saved = reservationRepository.save(pending.confirm());
        log.info("Reservation approved: reservationId={}, resourceId={}", saved.id(), saved.resourceId());
        return saved;
    }

    /**
     * 일정 변경: 기존 예약 취소와 대체 예약 저장을 한 트랜잭션으로 수행
     */
    @Transactional
    public Rescheduled commitReschedule(Reservation original, Reservation replacement, boolean approvalRequired) {
        Reservation cancelled = reservationRepository.save(original.cancel());
        Reservation saved = reservationRepository.save(approvalRequired ? replacement : replacement.confirm());
        log.info("Reservation rescheduled: previousId={}, reservationId={}, resourceId={}, slot={}",
                cancelled.id(), saved.id(), saved.resourceId(), saved.slot());
        return new Rescheduled(cancelled, saved);
    }

    public record Rescheduled(Reservation cancelled, Reservation replacement) {
    }
}
