package personal.hatchery.reservation.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.hatchery.reservation.booking.application.port.in.ApproveReservationUseCase;
import personal.hatchery.reservation.booking.application.port.in.BookReservationCommand;
import personal.hatchery.reservation.booking.application.port.in.BookReservationUseCase;
import personal.hatchery.reservation.booking.application.port.in.CancelReservationUseCase;
import personal.hatchery.reservation.booking.application.port.in.RescheduleReservationUseCase;
import personal.hatchery.reservation.booking.application.port.out.ReservationNotificationPort;
import personal.hatchery.reservation.booking.application.port.out.ReservationRepository;
import personal.hatchery.reservation.booking.application.port.out.ResourceCatalogPort;
import personal.hatchery.reservation.booking.application.port.out.ResourceLockPort;
import personal.hatchery.reservation.booking.domain.exception.ReservationNotFoundException;
import personal.hatchery.reservation.booking.domain.exception.ResourceLockLostException;
import personal.hatchery.reservation.booking.domain.exception.ResourceLockTimeoutException;
import personal.hatchery.reservation.booking.domain.model.BookingRequest;
import personal.hatchery.reservation.booking.domain.model.BookingResult;
import personal.hatchery.reservation.booking.domain.model.Decision;
import personal.hatchery.reservation.booking.domain.model.Reservation;
import personal.hatchery.reservation.booking.domain.model.ReservationEvent;
import personal.hatchery.reservation.booking.domain.model.ReservationEventType;
import personal.hatchery.reservation.booking.domain.model.TimeSlot;
import personal.hatchery.reservation.booking.domain.service.AvailabilityIndex;
import personal.hatchery.reservation.booking.domain.service.BookingManager;
import personal.hatchery.reservation.booking.domain.service.ConflictDetector;
import personal.hatchery.reservation.config.ReservationProperties;
import personal.hatchery.reservation.resource.domain.model.Resource;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.function.Function;

/**
 * Reservation Application Service
 * 예약/취소/일정 변경/승인의 단일 진입점
 *
 * 처리 순서 (모든 변경 공통):
 * 1. 자원 락 획득 (대기 한도 초과 시 ResourceLockTimeoutException)
 * 2. 공유 락(cluster)이면 해당 자원 인덱스를 저장소 기준으로 갱신
 * 3. 판정 -> 락 소유권 재확인 -> 저장 커밋(BookingManager 트랜잭션) -> 인덱스 갱신
 * 4. 락 해제 후 알림 발행 (실패해도 결과 유지)
 *
 * 커밋이 실패하면 인덱스는 갱신되지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReservationService implements
        BookReservationUseCase,
        CancelReservationUseCase,
        RescheduleReservationUseCase,
        ApproveReservationUseCase {

    private final ConflictDetector conflictDetector;
    private final BookingManager bookingManager;
    private final AvailabilityIndex availabilityIndex;
    private final ReservationRepository reservationRepository;
    private final ResourceCatalogPort resourceCatalogPort;
    private final ResourceLockPort resourceLockPort;
    private final ReservationNotificationPort notificationPort;
    private final ReservationProperties properties;
    private final Clock clock;

    @Override
    public BookingResult book(BookReservationCommand command) {
        BookingRequest request = command.toRequest();
        log.info("Booking requested: resourceId={}, requesterId={}, start={}, end={}",
                request.resourceId(), request.requesterId(), request.start(), request.end());

        BookingResult result = withResourceLock(request.resourceId(), owner -> {
            Decision decision = conflictDetector.evaluate(request);
            if (decision.isRejected()) {
                return reject(request, decision, owner);
            }

            Reservation pending = Reservation.pending(
                    request.resourceId(), request.requesterId(), request.slot(), clock.instant());
            ensureLockHeld(request.resourceId(), owner);
            Reservation committed = bookingManager.commitAdmission(pending, isApprovalRequired(request.resourceId()));
            availabilityIndex.insert(committed);
            return BookingResult.admitted(committed);
        });

        if (result.isAdmitted()) {
            notify(ReservationEventType.BOOKED, result.reservation());
        }
        return result;
    }

    @Override
    public Reservation cancel(Long reservationId) {
        Reservation found = loadReservation(reservationId);

        CancelOutcome outcome = withResourceLock(found.resourceId(), owner -> {
            Reservation current = loadReservation(reservationId);
            if (current.isCancelled()) {
                log.debug("Reservation already cancelled (no-op): reservationId={}", reservationId);
                return new CancelOutcome(current, false);
            }

            ensureLockHeld(current.resourceId(), owner);
            Reservation cancelled = bookingManager.commitCancellation(current);
            availabilityIndex.remove(reservationId);
            return new CancelOutcome(cancelled, true);
        });

        if (outcome.changed()) {
            notify(ReservationEventType.CANCELLED, outcome.reservation());
        }
        return outcome.reservation();
    }

    @Override
    public BookingResult reschedule(Long reservationId, Instant newStart, Instant newEnd) {
        Reservation found = loadReservation(reservationId);
        log.info("Reschedule requested: reservationId={}, resourceId={}, start={}, end={}",
                reservationId, found.resourceId(), newStart, newEnd);

        BookingResult result = withResourceLock(found.resourceId(), owner -> {
            Reservation original = loadReservation(reservationId);
            original.ensureActive();

            BookingRequest request = new BookingRequest(
                    original.resourceId(), original.requesterId(), newStart, newEnd);
            Decision decision = conflictDetector.evaluate(request, original.id());
            if (decision.isRejected()) {
                // 기존 예약은 유지되며 감사 레코드도 남기지 않는다
                log.warn("Reschedule rejected: reservationId={}, reason={}", reservationId, decision.reason());
                return BookingResult.rejected(decision.reason(), null);
            }

            Reservation replacement = original.replacementFor(TimeSlot.of(newStart, newEnd), clock.instant());
            ensureLockHeld(original.resourceId(), owner);
            BookingManager.Rescheduled rescheduled = bookingManager.commitReschedule(
                    original, replacement, isApprovalRequired(original.resourceId()));

            availabilityIndex.remove(original.id());
            availabilityIndex.insert(rescheduled.replacement());
            return BookingResult.admitted(rescheduled.replacement());
        });

        if (result.isAdmitted()) {
            notify(ReservationEventType.RESCHEDULED, result.reservation());
        }
        return result;
    }

    @Override
    public Reservation approve(Long reservationId) {
        Reservation found = loadReservation(reservationId);

        Reservation approved = withResourceLock(found.resourceId(), owner -> {
            Reservation current = loadReservation(reservationId);
            current.ensurePending();

            ensureLockHeld(current.resourceId(), owner);
            Reservation confirmed = bookingManager.commitApproval(current);
            availabilityIndex.replace(confirmed);
            return confirmed;
        });

        notify(ReservationEventType.APPROVED, approved);
        return approved;
    }

    /**
     * 자원 락 안에서 작업 수행
     * 락 획득 실패 시 아무 변경 없이 ResourceLockTimeoutException
     */
    private <T> T withResourceLock(String resourceId, Function<String, T> action) {
        Duration waitTimeout = properties.lock().waitTimeout();
        String owner = UUID.randomUUID().toString();

        if (!resourceLockPort.tryAcquire(resourceId, owner, waitTimeout)) {
            log.warn("Resource lock timeout: resourceId={}, strategy={}, waitTimeout={}ms",
                    resourceId, resourceLockPort.getStrategyName(), waitTimeout.toMillis());
            throw new ResourceLockTimeoutException(resourceId, waitTimeout);
        }

        try {
            if (resourceLockPort.isShared()) {
                // 다른 인스턴스의 커밋을 반영
                availabilityIndex.rebuild(resourceId, reservationRepository.findActiveByResourceId(resourceId));
            }
            return action.apply(owner);
        } finally {
            resourceLockPort.release(resourceId, owner);
        }
    }

    private BookingResult reject(BookingRequest request, Decision decision, String owner) {
        log.warn("Booking rejected: resourceId={}, requesterId={}, reason={}",
                request.resourceId(), request.requesterId(), decision.reason());

        if (!decision.reason().isRecordable()) {
            return BookingResult.rejected(decision.reason(), null);
        }

        Reservation pending = Reservation.pending(
                request.resourceId(), request.requesterId(), request.slot(), clock.instant());
        ensureLockHeld(request.resourceId(), owner);
        Reservation audit = bookingManager.recordRejection(pending, decision.reason());
        return BookingResult.rejected(decision.reason(), audit);
    }

    /**
     * 커밋 직전 락 소유권 재확인
     * cluster lease 가 만료됐다면 다른 인스턴스가 진입했을 수 있으므로 커밋하지 않는다.
     */
    private void ensureLockHeld(String resourceId, String owner) {
        if (!resourceLockPort.isHeld(resourceId, owner)) {
            log.error("Resource lock lost before commit: resourceId={}, strategy={}",
                    resourceId, resourceLockPort.getStrategyName());
            throw new ResourceLockLostException(resourceId);
        }
    }

    private boolean isApprovalRequired(String resourceId) {
        return resourceCatalogPort.findResource(resourceId)
                .map(Resource::approvalRequired)
                .orElse(false);
    }

    private Reservation loadReservation(Long reservationId) {
        return reservationRepository.findById(reservationId)
                .orElseThrow(() -> {
                    log.warn("Reservation not found: reservationId={}", reservationId);
                    return new ReservationNotFoundException(reservationId);
                });
    }

    /**
     * 락 해제 후 호출. 알림 실패는 기록만 하고 예약 결과에 영향을 주지 않는다
     */
    private void notify(ReservationEventType type, Reservation reservation) {
        try {
            notificationPort.publishReservationEvent(ReservationEvent.of(type, reservation, clock.instant()));
        } catch (RuntimeException e) {
            log.error("Failed to publish reservation event: type={}, reservationId={}",
                    type, reservation.id(), e);
        }
    }

    private record CancelOutcome(Reservation reservation, boolean changed) {
    }
}
