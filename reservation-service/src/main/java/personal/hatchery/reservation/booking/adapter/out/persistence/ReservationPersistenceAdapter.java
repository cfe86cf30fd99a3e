package personal.hatchery.reservation.booking.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.hatchery.reservation.booking.application.port.out.ReservationRepository;
import personal.hatchery.reservation.booking.domain.exception.ReservationNotFoundException;
import personal.hatchery.reservation.booking.domain.model.Reservation;
import personal.hatchery.reservation.booking.domain.model.ReservationStatus;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Reservation Persistence Adapter
 * JPA를 사용한 예약 저장소 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReservationPersistenceAdapter implements ReservationRepository {

    private static final Set<ReservationStatus> ACTIVE_STATUSES =
            EnumSet.of(ReservationStatus.PENDING, ReservationStatus.CONFIRMED);

    private final JpaReservationRepository jpaReservationRepository;

    @Override
    public Reservation save(Reservation reservation) {
        if (reservation.id() == null) {
            log.debug("Inserting reservation: resourceId={}, status={}", reservation.resourceId(), reservation.status());
            return jpaReservationRepository.saveAndFlush(ReservationEntity.fromDomain(reservation)).toDomain();
        }

        // 기존 예약은 상태만 변경된다 (시간 구간은 불변)
        ReservationEntity entity = jpaReservationRepository.findById(reservation.id())
                .orElseThrow(() -> {
                    log.warn("Status update for missing reservation: reservationId={}", reservation.id());
                    return new ReservationNotFoundException(reservation.id());
                });
        entity.updateStatus(reservation.status(), reservation.rejectionReason());
        log.debug("Updating reservation: reservationId={}, status={}", reservation.id(), reservation.status());
        return jpaReservationRepository.saveAndFlush(entity).toDomain();
    }

    @Override
    public Optional<Reservation> findById(Long reservationId) {
        return jpaReservationRepository.findById(reservationId)
                .map(ReservationEntity::toDomain);
    }

    @Override
    public List<Reservation> findActiveByResourceId(String resourceId) {
        return jpaReservationRepository
                .findAllByResourceIdAndStatusInOrderBySlotStartAscIdAsc(resourceId, ACTIVE_STATUSES).stream()
                .map(ReservationEntity::toDomain)
                .toList();
    }

    @Override
    public List<Reservation> findActiveOverlapping(String resourceId, Instant from, Instant to) {
        return jpaReservationRepository.findOverlapping(resourceId, ACTIVE_STATUSES, from, to).stream()
                .map(ReservationEntity::toDomain)
                .toList();
    }

    @Override
    public List<Reservation> findAllActive() {
        return jpaReservationRepository.findAllByStatusIn(ACTIVE_STATUSES).stream()
                .map(ReservationEntity::toDomain)
                .toList();
    }

    @Override
    public List<Reservation> findByRequesterId(String requesterId) {
        return jpaReservationRepository.findAllByRequesterIdOrderByCreatedAtDescIdDesc(requesterId).stream()
                .map(ReservationEntity::toDomain)
                .toList();
    }
}
