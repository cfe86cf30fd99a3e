package personal.hatchery.reservation.booking.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import personal.hatchery.reservation.booking.domain.model.ReservationStatus;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Spring Data JPA Repository for Reservation
 */
public interface JpaReservationRepository extends JpaRepository<ReservationEntity, Long> {

    List<ReservationEntity> findAllByResourceIdAndStatusInOrderBySlotStartAscIdAsc(
            String resourceId, Collection<ReservationStatus> statuses);

    List<ReservationEntity> findAllByStatusIn(Collection<ReservationStatus> statuses);

    List<ReservationEntity> findAllByRequesterIdOrderByCreatedAtDescIdDesc(String requesterId);

    /**
     * 반열림 구간 겹침: slot_start < :to AND slot_end > :from
     */
    @Query("SELECT r FROM ReservationEntity r " +
            "WHERE r.resourceId = :resourceId " +
            "AND r.status IN :statuses " +
            "AND r.slotStart < :to AND r.slotEnd > :from " +
            "ORDER BY r.slotStart ASC, r.id ASC")
    List<ReservationEntity> findOverlapping(
            @Param("resourceId") String resourceId,
            @Param("statuses") Collection<ReservationStatus> statuses,
            @Param("from") Instant from,
            @Param("to") Instant to);
}
