package personal.hatchery.reservation.booking.domain.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.hatchery.reservation.booking.domain.model.Reservation;
import personal.hatchery.reservation.booking.domain.model.TimeSlot;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Availability Index (Domain Service)
 * 자원별 활성(PENDING/CONFIRMED) 예약의 시간순 인메모리 투영
 *
 * - 저장소에서 언제든 재구성할 수 있는 파생 데이터이며 정본은 reservations 테이블이다.
 * - 자원별 타임라인은 ReadWriteLock 으로 보호되어 insert/remove/rebuild 가 조회에 대해 원자적이다.
 * - CANCELLED 예약은 보관하지 않는다.
 */
@Slf4j
@Component
public class AvailabilityIndex {

    private final Map<String, ResourceTimeline> timelines = new ConcurrentHashMap<>();
    private final Map<Long, String> resourceByReservationId = new ConcurrentHashMap<>();

    /**
     * 구간과 겹치는 활성 예약 (시작 시각, ID 순)
     */
    public List<Reservation> overlapping(String resourceId, TimeSlot slot) {
        return overlapping(resourceId, slot, null);
    }

    /**
     * 구간과 겹치는 활성 예약 (excludedReservationId 제외)
     */
    public List<Reservation> overlapping(String resourceId, TimeSlot slot, Long excludedReservationId) {
        ResourceTimeline timeline = timelines.get(resourceId);
        if (timeline == null) {
            return List.of();
        }
        return timeline.overlapping(slot, excludedReservationId);
    }

    public int countOverlapping(String resourceId, TimeSlot slot) {
        return overlapping(resourceId, slot).size();
    }

    /**
     * 일정 변경 판정용: 대체될 예약은 세지 않는다
     */
    public int countOverlapping(String resourceId, TimeSlot slot, Long excludedReservationId) {
        return overlapping(resourceId, slot, excludedReservationId).size();
    }

    /**
     * 활성 예약 추가 (CANCELLED 는 무시)
     */
    public void insert(Reservation reservation) {
        requirePersisted(reservation);
        if (!reservation.isActive()) {
            log.debug("Skipping inactive reservation for index: reservationId={}", reservation.id());
            return;
        }
        timelineOf(reservation.resourceId()).put(reservation);
        resourceByReservationId.put(reservation.id(), reservation.resourceId());
        log.debug("Index insert: reservationId={}, resourceId={}, slot={}",
                reservation.id(), reservation.resourceId(), reservation.slot());
    }

    /**
     * 예약 제거. 없는 ID 는 무시한다
     */
    public void remove(Long reservationId) {
        String resourceId = resourceByReservationId.remove(reservationId);
        if (resourceId == null) {
            return;
        }
        ResourceTimeline timeline = timelines.get(resourceId);
        if (timeline != null) {
            timeline.remove(reservationId);
        }
        log.debug("Index remove: reservationId={}, resourceId={}", reservationId, resourceId);
    }

    /**
     * 상태 변경 반영 (같은 구간). 비활성이 되면 제거된다
     */
    public void replace(Reservation reservation) {
        if (reservation.isActive()) {
            insert(reservation);
        } else {
            remove(reservation.id());
        }
    }

    /**
     * 한 자원의 타임라인을 주어진 예약들로 교체
     */
    public void rebuild(String resourceId, Collection<Reservation> reservations) {
        List<Reservation> active = reservations.stream()
                .filter(Reservation::isActive)
                .filter(reservation -> reservation.resourceId().equals(resourceId))
                .toList();

        ResourceTimeline timeline = timelineOf(resourceId);
        resourceByReservationId.entrySet().removeIf(entry -> entry.getValue().equals(resourceId));
        timeline.reset(active);
        active.forEach(reservation -> resourceByReservationId.put(reservation.id(), resourceId));

        log.debug("Index rebuilt for resource: resourceId={}, active={}", resourceId, active.size());
    }

    /**
     * 전체 인덱스를 주어진 예약들로 재구성
     */
    public void rebuildAll(Collection<Reservation> reservations) {
        Map<String, List<Reservation>> byResource = reservations.stream()
                .filter(Reservation::isActive)
                .collect(Collectors.groupingBy(Reservation::resourceId, Collectors.toCollection(ArrayList::new)));

        clear();
        byResource.forEach(this::rebuild);

        log.info("Availability index rebuilt: resources={}, activeReservations={}",
                byResource.size(), resourceByReservationId.size());
    }

    public void clear() {
        timelines.clear();
        resourceByReservationId.clear();
    }

    public int size(String resourceId) {
        ResourceTimeline timeline = timelines.get(resourceId);
        return timeline == null ? 0 : timeline.size();
    }

    private ResourceTimeline timelineOf(String resourceId) {
        return timelines.computeIfAbsent(resourceId, id -> new ResourceTimeline());
    }

    private void requirePersisted(Reservation reservation) {
        if (reservation.id() == null) {
            throw new IllegalArgumentException("Only persisted reservations can be indexed: resourceId="
                    + reservation.resourceId());
        }
    }
}
