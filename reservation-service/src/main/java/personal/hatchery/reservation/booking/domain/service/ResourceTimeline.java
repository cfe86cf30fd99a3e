package personal.hatchery.reservation.booking.domain.service;

import personal.hatchery.reservation.booking.domain.model.Reservation;
import personal.hatchery.reservation.booking.domain.model.TimeSlot;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 단일 자원의 활성 예약 타임라인
 * 시작 시각 -> (예약 ID -> 예약) 정렬 구조. 가장 긴 예약 길이를 추적하여
 * 겹침 후보를 [slot.start - longest, slot.end) 범위로 좁힌다.
 */
class ResourceTimeline {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final TreeMap<Instant, TreeMap<Long, Reservation>> byStart = new TreeMap<>();
    private final Map<Long, Reservation> byId = new HashMap<>();

    // 제거 시 줄이지 않는다 (rebuild 시 재계산)
    private Duration longest = Duration.ZERO;

    List<Reservation> overlapping(TimeSlot slot, Long excludedReservationId) {
        lock.readLock().lock();
        try {
            if (byId.isEmpty()) {
                return List.of();
            }
            // 시작 시각이 slot.start - longest 이하인 예약은 slot.start 이전에 끝난다
            NavigableMap<Instant, TreeMap<Long, Reservation>> candidates =
                    byStart.subMap(slot.start().minus(longest), false, slot.end(), false);

            List<Reservation> result = new ArrayList<>();
            for (TreeMap<Long, Reservation> sameStart : candidates.values()) {
                for (Reservation reservation : sameStart.values()) {
                    if (reservation.slot().overlaps(slot) && !reservation.id().equals(excludedReservationId)) {
                        result.add(reservation);
                    }
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    void put(Reservation reservation) {
        lock.writeLock().lock();
        try {
            putUnlocked(reservation);
        } finally {
            lock.writeLock().unlock();
        }
    }

    boolean remove(Long reservationId) {
        lock.writeLock().lock();
        try {
            return removeUnlocked(reservationId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    void reset(Collection<Reservation> reservations) {
        lock.writeLock().lock();
        try {
            byStart.clear();
            byId.clear();
            longest = Duration.ZERO;
            reservations.forEach(this::putUnlocked);
        } finally {
            lock.writeLock().unlock();
        }
    }

    int size() {
        lock.readLock().lock();
        try {
            return byId.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private void putUnlocked(Reservation reservation) {
        removeUnlocked(reservation.id());
        byStart.computeIfAbsent(reservation.slot().start(), start -> new TreeMap<>())
                .put(reservation.id(), reservation);
        byId.put(reservation.id(), reservation);

        Duration duration = reservation.slot().duration();
        if (duration.compareTo(longest) > 0) {
            longest = duration;
        }
    }

    private boolean removeUnlocked(Long reservationId) {
        Reservation existing = byId.remove(reservationId);
        if (existing == null) {
            return false;
        }
        TreeMap<Long, Reservation> sameStart = byStart.get(existing.slot().start());
        sameStart.remove(reservationId);
        if (sameStart.isEmpty()) {
            byStart.remove(existing.slot().start());
        }
        return true;
    }
}
