package personal.hatchery.reservation.booking.adapter.out.lock;

import lombok.extern.slf4j.Slf4j;
import personal.hatchery.reservation.booking.application.port.out.ResourceLockPort;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Local Resource Lock Adapter
 * JVM 내 자원별 ReentrantLock
 *
 * 사용 환경:
 * - 단일 인스턴스 (기본값)
 * - 테스트
 *
 * 락 엔트리는 보유/대기 중인 스레드 수로 참조 카운팅되며, 마지막 사용자가 떠나면 맵에서 제거된다.
 * 카운트 변경은 모두 ConcurrentHashMap.compute 안에서 일어난다.
 *
 * 주의: 다중 인스턴스 운영 환경에서는 cluster 전략을 사용해야 한다.
 */
@Slf4j
public class LocalResourceLockAdapter implements ResourceLockPort {

    private final Map<String, LockEntry> locks = new ConcurrentHashMap<>();

    @Override
    public boolean tryAcquire(String resourceId, String owner, Duration waitTimeout) {
        LockEntry entry = locks.compute(resourceId, (id, current) -> {
            LockEntry target = current == null ? new LockEntry() : current;
            target.users++;
            return target;
        });

        boolean acquired = false;
        try {
            acquired = entry.lock.tryLock(waitTimeout.toMillis(), TimeUnit.MILLISECONDS);
            log.debug("[LocalLock] Lock attempt: resourceId={}, owner={}, acquired={}", resourceId, owner, acquired);
            return acquired;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[LocalLock] Interrupted while waiting for lock: resourceId={}", resourceId);
            return false;
        } finally {
            if (!acquired) {
                leave(resourceId);
            }
        }
    }

    @Override
    public void release(String resourceId, String owner) {
        LockEntry entry = locks.get(resourceId);
        if (entry == null || !entry.lock.isHeldByCurrentThread()) {
            log.warn("[LocalLock] Release ignored (not held by current thread): resourceId={}, owner={}",
                    resourceId, owner);
            return;
        }
        entry.lock.unlock();
        leave(resourceId);
        log.debug("[LocalLock] Lock released: resourceId={}, owner={}", resourceId, owner);
    }

    @Override
    public boolean isShared() {
        return false;
    }

    @Override
    public boolean isHeld(String resourceId, String owner) {
        LockEntry entry = locks.get(resourceId);
        return entry != null && entry.lock.isHeldByCurrentThread();
    }

    @Override
    public String getStrategyName() {
        return "local";
    }

    /**
     * 현재 맵에 남아 있는 락 엔트리 수
     */
    int lockCount() {
        return locks.size();
    }

    private void leave(String resourceId) {
        locks.computeIfPresent(resourceId, (id, current) -> --current.users == 0 ? null : current);
    }

    private static final class LockEntry {
        private final ReentrantLock lock = new ReentrantLock(true);
        private int users;
    }
}
