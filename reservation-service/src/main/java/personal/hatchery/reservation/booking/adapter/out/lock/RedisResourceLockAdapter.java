package personal.hatchery.reservation.booking.adapter.out.lock;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import personal.hatchery.reservation.booking.application.port.out.ResourceLockPort;

import java.time.Duration;
import java.util.List;

/**
 * Redis Resource Lock Adapter
 * 다중 인스턴스 환경의 자원별 분산 락
 *
 * 특징:
 * - SETNX + TTL(lease) 을 원자적으로 수행 (setIfAbsent)
 * - 대기 한도 내에서 retryInterval 간격으로 재시도
 * - Lua Script 로 소유권을 검증한 뒤 해제
 * - Hash Tag {resourceId} 로 같은 자원의 키가 같은 노드에 저장된다
 * - lease 는 갱신되지 않는다. 커밋 직전 isHeld 로 소유권을 다시 확인한다
 */
@Slf4j
@RequiredArgsConstructor
public class RedisResourceLockAdapter implements ResourceLockPort {

    private static final String LOCK_KEY_FORMAT = "reservation:lock:{%s}";

    private final StringRedisTemplate redisTemplate;
    private final RedisScript<Long> releaseLockScript;
    private final Duration leaseTime;
    private final Duration retryInterval;

    @Override
    public boolean tryAcquire(String resourceId, String owner, Duration waitTimeout) {
        String key = buildLockKey(resourceId);
        long deadline = System.nanoTime() + waitTimeout.toNanos();

        try {
            while (true) {
                Boolean acquired = redisTemplate.opsForValue().setIfAbsent(key, owner, leaseTime);
                if (Boolean.TRUE.equals(acquired)) {
                    log.debug("[RedisLock] Lock acquired: key={}, owner={}", key, owner);
                    return true;
                }
                if (System.nanoTime() >= deadline) {
                    log.debug("[RedisLock] Lock not acquired within wait timeout: key={}", key);
                    return false;
                }
                Thread.sleep(retryInterval.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[RedisLock] Interrupted while waiting for lock: key={}", key);
            return false;
        } catch (RuntimeException e) {
            // 락 획득 실패로 처리 (아무것도 적용되지 않은 상태)
            log.error("[RedisLock] Failed to acquire lock: key={}", key, e);
            return false;
        }
    }

    @Override
    public void release(String resourceId, String owner) {
        String key = buildLockKey(resourceId);

        try {
            // GET + DEL 을 원자적으로 수행하여 소유권 검증
            Long released = redisTemplate.execute(releaseLockScript, List.of(key), owner);

            if (released != null && released > 0) {
                log.debug("[RedisLock] Lock released: key={}, owner={}", key, owner);
            } else {
                log.warn("[RedisLock] Lock not released (not owner or lease expired): key={}, owner={}", key, owner);
            }
        } catch (RuntimeException e) {
            // 해제 실패 시 lease TTL 로 자동 해제된다
            log.error("[RedisLock] Failed to release lock: key={}, owner={}", key, owner, e);
        }
    }

    @Override
    public boolean isHeld(String resourceId, String owner) {
        String key = buildLockKey(resourceId);
        try {
            boolean held = owner.equals(redisTemplate.opsForValue().get(key));
            if (!held) {
                log.warn("[RedisLock] Lock lease lost: key={}, owner={}", key, owner);
            }
            return held;
        } catch (RuntimeException e) {
            // 소유권을 확인할 수 없으면 보유하지 않은 것으로 본다
            log.error("[RedisLock] Failed to verify lock owner: key={}, owner={}", key, owner, e);
            return false;
        }
    }

    @Override
    public boolean isShared() {
        return true;
    }

    @Override
    public String getStrategyName() {
        return "cluster";
    }

    static String buildLockKey(String resourceId) {
        return String.format(LOCK_KEY_FORMAT, resourceId);
    }
}
