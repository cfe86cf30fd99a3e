package personal.hatchery.reservation.booking.application.port.out;

import java.time.Duration;

/**
 * Resource Lock Port (Output Port)
 * 자원 단위 상호 배제. 서로 다른 자원은 락을 공유하지 않는다.
 *
 * 구현체:
 * - LocalResourceLockAdapter: 단일 인스턴스 (JVM 내 ReentrantLock)
 * - RedisResourceLockAdapter: 다중 인스턴스 (Redis SETNX + TTL)
 */
public interface ResourceLockPort {

    /**
     * 락 획득 시도
     *
     * @param resourceId  자원 ID
     * @param owner       락 소유자 식별자 (해제 시 동일 값 필요)
     * @param waitTimeout 최대 대기 시간
     * @return 획득 성공 여부 (대기 한도 초과, 인터럽트 시 false)
     */
    boolean tryAcquire(String resourceId, String owner, Duration waitTimeout);

    /**
     * 락 해제. 소유자가 아니면 아무것도 하지 않는다
     */
    void release(String resourceId, String owner);

    /**
     * owner 가 아직 락을 보유하고 있는지. 저장 커밋 직전에 확인한다
     * cluster 락은 lease 가 만료되면 다른 인스턴스가 같은 자원에 진입할 수 있다.
     */
    boolean isHeld(String resourceId, String owner);

    /**
     * 여러 인스턴스가 공유하는 락인지. true 면 인메모리 인덱스를 락 획득 후 저장소 기준으로 갱신해야 한다
     */
    boolean isShared();

    /**
     * 락 전략 이름 (로깅/모니터링용)
     */
    String getStrategyName();
}
