package personal.hatchery.reservation.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Reservation 설정 Properties
 * application.yml의 hatchery.reservation.* 설정을 바인딩
 */
@ConfigurationProperties(prefix = "hatchery.reservation")
public record ReservationProperties(
        Lock lock,
        Notification notification
) {
    public ReservationProperties {
        if (lock == null) {
            lock = new Lock(null, null, null, null);
        }
        if (notification == null) {
            notification = new Notification(null, null);
        }
    }

    /**
     * 자원별 락 설정
     *
     * @param strategy      local | cluster
     * @param waitTimeout   락 획득 대기 한도 (초과 시 RESOURCE_LOCK_TIMEOUT)
     * @param leaseTime     cluster 락 TTL. 갱신되지 않으므로 판정부터 커밋까지의 최악 소요 시간보다 길어야 한다.
     *                      커밋 직전 소유권을 다시 확인하며, 만료된 경우 RESOURCE_LOCK_LOST 로 중단한다.
     * @param retryInterval cluster 락 재시도 간격
     */
    public record Lock(
            String strategy,
            Duration waitTimeout,
            Duration leaseTime,
            Duration retryInterval
    ) {
        public Lock {
            if (strategy == null || strategy.isBlank()) {
                strategy = "local";
            }
            if (waitTimeout == null) {
                waitTimeout = Duration.ofSeconds(3);
            }
            if (leaseTime == null) {
                leaseTime = Duration.ofSeconds(30);
            }
            if (retryInterval == null) {
                retryInterval = Duration.ofMillis(50);
            }
        }
    }

    /**
     * 알림 설정
     *
     * @param strategy log | kafka
     * @param topic    kafka 토픽
     */
    public record Notification(
            String strategy,
            String topic
    ) {
        public Notification {
            if (strategy == null || strategy.isBlank()) {
                strategy = "log";
            }
            if (topic == null || topic.isBlank()) {
                topic = "hatchery.reservation.events";
            }
        }
    }
}
