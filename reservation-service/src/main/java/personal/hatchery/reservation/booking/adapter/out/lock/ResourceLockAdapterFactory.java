package personal.hatchery.reservation.booking.adapter.out.lock;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import personal.hatchery.reservation.booking.application.port.out.ResourceLockPort;
import personal.hatchery.reservation.config.ReservationProperties;

/**
 * Resource Lock Adapter Factory
 * 설정에 따라 적절한 ResourceLockPort 구현체를 생성
 *
 * 설정:
 * - hatchery.reservation.lock.strategy=local → LocalResourceLockAdapter (기본값)
 * - hatchery.reservation.lock.strategy=cluster → RedisResourceLockAdapter
 */
@Slf4j
@Configuration
public class ResourceLockAdapterFactory {

    @Bean
    @ConditionalOnProperty(name = "hatchery.reservation.lock.strategy", havingValue = "local", matchIfMissing = true)
    public ResourceLockPort localResourceLockAdapter() {
        log.info("Creating LocalResourceLockAdapter - single instance per-resource locks");
        return new LocalResourceLockAdapter();
    }

    @Bean
    @ConditionalOnProperty(name = "hatchery.reservation.lock.strategy", havingValue = "cluster")
    public ResourceLockPort redisResourceLockAdapter(
            StringRedisTemplate redisTemplate,
            ReservationProperties properties) {

        ReservationProperties.Lock lock = properties.lock();
        log.info("Creating RedisResourceLockAdapter - leaseTime: {}ms, retryInterval: {}ms",
                lock.leaseTime().toMillis(), lock.retryInterval().toMillis());
        return new RedisResourceLockAdapter(
                redisTemplate,
                RedisScript.of(new ClassPathResource("scripts/release_lock.lua"), Long.class),
                lock.leaseTime(),
                lock.retryInterval());
    }
}
