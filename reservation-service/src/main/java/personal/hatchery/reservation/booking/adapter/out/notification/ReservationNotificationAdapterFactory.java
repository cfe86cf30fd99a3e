package personal.hatchery.reservation.booking.adapter.out.notification;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.KafkaTemplate;
import personal.hatchery.reservation.booking.application.port.out.ReservationNotificationPort;
import personal.hatchery.reservation.config.ReservationProperties;

/**
 * Reservation Notification Adapter Factory
 *
 * 설정:
 * - hatchery.reservation.notification.strategy=log → LoggingReservationNotificationAdapter (기본값)
 * - hatchery.reservation.notification.strategy=kafka → ReservationKafkaPublisher
 */
@Slf4j
@Configuration
public class ReservationNotificationAdapterFactory {

    @Bean
    @ConditionalOnProperty(name = "hatchery.reservation.notification.strategy", havingValue = "log", matchIfMissing = true)
    public ReservationNotificationPort loggingReservationNotificationAdapter() {
        log.info("Creating LoggingReservationNotificationAdapter");
        return new LoggingReservationNotificationAdapter();
    }

    @Bean
    @ConditionalOnProperty(name = "hatchery.reservation.notification.strategy", havingValue = "kafka")
    public ReservationNotificationPort reservationKafkaPublisher(
            KafkaTemplate<String, String> kafkaTemplate,
            ObjectMapper objectMapper,
            ReservationProperties properties) {

        String topic = properties.notification().topic();
        log.info("Creating ReservationKafkaPublisher - topic: {}", topic);
        return new ReservationKafkaPublisher(kafkaTemplate, objectMapper, topic);
    }
}
