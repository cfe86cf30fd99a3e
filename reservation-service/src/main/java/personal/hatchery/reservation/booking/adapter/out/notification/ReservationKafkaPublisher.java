package personal.hatchery.reservation.booking.adapter.out.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import personal.hatchery.reservation.booking.application.port.out.ReservationNotificationPort;
import personal.hatchery.reservation.booking.domain.model.ReservationEvent;

/**
 * Reservation Kafka Publisher (Adapter Layer)
 * Kafka 를 통한 예약 이벤트 발행 구현체
 * 자원 ID 를 키로 사용하여 같은 자원의 이벤트 순서를 유지한다.
 */
@Slf4j
@RequiredArgsConstructor
public class ReservationKafkaPublisher implements ReservationNotificationPort {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final String topic;

    @Override
    public void publishReservationEvent(ReservationEvent event) {
        String key = event.resourceId();
        String payload = serialize(event);

        log.debug("Publishing reservation event: topic={}, key={}, type={}", topic, key, event.type());
        kafkaTemplate.send(topic, key, payload)
                .whenComplete((result, ex) -> {
                    if (ex != null) {
                        log.error("Failed to publish reservation event: topic={}, key={}, reservationId={}",
                                topic, key, event.reservationId(), ex);
                    } else {
                        log.debug("Reservation event published: topic={}, key={}, reservationId={}",
                                topic, key, event.reservationId());
                    }
                });
    }

    private String serialize(ReservationEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize reservation event: reservationId="
                    + event.reservationId(), e);
        }
    }
}
