package personal.hatchery.reservation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Reservation Service Application
 * Resource Registry, Certification Gate, Booking 도메인을 포함하는 예약 코어 서비스
 */
@ConfigurationPropertiesScan
@SpringBootApplication(
    scanBasePackages = {
        "personal.hatchery.reservation",
        "personal.hatchery.common"  // common 모듈의 GlobalExceptionHandler 등을 스캔
    }
)
public class ReservationServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(ReservationServiceApplication.class, args);
    }
}
