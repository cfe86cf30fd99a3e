package personal.hatchery.reservation.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.stereotype.Component;
import personal.hatchery.reservation.booking.application.port.out.ReservationRepository;
import personal.hatchery.reservation.booking.domain.model.Reservation;
import personal.hatchery.reservation.booking.domain.service.AvailabilityIndex;

import java.util.List;

/**
 * Availability Index Initializer
 * 싱글톤 생성 완료 직후(웹 서버 기동 전) 저장소의 활성 예약으로 인덱스를 적재하고, 종료 시 비운다
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AvailabilityIndexInitializer implements SmartInitializingSingleton, DisposableBean {

    private final ReservationRepository reservationRepository;
    private final AvailabilityIndex availabilityIndex;

    @Override
    public void afterSingletonsInstantiated() {
        List<Reservation> active = reservationRepository.findAllActive();
        availabilityIndex.rebuildAll(active);
        log.info("Availability index loaded: activeReservations={}", active.size());
    }

    @Override
    public void destroy() {
        availabilityIndex.clear();
        log.info("Availability index cleared");
    }
}
