package personal.hatchery.reservation.acceptance.support;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.hatchery.reservation.booking.adapter.out.persistence.JpaReservationRepository;
import personal.hatchery.reservation.booking.adapter.out.persistence.ReservationEntity;
import personal.hatchery.reservation.booking.domain.model.ReservationStatus;
import personal.hatchery.reservation.booking.domain.service.AvailabilityIndex;
import personal.hatchery.reservation.certification.adapter.out.persistence.JpaCertificationRepository;
import personal.hatchery.reservation.resource.adapter.out.persistence.JpaResourceRepository;

/**
 * Reservation 인수 테스트 어댑터
 * 시나리오 간 데이터 초기화와 저장 상태 검증을 담당한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReservationTestAdapter {

    private final JpaReservationRepository reservationRepository;
    private final JpaCertificationRepository certificationRepository;
    private final JpaResourceRepository resourceRepository;
    private final AvailabilityIndex availabilityIndex;

    /**
     * 모든 테스트 데이터 초기화
     * 각 시나리오 시작 전에 호출되어 깨끗한 상태를 보장합니다.
     */
    public void clearAllData() {
        log.info(">>> Adapter: 모든 테스트 데이터 초기화");
        reservationRepository.deleteAll();
        certificationRepository.deleteAll();
        resourceRepository.deleteAll();
        availabilityIndex.clear();
        log.info(">>> Adapter: 데이터 초기화 완료");
    }

    /**
     * 저장소 기준 예약 상태 조회
     */
    public ReservationStatus getReservationStatus(Long reservationId) {
        ReservationEntity reservation = reservationRepository.findById(reservationId)
                .orElseThrow(() -> new IllegalArgumentException("Reservation not found: " + reservationId));
        log.info(">>> Adapter: 예약 상태 조회 - reservationId={}, status={}", reservationId, reservation.getStatus());
        return reservation.getStatus();
    }

    /**
     * 인덱스 기준 자원의 활성 예약 수
     */
    public int indexedReservationCount(String resourceId) {
        return availabilityIndex.size(resourceId);
    }
}
