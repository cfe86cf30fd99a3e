package personal.hatchery.reservation.booking.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.hatchery.reservation.booking.application.port.out.CertificationPort;
import personal.hatchery.reservation.booking.application.port.out.ResourceCatalogPort;
import personal.hatchery.reservation.booking.domain.model.BookingRequest;
import personal.hatchery.reservation.booking.domain.model.Decision;
import personal.hatchery.reservation.booking.domain.model.RejectionReason;
import personal.hatchery.reservation.resource.domain.model.Resource;

import java.util.Optional;

/**
 * Conflict Detector (Domain Service)
 * 예약 요청의 수용 가능 여부 판정. 부수 효과 없음
 *
 * 판정 순서 (처음 실패한 검사가 사유가 된다):
 * 1. 자원 존재 -> NOT_FOUND
 * 2. start < end -> INVALID_SLOT
 * 3. 인증 필요 장비면 요청자 인증 -> NOT_CERTIFIED
 * 4. 겹치는 활성 예약 수 < capacity -> CAPACITY_EXCEEDED
 *
 * 결과의 구속력은 호출자가 자원 락을 쥐고 있을 때만 보장된다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConflictDetector {

    private final ResourceCatalogPort resourceCatalogPort;
    private final CertificationPort certificationPort;
    private final AvailabilityIndex availabilityIndex;

    public Decision evaluate(BookingRequest request) {
        return evaluate(request, null);
    }

    /**
     * @param excludedReservationId 일정 변경 시 대체될 예약 (겹침 계산에서 제외, nullable)
     */
    public Decision evaluate(BookingRequest request, Long excludedReservationId) {
        Optional<Resource> found = resourceCatalogPort.findResource(request.resourceId());
        if (found.isEmpty()) {
            return reject(request, RejectionReason.NOT_FOUND);
        }
        Resource resource = found.get();

        if (!request.hasWellFormedSlot()) {
            return reject(request, RejectionReason.INVALID_SLOT);
        }

        if (resource.requiresCertification()
                && !certificationPort.isAuthorized(request.requesterId(), resource.id())) {
            return reject(request, RejectionReason.NOT_CERTIFIED);
        }

        int occupied = availabilityIndex.countOverlapping(resource.id(), request.slot(), excludedReservationId);
        if (occupied >= resource.capacity()) {
            log.debug("Capacity reached: resourceId={}, occupied={}, capacity={}",
                    resource.id(), occupied, resource.capacity());
            return reject(request, RejectionReason.CAPACITY_EXCEEDED);
        }

        return Decision.admit();
    }

    private Decision reject(BookingRequest request, RejectionReason reason) {
        log.debug("Booking request rejected: resourceId={}, requesterId={}, reason={}",
                request.resourceId(), request.requesterId(), reason);
        return Decision.reject(reason);
    }
}
