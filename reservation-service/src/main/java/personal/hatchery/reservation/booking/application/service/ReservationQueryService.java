package personal.hatchery.reservation.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.hatchery.common.exception.BusinessException;
import personal.hatchery.common.exception.ErrorCode;
import personal.hatchery.reservation.booking.application.port.in.CheckAvailabilityUseCase;
import personal.hatchery.reservation.booking.application.port.in.GetReservationUseCase;
import personal.hatchery.reservation.booking.application.port.out.ReservationRepository;
import personal.hatchery.reservation.booking.application.port.out.ResourceCatalogPort;
import personal.hatchery.reservation.booking.domain.exception.ReservationNotFoundException;
import personal.hatchery.reservation.booking.domain.model.Availability;
import personal.hatchery.reservation.booking.domain.model.Reservation;
import personal.hatchery.reservation.booking.domain.model.TimeSlot;
import personal.hatchery.reservation.booking.domain.service.AvailabilityIndex;
import personal.hatchery.reservation.resource.domain.exception.ResourceNotFoundException;
import personal.hatchery.reservation.resource.domain.model.Resource;

import java.time.Instant;
import java.util.List;

/**
 * Reservation Query Service
 * 예약 조회 및 락 없는 가용성 조회
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ReservationQueryService implements GetReservationUseCase, CheckAvailabilityUseCase {

    private final ReservationRepository reservationRepository;
    private final ResourceCatalogPort resourceCatalogPort;
    private final AvailabilityIndex availabilityIndex;

    @Override
    public Reservation getReservation(Long reservationId) {
        log.debug("Getting reservation: reservationId={}", reservationId);
        return reservationRepository.findById(reservationId)
                .orElseThrow(() -> new ReservationNotFoundException(reservationId));
    }

    @Override
    public List<Reservation> getReservationsForResource(String resourceId, Instant from, Instant to) {
        requireResource(resourceId);

        if (from == null && to == null) {
            return reservationRepository.findActiveByResourceId(resourceId);
        }
        if (!TimeSlot.isWellFormed(from, to)) {
            throw new BusinessException(ErrorCode.INVALID_SLOT,
                    String.format("Query window requires from < to: from=%s, to=%s", from, to));
        }
        return reservationRepository.findActiveOverlapping(resourceId, from, to);
    }

    @Override
    public List<Reservation> getReservationsForRequester(String requesterId) {
        log.debug("Getting reservations for requester: requesterId={}", requesterId);
        return reservationRepository.findByRequesterId(requesterId);
    }

    @Override
    public Availability checkAvailability(String resourceId, Instant start, Instant end) {
        Resource resource = requireResource(resourceId);
        TimeSlot slot = TimeSlot.of(start, end);

        List<Reservation> conflicts = availabilityIndex.overlapping(resourceId, slot);
        Availability availability = new Availability(
                resourceId, slot, resource.capacity(), conflicts.size(), conflicts);

        log.debug("Availability checked: resourceId={}, slot={}, occupied={}, capacity={}",
                resourceId, slot, availability.occupied(), availability.capacity());
        return availability;
    }

    private Resource requireResource(String resourceId) {
        return resourceCatalogPort.findResource(resourceId)
                .orElseThrow(() -> new ResourceNotFoundException(resourceId));
    }
}
