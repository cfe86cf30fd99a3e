package personal.hatchery.reservation.booking.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.hatchery.reservation.booking.adapter.in.web.dto.AvailabilityResponse;
import personal.hatchery.reservation.booking.adapter.in.web.dto.BookReservationRequest;
import personal.hatchery.reservation.booking.adapter.in.web.dto.BookingResultResponse;
import personal.hatchery.reservation.booking.adapter.in.web.dto.RescheduleRequest;
import personal.hatchery.reservation.booking.adapter.in.web.dto.ReservationResponse;
import personal.hatchery.reservation.booking.application.port.in.ApproveReservationUseCase;
import personal.hatchery.reservation.booking.application.port.in.BookReservationUseCase;
import personal.hatchery.reservation.booking.application.port.in.CancelReservationUseCase;
import personal.hatchery.reservation.booking.application.port.in.CheckAvailabilityUseCase;
import personal.hatchery.reservation.booking.application.port.in.GetReservationUseCase;
import personal.hatchery.reservation.booking.application.port.in.RescheduleReservationUseCase;
import personal.hatchery.reservation.booking.domain.model.BookingResult;

import java.time.Instant;
import java.util.List;

/**
 * Reservation API Controller
 * 예약 관련 REST API
 *
 * 요청자 식별은 X-User-Id 헤더를 그대로 신뢰한다.
 * 정책 거절은 200 + decision=REJECTED 로, 승인은 201 로 응답한다.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class ReservationController {

    private static final String USER_ID_HEADER = "X-User-Id";

    private final BookReservationUseCase bookReservationUseCase;
    private final CancelReservationUseCase cancelReservationUseCase;
    private final RescheduleReservationUseCase rescheduleReservationUseCase;
    private final ApproveReservationUseCase approveReservationUseCase;
    private final GetReservationUseCase getReservationUseCase;
    private final CheckAvailabilityUseCase checkAvailabilityUseCase;

    /**
     * 예약
     * POST /api/v1/reservations
     */
    @PostMapping("/reservations")
    public ResponseEntity<BookingResultResponse> book(
            @RequestHeader(USER_ID_HEADER) String userId,
            @Valid @RequestBody BookReservationRequest request
    ) {
        log.info("Book reservation: userId={}, resourceId={}, start={}, end={}",
                userId, request.resourceId(), request.start(), request.end());

        BookingResult result = bookReservationUseCase.book(request.toCommand(userId));
        return toResponse(result);
    }

    /**
     * 예약 취소 (멱등)
     * DELETE /api/v1/reservations/{reservationId}
     */
    @DeleteMapping("/reservations/{reservationId}")
    public ResponseEntity<ReservationResponse> cancel(@PathVariable Long reservationId) {
        log.info("Cancel reservation: reservationId={}", reservationId);

        return ResponseEntity.ok(ReservationResponse.from(cancelReservationUseCase.cancel(reservationId)));
    }

    /**
     * 일정 변경
     * PUT /api/v1/reservations/{reservationId}/slot
     */
    @PutMapping("/reservations/{reservationId}/slot")
    public ResponseEntity<BookingResultResponse> reschedule(
            @PathVariable Long reservationId,
            @Valid @RequestBody RescheduleRequest request
    ) {
        log.info("Reschedule reservation: reservationId={}, start={}, end={}",
                reservationId, request.start(), request.end());

        BookingResult result = rescheduleReservationUseCase.reschedule(reservationId, request.start(), request.end());
        return toResponse(result);
    }

    /**
     * 승인 대기 예약 승인
     * POST /api/v1/reservations/{reservationId}/approve
     */
    @PostMapping("/reservations/{reservationId}/approve")
    public ResponseEntity<ReservationResponse> approve(@PathVariable Long reservationId) {
        log.info("Approve reservation: reservationId={}", reservationId);

        return ResponseEntity.ok(ReservationResponse.from(approveReservationUseCase.approve(reservationId)));
    }

    /**
     * 예약 조회
     * GET /api/v1/reservations/{reservationId}
     */
    @GetMapping("/reservations/{reservationId}")
    public ResponseEntity<ReservationResponse> getReservation(@PathVariable Long reservationId) {
        return ResponseEntity.ok(ReservationResponse.from(getReservationUseCase.getReservation(reservationId)));
    }

    /**
     * 내 예약 목록 (최신순)
     * GET /api/v1/reservations/me
     */
    @GetMapping("/reservations/me")
    public ResponseEntity<List<ReservationResponse>> getMyReservations(@RequestHeader(USER_ID_HEADER) String userId) {
        List<ReservationResponse> response = getReservationUseCase.getReservationsForRequester(userId).stream()
                .map(ReservationResponse::from)
                .toList();

        return ResponseEntity.ok(response);
    }

    /**
     * 자원의 활성 예약 목록
     * GET /api/v1/resources/{resourceId}/reservations?from=...&to=...
     */
    @GetMapping("/resources/{resourceId}/reservations")
    public ResponseEntity<List<ReservationResponse>> getResourceReservations(
            @PathVariable String resourceId,
            @RequestParam(required = false) Instant from,
            @RequestParam(required = false) Instant to
    ) {
        List<ReservationResponse> response = getReservationUseCase.getReservationsForResource(resourceId, from, to)
                .stream()
                .map(ReservationResponse::from)
                .toList();

        return ResponseEntity.ok(response);
    }

    /**
     * 가용성 조회 (락 없음, 참고용)
     * GET /api/v1/resources/{resourceId}/availability?start=...&end=...
     */
    @GetMapping("/resources/{resourceId}/availability")
    public ResponseEntity<AvailabilityResponse> checkAvailability(
            @PathVariable String resourceId,
            @RequestParam Instant start,
            @RequestParam Instant end
    ) {
        return ResponseEntity.ok(AvailabilityResponse.from(
                checkAvailabilityUseCase.checkAvailability(resourceId, start, end)));
    }

    private ResponseEntity<BookingResultResponse> toResponse(BookingResult result) {
        HttpStatus status = result.isAdmitted() ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(BookingResultResponse.from(result));
    }
}
