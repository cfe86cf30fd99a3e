package personal.hatchery.reservation.booking.application.port.in;

import personal.hatchery.common.exception.BusinessException;
import personal.hatchery.common.exception.ErrorCode;
import personal.hatchery.reservation.booking.domain.model.BookingRequest;

import java.time.Instant;

/**
 * Book Reservation Command
 * 예약 커맨드. 구간 유효성(start < end)은 판정 단계에서 INVALID_SLOT 거절로 처리한다
 */
public record BookReservationCommand(
        String resourceId,
        String requesterId,
        Instant start,
        Instant end
) {
    public BookReservationCommand {
        if (resourceId == null || resourceId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Resource ID cannot be null or blank");
        }
        if (requesterId == null || requesterId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Requester ID cannot be null or blank");
        }
    }

    public BookingRequest toRequest() {
        return new BookingRequest(resourceId, requesterId, start, end);
    }
}
