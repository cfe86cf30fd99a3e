package personal.hatchery.reservation.certification.adapter.in.web.dto;

/**
 * 예약 자격 확인 응답 DTO
 */
public record AuthorizationResponse(
        String userId,
        String resourceId,
        boolean authorized
) {
}
