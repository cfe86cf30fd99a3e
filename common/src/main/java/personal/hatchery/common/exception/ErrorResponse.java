package personal.hatchery.common.exception;

import java.time.Instant;

/**
 * 에러 응답 포맷
 *
 * @param code      에러 코드 (예: R001)
 * @param message   사용자 메시지
 * @param timestamp 발생 시각
 */
public record ErrorResponse(
        String code,
        String message,
        Instant timestamp
) {
    public static ErrorResponse of(ErrorCode errorCode, String message) {
        return new ErrorResponse(errorCode.getCode(), message, Instant.now());
    }
}
