package personal.hatchery.common.exception;

import org.springframework.http.HttpStatus;

/**
 * 에러 코드 정의
 * HTTP Status Code와 메시지를 함께 관리
 */
public enum ErrorCode {
    // Common (Cxxx)
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "C001", "잘못된 입력값입니다."),
    NOT_FOUND(HttpStatus.NOT_FOUND, "C002", "요청한 리소스를 찾을 수 없습니다."),
    CONFLICT(HttpStatus.CONFLICT, "C003", "리소스 충돌이 발생했습니다."),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C004", "서버 내부 오류가 발생했습니다."),

    // Resource Registry (Rxxx)
    RESOURCE_NOT_FOUND(HttpStatus.NOT_FOUND, "R001", "예약 대상 자원을 찾을 수 없습니다."),
    DUPLICATE_RESOURCE(HttpStatus.CONFLICT, "R002", "이미 등록된 자원입니다."),

    // Certification Gate (Txxx)
    CERTIFICATION_NOT_APPLICABLE(HttpStatus.BAD_REQUEST, "T001", "인증은 장비(Machine) 자원에만 부여할 수 있습니다."),

    // Booking (Bxxx)
    RESERVATION_NOT_FOUND(HttpStatus.NOT_FOUND, "B001", "예약을 찾을 수 없습니다."),
    INVALID_RESERVATION_STATE(HttpStatus.CONFLICT, "B002", "현재 예약 상태에서는 처리할 수 없는 요청입니다."),
    INVALID_SLOT(HttpStatus.BAD_REQUEST, "B003", "예약 시간 구간이 올바르지 않습니다."),

    // Infrastructure (Exxx)
    RESOURCE_LOCK_TIMEOUT(HttpStatus.SERVICE_UNAVAILABLE, "E001", "예약 처리 대기 시간이 초과되었습니다. 잠시 후 다시 시도해주세요."),
    STORAGE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "E002", "저장소에 접근할 수 없습니다."),
    RESOURCE_LOCK_LOST(HttpStatus.SERVICE_UNAVAILABLE, "E003", "예약 처리 중 자원 잠금이 만료되었습니다. 잠시 후 다시 시도해주세요.");

    private final HttpStatus httpStatus;
    private final String code;
    private final String message;

    ErrorCode(HttpStatus httpStatus, String code, String message) {
        this.httpStatus = httpStatus;
        this.code = code;
        this.message = message;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
