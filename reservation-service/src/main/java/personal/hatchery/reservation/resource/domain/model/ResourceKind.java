package personal.hatchery.reservation.resource.domain.model;

/**
 * Resource Kind Enum
 * 예약 가능한 자원 종류
 */
public enum ResourceKind {
    /**
     * 장비 (레이저 커터, 3D 프린터 등). 인증 요구 가능
     */
    MACHINE,

    /**
     * 공간 (작업실, 회의실). capacity > 1 이면 동시 사용 허용
     */
    SPACE,

    /**
     * 트레이너의 시간
     */
    TRAINER
}
