package personal.hatchery.reservation.booking.application.port.out;

/**
 * Certification Port (Output Port)
 * 요청자의 장비 사용 자격 확인
 */
public interface CertificationPort {

    /**
     * @return 인증이 필요 없는 자원이거나 유효한 인증이 있으면 true
     */
    boolean isAuthorized(String requesterId, String resourceId);
}
