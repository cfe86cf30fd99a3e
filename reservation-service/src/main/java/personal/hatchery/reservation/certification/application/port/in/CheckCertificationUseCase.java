package personal.hatchery.reservation.certification.application.port.in;

/**
 * Check Certification UseCase (Input Port)
 * 예약 가능 인증 여부 확인 유스케이스
 */
public interface CheckCertificationUseCase {

    /**
     * 사용자가 해당 자원을 예약할 자격이 있는지 확인
     * 인증이 필요 없는 자원이면 항상 true, 존재하지 않는 자원이면 false
     */
    boolean isAuthorized(String userId, String machineId);
}
