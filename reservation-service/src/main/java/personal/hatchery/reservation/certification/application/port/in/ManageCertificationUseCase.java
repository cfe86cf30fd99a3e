package personal.hatchery.reservation.certification.application.port.in;

import personal.hatchery.reservation.certification.domain.model.Certification;

import java.time.Instant;

/**
 * Manage Certification UseCase (Input Port)
 * 인증 부여/회수 유스케이스
 */
public interface ManageCertificationUseCase {

    /**
     * 인증 부여
     * 유효한 인증이 이미 있고 새 만료 시각이 없으면 기존 인증을 그대로 반환한다 (멱등).
     * 기존 인증이 만료되었거나 다른 만료 시각이 주어지면 같은 레코드를 갱신한다.
     *
     * @param userId    사용자 ID
     * @param machineId 장비 자원 ID
     * @param expiresAt 만료 시각 (nullable)
     * @return 부여/갱신된(또는 기존) 인증
     * @throws personal.hatchery.reservation.resource.domain.exception.ResourceNotFoundException 자원이 없을 때
     * @throws personal.hatchery.reservation.certification.domain.exception.CertificationNotApplicableException 장비가 아닐 때
     */
    Certification grant(String userId, String machineId, Instant expiresAt);

    /**
     * 인증 회수
     * 이미 확정된 예약은 취소하지 않는다.
     *
     * @return 실제로 삭제되었으면 true
     */
    boolean revoke(String userId, String machineId);
}
