package personal.hatchery.reservation.certification.application.port.out;

import personal.hatchery.reservation.certification.domain.model.Certification;

import java.util.Optional;

/**
 * Certification Repository (Output Port)
 * 인증 저장소 인터페이스
 */
public interface CertificationRepository {

    /**
     * 인증 저장
     * (userId, resourceId) 중복 시 저장소의 무결성 예외가 전파된다.
     */
    Certification save(Certification certification);

    Optional<Certification> findByUserIdAndResourceId(String userId, String resourceId);

    /**
     * @return 삭제된 건수
     */
    long deleteByUserIdAndResourceId(String userId, String resourceId);
}
