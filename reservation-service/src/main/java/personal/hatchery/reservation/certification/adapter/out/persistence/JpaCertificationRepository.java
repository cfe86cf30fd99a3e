package personal.hatchery.reservation.certification.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

/**
 * Spring Data JPA Repository for Certification
 */
public interface JpaCertificationRepository extends JpaRepository<CertificationEntity, Long> {

    Optional<CertificationEntity> findByUserIdAndResourceId(String userId, String resourceId);

    long deleteByUserIdAndResourceId(String userId, String resourceId);
}
