package personal.hatchery.reservation.certification.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.hatchery.reservation.certification.application.port.out.CertificationRepository;
import personal.hatchery.reservation.certification.domain.model.Certification;

import java.util.Optional;

/**
 * Certification Persistence Adapter
 * JPA를 사용한 인증 저장소 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CertificationPersistenceAdapter implements CertificationRepository {

    private final JpaCertificationRepository jpaCertificationRepository;

    @Override
    public Certification save(Certification certification) {
        log.debug("Saving certification: userId={}, resourceId={}", certification.userId(), certification.resourceId());
        return jpaCertificationRepository.saveAndFlush(CertificationEntity.fromDomain(certification)).toDomain();
    }

    @Override
    public Optional<Certification> findByUserIdAndResourceId(String userId, String resourceId) {
        return jpaCertificationRepository.findByUserIdAndResourceId(userId, resourceId)
                .map(CertificationEntity::toDomain);
    }

    @Override
    public long deleteByUserIdAndResourceId(String userId, String resourceId) {
        return jpaCertificationRepository.deleteByUserIdAndResourceId(userId, resourceId);
    }
}
