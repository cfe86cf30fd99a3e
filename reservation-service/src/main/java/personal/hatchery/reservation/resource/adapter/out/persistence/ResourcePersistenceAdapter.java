package personal.hatchery.reservation.resource.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.hatchery.reservation.resource.application.port.out.ResourceRepository;
import personal.hatchery.reservation.resource.domain.model.Resource;
import personal.hatchery.reservation.resource.domain.model.ResourceKind;

import java.util.List;
import java.util.Optional;

/**
 * Resource Persistence Adapter
 * JPA를 사용한 자원 저장소 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResourcePersistenceAdapter implements ResourceRepository {

    private final JpaResourceRepository jpaResourceRepository;

    @Override
    public Resource insert(Resource resource) {
        log.debug("Inserting resource: resourceId={}", resource.id());
        // saveAndFlush: PK 충돌을 호출 시점에 DataIntegrityViolationException 으로 드러낸다
        return jpaResourceRepository.saveAndFlush(ResourceEntity.fromDomain(resource)).toDomain();
    }

    @Override
    public Optional<Resource> update(Resource resource) {
        log.debug("Updating resource: resourceId={}", resource.id());
        return jpaResourceRepository.findById(resource.id())
                .map(entity -> {
                    entity.apply(resource);
                    return jpaResourceRepository.saveAndFlush(entity).toDomain();
                });
    }

    @Override
    public Optional<Resource> findById(String resourceId) {
        return jpaResourceRepository.findById(resourceId)
                .map(ResourceEntity::toDomain);
    }

    @Override
    public boolean existsById(String resourceId) {
        return jpaResourceRepository.existsById(resourceId);
    }

    @Override
    public List<Resource> findAll() {
        return jpaResourceRepository.findAllByOrderByIdAsc().stream()
                .map(ResourceEntity::toDomain)
                .toList();
    }

    @Override
    public List<Resource> findAllByKind(ResourceKind kind) {
        return jpaResourceRepository.findAllByKindOrderByIdAsc(kind).stream()
                .map(ResourceEntity::toDomain)
                .toList();
    }
}
