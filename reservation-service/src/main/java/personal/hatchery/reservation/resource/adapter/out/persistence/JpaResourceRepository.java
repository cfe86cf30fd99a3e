package personal.hatchery.reservation.resource.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import personal.hatchery.reservation.resource.domain.model.ResourceKind;

import java.util.List;

/**
 * Spring Data JPA Repository for Resource
 */
public interface JpaResourceRepository extends JpaRepository<ResourceEntity, String> {

    List<ResourceEntity> findAllByKindOrderByIdAsc(ResourceKind kind);

    List<ResourceEntity> findAllByOrderByIdAsc();
}
