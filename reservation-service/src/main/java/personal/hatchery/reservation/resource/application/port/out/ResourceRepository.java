package personal.hatchery.reservation.resource.application.port.out;

import personal.hatchery.reservation.resource.domain.model.Resource;
import personal.hatchery.reservation.resource.domain.model.ResourceKind;

import java.util.List;
import java.util.Optional;

/**
 * Resource Repository (Output Port)
 * 자원 저장소 인터페이스
 */
public interface ResourceRepository {

    /**
     * 신규 자원 저장
     * 동일 ID가 이미 있으면 저장소의 무결성 예외가 전파된다.
     */
    Resource insert(Resource resource);

    /**
     * 기존 자원 속성 갱신
     *
     * @return 갱신된 자원 (없으면 empty)
     */
    Optional<Resource> update(Resource resource);

    Optional<Resource> findById(String resourceId);

    boolean existsById(String resourceId);

    List<Resource> findAll();

    List<Resource> findAllByKind(ResourceKind kind);
}
