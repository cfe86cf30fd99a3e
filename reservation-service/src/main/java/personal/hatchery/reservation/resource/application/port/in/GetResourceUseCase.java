package personal.hatchery.reservation.resource.application.port.in;

import personal.hatchery.reservation.resource.domain.model.Resource;
import personal.hatchery.reservation.resource.domain.model.ResourceKind;

import java.util.List;
import java.util.Optional;

/**
 * Get Resource UseCase (Input Port)
 * 자원 조회 유스케이스
 */
public interface GetResourceUseCase {

    /**
     * @throws personal.hatchery.reservation.resource.domain.exception.ResourceNotFoundException 자원이 없을 때
     */
    Resource getResource(String resourceId);

    Optional<Resource> findResource(String resourceId);

    /**
     * 자원 목록 조회
     *
     * @param kind 종류 필터 (null 이면 전체)
     */
    List<Resource> getResources(ResourceKind kind);
}
