package personal.hatchery.reservation.resource.application.port.in;

import personal.hatchery.reservation.resource.domain.model.Resource;

/**
 * Update Resource UseCase (Input Port)
 * 자원 속성 변경 유스케이스. 기존 예약은 소급해서 무효화되지 않는다.
 */
public interface UpdateResourceUseCase {

    Resource updateCapacity(String resourceId, int capacity);

    Resource setCertificationRequired(String resourceId, boolean required);
}
