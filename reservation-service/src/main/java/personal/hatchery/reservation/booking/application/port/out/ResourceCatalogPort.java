package personal.hatchery.reservation.booking.application.port.out;

import personal.hatchery.reservation.resource.domain.model.Resource;

import java.util.Optional;

/**
 * Resource Catalog Port (Output Port)
 * 예약 판정에 필요한 자원 정보 조회
 */
public interface ResourceCatalogPort {

    Optional<Resource> findResource(String resourceId);
}
