package personal.hatchery.reservation.booking.adapter.out.catalog;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import personal.hatchery.reservation.booking.application.port.out.ResourceCatalogPort;
import personal.hatchery.reservation.resource.application.port.in.GetResourceUseCase;
import personal.hatchery.reservation.resource.domain.model.Resource;

import java.util.Optional;

/**
 * Resource Catalog Adapter
 * 자원 레지스트리 유스케이스를 예약 모듈의 포트로 연결
 */
@Component
@RequiredArgsConstructor
public class ResourceCatalogAdapter implements ResourceCatalogPort {

    private final GetResourceUseCase getResourceUseCase;

    @Override
    public Optional<Resource> findResource(String resourceId) {
        return getResourceUseCase.findResource(resourceId);
    }
}
