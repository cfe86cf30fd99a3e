package personal.hatchery.reservation.resource.application.port.in;

/**
 * Register Resource UseCase (Input Port)
 * 자원 등록 유스케이스 (Catalog/Admin 협력자가 호출)
 */
public interface RegisterResourceUseCase {

    /**
     * 자원 등록
     *
     * @param command 등록 커맨드
     * @return 등록된 자원 ID
     * @throws personal.hatchery.reservation.resource.domain.exception.DuplicateResourceException 동일 ID가 이미 존재할 때
     */
    String register(RegisterResourceCommand command);
}
