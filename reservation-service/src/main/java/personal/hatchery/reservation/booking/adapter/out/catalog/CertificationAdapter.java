package personal.hatchery.reservation.booking.adapter.out.catalog;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.hatchery.reservation.booking.application.port.out.CertificationPort;
import personal.hatchery.reservation.certification.application.port.in.CheckCertificationUseCase;

/**
 * Certification Adapter
 * 인증 게이트 유스케이스를 예약 모듈의 포트로 연결
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CertificationAdapter implements CertificationPort {

    private final CheckCertificationUseCase checkCertificationUseCase;

    @Override
    public boolean isAuthorized(String requesterId, String resourceId) {
        boolean authorized = checkCertificationUseCase.isAuthorized(requesterId, resourceId);
        if (!authorized) {
            log.debug("Requester not certified: requesterId={}, resourceId={}", requesterId, resourceId);
        }
        return authorized;
    }
}
