package personal.hatchery.reservation.certification.domain.exception;

import personal.hatchery.common.exception.BusinessException;
import personal.hatchery.common.exception.ErrorCode;
import personal.hatchery.reservation.resource.domain.model.ResourceKind;

/**
 * Certification Not Applicable Exception
 * 장비가 아닌 자원에 인증을 부여하려 할 때 발생
 */
public class CertificationNotApplicableException extends BusinessException {
    public CertificationNotApplicableException(String resourceId, ResourceKind kind) {
        super(ErrorCode.CERTIFICATION_NOT_APPLICABLE,
                String.format("Certification applies only to machines: resourceId=%s, kind=%s", resourceId, kind));
    }
}
