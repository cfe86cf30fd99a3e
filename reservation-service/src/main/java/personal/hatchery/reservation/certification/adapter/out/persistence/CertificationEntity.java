package personal.hatchery.reservation.certification.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.hatchery.reservation.certification.domain.model.Certification;

import java.time.Instant;

/**
 * Certification JPA Entity
 * 인증 테이블 매핑
 */
@Entity
@Table(name = "certifications",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_certification_user_resource",
                columnNames = {"user_id", "resource_id"}
        ))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CertificationEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, length = 100)
    private String userId;

    @Column(name = "resource_id", nullable = false, length = 64)
    private String resourceId;

    @Column(name = "granted_at", nullable = false)
    private Instant grantedAt;

    @Column(name = "expires_at")
    private Instant expiresAt;

    public static CertificationEntity fromDomain(Certification certification) {
        CertificationEntity entity = new CertificationEntity();
        entity.id = certification.id();
        entity.userId = certification.userId();
        entity.resourceId = certification.resourceId();
        entity.grantedAt = certification.grantedAt();
        entity.expiresAt = certification.expiresAt();
        return entity;
    }

    public Certification toDomain() {
        return new Certification(id, userId, resourceId, grantedAt, expiresAt);
    }
}
