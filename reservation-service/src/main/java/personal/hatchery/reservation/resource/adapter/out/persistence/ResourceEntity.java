package personal.hatchery.reservation.resource.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.hatchery.reservation.resource.domain.model.Resource;
import personal.hatchery.reservation.resource.domain.model.ResourceKind;

import java.time.Instant;

/**
 * Resource JPA Entity
 * 자원 테이블 매핑
 * 단일 자원 속성 변경의 읽기/쓰기 배타성은 @Version(낙관적 락)으로 보장
 */
@Entity
@Table(name = "resources")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ResourceEntity {

    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false, length = 200)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ResourceKind kind;

    @Column(nullable = false)
    private int capacity;

    @Column(name = "certification_required", nullable = false)
    private boolean certificationRequired;

    @Column(name = "approval_required", nullable = false)
    private boolean approvalRequired;

    @Version
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /**
     * 도메인 모델로부터 엔티티 생성
     */
    public static ResourceEntity fromDomain(Resource resource) {
        ResourceEntity entity = new ResourceEntity();
        entity.id = resource.id();
        entity.apply(resource);
        return entity;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    /**
     * 변경 가능한 속성 반영 (영속성 컨텍스트 내에서 사용)
     */
    public void apply(Resource resource) {
        this.name = resource.name();
        this.kind = resource.kind();
        this.capacity = resource.capacity();
        this.certificationRequired = resource.certificationRequired();
        this.approvalRequired = resource.approvalRequired();
    }

    /**
     * 도메인 모델로 변환
     */
    public Resource toDomain() {
        return new Resource(id, name, kind, capacity, certificationRequired, approvalRequired);
    }
}
