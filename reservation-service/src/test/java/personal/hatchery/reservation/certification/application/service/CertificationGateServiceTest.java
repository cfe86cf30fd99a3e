package personal.hatchery.reservation.certification.application.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.hatchery.reservation.certification.application.port.out.CertificationRepository;
import personal.hatchery.reservation.certification.domain.exception.CertificationNotApplicableException;
import personal.hatchery.reservation.certification.domain.model.Certification;
import personal.hatchery.reservation.resource.application.port.in.GetResourceUseCase;
import personal.hatchery.reservation.resource.domain.exception.ResourceNotFoundException;
import personal.hatchery.reservation.resource.domain.model.Resource;
import personal.hatchery.reservation.resource.domain.model.ResourceKind;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@DisplayName("CertificationGateService 단위 테스트")
class CertificationGateServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-02T09:00:00Z");
    private static final String LASER = "LASER-01";

    @Mock
    private CertificationRepository certificationRepository;
    @Mock
    private GetResourceUseCase getResourceUseCase;

    private CertificationGateService certificationGateService;

    @BeforeEach
    void setUp() {
        certificationGateService = new CertificationGateService(
                certificationRepository, getResourceUseCase, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static Resource laser(boolean certificationRequired) {
        return new Resource(LASER, "Laser Cutter", ResourceKind.MACHINE, 1, certificationRequired, false);
    }

    @Test
    @DisplayName("장비 인증 부여 성공")
    void grant_Success() {
        // given
        given(getResourceUseCase.getResource(LASER)).willReturn(laser(true));
        given(certificationRepository.findByUserIdAndResourceId("alice", LASER)).willReturn(Optional.empty());
        given(certificationRepository.save(any(Certification.class)))
                .willAnswer(invocation -> invocation.getArgument(0));

        // when
        Certification certification = certificationGateService.grant("alice", LASER, null);

        // then
        assertThat(certification.userId()).isEqualTo("alice");
        assertThat(certification.grantedAt()).isEqualTo(NOW);
        assertThat(certification.expiresAt()).isNull();
    }

    @Test
    @DisplayName("유효한 인증에 다시 부여하면 기존 레코드를 그대로 반환한다 (멱등)")
    void grant_Idempotent() {
        Certification existing = new Certification(1L, "alice", LASER, NOW.minusSeconds(60), null);
        given(getResourceUseCase.getResource(LASER)).willReturn(laser(true));
        given(certificationRepository.findByUserIdAndResourceId("alice", LASER)).willReturn(Optional.of(existing));

        Certification certification = certificationGateService.grant("alice", LASER, null);

        assertThat(certification).isEqualTo(existing);
        verify(certificationRepository, never()).save(any(Certification.class));
    }

    @Test
    @DisplayName("만료된 인증은 다시 부여하면 같은 레코드로 갱신되어 지금 유효하다")
    void grant_ExpiredCertification_Renewed() {
        // given
        Certification expired = new Certification(1L, "alice", LASER,
                NOW.minus(Duration.ofDays(400)), NOW.minus(Duration.ofDays(35)));
        given(getResourceUseCase.getResource(LASER)).willReturn(laser(true));
        given(certificationRepository.findByUserIdAndResourceId("alice", LASER)).willReturn(Optional.of(expired));
        given(certificationRepository.save(any(Certification.class)))
                .willAnswer(invocation -> invocation.getArgument(0));
        Instant nextYear = NOW.plus(Duration.ofDays(365));

        // when
        Certification certification = certificationGateService.grant("alice", LASER, nextYear);

        // then
        assertThat(certification.isValidAt(NOW)).isTrue();
        assertThat(certification.id()).isEqualTo(1L);
        assertThat(certification.grantedAt()).isEqualTo(NOW);
        assertThat(certification.expiresAt()).isEqualTo(nextYear);
        verify(certificationRepository).save(certification);
    }

    @Test
    @DisplayName("만료된 인증을 만료 시각 없이 다시 부여하면 무기한 인증이 된다")
    void grant_ExpiredCertification_RenewedIndefinitely() {
        Certification expired = new Certification(1L, "alice", LASER,
                NOW.minus(Duration.ofDays(30)), NOW.minusSeconds(1));
        given(getResourceUseCase.getResource(LASER)).willReturn(laser(true));
        given(certificationRepository.findByUserIdAndResourceId("alice", LASER)).willReturn(Optional.of(expired));
        given(certificationRepository.save(any(Certification.class)))
                .willAnswer(invocation -> invocation.getArgument(0));

        Certification certification = certificationGateService.grant("alice", LASER, null);

        assertThat(certification.expiresAt()).isNull();
        assertThat(certification.isValidAt(NOW.plus(Duration.ofDays(3650)))).isTrue();
    }

    @Test
    @DisplayName("유효한 인증에 새 만료 시각을 주면 만료 시각이 연장된다")
    void grant_ValidCertification_Extended() {
        // given
        Certification current = new Certification(1L, "alice", LASER,
                NOW.minus(Duration.ofDays(10)), NOW.plus(Duration.ofDays(5)));
        given(getResourceUseCase.getResource(LASER)).willReturn(laser(true));
        given(certificationRepository.findByUserIdAndResourceId("alice", LASER)).willReturn(Optional.of(current));
        given(certificationRepository.save(any(Certification.class)))
                .willAnswer(invocation -> invocation.getArgument(0));
        Instant extended = NOW.plus(Duration.ofDays(90));

        // when
        Certification certification = certificationGateService.grant("alice", LASER, extended);

        // then
        assertThat(certification.id()).isEqualTo(1L);
        assertThat(certification.expiresAt()).isEqualTo(extended);
        assertThat(certification.isValidAt(NOW.plus(Duration.ofDays(30)))).isTrue();
    }

    @Test
    @DisplayName("유효한 인증에 같은 만료 시각으로 다시 부여하면 저장하지 않는다")
    void grant_SameExpiry_NoOp() {
        Instant expiresAt = NOW.plus(Duration.ofDays(5));
        Certification current = new Certification(1L, "alice", LASER, NOW.minus(Duration.ofDays(10)), expiresAt);
        given(getResourceUseCase.getResource(LASER)).willReturn(laser(true));
        given(certificationRepository.findByUserIdAndResourceId("alice", LASER)).willReturn(Optional.of(current));

        assertThat(certificationGateService.grant("alice", LASER, expiresAt)).isEqualTo(current);
        verify(certificationRepository, never()).save(any(Certification.class));
    }

    @Test
    @DisplayName("장비가 아닌 자원에는 인증을 부여할 수 없다")
    void grant_NonMachine() {
        given(getResourceUseCase.getResource("ROOM-A"))
                .willReturn(new Resource("ROOM-A", "Room", ResourceKind.SPACE, 4, false, false));

        assertThatThrownBy(() -> certificationGateService.grant("alice", "ROOM-A", null))
                .isInstanceOf(CertificationNotApplicableException.class);
        verifyNoInteractions(certificationRepository);
    }

    @Test
    @DisplayName("없는 자원에 대한 인증 부여는 ResourceNotFoundException")
    void grant_UnknownResource() {
        given(getResourceUseCase.getResource("GHOST")).willThrow(new ResourceNotFoundException("GHOST"));

        assertThatThrownBy(() -> certificationGateService.grant("alice", "GHOST", null))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("없는 인증 회수는 아무 일도 하지 않는다")
    void revoke_Missing_NoOp() {
        given(certificationRepository.deleteByUserIdAndResourceId("bob", LASER)).willReturn(0L);

        assertThat(certificationGateService.revoke("bob", LASER)).isFalse();
    }

    @Test
    @DisplayName("인증 회수 성공")
    void revoke_Success() {
        given(certificationRepository.deleteByUserIdAndResourceId("alice", LASER)).willReturn(1L);

        assertThat(certificationGateService.revoke("alice", LASER)).isTrue();
    }

    @Test
    @DisplayName("인증이 필요 없는 자원은 누구나 권한이 있다")
    void isAuthorized_NotRequired() {
        given(getResourceUseCase.findResource(LASER)).willReturn(Optional.of(laser(false)));

        assertThat(certificationGateService.isAuthorized("anyone", LASER)).isTrue();
        verifyNoInteractions(certificationRepository);
    }

    @Test
    @DisplayName("인증 필요 장비는 유효한 인증이 있어야 권한이 있다")
    void isAuthorized_Required() {
        given(getResourceUseCase.findResource(LASER)).willReturn(Optional.of(laser(true)));
        given(certificationRepository.findByUserIdAndResourceId("alice", LASER))
                .willReturn(Optional.of(new Certification(1L, "alice", LASER, NOW.minusSeconds(60), null)));
        given(certificationRepository.findByUserIdAndResourceId("bob", LASER)).willReturn(Optional.empty());

        assertThat(certificationGateService.isAuthorized("alice", LASER)).isTrue();
        assertThat(certificationGateService.isAuthorized("bob", LASER)).isFalse();
    }

    @Test
    @DisplayName("만료된 인증은 권한을 주지 않는다")
    void isAuthorized_Expired() {
        given(getResourceUseCase.findResource(LASER)).willReturn(Optional.of(laser(true)));
        Instant grantedAt = NOW.minus(Duration.ofDays(30));
        given(certificationRepository.findByUserIdAndResourceId("alice", LASER))
                .willReturn(Optional.of(new Certification(1L, "alice", LASER, grantedAt, NOW)));

        assertThat(certificationGateService.isAuthorized("alice", LASER)).isFalse();
    }

    @Test
    @DisplayName("없는 자원은 권한이 없다")
    void isAuthorized_UnknownResource() {
        given(getResourceUseCase.findResource("GHOST")).willReturn(Optional.empty());

        assertThat(certificationGateService.isAuthorized("alice", "GHOST")).isFalse();
    }
}
