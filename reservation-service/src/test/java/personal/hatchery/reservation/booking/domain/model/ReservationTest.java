package personal.hatchery.reservation.booking.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import personal.hatchery.reservation.booking.domain.exception.InvalidReservationStateException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static personal.hatchery.reservation.booking.support.ReservationFixtures.BASE;
import static personal.hatchery.reservation.booking.support.ReservationFixtures.reservation;
import static personal.hatchery.reservation.booking.support.ReservationFixtures.slot;

@DisplayName("Reservation 상태 전이 단위 테스트")
class ReservationTest {

    @Test
    @DisplayName("새 예약은 PENDING 상태이며 ID 가 없다")
    void pending_Created() {
        Reservation reservation = Reservation.pending("LASER-01", "alice", slot(1, 2), BASE);

        assertThat(reservation.id()).isNull();
        assertThat(reservation.status()).isEqualTo(ReservationStatus.PENDING);
        assertThat(reservation.isActive()).isTrue();
    }

    @Test
    @DisplayName("PENDING 예약은 확정/거절/취소할 수 있다")
    void pendingTransitions() {
        Reservation pending = reservation(1L, "LASER-01", "alice", 1, 2, ReservationStatus.PENDING);

        assertThat(pending.confirm().status()).isEqualTo(ReservationStatus.CONFIRMED);
        assertThat(pending.cancel().status()).isEqualTo(ReservationStatus.CANCELLED);

        Reservation rejected = pending.reject(RejectionReason.CAPACITY_EXCEEDED);
        assertThat(rejected.status()).isEqualTo(ReservationStatus.CANCELLED);
        assertThat(rejected.rejectionReason()).isEqualTo(RejectionReason.CAPACITY_EXCEEDED);
        assertThat(rejected.isActive()).isFalse();
    }

    @Test
    @DisplayName("CONFIRMED 예약은 취소만 가능하다")
    void confirmedTransitions() {
        Reservation confirmed = reservation(1L, "LASER-01", "alice", 1, 2, ReservationStatus.CONFIRMED);

        assertThat(confirmed.cancel().status()).isEqualTo(ReservationStatus.CANCELLED);
        assertThatThrownBy(confirmed::confirm).isInstanceOf(InvalidReservationStateException.class);
    }

    @Test
    @DisplayName("CANCELLED 예약은 어떤 상태로도 전이할 수 없다")
    void cancelledIsTerminal() {
        Reservation cancelled = reservation(1L, "LASER-01", "alice", 1, 2, ReservationStatus.CANCELLED);

        assertThatThrownBy(cancelled::cancel).isInstanceOf(InvalidReservationStateException.class);
        assertThatThrownBy(cancelled::confirm).isInstanceOf(InvalidReservationStateException.class);
        assertThatThrownBy(() -> cancelled.reject(RejectionReason.NOT_CERTIFIED))
                .isInstanceOf(InvalidReservationStateException.class);
    }

    @Test
    @DisplayName("대체 예약은 같은 자원/요청자를 유지하고 이전 예약을 가리킨다")
    void replacementFor_LinksOriginal() {
        Reservation original = reservation(7L, "ROOM-A", "bob", 1, 2, ReservationStatus.CONFIRMED);

        Reservation replacement = original.replacementFor(slot(3, 4), BASE);

        assertThat(replacement.id()).isNull();
        assertThat(replacement.resourceId()).isEqualTo("ROOM-A");
        assertThat(replacement.requesterId()).isEqualTo("bob");
        assertThat(replacement.slot()).isEqualTo(slot(3, 4));
        assertThat(replacement.rescheduledFromId()).isEqualTo(7L);
        assertThat(replacement.isPending()).isTrue();
    }
}
