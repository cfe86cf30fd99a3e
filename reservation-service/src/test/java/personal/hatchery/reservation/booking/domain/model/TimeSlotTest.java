package personal.hatchery.reservation.booking.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import personal.hatchery.common.exception.BusinessException;
import personal.hatchery.common.exception.ErrorCode;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static personal.hatchery.reservation.booking.support.ReservationFixtures.at;
import static personal.hatchery.reservation.booking.support.ReservationFixtures.slot;

@DisplayName("TimeSlot 단위 테스트")
class TimeSlotTest {

    @Test
    @DisplayName("시작과 종료가 같은 구간은 생성할 수 없다")
    void emptySlot_Rejected() {
        Instant instant = at(1);

        assertThatThrownBy(() -> TimeSlot.of(instant, instant))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode")
                .isEqualTo(ErrorCode.INVALID_SLOT);
    }

    @Test
    @DisplayName("종료가 시작보다 앞선 구간은 생성할 수 없다")
    void reversedSlot_Rejected() {
        assertThatThrownBy(() -> TimeSlot.of(at(3), at(1)))
                .isInstanceOf(BusinessException.class);
        assertThat(TimeSlot.isWellFormed(at(3), at(1))).isFalse();
        assertThat(TimeSlot.isWellFormed(null, at(1))).isFalse();
    }

    @Test
    @DisplayName("맞닿은 구간은 겹치지 않는다 (반열림 구간)")
    void adjacentSlots_DoNotOverlap() {
        assertThat(slot(10, 11).overlaps(slot(11, 12))).isFalse();
        assertThat(slot(11, 12).overlaps(slot(10, 11))).isFalse();
    }

    @Test
    @DisplayName("부분적으로 겹치거나 포함하는 구간은 겹친다")
    void overlappingSlots() {
        assertThat(slot(10, 12).overlaps(slot(11, 13))).isTrue();
        assertThat(slot(10, 14).overlaps(slot(11, 12))).isTrue();
        assertThat(slot(11, 12).overlaps(slot(10, 14))).isTrue();
        assertThat(slot(10, 11).overlaps(slot(10, 11))).isTrue();
    }

    @Test
    @DisplayName("종료 시각은 구간에 포함되지 않는다")
    void contains_ExcludesEnd() {
        TimeSlot slot = slot(10, 11);

        assertThat(slot.contains(at(10))).isTrue();
        assertThat(slot.contains(at(11))).isFalse();
    }
}
