package de.bycsitsm.agenda;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimeIntervalTest {

    private static final LocalDateTime NINE = LocalDateTime.of(2024, 3, 15, 9, 0);

    @Test
    void rejects_end_before_start() {
        assertThatThrownBy(() -> new TimeInterval(NINE, NINE.minusMinutes(1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("lies before its start");
    }

    @Test
    void allows_zero_length() {
        var interval = new TimeInterval(NINE, NINE);

        assertThat(interval.duration()).isEqualTo(Duration.ZERO);
    }

    @Test
    void touching_boundaries_overlap() {
        var interval = new TimeInterval(NINE, NINE.plusHours(1));

        assertThat(interval.overlaps(NINE.plusHours(1), NINE.plusHours(2))).isTrue();
        assertThat(interval.overlaps(NINE.minusHours(1), NINE)).isTrue();
        assertThat(interval.overlaps(NINE.plusHours(1).plusSeconds(1), NINE.plusHours(2))).isFalse();
    }

    @Test
    void overlap_is_symmetric() {
        var base = new TimeInterval(NINE, NINE.plusHours(2));
        for (int startOffset = -4; startOffset <= 4; startOffset++) {
            for (int length = 0; length <= 4; length++) {
                var other = new TimeInterval(NINE.plusHours(startOffset), NINE.plusHours(startOffset + length));

                assertThat(base.overlaps(other)).isEqualTo(other.overlaps(base));
            }
        }
    }

    @Test
    void starting_at_keeps_the_duration() {
        var interval = new TimeInterval(NINE, NINE.plusMinutes(45));

        var moved = interval.startingAt(NINE.plusDays(1));

        assertThat(moved).isEqualTo(new TimeInterval(NINE.plusDays(1), NINE.plusDays(1).plusMinutes(45)));
    }
}
