package de.bycsitsm.agenda.grid;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GridConfigTest {

    private static final LocalDate DAY = LocalDate.of(2024, 3, 15);

    @Test
    void slot_count_is_span_divided_by_interval_plus_one() {
        assertThat(GridConfig.defaults().slotCount()).isEqualTo(33);
        assertThat(config(Duration.ofMinutes(50), Duration.ofMinutes(15)).slotCount()).isEqualTo(4);
        assertThat(config(Duration.ZERO, Duration.ofMinutes(15)).slotCount()).isEqualTo(1);
    }

    @Test
    void slot_keys_include_the_grid_end() {
        var keys = config(Duration.ofHours(1), Duration.ofMinutes(30)).slotKeys(DAY);

        assertThat(keys).containsExactly(DAY.atTime(9, 0), DAY.atTime(9, 30), DAY.atTime(10, 0));
    }

    @Test
    void slot_keys_match_the_slot_count() {
        for (int minutes = 0; minutes <= 180; minutes += 7) {
            var config = config(Duration.ofMinutes(minutes), Duration.ofMinutes(20));

            assertThat(config.slotKeys(DAY)).hasSize(config.slotCount());
        }
    }

    @Test
    void span_may_reach_into_the_next_day() {
        var config = new GridConfig(LocalTime.of(15, 0), Duration.ofMinutes(630), Duration.ofMinutes(30), 4);

        var keys = config.slotKeys(DAY);

        assertThat(keys).hasSize(22);
        assertThat(keys.get(keys.size() - 1)).isEqualTo(DAY.plusDays(1).atTime(1, 30));
    }

    @Test
    void rejects_non_positive_slot_interval() {
        assertThatThrownBy(() -> config(Duration.ofHours(1), Duration.ZERO))
                .isInstanceOf(InvalidConfigException.class)
                .hasMessageContaining("Slot interval must be positive");
        assertThatThrownBy(() -> config(Duration.ofHours(1), Duration.ofMinutes(-15)))
                .isInstanceOf(InvalidConfigException.class);
    }

    @Test
    void rejects_negative_span_and_minimum_columns() {
        assertThatThrownBy(() -> config(Duration.ofHours(-1), Duration.ofMinutes(15)))
                .isInstanceOf(InvalidConfigException.class)
                .hasMessageContaining("Span duration");
        assertThatThrownBy(() -> new GridConfig(LocalTime.NOON, Duration.ofHours(1), Duration.ofMinutes(15), -1))
                .isInstanceOf(InvalidConfigException.class)
                .hasMessageContaining("Minimum column count");
    }

    private static GridConfig config(Duration span, Duration interval) {
        return new GridConfig(LocalTime.of(9, 0), span, interval, 4);
    }
}
