package de.bycsitsm.agenda.month;

import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class MonthCalendarTest {

    @Test
    void boundaries_cover_the_whole_month() {
        var boundaries = MonthCalendar.boundaries(LocalDate.of(2024, 2, 14));

        assertThat(boundaries.first()).isEqualTo(LocalDate.of(2024, 2, 1));
        assertThat(boundaries.last()).isEqualTo(LocalDate.of(2024, 2, 29));
    }

    @Test
    void weeks_starting_on_sunday_pad_with_nulls() {
        var weeks = MonthCalendar.weeks(YearMonth.of(2024, 3), DayOfWeek.SUNDAY);

        assertThat(weeks).hasSize(6);
        assertThat(weeks.get(0)).isEqualTo(Arrays.asList(null, null, null, null, null,
                LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 2)));
        assertThat(weeks.get(5)).isEqualTo(Arrays.asList(LocalDate.of(2024, 3, 31),
                null, null, null, null, null, null));
    }

    @Test
    void weeks_follow_the_first_weekday() {
        var weeks = MonthCalendar.weeks(YearMonth.of(2024, 3), DayOfWeek.MONDAY);

        assertThat(weeks).hasSize(5);
        assertThat(weeks.get(0)).isEqualTo(Arrays.asList(null, null, null, null,
                LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 2), LocalDate.of(2024, 3, 3)));
        assertThat(weeks).allSatisfy(week -> assertThat(week).hasSize(7));
    }

    @Test
    void month_filling_whole_weeks_needs_no_padding() {
        var weeks = MonthCalendar.weeks(YearMonth.of(2015, 2), DayOfWeek.SUNDAY);

        assertThat(weeks).hasSize(4);
        assertThat(weeks).allSatisfy(week -> assertThat(week).doesNotContainNull());
    }
}
