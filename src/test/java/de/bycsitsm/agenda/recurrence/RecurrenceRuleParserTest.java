package de.bycsitsm.agenda.recurrence;

import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.Month;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecurrenceRuleParserTest {

    @Test
    void parses_weekly_rule_with_weekdays() {
        var rule = RecurrenceRuleParser.parse("RRULE:FREQ=WEEKLY;INTERVAL=2;COUNT=6;BYDAY=MO,WE");

        assertThat(rule.frequency()).isEqualTo(Frequency.WEEKLY);
        assertThat(rule.interval()).isEqualTo(2);
        assertThat(rule.count()).isEqualTo(6);
        assertThat(rule.until()).isNull();
        assertThat(rule.byWeekday()).containsExactly(
                NthWeekday.every(DayOfWeek.MONDAY),
                NthWeekday.every(DayOfWeek.WEDNESDAY));
    }

    @Test
    void parses_weekday_ordinals() {
        var rule = RecurrenceRuleParser.parse("FREQ=MONTHLY;BYDAY=-1FR,+2TU;COUNT=3");

        assertThat(rule.byWeekday()).containsExactly(
                NthWeekday.nth(-1, DayOfWeek.FRIDAY),
                NthWeekday.nth(2, DayOfWeek.TUESDAY));
    }

    @Test
    void parses_month_filters_and_week_start() {
        var rule = RecurrenceRuleParser.parse("freq=yearly;bymonth=1,7;bymonthday=15;wkst=SU;count=2");

        assertThat(rule.frequency()).isEqualTo(Frequency.YEARLY);
        assertThat(rule.byMonth()).containsExactlyInAnyOrder(Month.JANUARY, Month.JULY);
        assertThat(rule.byMonthday()).containsExactly(15);
        assertThat(rule.weekStart()).isEqualTo(DayOfWeek.SUNDAY);
    }

    @Test
    void date_only_until_includes_the_whole_day() {
        var rule = RecurrenceRuleParser.parse("FREQ=DAILY;UNTIL=20240105");

        assertThat(rule.until()).isEqualTo(LocalDate.of(2024, 1, 5).atTime(LocalTime.MAX));
    }

    @Test
    void date_time_until_drops_the_utc_marker() {
        var rule = RecurrenceRuleParser.parse("FREQ=DAILY;UNTIL=20240105T093000Z");

        assertThat(rule.until()).isEqualTo(LocalDateTime.of(2024, 1, 5, 9, 30));
    }

    @Test
    void missing_frequency_defaults_to_daily() {
        var rule = RecurrenceRuleParser.parse("COUNT=2");

        assertThat(rule.frequency()).isEqualTo(Frequency.DAILY);
    }

    @Test
    void parsed_rule_expands_like_a_built_one() {
        var start = LocalDateTime.of(2024, 1, 1, 9, 0);
        var expander = new RecurrenceExpander();

        var parsed = expander.expand(start, start.plusHours(1),
                RecurrenceRuleParser.parse("FREQ=WEEKLY;BYDAY=MO,WE;COUNT=4"));
        var built = expander.expand(start, start.plusHours(1), RecurrenceRule.builder(Frequency.WEEKLY)
                .byWeekday(DayOfWeek.MONDAY, DayOfWeek.WEDNESDAY)
                .count(4)
                .build());

        assertThat(parsed).isEqualTo(built);
    }

    @Test
    void rejects_blank_text() {
        assertThatThrownBy(() -> RecurrenceRuleParser.parse(" "))
                .isInstanceOf(InvalidRuleException.class)
                .hasMessageContaining("must not be empty");
    }

    @Test
    void parses_set_positions_and_times_of_day() {
        var rule = RecurrenceRuleParser.parse("FREQ=MONTHLY;BYDAY=MO,TU,WE,TH,FR;BYSETPOS=-1;BYHOUR=8,16;BYMINUTE=30");

        assertThat(rule.bySetPos()).containsExactly(-1);
        assertThat(rule.byHour()).containsExactly(8, 16);
        assertThat(rule.byMinute()).containsExactly(30);
        assertThat(rule.byWeekday()).hasSize(5);
        assertThat(rule.isDegenerate()).isTrue();
    }

    @Test
    void parses_year_days_and_week_numbers() {
        var rule = RecurrenceRuleParser.parse("FREQ=YEARLY;BYWEEKNO=1,-1;BYDAY=MO;COUNT=4");

        assertThat(rule.byWeekNo()).containsExactly(1, -1);
        assertThat(RecurrenceRuleParser.parse("FREQ=YEARLY;BYYEARDAY=100;COUNT=1").byYearday())
                .containsExactly(100);
    }

    @Test
    void rendered_text_parses_back_to_the_same_rule() {
        var rule = RecurrenceRule.builder(Frequency.MONTHLY)
                .interval(2)
                .count(5)
                .byWeekday(NthWeekday.nth(2, DayOfWeek.TUESDAY))
                .byMonth(Month.MARCH)
                .weekStart(DayOfWeek.SUNDAY)
                .build();

        assertThat(rule.toText()).isEqualTo("FREQ=MONTHLY;INTERVAL=2;COUNT=5;BYDAY=+2TU;BYMONTH=3;WKST=SU");
        assertThat(RecurrenceRuleParser.parse(rule.toText())).isEqualTo(rule);
    }

    @Test
    void rejects_second_based_parts() {
        assertThatThrownBy(() -> RecurrenceRuleParser.parse("FREQ=DAILY;BYSECOND=9"))
                .isInstanceOf(InvalidRuleException.class)
                .hasMessageContaining("Unsupported rule part 'BYSECOND'");
        assertThatThrownBy(() -> RecurrenceRuleParser.parse("FREQ=SECONDLY;COUNT=2"))
                .isInstanceOf(InvalidRuleException.class)
                .hasMessageContaining("Unsupported frequency");
    }

    @Test
    void rejects_malformed_text() {
        for (var text : List.of("FREQ=FORTNIGHTLY", "FREQ=DAILY;COUNT=many", "FREQ=YEARLY;BYMONTH=13",
                "FREQ=WEEKLY;BYDAY=XX")) {
            assertThatThrownBy(() -> RecurrenceRuleParser.parse(text))
                    .as(text)
                    .isInstanceOf(InvalidRuleException.class)
                    .hasMessageContaining("Malformed recurrence rule");
        }
    }
}
