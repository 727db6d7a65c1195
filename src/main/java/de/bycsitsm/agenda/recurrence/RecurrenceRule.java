package de.bycsitsm.agenda.recurrence;

import org.jspecify.annotations.Nullable;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.Month;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.StringJoiner;
import java.util.stream.Collectors;

/**
 * A repetition pattern in the manner of an iCalendar {@code RRULE} (RFC 5545).
 * <p>
 * A rule without {@code count} and without {@code until} is degenerate: it describes a single,
 * non-repeating occasion. Values are not validated here; {@link RecurrenceExpander} rejects
 * malformed rules before expanding them.
 *
 * @param frequency  the period unit, {@link Frequency#DAILY} when omitted
 * @param interval   the number of frequency units between two periods
 * @param count      the maximum number of occurrences, or {@code null}
 * @param until      the last instant an occurrence may start at (inclusive), or {@code null}
 * @param byWeekday  weekday filter, empty for none
 * @param byMonthday day-of-month filter (1 to 31, or -31 to -1 counted from the month's end), empty for none
 * @param byMonth    month filter, empty for none
 * @param byYearday  day-of-year filter (1 to 366, or negative from the year's end), empty for none
 * @param byWeekNo   ISO week-number filter for yearly rules (1 to 53, or negative), empty for none
 * @param byHour     hour filter (0 to 23), empty for none
 * @param byMinute   minute filter (0 to 59), empty for none
 * @param bySetPos   positions within each period's set of occurrences (1 to 366, or negative), empty for none
 * @param weekStart  the first day of a week for weekly periods
 */
public record RecurrenceRule(
        Frequency frequency,
        int interval,
        @Nullable Integer count,
        @Nullable LocalDateTime until,
        List<NthWeekday> byWeekday,
        List<Integer> byMonthday,
        Set<Month> byMonth,
        List<Integer> byYearday,
        List<Integer> byWeekNo,
        List<Integer> byHour,
        List<Integer> byMinute,
        List<Integer> bySetPos,
        DayOfWeek weekStart
) {

    private static final DateTimeFormatter UNTIL_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss");

    public RecurrenceRule {
        if (frequency == null) {
            frequency = Frequency.DAILY;
        }
        byWeekday = byWeekday == null ? List.of() : List.copyOf(byWeekday);
        byMonthday = byMonthday == null ? List.of() : List.copyOf(byMonthday);
        byMonth = byMonth == null ? Set.of() : Set.copyOf(byMonth);
        byYearday = byYearday == null ? List.of() : List.copyOf(byYearday);
        byWeekNo = byWeekNo == null ? List.of() : List.copyOf(byWeekNo);
        byHour = byHour == null ? List.of() : List.copyOf(byHour);
        byMinute = byMinute == null ? List.of() : List.copyOf(byMinute);
        bySetPos = bySetPos == null ? List.of() : List.copyOf(bySetPos);
        if (weekStart == null) {
            weekStart = DayOfWeek.MONDAY;
        }
    }

    /**
     * Returns the degenerate rule: exactly one occurrence, no repetition.
     */
    public static RecurrenceRule once() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Frequency frequency) {
        return new Builder().frequency(frequency);
    }

    /**
     * Whether this rule lacks both {@code count} and {@code until} and therefore yields a single occurrence.
     */
    public boolean isDegenerate() {
        return count == null && until == null;
    }

    /**
     * Returns the rule in its textual {@code RRULE} form, without the {@code RRULE:} prefix.
     * Weekday ordinals are kept for monthly and yearly rules only, the only ones they apply to.
     */
    public String toText() {
        var text = new StringJoiner(";");
        text.add("FREQ=" + frequency);
        if (interval != 1) {
            text.add("INTERVAL=" + interval);
        }
        if (count != null) {
            text.add("COUNT=" + count);
        }
        if (until != null) {
            text.add("UNTIL=" + UNTIL_FORMAT.format(until));
        }
        if (!byWeekday.isEmpty()) {
            boolean ordinals = frequency == Frequency.MONTHLY || frequency == Frequency.YEARLY;
            text.add("BYDAY=" + byWeekday.stream()
                    .map(day -> ordinals ? day : NthWeekday.every(day.day()))
                    .map(NthWeekday::toString)
                    .distinct()
                    .collect(Collectors.joining(",")));
        }
        addPart(text, "BYMONTHDAY", byMonthday);
        if (!byMonth.isEmpty()) {
            addPart(text, "BYMONTH", byMonth.stream().map(Month::getValue).sorted().toList());
        }
        addPart(text, "BYYEARDAY", byYearday);
        addPart(text, "BYWEEKNO", byWeekNo);
        addPart(text, "BYHOUR", byHour);
        addPart(text, "BYMINUTE", byMinute);
        addPart(text, "BYSETPOS", bySetPos);
        if (weekStart != DayOfWeek.MONDAY) {
            text.add("WKST=" + NthWeekday.every(weekStart));
        }
        return text.toString();
    }

    private static void addPart(StringJoiner text, String name, List<Integer> values) {
        if (!values.isEmpty()) {
            text.add(name + "=" + values.stream().map(String::valueOf).collect(Collectors.joining(",")));
        }
    }

    public static final class Builder {

        private @Nullable Frequency frequency;
        private int interval = 1;
        private @Nullable Integer count;
        private @Nullable LocalDateTime until;
        private final List<NthWeekday> byWeekday = new ArrayList<>();
        private final List<Integer> byMonthday = new ArrayList<>();
        private final List<Month> byMonth = new ArrayList<>();
        private final List<Integer> byYearday = new ArrayList<>();
        private final List<Integer> byWeekNo = new ArrayList<>();
        private final List<Integer> byHour = new ArrayList<>();
        private final List<Integer> byMinute = new ArrayList<>();
        private final List<Integer> bySetPos = new ArrayList<>();
        private @Nullable DayOfWeek weekStart;

        private Builder() {
        }

        public Builder frequency(@Nullable Frequency frequency) {
            this.frequency = frequency;
            return this;
        }

        public Builder interval(int interval) {
            this.interval = interval;
            return this;
        }

        public Builder count(@Nullable Integer count) {
            this.count = count;
            return this;
        }

        public Builder until(@Nullable LocalDateTime until) {
            this.until = until;
            return this;
        }

        public Builder byWeekday(DayOfWeek... days) {
            for (var day : days) {
                byWeekday.add(NthWeekday.every(day));
            }
            return this;
        }

        public Builder byWeekday(NthWeekday... days) {
            byWeekday.addAll(Arrays.asList(days));
            return this;
        }

        public Builder byMonthday(Integer... days) {
            byMonthday.addAll(Arrays.asList(days));
            return this;
        }

        public Builder byMonth(Month... months) {
            byMonth.addAll(Arrays.asList(months));
            return this;
        }

        public Builder byYearday(Integer... days) {
            byYearday.addAll(Arrays.asList(days));
            return this;
        }

        public Builder byWeekNo(Integer... weeks) {
            byWeekNo.addAll(Arrays.asList(weeks));
            return this;
        }

        public Builder byHour(Integer... hours) {
            byHour.addAll(Arrays.asList(hours));
            return this;
        }

        public Builder byMinute(Integer... minutes) {
            byMinute.addAll(Arrays.asList(minutes));
            return this;
        }

        public Builder bySetPos(Integer... positions) {
            bySetPos.addAll(Arrays.asList(positions));
            return this;
        }

        public Builder weekStart(@Nullable DayOfWeek weekStart) {
            this.weekStart = weekStart;
            return this;
        }

        public RecurrenceRule build() {
            return new RecurrenceRule(frequency, interval, count, until,
                    byWeekday, byMonthday, Set.copyOf(byMonth), byYearday, byWeekNo, byHour, byMinute, bySetPos,
                    weekStart);
        }
    }
}
