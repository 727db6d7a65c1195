package de.bycsitsm.agenda.recurrence;

import org.dmfs.rfc5545.DateTime;
import org.dmfs.rfc5545.Weekday;
import org.dmfs.rfc5545.recur.Freq;
import org.dmfs.rfc5545.recur.InvalidRecurrenceRuleException;
import org.dmfs.rfc5545.recur.RecurrenceRule.Part;
import org.dmfs.rfc5545.recur.RecurrenceRule.RfcMode;
import org.dmfs.rfc5545.recur.RecurrenceRule.WeekdayNum;
import org.jspecify.annotations.Nullable;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.Month;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Parses the textual {@code RRULE} form of a recurrence rule, e.g.
 * {@code FREQ=WEEKLY;INTERVAL=2;COUNT=6;BYDAY=MO,WE}, with lib-recur in strict RFC 5545 mode.
 * <p>
 * Every rule part but {@code BYSECOND} is supported, and so are frequencies
 * from {@code YEARLY} to {@code MINUTELY}. A missing {@code FREQ} means {@code DAILY}. A
 * date-only {@code UNTIL} includes the whole day. A UTC {@code UNTIL} is read as a local time
 * since all times share one reference frame.
 */
public final class RecurrenceRuleParser {

    private static final String PREFIX = "RRULE:";

    private RecurrenceRuleParser() {
    }

    /**
     * Parses the given rule text.
     *
     * @param text the rule, optionally prefixed with {@code RRULE:}
     * @return the parsed rule
     * @throws InvalidRuleException if the text is empty, malformed or uses an unsupported part
     */
    public static RecurrenceRule parse(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidRuleException("Recurrence rule must not be empty.");
        }
        var body = text.trim().toUpperCase(Locale.ROOT);
        if (body.startsWith(PREFIX)) {
            body = body.substring(PREFIX.length());
        }
        if (Arrays.stream(body.split(";")).noneMatch(part -> part.startsWith("FREQ="))) {
            body = "FREQ=DAILY;" + body;
        }

        org.dmfs.rfc5545.recur.RecurrenceRule parsed;
        try {
            parsed = new org.dmfs.rfc5545.recur.RecurrenceRule(body, RfcMode.RFC5545_STRICT);
        } catch (InvalidRecurrenceRuleException | IllegalArgumentException e) {
            throw new InvalidRuleException("Malformed recurrence rule '" + text + "': " + e.getMessage(), e);
        }
        if (parsed.getByPart(Part.BYSECOND) != null) {
            throw new InvalidRuleException("Unsupported rule part 'BYSECOND'.");
        }

        return RecurrenceRule.builder(frequency(parsed.getFreq()))
                .interval(parsed.getInterval())
                .count(parsed.getCount())
                .until(until(parsed.getUntil()))
                .byWeekday(weekdays(parsed.getByDayPart()))
                .byMonthday(values(parsed, Part.BYMONTHDAY))
                .byMonth(Arrays.stream(values(parsed, Part.BYMONTH)).map(Month::of).toArray(Month[]::new))
                .byYearday(values(parsed, Part.BYYEARDAY))
                .byWeekNo(values(parsed, Part.BYWEEKNO))
                .byHour(values(parsed, Part.BYHOUR))
                .byMinute(values(parsed, Part.BYMINUTE))
                .bySetPos(values(parsed, Part.BYSETPOS))
                .weekStart(dayOfWeek(parsed.getWeekStart()))
                .build();
    }

    private static Frequency frequency(Freq freq) {
        try {
            return Frequency.valueOf(freq.name());
        } catch (IllegalArgumentException e) {
            throw new InvalidRuleException("Unsupported frequency '" + freq + "'.", e);
        }
    }

    private static @Nullable LocalDateTime until(@Nullable DateTime until) {
        if (until == null) {
            return null;
        }
        var day = LocalDate.of(until.getYear(), until.getMonth() + 1, until.getDayOfMonth());
        if (until.isAllDay()) {
            return day.atTime(LocalTime.MAX);
        }
        return day.atTime(until.getHours(), until.getMinutes(), until.getSeconds());
    }

    private static NthWeekday[] weekdays(@Nullable List<WeekdayNum> days) {
        if (days == null) {
            return new NthWeekday[0];
        }
        return days.stream()
                .map(day -> new NthWeekday(dayOfWeek(day.weekday), day.pos))
                .toArray(NthWeekday[]::new);
    }

    private static Integer[] values(org.dmfs.rfc5545.recur.RecurrenceRule rule, Part part) {
        var values = rule.getByPart(part);
        return values == null ? new Integer[0] : values.toArray(Integer[]::new);
    }

    private static @Nullable DayOfWeek dayOfWeek(@Nullable Weekday weekday) {
        if (weekday == null) {
            return null;
        }
        for (var day : DayOfWeek.values()) {
            if (day.name().startsWith(weekday.name())) {
                return day;
            }
        }
        throw new InvalidRuleException("Unknown weekday '" + weekday + "'.");
    }
}
