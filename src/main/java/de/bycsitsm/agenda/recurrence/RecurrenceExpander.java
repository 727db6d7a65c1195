package de.bycsitsm.agenda.recurrence;

import de.bycsitsm.agenda.TimeInterval;
import org.dmfs.rfc5545.DateTime;
import org.dmfs.rfc5545.recur.InvalidRecurrenceRuleException;
import org.dmfs.rfc5545.recur.RecurrenceRule.RfcMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Expands a start/end pair and a {@link RecurrenceRule} into the concrete, chronologically
 * ordered time intervals the rule describes.
 * <p>
 * Occurrences are computed by lib-recur. The start anchors the rule's periods and supplies the
 * parts a rule leaves open: yearly rules repeat on the start's month and day, monthly rules on
 * the start's day of month, weekly rules on the start's weekday, and every rule at the start's
 * time of day. The start itself is an occurrence only if it matches the rule.
 * <p>
 * The result is always finite: a degenerate rule never reaches the library, and a rule whose
 * filters stop matching is abandoned once the search passes the year {@value #MAX_YEAR} or
 * {@value #MAX_EMPTY_RESUMES} resumptions in a row found nothing.
 */
@Component
public class RecurrenceExpander {

    private static final Logger log = LoggerFactory.getLogger(RecurrenceExpander.class);

    /**
     * Periods to skip when lib-recur gives up on a run of empty periods. The library gives up
     * after 1000 of them in a row, so skipping fewer never passes an unseen occurrence.
     */
    static final int RESUME_STEP = 500;

    static final int MAX_EMPTY_RESUMES = 2_000;

    static final int MAX_YEAR = 9999;

    /**
     * Expands the rule into time intervals, each as long as {@code [start, end]}.
     *
     * @param start the start of the first occasion, also the anchor of the rule
     * @param end   the end of the first occasion
     * @param rule  the repetition pattern
     * @return the intervals in ascending order of their start
     * @throws InvalidRuleException     if the rule is malformed; nothing is returned in that case
     * @throws IllegalArgumentException if {@code end} lies before {@code start}
     */
    public List<TimeInterval> expand(LocalDateTime start, LocalDateTime end, RecurrenceRule rule) {
        Objects.requireNonNull(rule, "rule");
        var first = new TimeInterval(start, end);
        validate(rule);

        if (rule.isDegenerate()) {
            return List.of(first);
        }

        var delta = Duration.between(start, end);
        var intervals = anchors(start, rule).stream()
                .map(anchor -> new TimeInterval(anchor, anchor.plus(delta)))
                .toList();
        log.debug("Expanded {} rule from {} into {} interval(s)", rule.frequency(), start, intervals.size());
        return intervals;
    }

    private void validate(RecurrenceRule rule) {
        if (rule.interval() < 1) {
            throw new InvalidRuleException("Interval must be at least 1, was " + rule.interval() + ".");
        }
        if (rule.count() != null && rule.count() < 1) {
            throw new InvalidRuleException("Count must be at least 1, was " + rule.count() + ".");
        }
        requireOffsets("Day of month", rule.byMonthday(), 31);
        requireOffsets("Day of year", rule.byYearday(), 366);
        requireOffsets("Week number", rule.byWeekNo(), 53);
        requireOffsets("Set position", rule.bySetPos(), 366);
        requireRange("Hour", rule.byHour(), 23);
        requireRange("Minute", rule.byMinute(), 59);
    }

    private static void requireOffsets(String name, List<Integer> values, int max) {
        for (var value : values) {
            if (value == 0 || Math.abs(value) > max) {
                throw new InvalidRuleException(name + " must lie between -" + max + " and " + max
                        + " and not be 0, was " + value + ".");
            }
        }
    }

    private static void requireRange(String name, List<Integer> values, int max) {
        for (var value : values) {
            if (value < 0 || value > max) {
                throw new InvalidRuleException(name + " must lie between 0 and " + max + ", was " + value + ".");
            }
        }
    }

    /**
     * Collects the occurrence starts of the rule.
     * <p>
     * Each iteration starts a whole number of steps away from {@code start}, so every iteration
     * sees the same periods. The first one starts one step early, which keeps the start from
     * being reported as an occurrence when it does not match. When lib-recur gives up on a long
     * run of empty periods, iteration resumes further on, skipping the first instant of the new
     * iteration since that lies in the empty run.
     */
    private List<LocalDateTime> anchors(LocalDateTime start, RecurrenceRule rule) {
        var libraryRule = toLibraryRule(withStartParts(rule, start));
        var until = rule.until();
        Integer count = rule.count();
        var anchors = new ArrayList<LocalDateTime>();
        long step = -1;
        int emptyResumes = 0;

        while (true) {
            var iterationStart = start.plus(step * rule.interval(), rule.frequency().unit());
            if (iterationStart.getYear() > MAX_YEAR || until != null && iterationStart.isAfter(until)) {
                return anchors;
            }

            var iterator = libraryRule.iterator(toDateTime(iterationStart));
            long lastStep = step;
            int found = anchors.size();
            try {
                while (iterator.hasNext()) {
                    var instance = toLocalDateTime(iterator.nextDateTime()).withNano(start.getNano());
                    lastStep = stepOf(start, instance, rule);
                    if (instance.isBefore(start) || instance.equals(iterationStart)) {
                        continue;
                    }
                    if (instance.getYear() > MAX_YEAR || until != null && instance.isAfter(until)) {
                        return anchors;
                    }
                    anchors.add(instance);
                    if (count != null && anchors.size() >= count) {
                        return anchors;
                    }
                }
                return anchors;
            } catch (IllegalArgumentException e) {
                emptyResumes = anchors.size() > found ? 0 : emptyResumes + 1;
                if (emptyResumes >= MAX_EMPTY_RESUMES) {
                    log.warn("Recurrence rule {} found no occurrence after {}, stopping with {} occurrence(s)",
                            rule.toText(), iterationStart, anchors.size());
                    return anchors;
                }
                step = Math.max(step, lastStep) + RESUME_STEP;
                log.debug("Resuming recurrence rule {} after a run of empty periods: {}", rule.toText(),
                        e.getMessage());
            }
        }
    }

    /**
     * Spells out the parts a rule takes from its start date, so the rule no longer depends on the
     * date an iteration starts at. The time of day stays implicit since every iteration start
     * shares it. Count and until are dropped; they apply to the whole expansion.
     */
    private static RecurrenceRule withStartParts(RecurrenceRule rule, LocalDateTime start) {
        var byWeekday = rule.byWeekday();
        var byMonthday = rule.byMonthday();
        var byMonth = rule.byMonth();
        boolean noDayPart = byWeekday.isEmpty() && byMonthday.isEmpty();

        switch (rule.frequency()) {
            case YEARLY -> {
                if (noDayPart && rule.byYearday().isEmpty()) {
                    if (!rule.byWeekNo().isEmpty()) {
                        byWeekday = List.of(NthWeekday.every(start.getDayOfWeek()));
                    } else {
                        byMonthday = List.of(start.getDayOfMonth());
                        if (byMonth.isEmpty()) {
                            byMonth = Set.of(start.getMonth());
                        }
                    }
                }
            }
            case MONTHLY -> {
                if (noDayPart) {
                    byMonthday = List.of(start.getDayOfMonth());
                }
            }
            case WEEKLY -> {
                if (byWeekday.isEmpty()) {
                    byWeekday = List.of(NthWeekday.every(start.getDayOfWeek()));
                }
            }
            default -> {
            }
        }
        return new RecurrenceRule(rule.frequency(), rule.interval(), null, null, byWeekday, byMonthday, byMonth,
                rule.byYearday(), rule.byWeekNo(), rule.byHour(), rule.byMinute(), rule.bySetPos(),
                rule.weekStart());
    }

    private static org.dmfs.rfc5545.recur.RecurrenceRule toLibraryRule(RecurrenceRule rule) {
        try {
            return new org.dmfs.rfc5545.recur.RecurrenceRule(rule.toText(), RfcMode.RFC5545_LAX);
        } catch (InvalidRecurrenceRuleException e) {
            throw new InvalidRuleException("Recurrence rule " + rule.toText() + " is invalid: " + e.getMessage(), e);
        }
    }

    /**
     * Returns the number of interval steps between the period of {@code start} and the period of
     * {@code instance}.
     */
    private static long stepOf(LocalDateTime start, LocalDateTime instance, RecurrenceRule rule) {
        long periods = switch (rule.frequency()) {
            case YEARLY -> instance.getYear() - start.getYear();
            case MONTHLY -> ChronoUnit.MONTHS.between(YearMonth.from(start), YearMonth.from(instance));
            case WEEKLY -> ChronoUnit.WEEKS.between(
                    start.toLocalDate().with(TemporalAdjusters.previousOrSame(rule.weekStart())),
                    instance.toLocalDate().with(TemporalAdjusters.previousOrSame(rule.weekStart())));
            case DAILY -> ChronoUnit.DAYS.between(start.toLocalDate(), instance.toLocalDate());
            case HOURLY -> ChronoUnit.HOURS.between(start.truncatedTo(ChronoUnit.HOURS),
                    instance.truncatedTo(ChronoUnit.HOURS));
            case MINUTELY -> ChronoUnit.MINUTES.between(start.truncatedTo(ChronoUnit.MINUTES),
                    instance.truncatedTo(ChronoUnit.MINUTES));
        };
        return Math.floorDiv(periods, rule.interval());
    }

    private static DateTime toDateTime(LocalDateTime time) {
        return new DateTime(time.getYear(), time.getMonthValue() - 1, time.getDayOfMonth(),
                time.getHour(), time.getMinute(), time.getSecond());
    }

    private static LocalDateTime toLocalDateTime(DateTime time) {
        if (time.isAllDay()) {
            return LocalDateTime.of(time.getYear(), time.getMonth() + 1, time.getDayOfMonth(), 0, 0);
        }
        return LocalDateTime.of(time.getYear(), time.getMonth() + 1, time.getDayOfMonth(),
                time.getHours(), time.getMinutes(), time.getSeconds());
    }
}
