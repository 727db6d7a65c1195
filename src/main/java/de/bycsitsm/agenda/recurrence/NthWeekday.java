package de.bycsitsm.agenda.recurrence;

import java.time.DayOfWeek;
import java.util.Objects;

/**
 * A weekday filter of a recurrence rule, optionally restricted to the n-th occurrence
 * of that weekday within the month or year ({@code +1MO}, {@code -1FR}).
 *
 * @param day     the weekday
 * @param ordinal {@code 0} for every such weekday, a positive value counts from the start,
 *                a negative value from the end
 */
public record NthWeekday(DayOfWeek day, int ordinal) {

    private static final int MAX_ORDINAL = 53;

    public NthWeekday {
        Objects.requireNonNull(day, "day");
        if (Math.abs(ordinal) > MAX_ORDINAL) {
            throw new InvalidRuleException("Weekday ordinal must lie between -53 and 53, was " + ordinal + ".");
        }
    }

    public static NthWeekday every(DayOfWeek day) {
        return new NthWeekday(day, 0);
    }

    public static NthWeekday nth(int ordinal, DayOfWeek day) {
        if (ordinal == 0) {
            throw new InvalidRuleException("Weekday ordinal must not be 0.");
        }
        return new NthWeekday(day, ordinal);
    }

    public boolean isEvery() {
        return ordinal == 0;
    }

    @Override
    public String toString() {
        var code = day.name().substring(0, 2);
        if (ordinal == 0) {
            return code;
        }
        return (ordinal > 0 ? "+" : "") + ordinal + code;
    }
}
