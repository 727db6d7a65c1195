package de.bycsitsm.agenda.month;

import org.jspecify.annotations.Nullable;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Month arithmetic for calendar views.
 */
public final class MonthCalendar {

    private static final int DAYS_PER_WEEK = 7;

    private MonthCalendar() {
    }

    /**
     * Returns the first and the last date of the month containing {@code date}.
     */
    public static Boundaries boundaries(LocalDate date) {
        var month = YearMonth.from(date);
        return new Boundaries(month.atDay(1), month.atEndOfMonth());
    }

    /**
     * Returns the month as a list of weeks. Each week holds seven entries starting with
     * {@code firstWeekday}; entries outside the month are {@code null}.
     */
    public static List<List<@Nullable LocalDate>> weeks(YearMonth month, DayOfWeek firstWeekday) {
        var weeks = new ArrayList<List<@Nullable LocalDate>>();
        var week = new LocalDate[DAYS_PER_WEEK];
        int leading = Math.floorMod(month.atDay(1).getDayOfWeek().getValue() - firstWeekday.getValue(),
                DAYS_PER_WEEK);
        int position = leading;

        for (int day = 1; day <= month.lengthOfMonth(); day++) {
            week[position++] = month.atDay(day);
            if (position == DAYS_PER_WEEK) {
                weeks.add(Collections.unmodifiableList(Arrays.asList(week)));
                week = new LocalDate[DAYS_PER_WEEK];
                position = 0;
            }
        }
        if (position > 0) {
            weeks.add(Collections.unmodifiableList(Arrays.asList(week)));
        }
        return weeks;
    }

    /**
     * @param first the first day of the month
     * @param last  the last day of the month
     */
    public record Boundaries(LocalDate first, LocalDate last) {
    }
}
