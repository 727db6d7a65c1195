package de.bycsitsm.agenda.recurrence;

import java.time.temporal.ChronoUnit;

/**
 * The unit by which a {@link RecurrenceRule} advances from one period to the next.
 */
public enum Frequency {
    YEARLY(ChronoUnit.YEARS),
    MONTHLY(ChronoUnit.MONTHS),
    WEEKLY(ChronoUnit.WEEKS),
    DAILY(ChronoUnit.DAYS),
    HOURLY(ChronoUnit.HOURS),
    MINUTELY(ChronoUnit.MINUTES);

    private final ChronoUnit unit;

    Frequency(ChronoUnit unit) {
        this.unit = unit;
    }

    /**
     * The length of one period.
     */
    public ChronoUnit unit() {
        return unit;
    }
}
