package de.bycsitsm.agenda;

import de.bycsitsm.agenda.grid.GridConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.format.annotation.DateTimeFormat;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalTime;

/**
 * Configuration properties for time-slot grids and occasion defaults.
 *
 * @param slotInterval             the distance between two consecutive grid rows
 * @param startTime                the time of day of the first grid row
 * @param spanDuration             the span of the grid, measured from {@code startTime}; may reach into the next day
 * @param minColumns               the minimum number of columns of every grid
 * @param timeFormat               the {@link java.time.format.DateTimeFormatter} pattern used for slot labels
 * @param defaultOccasionDuration  the length of a new occasion when no end time is given
 * @param firstWeekday             the first day of a week in month calendars
 * @param occasionLinkPattern      the link template of the default formatter, with {@code {event}} and
 *                                 {@code {occasion}} placeholders
 */
@ConfigurationProperties(prefix = "agenda")
public record AgendaProperties(
        Duration slotInterval,
        @DateTimeFormat(pattern = "HH:mm") LocalTime startTime,
        Duration spanDuration,
        Integer minColumns,
        String timeFormat,
        Duration defaultOccasionDuration,
        DayOfWeek firstWeekday,
        String occasionLinkPattern
) {

    public AgendaProperties {
        if (slotInterval == null) {
            slotInterval = Duration.ofMinutes(15);
        }
        if (startTime == null) {
            startTime = LocalTime.of(9, 0);
        }
        if (spanDuration == null) {
            spanDuration = Duration.ofHours(8);
        }
        if (minColumns == null) {
            minColumns = 4;
        }
        if (timeFormat == null || timeFormat.isBlank()) {
            timeFormat = "hh:mm a";
        }
        if (defaultOccasionDuration == null) {
            defaultOccasionDuration = Duration.ofHours(1);
        }
        if (firstWeekday == null) {
            firstWeekday = DayOfWeek.SUNDAY;
        }
        if (occasionLinkPattern == null || occasionLinkPattern.isBlank()) {
            occasionLinkPattern = "/events/{event}/{occasion}";
        }
    }

    /**
     * Returns the properties with every option at its default value.
     */
    public static AgendaProperties defaults() {
        return new AgendaProperties(null, null, null, null, null, null, null, null);
    }

    /**
     * Builds the grid configuration described by these properties.
     *
     * @throws de.bycsitsm.agenda.grid.InvalidConfigException if the slot interval is not positive
     */
    public GridConfig gridConfig() {
        return new GridConfig(startTime, spanDuration, slotInterval, minColumns);
    }
}
