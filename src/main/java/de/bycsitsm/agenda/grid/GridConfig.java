package de.bycsitsm.agenda.grid;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * The shape of a time-slot grid. For a day, the grid spans
 * {@code [day + startTime, day + startTime + spanDuration]} inclusive, with one slot every
 * {@code slotInterval}. The span may reach into the following day.
 *
 * @param startTime    the time of day of the first slot
 * @param spanDuration the distance between the first and the last possible slot
 * @param slotInterval the distance between two slots, always positive
 * @param minColumns   the minimum width of the grid
 */
public record GridConfig(LocalTime startTime, Duration spanDuration, Duration slotInterval, int minColumns) {

    public GridConfig {
        if (startTime == null) {
            throw new InvalidConfigException("Grid start time must be set.");
        }
        if (slotInterval == null || slotInterval.isZero() || slotInterval.isNegative()) {
            throw new InvalidConfigException("Slot interval must be positive, was " + slotInterval + ".");
        }
        if (spanDuration == null || spanDuration.isNegative()) {
            throw new InvalidConfigException("Span duration must not be negative, was " + spanDuration + ".");
        }
        if (minColumns < 0) {
            throw new InvalidConfigException("Minimum column count must not be negative, was " + minColumns + ".");
        }
    }

    /**
     * Returns the configuration with the default options: slots every 15 minutes from 09:00 for
     * 8 hours, at least 4 columns.
     */
    public static GridConfig defaults() {
        return new GridConfig(LocalTime.of(9, 0), Duration.ofHours(8), Duration.ofMinutes(15), 4);
    }

    /**
     * The number of slots of every grid, {@code floor(spanDuration / slotInterval) + 1}.
     */
    public int slotCount() {
        return Math.toIntExact(spanDuration.dividedBy(slotInterval)) + 1;
    }

    public LocalDateTime gridStart(LocalDate day) {
        return day.atTime(startTime);
    }

    public LocalDateTime gridEnd(LocalDate day) {
        return gridStart(day).plus(spanDuration);
    }

    /**
     * Returns the slot keys of the given day in ascending order. The grid end is included when it
     * falls on a slot.
     */
    public List<LocalDateTime> slotKeys(LocalDate day) {
        var end = gridEnd(day);
        var keys = new ArrayList<LocalDateTime>(slotCount());
        for (var slot = gridStart(day); !slot.isAfter(end); slot = slot.plus(slotInterval)) {
            keys.add(slot);
        }
        return keys;
    }
}
