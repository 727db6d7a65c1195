package de.bycsitsm.agenda;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A closed span of time between two date-times of the same reference frame.
 *
 * @param start the first instant of the interval
 * @param end   the last instant of the interval, never before {@code start}
 */
public record TimeInterval(LocalDateTime start, LocalDateTime end) {

    public TimeInterval {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Interval end " + end + " lies before its start " + start + ".");
        }
    }

    public Duration duration() {
        return Duration.between(start, end);
    }

    /**
     * Tests whether this interval and the window {@code [windowStart, windowEnd]} share at least one instant.
     * Touching boundaries count as overlap.
     */
    public boolean overlaps(LocalDateTime windowStart, LocalDateTime windowEnd) {
        return !start.isAfter(windowEnd) && !end.isBefore(windowStart);
    }

    public boolean overlaps(TimeInterval other) {
        return overlaps(other.start, other.end);
    }

    /**
     * Returns an interval of the same duration beginning at {@code newStart}.
     */
    public TimeInterval startingAt(LocalDateTime newStart) {
        return new TimeInterval(newStart, newStart.plus(duration()));
    }
}
