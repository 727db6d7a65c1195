package de.bycsitsm.agenda.occasion;

import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Selects the occasions of a collection that overlap a time window.
 * <p>
 * An occasion overlaps the window {@code [windowStart, windowEnd]} iff
 * {@code occasion.start <= windowEnd} and {@code occasion.end >= windowStart}. This covers
 * occasions that contain the window, start or end inside it, or lie entirely within it.
 * Touching boundaries count as overlap. Results are returned in the natural order of
 * {@link Occasion}.
 */
@Component
public class OverlapQuery {

    /** Last second of a day window. */
    public static final LocalTime END_OF_DAY = LocalTime.of(23, 59, 59);

    private final Clock clock;

    public OverlapQuery(Clock clock) {
        this.clock = clock;
    }

    /**
     * Returns the occasions overlapping {@code [windowStart, windowEnd]}.
     *
     * @throws IllegalArgumentException if the window ends before it starts
     */
    public List<Occasion> overlapping(Collection<Occasion> occasions, LocalDateTime windowStart,
                                      LocalDateTime windowEnd) {
        return overlapping(occasions, windowStart, windowEnd, null);
    }

    /**
     * Returns the occasions overlapping {@code [windowStart, windowEnd]}, restricted to those of
     * {@code owner} unless it is {@code null}.
     *
     * @throws IllegalArgumentException if the window ends before it starts
     */
    public List<Occasion> overlapping(Collection<Occasion> occasions, LocalDateTime windowStart,
                                      LocalDateTime windowEnd, @Nullable Event owner) {
        Objects.requireNonNull(windowStart, "windowStart");
        Objects.requireNonNull(windowEnd, "windowEnd");
        if (windowEnd.isBefore(windowStart)) {
            throw new IllegalArgumentException("Window end " + windowEnd + " lies before its start " + windowStart
                    + ".");
        }
        return occasions.stream()
                .filter(occasion -> owner == null || occasion.belongsTo(owner))
                .filter(occasion -> occasion.interval().overlaps(windowStart, windowEnd))
                .sorted()
                .toList();
    }

    /**
     * Returns the occasions overlapping the given day, from midnight to {@code 23:59:59}.
     */
    public List<Occasion> daily(Collection<Occasion> occasions, LocalDate day, @Nullable Event owner) {
        return overlapping(occasions, day.atStartOfDay(), day.atTime(END_OF_DAY), owner);
    }

    /**
     * Returns the occasions overlapping the day of {@code reference}.
     */
    public List<Occasion> daily(Collection<Occasion> occasions, LocalDateTime reference) {
        return daily(occasions, reference.toLocalDate(), null);
    }

    /**
     * Returns the occasions overlapping the current day.
     */
    public List<Occasion> daily(Collection<Occasion> occasions) {
        return daily(occasions, now());
    }

    /**
     * Returns the occasions starting at or after {@code now}.
     */
    public List<Occasion> upcoming(Collection<Occasion> occasions, LocalDateTime now) {
        return occasions.stream()
                .filter(occasion -> !occasion.start().isBefore(now))
                .sorted()
                .toList();
    }

    /**
     * Returns the first occasion starting at or after {@code now}, if any.
     */
    public Optional<Occasion> next(Collection<Occasion> occasions, LocalDateTime now) {
        return upcoming(occasions, now).stream().findFirst();
    }

    public LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
