package de.bycsitsm.agenda.occasion;

import de.bycsitsm.agenda.TimeInterval;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.Objects;
import java.util.UUID;

/**
 * One concrete, scheduled time interval of an {@link Event}.
 * <p>
 * The natural order is ascending by start, then by end, then by id. It is a total order, so
 * two distinct occasions of the same interval never compare as equal.
 *
 * @param id       the identifier of the occasion
 * @param event    the owning event
 * @param interval the time span of the occasion
 */
public record Occasion(UUID id, Event event, TimeInterval interval) implements Comparable<Occasion> {

    public static final Comparator<Occasion> CHRONOLOGICAL = Comparator
            .comparing(Occasion::start)
            .thenComparing(Occasion::end)
            .thenComparing(Occasion::id);

    public Occasion {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(interval, "interval");
    }

    public static Occasion of(Event event, TimeInterval interval) {
        return new Occasion(UUID.randomUUID(), event, interval);
    }

    public static Occasion of(Event event, LocalDateTime start, LocalDateTime end) {
        return of(event, new TimeInterval(start, end));
    }

    public LocalDateTime start() {
        return interval.start();
    }

    public LocalDateTime end() {
        return interval.end();
    }

    public String title() {
        return event.title();
    }

    public boolean belongsTo(Event owner) {
        return event.id().equals(owner.id());
    }

    @Override
    public int compareTo(Occasion other) {
        return CHRONOLOGICAL.compare(this, other);
    }

    @Override
    public String toString() {
        return title() + ": " + start();
    }
}
