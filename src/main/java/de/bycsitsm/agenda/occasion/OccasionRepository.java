package de.bycsitsm.agenda.occasion;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Storage port for occasions. The core never talks to a store directly, only through this contract.
 */
public interface OccasionRepository {

    /**
     * Loads the occasions overlapping the given day.
     *
     * @param owner restricts the result to the occasions of this event, or {@code null} for all
     */
    List<Occasion> loadOccasionsForDay(LocalDate day, @Nullable Event owner);

    /**
     * Loads the occasions overlapping {@code [start, end]}.
     *
     * @param owner restricts the result to the occasions of this event, or {@code null} for all
     */
    List<Occasion> loadOccasionsBetween(LocalDateTime start, LocalDateTime end, @Nullable Event owner);

    /**
     * Loads every occasion of the given event.
     */
    List<Occasion> findByEvent(Event event);

    /**
     * Stores an occasion. Saving an occasion with a known id replaces it.
     */
    void saveOccasion(Occasion occasion);
}
