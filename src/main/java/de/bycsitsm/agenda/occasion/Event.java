package de.bycsitsm.agenda.occasion;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * The owning entity of a set of occasions. Its lifetime is independent of the occasions
 * referencing it.
 *
 * @param id          the identifier of the event
 * @param title       the title shown for each of its occasions
 * @param description a longer description, possibly empty
 * @param type        the category of the event, or {@code null} if uncategorized
 * @param notes       free-text notes attached to the event, oldest first
 */
public record Event(
        UUID id,
        String title,
        String description,
        @Nullable EventType type,
        List<String> notes
) {

    public Event {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(title, "title");
        if (description == null) {
            description = "";
        }
        notes = notes == null ? List.of() : List.copyOf(notes);
    }

    public static Event of(String title, @Nullable String description, @Nullable EventType type) {
        return new Event(UUID.randomUUID(), title, description, type, List.of());
    }

    /**
     * Returns a copy of this event with the given note appended.
     */
    public Event withNote(String note) {
        Objects.requireNonNull(note, "note");
        var extended = new ArrayList<>(notes);
        extended.add(note);
        return new Event(id, title, description, type, extended);
    }

    /**
     * Returns the abbreviation of the event type, or {@code null} for uncategorized events.
     */
    public @Nullable String category() {
        return type != null ? type.abbr() : null;
    }
}
