package de.bycsitsm.agenda.occasion;

/**
 * The category of an event, used to pick visual classes for its occasions.
 *
 * @param abbr  the short, unique abbreviation of the category
 * @param label the human-readable name of the category
 */
public record EventType(String abbr, String label) {

    public EventType {
        if (abbr == null || abbr.isBlank()) {
            throw new IllegalArgumentException("Event type abbreviation must not be empty.");
        }
        if (label == null) {
            label = abbr;
        }
    }
}
