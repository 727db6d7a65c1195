package de.bycsitsm.agenda.grid;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * The visual classes available per event category. Grid columns cycle through the classes of
 * a category independently of each other.
 */
public final class VisualClassPalette {

    private static final List<String> UNCATEGORIZED = List.of("evt-even", "evt-odd");

    private final Function<String, List<String>> classesByCategory;
    private final List<String> fallback;

    private VisualClassPalette(Function<String, List<String>> classesByCategory, List<String> fallback) {
        if (fallback.isEmpty()) {
            throw new IllegalArgumentException("Fallback classes must not be empty.");
        }
        this.classesByCategory = classesByCategory;
        this.fallback = List.copyOf(fallback);
    }

    /**
     * Alternates {@code evt-<abbr>-even} and {@code evt-<abbr>-odd} for categorized events, and
     * {@code evt-even} and {@code evt-odd} for the rest.
     */
    public static VisualClassPalette defaults() {
        return new VisualClassPalette(abbr -> List.of("evt-" + abbr + "-even", "evt-" + abbr + "-odd"),
                UNCATEGORIZED);
    }

    /**
     * Uses the given classes per category abbreviation, and {@code fallback} for uncategorized
     * events and unlisted categories.
     */
    public static VisualClassPalette of(Map<String, List<String>> classes, List<String> fallback) {
        var copy = Map.copyOf(classes);
        return new VisualClassPalette(abbr -> copy.getOrDefault(abbr, List.of()), fallback);
    }

    /**
     * Returns the non-empty, ordered cycle of classes for the given category.
     */
    public List<String> classesFor(@Nullable String category) {
        if (category == null) {
            return fallback;
        }
        var classes = classesByCategory.apply(category);
        return classes == null || classes.isEmpty() ? fallback : classes;
    }
}
