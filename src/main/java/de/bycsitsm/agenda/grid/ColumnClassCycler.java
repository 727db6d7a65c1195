package de.bycsitsm.agenda.grid;

import org.jspecify.annotations.Nullable;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-build state for visual class assignment: one counter per column and category.
 */
final class ColumnClassCycler {

    private static final String NO_CATEGORY = "";

    private final VisualClassPalette palette;
    private final Map<Integer, Map<String, ClassCycle>> cycles = new HashMap<>();

    ColumnClassCycler(VisualClassPalette palette) {
        this.palette = palette;
    }

    String next(int column, @Nullable String category) {
        return cycles.computeIfAbsent(column, c -> new HashMap<>())
                .computeIfAbsent(category != null ? category : NO_CATEGORY,
                        key -> new ClassCycle(palette.classesFor(category)))
                .next();
    }

    private static final class ClassCycle {

        private final List<String> classes;
        private int nextIndex;

        ClassCycle(List<String> classes) {
            this.classes = classes;
        }

        String next() {
            var visualClass = classes.get(nextIndex);
            nextIndex = (nextIndex + 1) % classes.size();
            return visualClass;
        }
    }
}
