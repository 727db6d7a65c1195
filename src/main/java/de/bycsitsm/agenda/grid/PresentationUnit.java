package de.bycsitsm.agenda.grid;

import org.jspecify.annotations.Nullable;

/**
 * What a {@link PlacementFormatter} makes of a placement. The grid never inspects it.
 *
 * @param label       the text to show
 * @param link        the target to link the label to, or {@code null}
 * @param visualClass the visual (CSS) class, or {@code null}
 */
public record PresentationUnit(String label, @Nullable String link, @Nullable String visualClass) {
}
