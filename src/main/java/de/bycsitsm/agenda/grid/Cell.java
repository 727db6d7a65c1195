package de.bycsitsm.agenda.grid;

import org.jspecify.annotations.Nullable;

/**
 * One cell of a grid row: empty, or holding a placement.
 *
 * @param placement    the placement covering this cell, or {@code null} for an empty cell
 * @param continuation whether the placement began in an earlier row
 */
public record Cell(@Nullable Placement placement, boolean continuation) {

    public static final Cell EMPTY = new Cell(null, false);

    static Cell start(Placement placement) {
        return new Cell(placement, false);
    }

    static Cell continuationOf(Placement placement) {
        return new Cell(placement, true);
    }

    public boolean isEmpty() {
        return placement == null;
    }
}
