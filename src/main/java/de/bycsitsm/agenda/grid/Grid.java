package de.bycsitsm.agenda.grid;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * An immutable, rectangular time-slot grid: rows ascending by slot, every row exactly
 * {@link #columnCount()} cells wide.
 */
public final class Grid {

    private final List<GridRow> rows;
    private final int columnCount;

    Grid(List<GridRow> rows, int columnCount) {
        this.rows = List.copyOf(rows);
        this.columnCount = columnCount;
    }

    public List<GridRow> rows() {
        return rows;
    }

    public int columnCount() {
        return columnCount;
    }

    public Optional<GridRow> row(LocalDateTime slot) {
        return rows.stream().filter(row -> row.slot().equals(slot)).findFirst();
    }

    /**
     * Returns every distinct placement of the grid, ordered by the row and column of its first cell.
     */
    public List<Placement> placements() {
        Set<Placement> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        var placements = new ArrayList<Placement>();
        for (var row : rows) {
            for (var cell : row.cells()) {
                var placement = cell.placement();
                if (placement != null && seen.add(placement)) {
                    placements.add(placement);
                }
            }
        }
        return placements;
    }
}
