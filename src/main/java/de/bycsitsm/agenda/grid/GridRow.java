package de.bycsitsm.agenda.grid;

import java.time.LocalDateTime;
import java.util.List;

/**
 * One slot of a grid with its cells, ordered by column.
 *
 * @param slot  the slot key
 * @param cells the cells of the row, as many as the grid has columns
 */
public record GridRow(LocalDateTime slot, List<Cell> cells) {

    public GridRow {
        cells = List.copyOf(cells);
    }

    public Cell cell(int column) {
        return cells.get(column);
    }
}
