package de.bycsitsm.agenda.grid;

import org.jspecify.annotations.Nullable;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A grid formatted for display: each row carries its time label and one presentation unit per
 * column, {@code null} for empty cells.
 *
 * @param rows        the formatted rows in slot order
 * @param columnCount the number of units in every row
 */
public record TimeslotTable(List<Row> rows, int columnCount) {

    public TimeslotTable {
        rows = List.copyOf(rows);
    }

    /**
     * Formats the grid. The formatter sees the first cell of every placement once through
     * {@link PlacementFormatter#format} and each continuation cell through
     * {@link PlacementFormatter#formatContinuation}.
     */
    public static TimeslotTable of(Grid grid, PlacementFormatter formatter, DateTimeFormatter timeFormatter) {
        var rows = new ArrayList<Row>(grid.rows().size());
        for (var gridRow : grid.rows()) {
            var units = new ArrayList<@Nullable PresentationUnit>(grid.columnCount());
            for (var cell : gridRow.cells()) {
                var placement = cell.placement();
                if (placement == null) {
                    units.add(null);
                } else if (cell.continuation()) {
                    units.add(formatter.formatContinuation(placement));
                } else {
                    units.add(formatter.format(placement));
                }
            }
            rows.add(new Row(gridRow.slot(), timeFormatter.format(gridRow.slot()),
                    Collections.unmodifiableList(units)));
        }
        return new TimeslotTable(rows, grid.columnCount());
    }

    /**
     * @param slot  the slot key
     * @param label the formatted slot time
     * @param units the formatted cells, {@code null} where the cell is empty
     */
    public record Row(LocalDateTime slot, String label, List<@Nullable PresentationUnit> units) {
    }
}
