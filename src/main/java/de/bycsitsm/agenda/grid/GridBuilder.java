package de.bycsitsm.agenda.grid;

import de.bycsitsm.agenda.occasion.Occasion;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Lays out occasions on the time-slot grid of a day.
 * <p>
 * Occasions are processed in their natural order. Each one claims the lowest free column of
 * the row it starts in and keeps that column, through one shared {@link Placement}, for every
 * following slot before its end. An occasion ending exactly at the grid end also fills the
 * last slot. Occasions that began before the grid start in its first row.
 * The grid grows as many columns as the busiest row needs, but never fewer than the configured
 * minimum.
 * <p>
 * Rendering degrades silently instead of failing: occasions that end at or before the grid
 * start, occasions whose start does not fall on a slot, and the part of an occasion that runs
 * past the last slot are left out of the grid.
 */
@Component
public class GridBuilder {

    private static final Logger log = LoggerFactory.getLogger(GridBuilder.class);

    /**
     * Builds the grid of the given day without visual classes.
     */
    public Grid build(LocalDate day, GridConfig config, Collection<Occasion> occasions) {
        return build(day, config, occasions, null);
    }

    /**
     * Builds the grid of the given day.
     *
     * @param day       the day whose slots form the rows
     * @param config    the grid shape
     * @param occasions the occasions to place, in any order; they are not modified
     * @param palette   the visual classes to cycle through per column, or {@code null} to assign none
     * @return a fresh grid, independent of any earlier call
     */
    public Grid build(LocalDate day, GridConfig config, Collection<Occasion> occasions,
                      @Nullable VisualClassPalette palette) {
        var slots = config.slotKeys(day);
        var gridStart = slots.get(0);
        var gridEnd = config.gridEnd(day);

        Map<LocalDateTime, Map<Integer, Cell>> layout = new LinkedHashMap<>();
        for (var slot : slots) {
            layout.put(slot, new HashMap<>());
        }

        var ordered = new ArrayList<>(occasions);
        ordered.sort(null);

        int placed = 0;
        for (var occasion : ordered) {
            if (!occasion.end().isAfter(gridStart)) {
                log.debug("Skipping {}: it ends before the grid starts at {}", occasion, gridStart);
                continue;
            }

            var rowKey = occasion.start().isAfter(gridStart) ? occasion.start() : gridStart;
            var row = layout.get(rowKey);
            if (row == null) {
                log.debug("Skipping {}: its start does not fall on a slot of the grid", occasion);
                continue;
            }

            int column = 0;
            while (row.containsKey(column)) {
                column++;
            }
            var placement = new Placement(occasion, column, rowKey);
            row.put(column, Cell.start(placement));

            for (var slot = rowKey.plus(config.slotInterval());
                 covers(occasion, slot, gridEnd);
                 slot = slot.plus(config.slotInterval())) {
                var next = layout.get(slot);
                if (next == null) {
                    log.debug("Truncating {} at the end of the grid", occasion);
                    break;
                }
                next.put(column, Cell.continuationOf(placement));
            }
            placed++;
        }

        int widest = layout.values().stream().mapToInt(Map::size).max().orElse(0);
        int columnCount = Math.max(config.minColumns(), widest);

        var rows = new ArrayList<GridRow>(layout.size());
        for (var entry : layout.entrySet()) {
            var cells = new Cell[columnCount];
            Arrays.fill(cells, Cell.EMPTY);
            entry.getValue().forEach((column, cell) -> cells[column] = cell);
            rows.add(new GridRow(entry.getKey(), Arrays.asList(cells)));
        }

        if (palette != null) {
            assignVisualClasses(rows, new ColumnClassCycler(palette));
        }

        log.debug("Built grid for {} with {} row(s), {} column(s) and {} placement(s)",
                day, rows.size(), columnCount, placed);
        return new Grid(rows, columnCount);
    }

    /**
     * Whether a continuation of the occasion belongs into the given slot: every slot before the
     * occasion's end, plus the grid's last slot when the occasion ends exactly there.
     */
    private static boolean covers(Occasion occasion, LocalDateTime slot, LocalDateTime gridEnd) {
        return slot.isBefore(occasion.end()) || slot.equals(gridEnd) && occasion.end().equals(gridEnd);
    }

    /**
     * Gives each placement a class from the cycle of its column and category, in row order.
     * A placement keeps the class it received first.
     */
    private void assignVisualClasses(Iterable<GridRow> rows, ColumnClassCycler cycler) {
        for (var row : rows) {
            for (int column = 0; column < row.cells().size(); column++) {
                var placement = row.cell(column).placement();
                if (placement != null && placement.visualClass() == null) {
                    placement.assignVisualClass(cycler.next(column, placement.occasion().event().category()));
                }
            }
        }
    }
}
