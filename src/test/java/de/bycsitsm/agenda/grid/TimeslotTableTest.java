package de.bycsitsm.agenda.grid;

import de.bycsitsm.agenda.occasion.Event;
import de.bycsitsm.agenda.occasion.Occasion;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

class TimeslotTableTest {

    private static final LocalDate DAY = LocalDate.of(2024, 3, 15);
    private static final GridConfig CONFIG = new GridConfig(LocalTime.of(9, 0), Duration.ofHours(1),
            Duration.ofMinutes(15), 2);
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("hh:mm a", Locale.ENGLISH);

    private final GridBuilder gridBuilder = new GridBuilder();

    @Test
    void formats_each_placement_once_and_marks_continuations() {
        var review = Occasion.of(Event.of("Review", "", null), DAY.atTime(9, 0), DAY.atTime(9, 45));
        var grid = gridBuilder.build(DAY, CONFIG, List.of(review));
        var formatted = new ArrayList<Placement>();
        PlacementFormatter formatter = placement -> {
            formatted.add(placement);
            return new PresentationUnit(placement.occasion().title(), null, placement.visualClass());
        };

        var table = TimeslotTable.of(grid, formatter, TIME);

        assertThat(formatted).hasSize(1);
        assertThat(table.columnCount()).isEqualTo(2);
        assertThat(table.rows()).extracting(TimeslotTable.Row::label)
                .containsExactly("09:00 AM", "09:15 AM", "09:30 AM", "09:45 AM", "10:00 AM");
        assertThat(table.rows().get(0).units())
                .containsExactly(new PresentationUnit("Review", null, null), null);
        assertThat(table.rows().get(1).units().get(0).label()).isEqualTo(PlacementFormatter.CONTINUATION_LABEL);
        assertThat(table.rows().get(2).units().get(0).label()).isEqualTo("^");
        assertThat(table.rows().get(3).units()).containsOnlyNulls();
    }

    @Test
    void every_row_has_one_unit_per_column() {
        var event = Event.of("Sync", "", null);
        var occasions = List.of(
                Occasion.of(event, DAY.atTime(9, 15), DAY.atTime(9, 30)),
                Occasion.of(event, DAY.atTime(9, 15), DAY.atTime(9, 30)),
                Occasion.of(event, DAY.atTime(9, 15), DAY.atTime(9, 30)));

        var table = TimeslotTable.of(gridBuilder.build(DAY, CONFIG, occasions),
                placement -> new PresentationUnit("x", null, null), TIME);

        assertThat(table.columnCount()).isEqualTo(3);
        assertThat(table.rows()).allSatisfy(row -> assertThat(row.units()).hasSize(3));
    }
}
