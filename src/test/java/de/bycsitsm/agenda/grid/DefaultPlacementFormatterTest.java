package de.bycsitsm.agenda.grid;

import de.bycsitsm.agenda.AgendaProperties;
import de.bycsitsm.agenda.occasion.Event;
import de.bycsitsm.agenda.occasion.Occasion;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class DefaultPlacementFormatterTest {

    private static final LocalDateTime NINE = LocalDateTime.of(2024, 3, 15, 9, 0);

    private final Event event = Event.of("Planning", "", null);
    private final Occasion occasion = Occasion.of(event, NINE, NINE.plusHours(1));

    @Test
    void formats_title_link_and_visual_class() {
        var formatter = new DefaultPlacementFormatter(AgendaProperties.defaults());
        var placement = new Placement(occasion, 0, NINE);
        placement.assignVisualClass("evt-even");

        var unit = formatter.format(placement);

        assertThat(unit.label()).isEqualTo("Planning");
        assertThat(unit.link()).isEqualTo("/events/" + event.id() + "/" + occasion.id());
        assertThat(unit.visualClass()).isEqualTo("evt-even");
    }

    @Test
    void uses_the_configured_link_pattern() {
        var properties = new AgendaProperties(null, null, null, null, null, null, null,
                "/calendar/occasions/{occasion}");
        var formatter = new DefaultPlacementFormatter(properties);

        var unit = formatter.format(new Placement(occasion, 1, NINE));

        assertThat(unit.link()).isEqualTo("/calendar/occasions/" + occasion.id());
        assertThat(unit.visualClass()).isNull();
    }

    @Test
    void continuation_cells_show_the_continuation_marker() {
        var formatter = new DefaultPlacementFormatter(AgendaProperties.defaults());
        var placement = new Placement(occasion, 0, NINE);
        placement.assignVisualClass("evt-odd");

        var unit = formatter.formatContinuation(placement);

        assertThat(unit).isEqualTo(new PresentationUnit("^", null, "evt-odd"));
    }

    @Test
    void first_visual_class_wins() {
        var placement = new Placement(occasion, 0, NINE);

        assertThat(placement.assignVisualClass("evt-even")).isTrue();
        assertThat(placement.assignVisualClass("evt-odd")).isFalse();
        assertThat(placement.visualClass()).isEqualTo("evt-even");
    }
}
