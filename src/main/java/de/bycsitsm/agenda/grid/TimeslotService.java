package de.bycsitsm.agenda.grid;

import de.bycsitsm.agenda.AgendaProperties;
import de.bycsitsm.agenda.occasion.Event;
import de.bycsitsm.agenda.occasion.OccasionRepository;
import de.bycsitsm.agenda.occasion.OverlapQuery;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Service layer for rendering the time-slot grid of a day. Loads the day's occasions through
 * the {@link OccasionRepository}, lays them out with the {@link GridBuilder} and formats the
 * result with the configured {@link PlacementFormatter}.
 */
@Service
public class TimeslotService {

    private static final Logger log = LoggerFactory.getLogger(TimeslotService.class);

    private final OccasionRepository occasionRepository;
    private final GridBuilder gridBuilder;
    private final PlacementFormatter placementFormatter;
    private final GridConfig gridConfig;
    private final DateTimeFormatter timeFormatter;

    TimeslotService(OccasionRepository occasionRepository, GridBuilder gridBuilder,
                    PlacementFormatter placementFormatter, AgendaProperties agendaProperties) {
        this.occasionRepository = occasionRepository;
        this.gridBuilder = gridBuilder;
        this.placementFormatter = placementFormatter;
        this.gridConfig = agendaProperties.gridConfig();
        this.timeFormatter = timeFormatter(agendaProperties.timeFormat());
    }

    public GridConfig gridConfig() {
        return gridConfig;
    }

    /**
     * Builds the grid of the given day with the default visual classes.
     *
     * @param day   the day to render
     * @param owner restricts the grid to the occasions of this event, or {@code null} for all
     */
    public Grid grid(LocalDate day, @Nullable Event owner) {
        var windowStart = day.atStartOfDay();
        var dayEnd = day.atTime(OverlapQuery.END_OF_DAY);
        var gridEnd = gridConfig.gridEnd(day);
        var windowEnd = gridEnd.isAfter(dayEnd) ? gridEnd : dayEnd;

        var occasions = occasionRepository.loadOccasionsBetween(windowStart, windowEnd, owner);
        var grid = gridBuilder.build(day, gridConfig, occasions, VisualClassPalette.defaults());
        log.info("Rendered grid for {} with {} of {} occasion(s) in {} column(s)",
                day, grid.placements().size(), occasions.size(), grid.columnCount());
        return grid;
    }

    /**
     * Builds and formats the grid of the given day.
     */
    public TimeslotTable table(LocalDate day, @Nullable Event owner) {
        return TimeslotTable.of(grid(day, owner), placementFormatter, timeFormatter);
    }

    /**
     * Returns the selectable times of a day, labelled with the configured time format.
     */
    public List<TimeslotOptions.TimeslotOption> timeslotOptions() {
        return TimeslotOptions.of(gridConfig, timeFormatter);
    }

    private static DateTimeFormatter timeFormatter(String pattern) {
        try {
            return DateTimeFormatter.ofPattern(pattern, Locale.ENGLISH);
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigException("Invalid time format '" + pattern + "': " + e.getMessage(), e);
        }
    }
}
