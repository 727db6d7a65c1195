package de.bycsitsm.agenda.grid;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * The selectable start and end times of a day, one per grid slot, as offered by time pickers.
 */
public final class TimeslotOptions {

    private TimeslotOptions() {
    }

    public static List<TimeslotOption> of(GridConfig config, DateTimeFormatter timeFormatter) {
        return config.slotKeys(LocalDate.EPOCH).stream()
                .map(slot -> new TimeslotOption(slot.toLocalTime(), timeFormatter.format(slot)))
                .toList();
    }

    /**
     * @param time  the time of day of the slot
     * @param label the formatted time
     */
    public record TimeslotOption(LocalTime time, String label) {
    }
}
