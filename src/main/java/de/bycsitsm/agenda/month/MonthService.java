package de.bycsitsm.agenda.month;

import de.bycsitsm.agenda.AgendaProperties;
import de.bycsitsm.agenda.occasion.Event;
import de.bycsitsm.agenda.occasion.Occasion;
import de.bycsitsm.agenda.occasion.OccasionRepository;
import de.bycsitsm.agenda.occasion.OverlapQuery;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Service layer for month calendars: the week layout of a month and the occasions of each of
 * its days.
 */
@Service
public class MonthService {

    private static final Logger log = LoggerFactory.getLogger(MonthService.class);

    private final OccasionRepository occasionRepository;
    private final OverlapQuery overlapQuery;
    private final DayOfWeek firstWeekday;

    MonthService(OccasionRepository occasionRepository, OverlapQuery overlapQuery,
                 AgendaProperties agendaProperties) {
        this.occasionRepository = occasionRepository;
        this.overlapQuery = overlapQuery;
        this.firstWeekday = agendaProperties.firstWeekday();
    }

    /**
     * Returns the weeks of the month, starting with the configured first weekday.
     */
    public List<List<@Nullable LocalDate>> weeks(YearMonth month) {
        return MonthCalendar.weeks(month, firstWeekday);
    }

    /**
     * Returns, for every day of the month in order, the occasions overlapping that day.
     *
     * @param owner restricts the result to the occasions of this event, or {@code null} for all
     */
    public Map<LocalDate, List<Occasion>> occasionsByDay(YearMonth month, @Nullable Event owner) {
        var boundaries = MonthCalendar.boundaries(month.atDay(1));
        var occasions = occasionRepository.loadOccasionsBetween(boundaries.first().atStartOfDay(),
                boundaries.last().atTime(OverlapQuery.END_OF_DAY), owner);

        var byDay = new LinkedHashMap<LocalDate, List<Occasion>>();
        for (var day = boundaries.first(); !day.isAfter(boundaries.last()); day = day.plusDays(1)) {
            byDay.put(day, overlapQuery.daily(occasions, day, null));
        }
        log.info("Loaded {} occasion(s) for {}", occasions.size(), month);
        return byDay;
    }
}
