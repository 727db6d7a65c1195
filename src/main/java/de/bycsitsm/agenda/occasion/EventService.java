package de.bycsitsm.agenda.occasion;

import de.bycsitsm.agenda.AgendaProperties;
import de.bycsitsm.agenda.recurrence.RecurrenceExpander;
import de.bycsitsm.agenda.recurrence.RecurrenceRule;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * Service layer for events and their occasions. Validates inputs, expands recurrence rules
 * and hands the resulting occasions to the {@link OccasionRepository}.
 */
@Service
public class EventService {

    private static final Logger log = LoggerFactory.getLogger(EventService.class);

    private final OccasionRepository occasionRepository;
    private final RecurrenceExpander recurrenceExpander;
    private final OverlapQuery overlapQuery;
    private final Duration defaultOccasionDuration;

    EventService(OccasionRepository occasionRepository, RecurrenceExpander recurrenceExpander,
                 OverlapQuery overlapQuery, AgendaProperties agendaProperties) {
        this.occasionRepository = occasionRepository;
        this.recurrenceExpander = recurrenceExpander;
        this.overlapQuery = overlapQuery;
        this.defaultOccasionDuration = agendaProperties.defaultOccasionDuration();
    }

    /**
     * Creates an event without a note and its occasions.
     *
     * @see #createEvent(String, String, EventType, LocalDateTime, LocalDateTime, RecurrenceRule, String)
     */
    public Event createEvent(String title, @Nullable String description, @Nullable EventType type,
                             @Nullable LocalDateTime start, @Nullable LocalDateTime end, RecurrenceRule rule) {
        return createEvent(title, description, type, start, end, rule, null);
    }

    /**
     * Creates an event and its occasions.
     * <p>
     * A missing start defaults to the beginning of the current hour, a missing end to the start
     * plus the configured default occasion duration. Occasions follow the rules of
     * {@link #addOccasions}.
     *
     * @param title       the event title
     * @param description the event description, may be {@code null}
     * @param type        the event category, may be {@code null}
     * @param start       the start of the first occasion, or {@code null}
     * @param end         the end of the first occasion, or {@code null}
     * @param rule        the repetition pattern; {@link RecurrenceRule#once()} for a single occasion
     * @param note        a note to attach to the event; ignored when {@code null} or blank
     * @return the created event
     * @throws IllegalArgumentException if the title is blank or the end lies before the start
     * @throws de.bycsitsm.agenda.recurrence.InvalidRuleException if the rule is malformed
     */
    public Event createEvent(String title, @Nullable String description, @Nullable EventType type,
                             @Nullable LocalDateTime start, @Nullable LocalDateTime end, RecurrenceRule rule,
                             @Nullable String note) {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Event title must not be empty.");
        }

        var firstStart = start != null ? start : overlapQuery.now().truncatedTo(ChronoUnit.HOURS);
        var firstEnd = end != null ? end : firstStart.plus(defaultOccasionDuration);

        var event = Event.of(title, description, type);
        if (note != null && !note.isBlank()) {
            event = event.withNote(note);
        }
        addOccasions(event, firstStart, firstEnd, rule);
        log.info("Created event '{}' ({})", event.title(), event.id());
        return event;
    }

    /**
     * Adds one or more occasions to an event.
     * <p>
     * A rule with neither count nor until adds exactly one occasion spanning {@code [start, end]}.
     * Otherwise every occurrence of the rule adds an occasion as long as {@code [start, end]}.
     * The rule is expanded completely before anything is saved, so a malformed rule saves nothing.
     *
     * @return the saved occasions in chronological order
     * @throws de.bycsitsm.agenda.recurrence.InvalidRuleException if the rule is malformed
     */
    public List<Occasion> addOccasions(Event event, LocalDateTime start, LocalDateTime end, RecurrenceRule rule) {
        var intervals = recurrenceExpander.expand(start, end, rule);

        var occasions = intervals.stream()
                .map(interval -> Occasion.of(event, interval))
                .toList();
        occasions.forEach(occasionRepository::saveOccasion);

        log.info("Added {} occasion(s) to event '{}' starting {}", occasions.size(), event.title(), start);
        return occasions;
    }

    /**
     * Returns the occasions of the event that start at or after the current time.
     */
    public List<Occasion> upcomingOccasions(Event event) {
        return overlapQuery.upcoming(occasionRepository.findByEvent(event), overlapQuery.now());
    }

    /**
     * Returns the first occasion of the event that starts at or after the current time.
     */
    public Optional<Occasion> nextOccasion(Event event) {
        return overlapQuery.next(occasionRepository.findByEvent(event), overlapQuery.now());
    }

    /**
     * Returns the occasions overlapping the given day, optionally restricted to one event.
     */
    public List<Occasion> dailyOccasions(LocalDate day, @Nullable Event event) {
        return occasionRepository.loadOccasionsForDay(day, event);
    }
}
