package de.bycsitsm.agenda.occasion;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link OccasionRepository} keeping occasions in memory. Each query works on a snapshot of the
 * stored values, so concurrent saves never tear a read.
 */
@Repository
class InMemoryOccasionRepository implements OccasionRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemoryOccasionRepository.class);

    private final Map<UUID, Occasion> occasions = new ConcurrentHashMap<>();

    private final OverlapQuery overlapQuery;

    InMemoryOccasionRepository(OverlapQuery overlapQuery) {
        this.overlapQuery = overlapQuery;
    }

    @Override
    public List<Occasion> loadOccasionsForDay(LocalDate day, @Nullable Event owner) {
        return overlapQuery.daily(snapshot(), day, owner);
    }

    @Override
    public List<Occasion> loadOccasionsBetween(LocalDateTime start, LocalDateTime end, @Nullable Event owner) {
        return overlapQuery.overlapping(snapshot(), start, end, owner);
    }

    @Override
    public List<Occasion> findByEvent(Event event) {
        return snapshot().stream()
                .filter(occasion -> occasion.belongsTo(event))
                .sorted()
                .toList();
    }

    @Override
    public void saveOccasion(Occasion occasion) {
        occasions.put(occasion.id(), occasion);
        log.debug("Saved occasion {} of event {}", occasion.id(), occasion.event().id());
    }

    private List<Occasion> snapshot() {
        return List.copyOf(occasions.values());
    }
}
