package io.certcsi.observation.model;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An entity together with its recorded events, ordered by timestamp.
 */
public record EntityTimeline(Entity entity, List<Event> events) {
    public EntityTimeline {
        Objects.requireNonNull(entity, "entity");
        events = events == null ? List.of() : events.stream()
            .sorted(Comparator.comparing(Event::timestamp))
            .toList();
    }

    /**
     * Timestamp of the first event of the given type, if any was recorded.
     */
    public Optional<Instant> firstOccurrence(EventType type) {
        return events.stream()
            .filter(event -> event.type() == type)
            .map(Event::timestamp)
            .findFirst();
    }

    public long count(EventType type) {
        return events.stream().filter(event -> event.type() == type).count();
    }
}
