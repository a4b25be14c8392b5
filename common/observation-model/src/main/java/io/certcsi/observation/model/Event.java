package io.certcsi.observation.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable fact: entity {@code entityUid} underwent {@code type} at {@code timestamp} within
 * test case {@code testCaseId}.
 */
public record Event(String name, long testCaseId, String entityUid, EventType type, Instant timestamp) {
    public Event {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(entityUid, "entityUid");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public static Event of(Entity entity, EventType type, Instant timestamp) {
        Objects.requireNonNull(entity, "entity");
        return new Event(EventNames.generate(type), entity.testCaseId(), entity.k8sUid(), type, timestamp);
    }
}
