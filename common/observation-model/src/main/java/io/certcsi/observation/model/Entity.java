package io.certcsi.observation.model;

import java.util.Objects;

/**
 * A cluster resource instance observed during one test case.
 * <p>
 * {@code k8sUid} is unique across the store; {@code (type, name, testCaseId)} is unique within it.
 * Entities are never updated once stored, events reference them through {@link #k8sUid()}.
 */
public record Entity(String k8sUid, String name, EntityType type, long testCaseId) {
    public Entity {
        k8sUid = requireNonBlank(k8sUid, "k8sUid");
        name = requireNonBlank(name, "name");
        type = Objects.requireNonNull(type, "type");
    }

    private static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value;
    }
}
