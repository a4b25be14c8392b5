package io.certcsi.observation.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Population sample of the observed namespace at one instant.
 */
public record EntityCount(long testCaseId,
                          Instant timestamp,
                          int podsCreating,
                          int podsReady,
                          int podsTerminating,
                          int pvcCreating,
                          int pvcBound,
                          int pvcTerminating) {
    public EntityCount {
        Objects.requireNonNull(timestamp, "timestamp");
    }
}
