package io.certcsi.observation.model;

import java.time.Instant;
import java.util.Objects;

public record TestRun(long id, String name, Instant startedAt, String storageClass, String clusterAddress) {
    public TestRun {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(startedAt, "startedAt");
    }
}
