package io.certcsi.observation.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * One certification scenario inside a {@link TestRun}; groups every entity and event observed
 * while it ran.
 *
 * @param endedAt      {@code null} while the test case is still running
 * @param errorMessage {@code null} unless the test case failed
 */
public record TestCase(long id,
                       long runId,
                       String name,
                       Map<String, Object> parameters,
                       Instant startedAt,
                       Instant endedAt,
                       boolean success,
                       String errorMessage) {
    public TestCase {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(startedAt, "startedAt");
        parameters = parameters == null || parameters.isEmpty() ? Map.of() : Map.copyOf(parameters);
    }

    public boolean isCompleted() {
        return endedAt != null;
    }
}
