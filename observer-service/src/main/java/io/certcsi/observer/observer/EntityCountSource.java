package io.certcsi.observer.observer;

import io.certcsi.observation.model.EntityCount;
import java.time.Instant;

/**
 * Counts the claims and pods of the observed namespace by state.
 */
@FunctionalInterface
public interface EntityCountSource {

  EntityCount sample(long testCaseId, Instant timestamp);
}
