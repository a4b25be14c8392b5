package io.certcsi.store;

import io.certcsi.observation.model.Entity;
import io.certcsi.observation.model.EntityCount;
import io.certcsi.observation.model.EntityTimeline;
import io.certcsi.observation.model.Event;
import io.certcsi.observation.model.TestCase;
import io.certcsi.observation.model.TestRun;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable record of everything observed during certification runs.
 * <p>
 * Implementations must be safe for concurrent use: every observer of a test case writes through
 * the same instance while the runner and the metrics collector read from it.
 * All failures are reported as {@link EventStoreException}.
 */
public interface EventStore {

  /**
   * Persists entities. Re-inserting an entity that already exists (same {@code k8sUid}, or same
   * type, name and test case) is a no-op rather than an error, because watch streams redeliver
   * "added" notifications on reconnect.
   */
  void saveEntities(List<Entity> entities);

  /**
   * Persists a batch of events atomically: after this call either every event is visible to
   * readers or none is.
   */
  void saveEvents(List<Event> events);

  void saveEntityCounts(List<EntityCount> counts);

  TestRun createTestRun(String name, String storageClass, String clusterAddress, Instant startedAt);

  TestCase createTestCase(long runId, String name, Map<String, Object> parameters, Instant startedAt);

  void completeTestCase(long testCaseId, Instant endedAt, boolean success, String errorMessage);

  Optional<TestRun> findTestRun(String name);

  Optional<TestCase> findTestCase(long testCaseId);

  List<TestCase> findTestCases(long runId);

  /**
   * Loads every entity of a test case with its events ordered by timestamp. Returns an empty list
   * when nothing was observed for the id.
   */
  List<EntityTimeline> loadTimelines(long testCaseId);

  List<EntityCount> loadEntityCounts(long testCaseId);
}
