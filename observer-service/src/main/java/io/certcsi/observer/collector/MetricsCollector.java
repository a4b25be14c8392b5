package io.certcsi.observer.collector;

import io.certcsi.observation.model.EntityTimeline;
import io.certcsi.observation.model.Event;
import io.certcsi.observation.model.EventType;
import io.certcsi.observation.model.TestCase;
import io.certcsi.observation.model.TestRun;
import io.certcsi.store.EventStore;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads finalized timelines back from the event store and derives per-type counts and stage
 * durations. Only meaningful once the runner of the test case has stopped.
 */
public class MetricsCollector {

  private static final Logger log = LoggerFactory.getLogger(MetricsCollector.class);

  private final EventStore eventStore;

  public MetricsCollector(EventStore eventStore) {
    this.eventStore = Objects.requireNonNull(eventStore, "eventStore");
  }

  /**
   * @throws RunNotFoundException when no entity was recorded for {@code testCaseId}
   */
  public TestCaseMetrics collect(long testCaseId) {
    List<EntityTimeline> timelines = eventStore.loadTimelines(testCaseId);
    if (timelines.isEmpty()) {
      throw RunNotFoundException.forTestCase(testCaseId);
    }
    Map<EventType, Long> counts = new EnumMap<>(EventType.class);
    for (EventType type : EventType.values()) {
      counts.put(type, 0L);
    }
    for (EntityTimeline timeline : timelines) {
      for (Event event : timeline.events()) {
        counts.merge(event.type(), 1L, Long::sum);
      }
    }
    Map<Stage, StageMetrics> stages = new EnumMap<>(Stage.class);
    for (Stage stage : Stage.values()) {
      stages.put(stage, StageMetrics.of(stage, durations(stage, timelines)));
    }
    log.debug("collected {} entities for test case {}", timelines.size(), testCaseId);
    return new TestCaseMetrics(testCaseId, timelines.size(), counts, stages,
        eventStore.loadEntityCounts(testCaseId));
  }

  /**
   * Collects every test case of a named run. Test cases that recorded nothing are skipped.
   *
   * @throws RunNotFoundException when no run has that name
   */
  public RunMetrics collectRun(String runName) {
    TestRun run = eventStore.findTestRun(runName).orElseThrow(() -> RunNotFoundException.forRun(runName));
    List<RunMetrics.Entry> entries = new ArrayList<>();
    for (TestCase testCase : eventStore.findTestCases(run.id())) {
      try {
        entries.add(new RunMetrics.Entry(testCase, collect(testCase.id())));
      } catch (RunNotFoundException e) {
        log.warn("run {}: {}", runName, e.getMessage());
      }
    }
    return new RunMetrics(run, entries);
  }

  static List<Duration> durations(Stage stage, List<EntityTimeline> timelines) {
    List<Duration> durations = new ArrayList<>();
    for (EntityTimeline timeline : timelines) {
      if (timeline.entity().type() != stage.entityType()) {
        continue;
      }
      Optional<Instant> start = timeline.firstOccurrence(stage.start());
      Optional<Instant> end = timeline.firstOccurrence(stage.end());
      if (start.isPresent() && end.isPresent() && !end.get().isBefore(start.get())) {
        durations.add(Duration.between(start.get(), end.get()));
      }
    }
    return durations;
  }
}
