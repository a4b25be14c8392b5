package io.certcsi.observer.collector;

import io.certcsi.observation.model.EntityCount;
import io.certcsi.observation.model.EventType;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Statistics derived from the timelines of one test case. Event types that never occurred count
 * as zero.
 */
public record TestCaseMetrics(long testCaseId,
                              int entities,
                              Map<EventType, Long> eventCounts,
                              Map<Stage, StageMetrics> stages,
                              List<EntityCount> entityCounts) {

  public TestCaseMetrics {
    eventCounts = Collections.unmodifiableMap(new EnumMap<>(eventCounts));
    stages = Collections.unmodifiableMap(new EnumMap<>(stages));
    entityCounts = List.copyOf(entityCounts);
  }

  public long count(EventType type) {
    return eventCounts.getOrDefault(type, 0L);
  }

  public StageMetrics stage(Stage stage) {
    return stages.get(stage);
  }
}
