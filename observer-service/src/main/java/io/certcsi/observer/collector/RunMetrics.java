package io.certcsi.observer.collector;

import io.certcsi.observation.model.TestCase;
import io.certcsi.observation.model.TestRun;
import java.util.List;
import java.util.Objects;

public record RunMetrics(TestRun run, List<Entry> testCases) {

  public RunMetrics {
    Objects.requireNonNull(run, "run");
    testCases = List.copyOf(testCases);
  }

  public record Entry(TestCase testCase, TestCaseMetrics metrics) {
  }
}
