package io.certcsi.observer.collector;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Duration statistics of one {@link Stage}. All durations are {@link Duration#ZERO} when no entity
 * completed the stage.
 */
public record StageMetrics(Stage stage,
                           int samples,
                           Duration min,
                           Duration max,
                           Duration average,
                           Duration median) {

  public StageMetrics {
    Objects.requireNonNull(stage, "stage");
  }

  static StageMetrics of(Stage stage, Collection<Duration> durations) {
    if (durations.isEmpty()) {
      return new StageMetrics(stage, 0, Duration.ZERO, Duration.ZERO, Duration.ZERO, Duration.ZERO);
    }
    List<Duration> sorted = new ArrayList<>(durations);
    sorted.sort(null);
    int n = sorted.size();
    Duration total = Duration.ZERO;
    for (Duration duration : sorted) {
      total = total.plus(duration);
    }
    Duration median = n % 2 == 1
        ? sorted.get(n / 2)
        : sorted.get(n / 2 - 1).plus(sorted.get(n / 2)).dividedBy(2);
    return new StageMetrics(stage, n, sorted.get(0), sorted.get(n - 1), total.dividedBy(n), median);
  }
}
