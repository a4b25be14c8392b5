package io.certcsi.observer.observer;

import io.certcsi.observation.model.EntityCount;
import io.certcsi.observer.runner.Runner;
import io.certcsi.store.EventStoreException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Samples the namespace population once when started and then every {@code interval} until
 * stopped, then writes all samples in one batch.
 */
public final class EntityCountObserver extends AbstractObserver {

  public static final String OBSERVER_NAME = "EntityCountObserver";

  private static final Logger log = LoggerFactory.getLogger(EntityCountObserver.class);

  private final EntityCountSource source;
  private final Duration interval;
  private final Clock clock;

  public EntityCountObserver(EntityCountSource source, Duration interval, Clock clock, ObserverMetrics metrics) {
    super(OBSERVER_NAME, metrics);
    this.source = Objects.requireNonNull(source, "source");
    this.interval = Objects.requireNonNull(interval, "interval");
    this.clock = Objects.requireNonNull(clock, "clock");
    if (interval.isZero() || interval.isNegative()) {
      throw new IllegalArgumentException("interval must be positive");
    }
  }

  @Override
  protected ObserverOutcome observe(Runner runner, BlockingQueue<ObserverSignal> signals) {
    long testCaseId = runner.testCase().id();
    List<EntityCount> samples = new ArrayList<>();
    sample(testCaseId, samples);
    while (true) {
      ObserverSignal signal;
      try {
        signal = signals.poll(interval.toMillis(), TimeUnit.MILLISECONDS);
      } catch (InterruptedException e) {
        ObserverOutcome outcome = flush(runner, samples);
        Thread.currentThread().interrupt();
        return outcome;
      }
      if (signal == null) {
        sample(testCaseId, samples);
      } else if (signal instanceof ObserverSignal.Shutdown) {
        return flush(runner, samples);
      }
    }
  }

  private void sample(long testCaseId, List<EntityCount> samples) {
    try {
      samples.add(source.sample(testCaseId, clock.instant()));
    } catch (RuntimeException e) {
      log.warn("{} sampling failed; error={}", getName(), e.getMessage());
      metrics().notificationIgnored(getName(), "sample-failed");
    }
  }

  private ObserverOutcome flush(Runner runner, List<EntityCount> samples) {
    try {
      runner.eventStore().saveEntityCounts(samples);
    } catch (EventStoreException e) {
      log.error("{} can't save {} samples; error={}", getName(), samples.size(), e.getMessage(), e);
      metrics().flushFailed(getName());
      return ObserverOutcome.FLUSH_FAILED;
    }
    log.info("{} saved {} samples for test case {}", getName(), samples.size(), runner.testCase().id());
    return ObserverOutcome.FLUSHED;
  }
}
