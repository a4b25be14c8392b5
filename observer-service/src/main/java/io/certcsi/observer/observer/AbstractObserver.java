package io.certcsi.observer.observer;

import io.certcsi.observer.runner.Runner;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shutdown signalling and completion reporting shared by every observer.
 */
public abstract class AbstractObserver implements Observer {

  private static final Logger log = LoggerFactory.getLogger(AbstractObserver.class);

  private final String name;
  private final ObserverMetrics metrics;
  private volatile BlockingQueue<ObserverSignal> signals = new LinkedBlockingQueue<>();

  protected AbstractObserver(String name, ObserverMetrics metrics) {
    this.name = Objects.requireNonNull(name, "name");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public final void startWatching(Runner runner) {
    Objects.requireNonNull(runner, "runner");
    ObserverOutcome outcome = ObserverOutcome.FAILED;
    log.debug("{} started watching", name);
    try {
      outcome = observe(runner, signals);
    } catch (RuntimeException e) {
      log.error("{} stopped on unexpected error", name, e);
    } finally {
      metrics.sessionEnded(name, outcome);
      runner.observerFinished(this, outcome);
    }
  }

  @Override
  public final void stopWatching() {
    signals.offer(ObserverSignal.SHUTDOWN);
  }

  @Override
  public final String getName() {
    return name;
  }

  @Override
  public final void reset() {
    signals = new LinkedBlockingQueue<>();
  }

  protected ObserverMetrics metrics() {
    return metrics;
  }

  /**
   * Runs one session, blocking on {@code signals}. Must not report completion itself.
   */
  protected abstract ObserverOutcome observe(Runner runner, BlockingQueue<ObserverSignal> signals);
}
