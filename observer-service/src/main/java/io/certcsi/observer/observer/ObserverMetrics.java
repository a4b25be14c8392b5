package io.certcsi.observer.observer;

import io.certcsi.observation.model.EventType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Objects;

/**
 * Micrometer counters describing what observers recorded and dropped.
 */
public final class ObserverMetrics {

  private final MeterRegistry meterRegistry;

  public ObserverMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
  }

  void eventRecorded(String observer, EventType type) {
    Counter.builder("certcsi_observer_events")
        .description("Lifecycle events recorded by observers")
        .tag("observer", observer)
        .tag("type", type.name())
        .register(meterRegistry)
        .increment();
  }

  void notificationIgnored(String observer, String reason) {
    Counter.builder("certcsi_observer_ignored_notifications")
        .description("Watch notifications dropped without recording an event")
        .tag("observer", observer)
        .tag("reason", reason)
        .register(meterRegistry)
        .increment();
  }

  void flushFailed(String observer) {
    Counter.builder("certcsi_observer_flush_failures")
        .description("Sessions whose buffered records could not be persisted")
        .tag("observer", observer)
        .register(meterRegistry)
        .increment();
  }

  void sessionEnded(String observer, ObserverOutcome outcome) {
    Counter.builder("certcsi_observer_sessions")
        .description("Observation sessions by outcome")
        .tag("observer", observer)
        .tag("outcome", outcome.name())
        .register(meterRegistry)
        .increment();
  }
}
