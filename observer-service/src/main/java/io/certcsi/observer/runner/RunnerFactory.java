package io.certcsi.observer.runner;

import io.certcsi.observation.model.TestCase;
import io.certcsi.observer.config.ObserverKind;
import io.certcsi.observer.config.ObserverProperties;
import io.certcsi.observer.handoff.HandoffRegistry;
import io.certcsi.observer.infra.kubernetes.KubernetesEntityCountSource;
import io.certcsi.observer.infra.kubernetes.KubernetesWatchSource;
import io.certcsi.observer.observer.EntityCountObserver;
import io.certcsi.observer.observer.Observer;
import io.certcsi.observer.observer.ObserverMetrics;
import io.certcsi.observer.observer.ResourceObserver;
import io.certcsi.store.EventStore;
import io.fabric8.kubernetes.client.KubernetesClient;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Builds runners wired with the configured observers and records test-case boundaries in the
 * event store.
 */
@Component
public class RunnerFactory {

  private static final Logger log = LoggerFactory.getLogger(RunnerFactory.class);

  private final ObserverProperties properties;
  private final EventStore eventStore;
  private final KubernetesClient client;
  private final ObserverMetrics metrics;
  private final Clock clock;

  public RunnerFactory(ObserverProperties properties,
                       EventStore eventStore,
                       KubernetesClient client,
                       ObserverMetrics metrics,
                       Clock clock) {
    this.properties = Objects.requireNonNull(properties, "properties");
    this.eventStore = Objects.requireNonNull(eventStore, "eventStore");
    this.client = Objects.requireNonNull(client, "client");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Registers a new test case under {@code runId} and returns a runner for it. The runner is not
   * started.
   */
  public Runner begin(long runId, String testCaseName, Map<String, Object> parameters) {
    TestCase testCase = eventStore.createTestCase(runId, testCaseName, parameters, clock.instant());
    log.info("test case {} ({}) created in run {}", testCase.id(), testCaseName, runId);
    return create(testCase);
  }

  public Runner create(TestCase testCase) {
    return new Runner(testCase, eventStore, new HandoffRegistry(), observers(),
        properties.getWatchTimeout(), properties.getShutdownTimeout());
  }

  /**
   * Stops {@code runner} and marks its test case completed. The test case fails when any observer
   * did not persist its session.
   */
  public boolean finish(Runner runner) {
    boolean completed = runner.stop();
    List<String> endedEarly = runner.endedEarly();
    boolean success = completed && endedEarly.isEmpty();
    String error = null;
    if (!completed) {
      error = "observers did not finish within " + properties.getShutdownTimeout();
    } else if (!endedEarly.isEmpty()) {
      error = "observation ended early: " + String.join(", ", endedEarly);
    }
    eventStore.completeTestCase(runner.testCase().id(), clock.instant(), success, error);
    return success;
  }

  List<Observer> observers() {
    String namespace = properties.getNamespace();
    List<Observer> observers = new ArrayList<>();
    if (properties.isEnabled(ObserverKind.PERSISTENT_VOLUME_CLAIM)) {
      observers.add(ResourceObserver.claims(KubernetesWatchSource.persistentVolumeClaims(client, namespace), clock, metrics));
    }
    if (properties.isEnabled(ObserverKind.POD)) {
      observers.add(ResourceObserver.pods(KubernetesWatchSource.pods(client, namespace), clock, metrics));
    }
    if (properties.isEnabled(ObserverKind.VOLUME_ATTACHMENT)) {
      observers.add(ResourceObserver.volumeAttachments(KubernetesWatchSource.volumeAttachments(client), clock, metrics));
    }
    if (properties.isEnabled(ObserverKind.ENTITY_COUNT)) {
      observers.add(new EntityCountObserver(new KubernetesEntityCountSource(client, namespace),
          properties.getEntityCountInterval(), clock, metrics));
    }
    return observers;
  }
}
