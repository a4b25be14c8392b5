package io.certcsi.observer.observer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import io.certcsi.observation.model.EntityCount;
import io.certcsi.observation.model.TestCase;
import io.certcsi.observer.handoff.HandoffRegistry;
import io.certcsi.observer.runner.Runner;
import io.certcsi.store.EventStore;
import io.certcsi.store.EventStoreException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class EntityCountObserverTest {

  private static final Instant T0 = Instant.parse("2024-05-01T09:00:00Z");
  private static final TestCase TEST_CASE = new TestCase(9L, 1L, "counts", Map.of(), T0, null, false, null);

  private final EventStore store = mock(EventStore.class);
  private final SteppingClock clock = new SteppingClock(T0, Duration.ofSeconds(10));

  @Test
  void flushesTheInitialSampleWhenStoppedBeforeTheFirstTick() {
    EntityCountObserver observer = new EntityCountObserver(
        (testCaseId, at) -> new EntityCount(testCaseId, at, 1, 2, 0, 0, 3, 1),
        Duration.ofHours(1), clock, new ObserverMetrics(new SimpleMeterRegistry()));
    Runner runner = runner(observer);
    observer.stopWatching();

    observer.startWatching(runner);

    assertThat(savedCounts()).containsExactly(new EntityCount(9L, T0, 1, 2, 0, 0, 3, 1));
    assertThat(runner.outcomes()).containsEntry(EntityCountObserver.OBSERVER_NAME, ObserverOutcome.FLUSHED);
  }

  @Test
  void samplesEveryIntervalUntilStopped() throws InterruptedException {
    CountDownLatch sampled = new CountDownLatch(3);
    EntityCountObserver observer = new EntityCountObserver((testCaseId, at) -> {
      sampled.countDown();
      return new EntityCount(testCaseId, at, 0, 0, 0, 0, 0, 0);
    }, Duration.ofMillis(10), clock, new ObserverMetrics(new SimpleMeterRegistry()));
    Runner runner = runner(observer);

    runner.start();
    assertThat(sampled.await(5, TimeUnit.SECONDS)).isTrue();
    assertThat(runner.stop()).isTrue();

    assertThat(savedCounts()).hasSizeGreaterThanOrEqualTo(3)
        .extracting(EntityCount::testCaseId).containsOnly(9L);
  }

  @Test
  void skipsFailedSamples() {
    AtomicInteger calls = new AtomicInteger();
    SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    EntityCountObserver observer = new EntityCountObserver((testCaseId, at) -> {
      if (calls.incrementAndGet() == 1) {
        throw new IllegalStateException("api unavailable");
      }
      return new EntityCount(testCaseId, at, 0, 0, 0, 0, 0, 0);
    }, Duration.ofHours(1), clock, new ObserverMetrics(meterRegistry));
    Runner runner = runner(observer);
    observer.stopWatching();

    observer.startWatching(runner);

    assertThat(savedCounts()).isEmpty();
    assertThat(meterRegistry.get("certcsi_observer_ignored_notifications")
        .tag("reason", "sample-failed").counter().count()).isEqualTo(1.0);
  }

  @Test
  void reportsFlushFailure() {
    doThrow(new EventStoreException("db down", null)).when(store).saveEntityCounts(anyList());
    EntityCountObserver observer = new EntityCountObserver(
        (testCaseId, at) -> new EntityCount(testCaseId, at, 0, 0, 0, 0, 0, 0),
        Duration.ofHours(1), clock, new ObserverMetrics(new SimpleMeterRegistry()));
    Runner runner = runner(observer);
    observer.stopWatching();

    observer.startWatching(runner);

    assertThat(runner.outcomes()).containsEntry(EntityCountObserver.OBSERVER_NAME, ObserverOutcome.FLUSH_FAILED);
  }

  @Test
  void rejectsNonPositiveInterval() {
    assertThatThrownBy(() -> new EntityCountObserver((id, at) -> null, Duration.ZERO, clock,
        new ObserverMetrics(new SimpleMeterRegistry())))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private Runner runner(EntityCountObserver observer) {
    return new Runner(TEST_CASE, store, new HandoffRegistry(), List.of(observer),
        Duration.ofMinutes(1), Duration.ofSeconds(5));
  }

  @SuppressWarnings("unchecked")
  private List<EntityCount> savedCounts() {
    ArgumentCaptor<List<EntityCount>> captor = ArgumentCaptor.forClass(List.class);
    verify(store).saveEntityCounts(captor.capture());
    return captor.getValue();
  }
}
