package io.certcsi.observer.runner;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

import io.certcsi.observation.model.TestCase;
import io.certcsi.observer.handoff.HandoffRegistry;
import io.certcsi.observer.observer.Observer;
import io.certcsi.observer.observer.ObserverOutcome;
import io.certcsi.store.EventStore;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class RunnerTest {

  private static final TestCase TEST_CASE =
      new TestCase(11L, 1L, "runner", Map.of(), Instant.parse("2024-05-01T09:00:00Z"), null, false, null);

  private final EventStore store = mock(EventStore.class);

  @Test
  void stopBroadcastsOnceAndWaitsForEveryObserver() {
    FakeObserver claims = FakeObserver.untilStopped("claims", ObserverOutcome.FLUSHED);
    FakeObserver pods = FakeObserver.untilStopped("pods", ObserverOutcome.FLUSHED);
    Runner runner = runner(List.of(claims, pods), Duration.ofSeconds(5));

    runner.start();
    assertThat(runner.stop()).isTrue();
    assertThat(runner.stop()).isTrue();

    assertThat(runner.outcomes()).containsExactly(
        Map.entry("claims", ObserverOutcome.FLUSHED),
        Map.entry("pods", ObserverOutcome.FLUSHED));
    assertThat(claims.stops.get()).isEqualTo(1);
    assertThat(pods.stops.get()).isEqualTo(1);
    assertThat(claims.resets.get()).isEqualTo(1);
    assertThat(runner.endedEarly()).isEmpty();
  }

  @Test
  void reportsObserversThatEndedEarly() {
    FakeObserver expired = FakeObserver.immediately("claims", ObserverOutcome.EXPIRED);
    FakeObserver flushed = FakeObserver.untilStopped("pods", ObserverOutcome.FLUSHED);
    Runner runner = runner(List.of(expired, flushed), Duration.ofSeconds(5));

    runner.start();
    assertThat(runner.stop()).isTrue();

    assertThat(runner.endedEarly()).containsExactly("claims");
  }

  @Test
  void stopGivesUpAfterTheShutdownTimeout() {
    FakeObserver stuck = FakeObserver.ignoringStop("stuck");
    Runner runner = runner(List.of(stuck), Duration.ofMillis(100));

    runner.start();

    assertThat(runner.stop()).isFalse();
    assertThat(runner.outcomes()).isEmpty();
  }

  @Test
  void secondCompletionOfTheSameObserverIsIgnored() {
    FakeObserver first = FakeObserver.untilStopped("first", ObserverOutcome.FLUSHED);
    FakeObserver second = FakeObserver.untilStopped("second", ObserverOutcome.FLUSHED);
    Runner runner = runner(List.of(first, second), Duration.ofSeconds(5));

    runner.observerFinished(first, ObserverOutcome.EXPIRED);
    runner.observerFinished(first, ObserverOutcome.FLUSHED);

    assertThat(runner.awaitCompletion(Duration.ofMillis(50))).isFalse();
    assertThat(runner.outcomes()).containsExactly(Map.entry("first", ObserverOutcome.EXPIRED));
  }

  @Test
  void completionFromAnUnknownObserverIsIgnored() {
    FakeObserver registered = FakeObserver.untilStopped("registered", ObserverOutcome.FLUSHED);
    Runner runner = runner(List.of(registered), Duration.ofSeconds(5));

    runner.observerFinished(FakeObserver.immediately("stranger", ObserverOutcome.FLUSHED), ObserverOutcome.FLUSHED);

    assertThat(runner.awaitCompletion(Duration.ofMillis(50))).isFalse();
  }

  @Test
  void startsOnlyOnce() {
    Runner runner = runner(List.of(FakeObserver.immediately("claims", ObserverOutcome.FLUSHED)), Duration.ofSeconds(5));

    runner.start();

    assertThatThrownBy(runner::start).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void stopBeforeStartIsRejected() {
    Runner runner = runner(List.of(FakeObserver.immediately("claims", ObserverOutcome.FLUSHED)), Duration.ofSeconds(5));

    assertThatThrownBy(runner::stop).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void rejectsDuplicateObserverNames() {
    assertThatThrownBy(() -> runner(List.of(
        FakeObserver.immediately("claims", ObserverOutcome.FLUSHED),
        FakeObserver.immediately("claims", ObserverOutcome.FLUSHED)), Duration.ofSeconds(5)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("claims");
  }

  private Runner runner(List<? extends Observer> observers, Duration shutdownTimeout) {
    return new Runner(TEST_CASE, store, new HandoffRegistry(), observers, Duration.ofMinutes(1), shutdownTimeout);
  }

  static final class FakeObserver implements Observer {

    private final String name;
    private final ObserverOutcome outcome;
    private final boolean waitForStop;
    private final boolean honourStop;
    private final CountDownLatch stopRequested = new CountDownLatch(1);
    final AtomicInteger stops = new AtomicInteger();
    final AtomicInteger resets = new AtomicInteger();

    private FakeObserver(String name, ObserverOutcome outcome, boolean waitForStop, boolean honourStop) {
      this.name = name;
      this.outcome = outcome;
      this.waitForStop = waitForStop;
      this.honourStop = honourStop;
    }

    static FakeObserver untilStopped(String name, ObserverOutcome outcome) {
      return new FakeObserver(name, outcome, true, true);
    }

    static FakeObserver immediately(String name, ObserverOutcome outcome) {
      return new FakeObserver(name, outcome, false, true);
    }

    static FakeObserver ignoringStop(String name) {
      return new FakeObserver(name, ObserverOutcome.FLUSHED, true, false);
    }

    @Override
    public void startWatching(Runner runner) {
      if (waitForStop) {
        try {
          if (!stopRequested.await(5, TimeUnit.SECONDS)) {
            return;
          }
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          return;
        }
      }
      runner.observerFinished(this, outcome);
    }

    @Override
    public void stopWatching() {
      stops.incrementAndGet();
      if (honourStop) {
        stopRequested.countDown();
      }
    }

    @Override
    public String getName() {
      return name;
    }

    @Override
    public void reset() {
      resets.incrementAndGet();
    }
  }
}
