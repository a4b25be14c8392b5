package io.certcsi.observer.runner;

import io.certcsi.observation.model.TestCase;
import io.certcsi.observer.handoff.HandoffRegistry;
import io.certcsi.observer.observer.Observer;
import io.certcsi.observer.observer.ObserverOutcome;
import io.certcsi.store.EventStore;
import java.time.Duration;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a fixed set of observers concurrently for one test case.
 * <p>
 * Every observer gets its own daemon thread. {@link #stop()} asks each of them to stop exactly
 * once and then waits on a completion barrier that every observer passes exactly once, whether it
 * flushed, failed or saw its watch end early. A runner is started at most once.
 */
public final class Runner {

  private static final Logger log = LoggerFactory.getLogger(Runner.class);

  private final TestCase testCase;
  private final EventStore eventStore;
  private final HandoffRegistry handoffRegistry;
  private final List<Observer> observers;
  private final Duration watchTimeout;
  private final Duration shutdownTimeout;
  private final CountDownLatch finished;
  private final Map<Observer, ObserverOutcome> outcomes = new ConcurrentHashMap<>();
  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean stopped = new AtomicBoolean();
  private final ExecutorService executor;

  public Runner(TestCase testCase,
                EventStore eventStore,
                HandoffRegistry handoffRegistry,
                List<? extends Observer> observers,
                Duration watchTimeout,
                Duration shutdownTimeout) {
    this.testCase = Objects.requireNonNull(testCase, "testCase");
    this.eventStore = Objects.requireNonNull(eventStore, "eventStore");
    this.handoffRegistry = Objects.requireNonNull(handoffRegistry, "handoffRegistry");
    this.observers = List.copyOf(Objects.requireNonNull(observers, "observers"));
    this.watchTimeout = requirePositive(watchTimeout, "watchTimeout");
    this.shutdownTimeout = requirePositive(shutdownTimeout, "shutdownTimeout");
    Set<String> names = new HashSet<>();
    for (Observer observer : this.observers) {
      if (!names.add(observer.getName())) {
        throw new IllegalArgumentException("Duplicate observer name " + observer.getName());
      }
    }
    this.finished = new CountDownLatch(this.observers.size());
    AtomicInteger sequence = new AtomicInteger();
    this.executor = Executors.newFixedThreadPool(Math.max(1, this.observers.size()), new ThreadFactory() {
      @Override
      public Thread newThread(Runnable r) {
        Thread thread = new Thread(r, "observer-" + testCase.id() + "-" + sequence.incrementAndGet());
        thread.setDaemon(true);
        return thread;
      }
    });
  }

  public TestCase testCase() {
    return testCase;
  }

  public EventStore eventStore() {
    return eventStore;
  }

  public HandoffRegistry handoffRegistry() {
    return handoffRegistry;
  }

  public Duration watchTimeout() {
    return watchTimeout;
  }

  public List<Observer> observers() {
    return observers;
  }

  /**
   * Starts every observer on its own thread and returns immediately.
   *
   * @throws IllegalStateException when the runner was already started
   */
  public void start() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Runner for test case " + testCase.id() + " already started");
    }
    log.info("starting {} observers for test case {}", observers.size(), testCase.id());
    for (Observer observer : observers) {
      observer.reset();
    }
    for (Observer observer : observers) {
      executor.execute(() -> observer.startWatching(this));
    }
  }

  /**
   * Asks every observer to stop and waits, bounded by the shutdown timeout, until all of them
   * reported completion.
   *
   * @return {@code true} when every observer finished within the timeout
   */
  public boolean stop() {
    if (!started.get()) {
      throw new IllegalStateException("Runner for test case " + testCase.id() + " was not started");
    }
    if (stopped.compareAndSet(false, true)) {
      for (Observer observer : observers) {
        observer.stopWatching();
      }
    }
    boolean completed = awaitCompletion(shutdownTimeout);
    if (!completed) {
      log.error("{} observers of test case {} did not finish within {}",
          finished.getCount(), testCase.id(), shutdownTimeout);
    }
    executor.shutdownNow();
    outcomes().forEach((name, outcome) -> {
      if (outcome.endedEarly()) {
        log.warn("observation ended early: {} finished with {}", name, outcome);
      }
    });
    log.info("observers of test case {} finished: {}", testCase.id(), outcomes());
    return completed;
  }

  /**
   * Waits until every observer reported completion.
   */
  public boolean awaitCompletion(Duration timeout) {
    try {
      return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  /**
   * Completion callback; each observer calls it exactly once per session. Repeated calls are
   * logged and ignored so the barrier can't be released early.
   */
  public void observerFinished(Observer observer, ObserverOutcome outcome) {
    Objects.requireNonNull(observer, "observer");
    Objects.requireNonNull(outcome, "outcome");
    if (!observers.contains(observer)) {
      log.warn("{} is not registered with this runner, ignoring {}", observer.getName(), outcome);
      return;
    }
    if (outcomes.putIfAbsent(observer, outcome) != null) {
      log.warn("{} reported completion twice, ignoring {}", observer.getName(), outcome);
      return;
    }
    log.debug("{} finished with {}", observer.getName(), outcome);
    finished.countDown();
  }

  /**
   * Outcomes reported so far, keyed by observer name in registration order.
   */
  public Map<String, ObserverOutcome> outcomes() {
    Map<String, ObserverOutcome> byName = new LinkedHashMap<>();
    for (Observer observer : observers) {
      ObserverOutcome outcome = outcomes.get(observer);
      if (outcome != null) {
        byName.put(observer.getName(), outcome);
      }
    }
    return Collections.unmodifiableMap(byName);
  }

  /**
   * Names of observers that finished without persisting their session.
   */
  public List<String> endedEarly() {
    return outcomes().entrySet().stream()
        .filter(entry -> entry.getValue().endedEarly())
        .map(Map.Entry::getKey)
        .toList();
  }

  private static Duration requirePositive(Duration value, String name) {
    Objects.requireNonNull(value, name);
    if (value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(name + " must be positive");
    }
    return value;
  }
}
