package io.certcsi.observer.observer;

import io.certcsi.observer.runner.Runner;

/**
 * Concurrent task that watches one resource kind for the duration of a test case and derives
 * lifecycle events from what it sees.
 */
public interface Observer {

  /**
   * Runs the observation session on the calling thread until {@link #stopWatching()} is called,
   * the thread is interrupted or the watch expires. Persists the buffered events before
   * returning when asked to stop. Never throws: whatever the exit path, exactly one completion is
   * reported through {@link Runner#observerFinished(Observer, ObserverOutcome)}.
   */
  void startWatching(Runner runner);

  /**
   * Requests a graceful shutdown. The running session notices it at its next wake-up. Call at most
   * once per session.
   */
  void stopWatching();

  /**
   * Stable name used in logs and metrics, fixed per kind.
   */
  String getName();

  /**
   * Re-initializes the shutdown signal. Must be called before every {@link #startWatching(Runner)}
   * when an instance is reused.
   */
  void reset();
}
