package io.certcsi.observer.observer;

/**
 * How an observation session ended.
 */
public enum ObserverOutcome {
  /** Shutdown requested and buffered events persisted. */
  FLUSHED,
  /** Shutdown requested but persisting the buffer failed; the session's events are lost. */
  FLUSH_FAILED,
  /** The watch ended before shutdown was requested; buffered events were not persisted. */
  EXPIRED,
  /** The watch could not be opened; no event was observed. */
  WATCH_FAILED,
  /** The session stopped on an unexpected error. */
  FAILED;

  public boolean endedEarly() {
    return this != FLUSHED;
  }
}
