package io.certcsi.observer.watch;

/**
 * Handle on an open watch session.
 */
public interface WatchHandle extends AutoCloseable {

  /**
   * Stops the session. Idempotent; never throws.
   */
  @Override
  void close();
}
