package io.certcsi.observer.watch;

import java.time.Duration;

/**
 * Opens bounded watch sessions over one resource kind.
 * <p>
 * A session delivers {@code (change type, resource snapshot)} pairs to its listener, at most once
 * per change and in the order the API server produced them, and always ends within the requested
 * timeout even when nothing changes.
 */
public interface WatchSource {

  /**
   * @throws WatchException when the watch cannot be established
   */
  WatchHandle open(Duration timeout, WatchListener listener);

  /**
   * Human-readable description used in log messages, e.g. {@code persistentvolumeclaims/default}.
   */
  String describe();
}
