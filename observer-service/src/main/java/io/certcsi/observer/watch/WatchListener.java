package io.certcsi.observer.watch;

import io.fabric8.kubernetes.client.Watcher;

/**
 * Receives the notifications of one watch session. Callbacks arrive on the watch transport's
 * threads and must not block.
 */
public interface WatchListener {

  /**
   * @param resource the snapshot carried by the notification; may be {@code null} or of an
   *                 unexpected type for malformed notifications
   */
  void onNotification(Watcher.Action action, Object resource);

  /**
   * Called once when the session ends on its own: timeout elapsed, server closed the stream or
   * the transport failed ({@code cause} non-null). Not called after {@link WatchHandle#close()}.
   */
  void onClosed(Throwable cause);
}
