package io.certcsi.observer.observer;

import io.fabric8.kubernetes.client.Watcher;

/**
 * Everything an observer session can wake up for. Watch callbacks and shutdown requests share a
 * single queue, so the session blocks in exactly one place.
 */
sealed interface ObserverSignal
    permits ObserverSignal.Shutdown, ObserverSignal.Notification, ObserverSignal.WatchClosed {

  Shutdown SHUTDOWN = new Shutdown();

  record Shutdown() implements ObserverSignal {}

  record Notification(Watcher.Action action, Object resource) implements ObserverSignal {}

  record WatchClosed(Throwable cause) implements ObserverSignal {}
}
