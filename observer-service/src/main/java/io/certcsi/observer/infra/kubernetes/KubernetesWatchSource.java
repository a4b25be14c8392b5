package io.certcsi.observer.infra.kubernetes;

import io.certcsi.observer.watch.WatchException;
import io.certcsi.observer.watch.WatchHandle;
import io.certcsi.observer.watch.WatchListener;
import io.certcsi.observer.watch.WatchSource;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.ListOptions;
import io.fabric8.kubernetes.api.model.ListOptionsBuilder;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.storage.VolumeAttachment;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.Watch;
import io.fabric8.kubernetes.client.Watcher;
import io.fabric8.kubernetes.client.WatcherException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link WatchSource} over the fabric8 watch API.
 * <p>
 * The requested timeout is passed to the API server as {@code timeoutSeconds}. fabric8 reconnects
 * transparently when the server ends the stream, so the session is also closed client side once
 * the timeout elapses.
 */
public final class KubernetesWatchSource<T extends HasMetadata> implements WatchSource {

  private static final Logger log = LoggerFactory.getLogger(KubernetesWatchSource.class);

  private static final ScheduledExecutorService DEADLINES = Executors.newSingleThreadScheduledExecutor(new ThreadFactory() {
    @Override
    public Thread newThread(Runnable r) {
      Thread thread = new Thread(r, "watch-deadline");
      thread.setDaemon(true);
      return thread;
    }
  });

  /**
   * Starts a fabric8 watch for one resource kind.
   */
  @FunctionalInterface
  public interface WatchOpener<T> {
    Watch open(ListOptions options, Watcher<T> watcher);
  }

  private final String description;
  private final WatchOpener<T> opener;

  public KubernetesWatchSource(String description, WatchOpener<T> opener) {
    this.description = Objects.requireNonNull(description, "description");
    this.opener = Objects.requireNonNull(opener, "opener");
  }

  public static KubernetesWatchSource<PersistentVolumeClaim> persistentVolumeClaims(KubernetesClient client, String namespace) {
    return new KubernetesWatchSource<>("persistentvolumeclaims/" + namespace,
        (options, watcher) -> client.persistentVolumeClaims().inNamespace(namespace).watch(options, watcher));
  }

  public static KubernetesWatchSource<Pod> pods(KubernetesClient client, String namespace) {
    return new KubernetesWatchSource<>("pods/" + namespace,
        (options, watcher) -> client.pods().inNamespace(namespace).watch(options, watcher));
  }

  public static KubernetesWatchSource<VolumeAttachment> volumeAttachments(KubernetesClient client) {
    return new KubernetesWatchSource<>("volumeattachments",
        (options, watcher) -> client.storage().v1().volumeAttachments().watch(options, watcher));
  }

  @Override
  public String describe() {
    return description;
  }

  @Override
  public WatchHandle open(Duration timeout, WatchListener listener) {
    Objects.requireNonNull(timeout, "timeout");
    Objects.requireNonNull(listener, "listener");
    AtomicBoolean done = new AtomicBoolean();
    ListOptions options = new ListOptionsBuilder()
        .withTimeoutSeconds(Math.max(1L, timeout.toSeconds()))
        .build();
    Watcher<T> watcher = new Watcher<>() {
      @Override
      public void eventReceived(Action action, T resource) {
        if (!done.get()) {
          listener.onNotification(action, resource);
        }
      }

      @Override
      public void onClose() {
        if (done.compareAndSet(false, true)) {
          listener.onClosed(null);
        }
      }

      @Override
      public void onClose(WatcherException cause) {
        if (done.compareAndSet(false, true)) {
          listener.onClosed(cause);
        }
      }
    };

    Watch watch;
    try {
      watch = opener.open(options, watcher);
    } catch (KubernetesClientException e) {
      throw new WatchException("Can't watch " + description + ": " + e.getMessage(), e);
    }
    log.debug("watch on {} opened, bounded to {}", description, timeout);

    ScheduledFuture<?> deadline = DEADLINES.schedule(() -> {
      if (done.compareAndSet(false, true)) {
        log.info("watch on {} reached its {} bound", description, timeout);
        closeQuietly(watch);
        listener.onClosed(null);
      }
    }, timeout.toMillis(), TimeUnit.MILLISECONDS);

    return () -> {
      deadline.cancel(false);
      if (done.compareAndSet(false, true)) {
        closeQuietly(watch);
      }
    };
  }

  private void closeQuietly(Watch watch) {
    try {
      watch.close();
    } catch (RuntimeException e) {
      log.warn("closing watch on {} failed; error={}", description, e.getMessage());
    }
  }
}
