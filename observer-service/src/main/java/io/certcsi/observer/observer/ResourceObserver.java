package io.certcsi.observer.observer;

import io.certcsi.observation.model.Event;
import io.certcsi.observer.runner.Runner;
import io.certcsi.observer.watch.WatchException;
import io.certcsi.observer.watch.WatchHandle;
import io.certcsi.observer.watch.WatchListener;
import io.certcsi.observer.watch.WatchSource;
import io.certcsi.store.EventStoreException;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.storage.VolumeAttachment;
import io.fabric8.kubernetes.client.Watcher;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Watches one resource kind for the duration of a test case and records the transitions its
 * {@link ResourceLifecycle} derives from each notification.
 * <p>
 * Events are buffered for the whole session and written as a single batch when the runner asks
 * the observer to stop. A watch that ends on its own (timeout, server close, transport failure)
 * ends the session without writing anything.
 */
public final class ResourceObserver<T extends HasMetadata> extends AbstractObserver {

  private static final Logger log = LoggerFactory.getLogger(ResourceObserver.class);

  private final ResourceLifecycle<T> lifecycle;
  private final WatchSource source;
  private final Clock clock;

  public ResourceObserver(ResourceLifecycle<T> lifecycle, WatchSource source, Clock clock, ObserverMetrics metrics) {
    super(Objects.requireNonNull(lifecycle, "lifecycle").observerName(), metrics);
    this.lifecycle = lifecycle;
    this.source = Objects.requireNonNull(source, "source");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public static ResourceObserver<PersistentVolumeClaim> claims(WatchSource source, Clock clock, ObserverMetrics metrics) {
    return new ResourceObserver<>(new ClaimLifecycle(), source, clock, metrics);
  }

  public static ResourceObserver<Pod> pods(WatchSource source, Clock clock, ObserverMetrics metrics) {
    return new ResourceObserver<>(new PodLifecycle(), source, clock, metrics);
  }

  public static ResourceObserver<VolumeAttachment> volumeAttachments(WatchSource source, Clock clock, ObserverMetrics metrics) {
    return new ResourceObserver<>(new VolumeAttachmentLifecycle(), source, clock, metrics);
  }

  @Override
  protected ObserverOutcome observe(Runner runner, BlockingQueue<ObserverSignal> signals) {
    ObservationSession session = new ObservationSession(getName(), runner.testCase().id(),
        runner.eventStore(), runner.handoffRegistry(), clock, metrics());
    WatchHandle handle;
    try {
      handle = source.open(runner.watchTimeout(), new QueueingListener(signals));
    } catch (WatchException e) {
      log.error("{} can't watch {}; error={}", getName(), source.describe(), e.getMessage(), e);
      return ObserverOutcome.WATCH_FAILED;
    }
    log.info("{} watching {} for test case {}", getName(), source.describe(), runner.testCase().id());
    try (handle) {
      while (true) {
        ObserverSignal signal;
        try {
          signal = signals.take();
        } catch (InterruptedException e) {
          log.warn("{} interrupted, flushing as if stopped", getName());
          ObserverOutcome outcome = flush(runner, session);
          Thread.currentThread().interrupt();
          return outcome;
        }
        if (signal instanceof ObserverSignal.Shutdown) {
          return flush(runner, session);
        }
        if (signal instanceof ObserverSignal.WatchClosed closed) {
          log.warn("{} watch on {} ended before shutdown, {} buffered events dropped",
              getName(), source.describe(), session.events().size(), closed.cause());
          return ObserverOutcome.EXPIRED;
        }
        dispatch((ObserverSignal.Notification) signal, session);
      }
    }
  }

  private void dispatch(ObserverSignal.Notification notification, ObservationSession session) {
    Watcher.Action action = notification.action();
    Object payload = notification.resource();
    if (action != Watcher.Action.ADDED && action != Watcher.Action.MODIFIED && action != Watcher.Action.DELETED) {
      log.error("{} unsupported change type {}", getName(), action);
      session.ignored("unsupported-action");
      return;
    }
    if (payload == null) {
      log.warn("{} {} notification without a resource", getName(), action);
      session.ignored("null-payload");
      return;
    }
    if (!lifecycle.resourceType().isInstance(payload)) {
      log.warn("{} unexpected resource {} in {} notification", getName(), payload.getClass().getName(), action);
      session.ignored("unexpected-type");
      return;
    }
    T resource = lifecycle.resourceType().cast(payload);
    if (resource.getMetadata() == null || resource.getMetadata().getName() == null
        || resource.getMetadata().getUid() == null) {
      log.warn("{} {} notification without name or uid", getName(), action);
      session.ignored("missing-metadata");
      return;
    }
    String name = resource.getMetadata().getName();
    if (session.isTerminated(name)) {
      log.debug("{} {} for deleted {} ignored", getName(), action, name);
      session.ignored("terminated");
      return;
    }
    log.debug("{} {} {}", getName(), action, name);
    try {
      switch (action) {
        case ADDED -> lifecycle.onAdded(resource, session);
        case MODIFIED -> lifecycle.onModified(resource, session);
        default -> {
          lifecycle.onDeleted(resource, session);
          session.terminate(name);
        }
      }
    } catch (RuntimeException e) {
      log.error("{} failed to handle {} of {}", getName(), action, name, e);
      session.ignored("handler-error");
    }
  }

  private ObserverOutcome flush(Runner runner, ObservationSession session) {
    List<Event> events = session.flushableEvents();
    try {
      runner.eventStore().saveEvents(events);
    } catch (EventStoreException e) {
      log.error("{} can't save {} events; error={}", getName(), events.size(), e.getMessage(), e);
      metrics().flushFailed(getName());
      return ObserverOutcome.FLUSH_FAILED;
    }
    log.info("{} saved {} events for test case {}", getName(), events.size(), runner.testCase().id());
    return ObserverOutcome.FLUSHED;
  }

  private static final class QueueingListener implements WatchListener {

    private final BlockingQueue<ObserverSignal> signals;

    QueueingListener(BlockingQueue<ObserverSignal> signals) {
      this.signals = signals;
    }

    @Override
    public void onNotification(Watcher.Action action, Object resource) {
      signals.offer(new ObserverSignal.Notification(action, resource));
    }

    @Override
    public void onClosed(Throwable cause) {
      signals.offer(new ObserverSignal.WatchClosed(cause));
    }
  }
}
