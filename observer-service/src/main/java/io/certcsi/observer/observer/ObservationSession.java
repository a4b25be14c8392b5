package io.certcsi.observer.observer;

import io.certcsi.observation.model.Entity;
import io.certcsi.observation.model.EntityType;
import io.certcsi.observation.model.Event;
import io.certcsi.observation.model.EventType;
import io.certcsi.observer.handoff.HandoffRegistry;
import io.certcsi.store.EventStore;
import io.certcsi.store.EventStoreException;
import io.fabric8.kubernetes.api.model.HasMetadata;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * State of one observation session: the event buffer, the entities seen so far and the guards
 * that keep repeated notifications from recording the same transition twice.
 * <p>
 * Confined to the observer's thread and discarded when the session ends.
 */
public final class ObservationSession {

  private static final Logger log = LoggerFactory.getLogger(ObservationSession.class);

  private final String observerName;
  private final long testCaseId;
  private final EventStore eventStore;
  private final HandoffRegistry handoffRegistry;
  private final Clock clock;
  private final ObserverMetrics metrics;

  private final List<Event> events = new ArrayList<>();
  private final Map<String, Entity> entities = new HashMap<>();
  private final Map<String, EnumSet<EventType>> recorded = new HashMap<>();
  private final Map<String, Instant> firstSeen = new HashMap<>();
  private final Set<String> terminated = new HashSet<>();
  private final Set<String> unsaved = new HashSet<>();
  private Instant lastTimestamp = Instant.MIN;

  ObservationSession(String observerName,
                     long testCaseId,
                     EventStore eventStore,
                     HandoffRegistry handoffRegistry,
                     Clock clock,
                     ObserverMetrics metrics) {
    this.observerName = Objects.requireNonNull(observerName, "observerName");
    this.testCaseId = testCaseId;
    this.eventStore = Objects.requireNonNull(eventStore, "eventStore");
    this.handoffRegistry = Objects.requireNonNull(handoffRegistry, "handoffRegistry");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  public String observerName() {
    return observerName;
  }

  public HandoffRegistry handoffRegistry() {
    return handoffRegistry;
  }

  /**
   * Returns the entity for {@code resource}, registering it in the store the first time it is
   * seen. A failed save is logged and retried on the entity's next notification; until it
   * succeeds the entity's events are held back from the flush.
   */
  public Entity track(HasMetadata resource, EntityType type) {
    String name = resource.getMetadata().getName();
    Entity known = entities.get(name);
    if (known != null) {
      if (unsaved.contains(known.k8sUid())) {
        save(known);
      }
      return known;
    }
    Entity entity = new Entity(resource.getMetadata().getUid(), name, type, testCaseId);
    entities.put(name, entity);
    save(entity);
    return entity;
  }

  /**
   * Records {@code type} for {@code entity} unless the resource {@code key} already recorded it
   * during this session.
   *
   * @return {@code true} when the event was recorded
   */
  public boolean recordOnce(String key, Entity entity, EventType type) {
    if (!markRecorded(key, type)) {
      return false;
    }
    append(entity, type, now());
    return true;
  }

  public boolean recordOnce(String key, Entity entity, EventType type, Instant timestamp) {
    if (!markRecorded(key, type)) {
      return false;
    }
    append(entity, type, timestamp);
    return true;
  }

  /**
   * Remembers when a resource was first seen in this session and returns that instant.
   */
  public Instant firstSeen(String key) {
    return firstSeen.computeIfAbsent(key, k -> now());
  }

  boolean wasSeen(String key) {
    return firstSeen.containsKey(key);
  }

  /**
   * Counts a notification that was dropped without recording anything.
   */
  void ignored(String reason) {
    metrics.notificationIgnored(observerName, reason);
  }

  void terminate(String key) {
    terminated.add(key);
  }

  boolean isTerminated(String key) {
    return terminated.contains(key);
  }

  List<Event> events() {
    return List.copyOf(events);
  }

  /**
   * Events whose entity row exists in the store. Entities that could not be saved get one last
   * attempt; events of those still missing are dropped so the rest of the batch can persist.
   */
  List<Event> flushableEvents() {
    for (Entity entity : List.copyOf(entities.values())) {
      if (unsaved.contains(entity.k8sUid())) {
        save(entity);
      }
    }
    if (unsaved.isEmpty()) {
      return events();
    }
    List<Event> flushable = new ArrayList<>(events.size());
    int dropped = 0;
    for (Event event : events) {
      if (unsaved.contains(event.entityUid())) {
        dropped++;
      } else {
        flushable.add(event);
      }
    }
    if (dropped > 0) {
      log.warn("{} dropping {} events of {} unsaved entities", observerName, dropped, unsaved.size());
      metrics.notificationIgnored(observerName, "unsaved-entity");
    }
    return flushable;
  }

  /**
   * Wall-clock time, never earlier than a timestamp already handed out by this session.
   */
  Instant now() {
    Instant current = clock.instant();
    if (current.isBefore(lastTimestamp)) {
      return lastTimestamp;
    }
    lastTimestamp = current;
    return current;
  }

  private void save(Entity entity) {
    try {
      eventStore.saveEntities(List.of(entity));
      unsaved.remove(entity.k8sUid());
    } catch (EventStoreException e) {
      unsaved.add(entity.k8sUid());
      log.error("{} can't save entity {}; error={}", observerName, entity.name(), e.getMessage(), e);
    }
  }

  private boolean markRecorded(String key, EventType type) {
    return recorded.computeIfAbsent(key, k -> EnumSet.noneOf(EventType.class)).add(type);
  }

  private void append(Entity entity, EventType type, Instant timestamp) {
    events.add(Event.of(entity, type, timestamp));
    metrics.eventRecorded(observerName, type);
    log.debug("{} recorded {} for {}", observerName, type, entity.name());
  }
}
