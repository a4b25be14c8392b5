package io.certcsi.observer.collector;

import io.certcsi.observation.model.EntityType;
import io.certcsi.observation.model.EventType;

/**
 * Paired transitions whose gap is measured per entity.
 */
public enum Stage {
  PVC_CREATION(EventType.PVC_ADDED, EventType.PVC_BOUND),
  PVC_ATTACHMENT(EventType.PVC_ATTACH_STARTED, EventType.PVC_ATTACH_ENDED),
  PVC_UNATTACHMENT(EventType.PVC_UNATTACH_STARTED, EventType.PVC_UNATTACH_ENDED),
  PVC_DELETION(EventType.PVC_DELETING_STARTED, EventType.PVC_DELETING_ENDED),
  POD_CREATION(EventType.POD_ADDED, EventType.POD_READY),
  POD_DELETION(EventType.POD_TERMINATING, EventType.POD_DELETED);

  private final EventType start;
  private final EventType end;

  Stage(EventType start, EventType end) {
    this.start = start;
    this.end = end;
  }

  public EventType start() {
    return start;
  }

  public EventType end() {
    return end;
  }

  public EntityType entityType() {
    return start.entityType();
  }
}
