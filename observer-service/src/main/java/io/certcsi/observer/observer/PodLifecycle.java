package io.certcsi.observer.observer;

import io.certcsi.observation.model.Entity;
import io.certcsi.observation.model.EntityType;
import io.certcsi.observation.model.EventType;
import io.fabric8.kubernetes.api.model.Pod;

public final class PodLifecycle implements ResourceLifecycle<Pod> {

  public static final String OBSERVER_NAME = "PodObserver";

  @Override
  public String observerName() {
    return OBSERVER_NAME;
  }

  @Override
  public Class<Pod> resourceType() {
    return Pod.class;
  }

  @Override
  public void onAdded(Pod pod, ObservationSession session) {
    created(pod, session);
  }

  @Override
  public void onModified(Pod pod, ObservationSession session) {
    Entity entity = created(pod, session);
    if (ResourceStates.isReady(pod)) {
      session.recordOnce(entity.name(), entity, EventType.POD_READY);
    }
    if (ResourceStates.isDeleting(pod)) {
      session.recordOnce(entity.name(), entity, EventType.POD_TERMINATING);
    }
  }

  @Override
  public void onDeleted(Pod pod, ObservationSession session) {
    Entity entity = session.track(pod, EntityType.POD);
    session.recordOnce(entity.name(), entity, EventType.POD_DELETED);
  }

  private Entity created(Pod pod, ObservationSession session) {
    Entity entity = session.track(pod, EntityType.POD);
    session.recordOnce(entity.name(), entity, EventType.POD_ADDED);
    return entity;
  }
}
