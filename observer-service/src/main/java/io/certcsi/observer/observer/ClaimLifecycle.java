package io.certcsi.observer.observer;

import io.certcsi.observation.model.Entity;
import io.certcsi.observation.model.EntityType;
import io.certcsi.observation.model.EventType;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * PersistentVolumeClaim transitions. A bound claim is published to the hand-off registry under its
 * volume name so attachments of that volume can be attributed to it.
 */
public final class ClaimLifecycle implements ResourceLifecycle<PersistentVolumeClaim> {

  public static final String OBSERVER_NAME = "PersistentVolumeClaimObserver";

  private static final Logger log = LoggerFactory.getLogger(ClaimLifecycle.class);

  @Override
  public String observerName() {
    return OBSERVER_NAME;
  }

  @Override
  public Class<PersistentVolumeClaim> resourceType() {
    return PersistentVolumeClaim.class;
  }

  @Override
  public void onAdded(PersistentVolumeClaim claim, ObservationSession session) {
    created(claim, session);
  }

  @Override
  public void onModified(PersistentVolumeClaim claim, ObservationSession session) {
    String name = claim.getMetadata().getName();
    Entity entity = created(claim, session);
    if (ResourceStates.isBound(claim)) {
      String volumeName = ResourceStates.volumeName(claim);
      if (volumeName != null) {
        session.handoffRegistry().publish(volumeName, entity);
      } else {
        log.warn("{} claim {} is bound without a volume name", session.observerName(), name);
      }
      session.recordOnce(name, entity, EventType.PVC_BOUND);
    }
    if (ResourceStates.isDeleting(claim)) {
      session.recordOnce(name, entity, EventType.PVC_DELETING_STARTED);
    }
  }

  @Override
  public void onDeleted(PersistentVolumeClaim claim, ObservationSession session) {
    Entity entity = session.track(claim, EntityType.PVC);
    session.recordOnce(claim.getMetadata().getName(), entity, EventType.PVC_DELETING_ENDED);
  }

  private Entity created(PersistentVolumeClaim claim, ObservationSession session) {
    Entity entity = session.track(claim, EntityType.PVC);
    session.recordOnce(entity.name(), entity, EventType.PVC_ADDED);
    return entity;
  }
}
