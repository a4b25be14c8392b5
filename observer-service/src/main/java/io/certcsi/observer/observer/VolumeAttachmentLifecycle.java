package io.certcsi.observer.observer;

import io.certcsi.observation.model.Entity;
import io.certcsi.observation.model.EventType;
import io.fabric8.kubernetes.api.model.storage.VolumeAttachment;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * VolumeAttachment transitions, recorded against the claim whose volume is being attached.
 * <p>
 * The claim is found through the hand-off registry. When the claim observer has not published it
 * yet the attachment stays pending: nothing is recorded, and the next notification for the same
 * attachment tries again. The attach start is always stamped with the instant the attachment was
 * first seen, so a late resolution does not shift it.
 */
public final class VolumeAttachmentLifecycle implements ResourceLifecycle<VolumeAttachment> {

  public static final String OBSERVER_NAME = "VolumeAttachmentObserver";

  private static final Logger log = LoggerFactory.getLogger(VolumeAttachmentLifecycle.class);

  @Override
  public String observerName() {
    return OBSERVER_NAME;
  }

  @Override
  public Class<VolumeAttachment> resourceType() {
    return VolumeAttachment.class;
  }

  @Override
  public void onAdded(VolumeAttachment attachment, ObservationSession session) {
    started(attachment, session);
  }

  @Override
  public void onModified(VolumeAttachment attachment, ObservationSession session) {
    String name = attachment.getMetadata().getName();
    started(attachment, session).ifPresent(claim -> {
      if (ResourceStates.isAttached(attachment)) {
        session.recordOnce(name, claim, EventType.PVC_ATTACH_ENDED);
      }
      if (ResourceStates.isDeleting(attachment)) {
        session.recordOnce(name, claim, EventType.PVC_UNATTACH_STARTED);
      }
    });
  }

  @Override
  public void onDeleted(VolumeAttachment attachment, ObservationSession session) {
    String name = attachment.getMetadata().getName();
    Optional<Entity> claim = session.wasSeen(name) ? started(attachment, session) : resolve(attachment, session);
    claim.ifPresent(entity -> session.recordOnce(name, entity, EventType.PVC_UNATTACH_ENDED));
  }

  private Optional<Entity> started(VolumeAttachment attachment, ObservationSession session) {
    String name = attachment.getMetadata().getName();
    Instant firstSeen = session.firstSeen(name);
    Optional<Entity> claim = resolve(attachment, session);
    claim.ifPresent(entity -> session.recordOnce(name, entity, EventType.PVC_ATTACH_STARTED, firstSeen));
    return claim;
  }

  private Optional<Entity> resolve(VolumeAttachment attachment, ObservationSession session) {
    String volumeName = ResourceStates.persistentVolumeName(attachment);
    Optional<Entity> claim = session.handoffRegistry().lookup(volumeName);
    if (claim.isEmpty()) {
      log.warn("{} no claim published for volume {} yet, attachment {} stays pending",
          session.observerName(), volumeName, attachment.getMetadata().getName());
      session.ignored("pending-claim");
    }
    return claim;
  }
}
