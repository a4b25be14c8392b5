package io.certcsi.observer.observer;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodCondition;
import io.fabric8.kubernetes.api.model.storage.VolumeAttachment;

/**
 * Predicates over resource snapshots shared by the lifecycles and the entity-count sampler.
 */
public final class ResourceStates {

  static final String CLAIM_BOUND = "Bound";

  private ResourceStates() {}

  public static boolean isDeleting(HasMetadata resource) {
    return resource.getMetadata() != null && resource.getMetadata().getDeletionTimestamp() != null;
  }

  public static boolean isBound(PersistentVolumeClaim claim) {
    return claim.getStatus() != null && CLAIM_BOUND.equals(claim.getStatus().getPhase());
  }

  public static boolean isReady(Pod pod) {
    if (pod.getStatus() == null || pod.getStatus().getConditions() == null) {
      return false;
    }
    for (PodCondition condition : pod.getStatus().getConditions()) {
      if ("Ready".equals(condition.getType()) && "True".equals(condition.getStatus())) {
        return true;
      }
    }
    return false;
  }

  public static boolean isAttached(VolumeAttachment attachment) {
    return attachment.getStatus() != null && Boolean.TRUE.equals(attachment.getStatus().getAttached());
  }

  static String volumeName(PersistentVolumeClaim claim) {
    return claim.getSpec() != null ? claim.getSpec().getVolumeName() : null;
  }

  static String persistentVolumeName(VolumeAttachment attachment) {
    if (attachment.getSpec() == null || attachment.getSpec().getSource() == null) {
      return null;
    }
    return attachment.getSpec().getSource().getPersistentVolumeName();
  }
}
