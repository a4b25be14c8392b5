package io.certcsi.observer.observer;

import io.fabric8.kubernetes.api.model.HasMetadata;

/**
 * Transition table of one resource kind: which lifecycle events a change notification produces.
 * Implementations keep no state of their own; everything a session remembers lives in the
 * {@link ObservationSession}.
 */
public sealed interface ResourceLifecycle<T extends HasMetadata>
    permits ClaimLifecycle, PodLifecycle, VolumeAttachmentLifecycle {

  String observerName();

  Class<T> resourceType();

  void onAdded(T resource, ObservationSession session);

  void onModified(T resource, ObservationSession session);

  void onDeleted(T resource, ObservationSession session);
}
