package io.certcsi.observation.model;

/**
 * Lifecycle transitions recorded for observed entities.
 * <p>
 * Attachment transitions are recorded by the volume-attachment observer but belong to the claim
 * entity the attachment was resolved to, hence their {@link EntityType#PVC} owner.
 */
public enum EventType {
    PVC_ADDED(EntityType.PVC),
    PVC_BOUND(EntityType.PVC),
    PVC_ATTACH_STARTED(EntityType.PVC),
    PVC_ATTACH_ENDED(EntityType.PVC),
    PVC_UNATTACH_STARTED(EntityType.PVC),
    PVC_UNATTACH_ENDED(EntityType.PVC),
    PVC_DELETING_STARTED(EntityType.PVC),
    PVC_DELETING_ENDED(EntityType.PVC),
    POD_ADDED(EntityType.POD),
    POD_READY(EntityType.POD),
    POD_TERMINATING(EntityType.POD),
    POD_DELETED(EntityType.POD);

    private final EntityType entityType;

    EventType(EntityType entityType) {
        this.entityType = entityType;
    }

    public EntityType entityType() {
        return entityType;
    }
}
