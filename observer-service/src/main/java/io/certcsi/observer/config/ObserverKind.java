package io.certcsi.observer.config;

/**
 * Observers a runner can be built with.
 */
public enum ObserverKind {
    PERSISTENT_VOLUME_CLAIM,
    POD,
    VOLUME_ATTACHMENT,
    ENTITY_COUNT
}
