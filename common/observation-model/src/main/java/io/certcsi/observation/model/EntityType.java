package io.certcsi.observation.model;

/**
 * Kind of cluster resource an {@link Entity} stands for.
 */
public enum EntityType {
    PVC,
    POD,
    UNKNOWN
}
