package org.rgen.runtime.model;

/**
 * Discriminator of the entity variants owned by a world.
 */
public enum EntityKind {
    NPC,
    LOCATION
}
