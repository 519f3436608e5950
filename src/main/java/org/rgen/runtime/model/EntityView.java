package org.rgen.runtime.model;

/**
 * Immutable read view of an entity, safe to hand to callers outside the world.
 */
public interface EntityView {

    String id();

    EntityKind kind();

    String name();

    boolean active();

    long createdAtMinute();
}
