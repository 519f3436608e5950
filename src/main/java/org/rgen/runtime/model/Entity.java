package org.rgen.runtime.model;

import java.util.Objects;

/**
 * Base of every entity owned by a world. Entities are never erased: removal only clears the
 * active flag, so ids stay unique for the lifetime of the world.
 */
public abstract class Entity {

    private final String id;
    private final EntityKind kind;
    private final String name;
    private final long createdAtMinute;
    private boolean active = true;

    protected Entity(String id, EntityKind kind, String name, long createdAtMinute) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Entity id must not be blank");
        }
        this.id = id;
        this.kind = Objects.requireNonNull(kind, "kind");
        this.name = name == null || name.isBlank() ? id : name;
        this.createdAtMinute = createdAtMinute;
    }

    public String getId() {
        return id;
    }

    public EntityKind getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    public long getCreatedAtMinute() {
        return createdAtMinute;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    /**
     * @return an immutable copy of the current state.
     */
    public abstract EntityView toView();

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{id=" + id + ", name=" + name + ", active=" + active + "}";
    }
}
