package org.rgen.runtime.api;

/**
 * Thrown when an entity id is unknown to the world or refers to an inactive entity.
 */
public class EntityNotFoundException extends Exception {

    private final String entityId;

    /**
     * Creates a new EntityNotFoundException for the given id.
     *
     * @param entityId the id that could not be resolved.
     * @param message description of the lookup that failed.
     */
    public EntityNotFoundException(String entityId, String message) {
        super(message);
        this.entityId = entityId;
    }

    /**
     * @return the id that could not be resolved.
     */
    public String getEntityId() {
        return entityId;
    }
}
