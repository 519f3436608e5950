package org.rgen.generation;

/**
 * Parameters of a full world generation.
 *
 * @param seed          master seed; identical requests yield identical worlds.
 * @param locationCount number of locations, at least 1.
 * @param npcCount      number of NPCs, at least 0.
 * @param worldName     display name of the world.
 */
public record GenerationRequest(long seed, int locationCount, int npcCount, String worldName) {

    public GenerationRequest {
        if (locationCount < 1) {
            throw new IllegalArgumentException("locationCount must be >= 1: " + locationCount);
        }
        if (npcCount < 0) {
            throw new IllegalArgumentException("npcCount must be >= 0: " + npcCount);
        }
        if (worldName == null || worldName.isBlank()) {
            throw new IllegalArgumentException("worldName must not be blank");
        }
    }
}
