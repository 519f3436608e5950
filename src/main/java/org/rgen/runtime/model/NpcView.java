package org.rgen.runtime.model;

import java.util.List;

/**
 * Immutable snapshot of an {@link Npc}.
 */
public record NpcView(
    String id,
    String name,
    boolean active,
    long createdAtMinute,
    String race,
    String title,
    List<String> professions,
    double energy,
    double hunger,
    double mood,
    NpcState state,
    String locationId,
    String workLocationId,
    List<String> travelPath,
    List<MemoryEntry> memory,
    double moodBaseline,
    int memoryCapacity
) implements EntityView {

    public NpcView {
        professions = List.copyOf(professions);
        travelPath = List.copyOf(travelPath);
        memory = List.copyOf(memory);
    }

    @Override
    public EntityKind kind() {
        return EntityKind.NPC;
    }
}
