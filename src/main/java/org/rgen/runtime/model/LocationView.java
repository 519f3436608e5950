package org.rgen.runtime.model;

import java.util.List;

/**
 * Immutable snapshot of a {@link Location}.
 */
public record LocationView(
    String id,
    String name,
    boolean active,
    long createdAtMinute,
    String type,
    String biome,
    List<String> tags,
    List<String> connections,
    List<String> npcIds,
    Weather weather,
    boolean marketOpen,
    boolean foodAvailable,
    boolean marketCapable
) implements EntityView {

    public LocationView {
        tags = List.copyOf(tags);
        connections = List.copyOf(connections);
        npcIds = List.copyOf(npcIds);
    }

    @Override
    public EntityKind kind() {
        return EntityKind.LOCATION;
    }
}
