package org.rgen.generation;

import java.util.List;

/**
 * Output of {@link IContentGenerator#generateWorld(GenerationRequest)}. NPC records name their
 * starting location under {@code "location"}.
 */
public record GeneratedWorld(String worldName, long seed, List<DescriptiveRecord> locations,
                             List<DescriptiveRecord> npcs) {

    public GeneratedWorld {
        locations = List.copyOf(locations);
        npcs = List.copyOf(npcs);
    }
}
