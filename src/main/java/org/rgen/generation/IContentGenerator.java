package org.rgen.generation;

/**
 * Produces descriptive content for new worlds and spawns. Implementations must be deterministic:
 * the same request always yields the same records.
 */
public interface IContentGenerator {

    GeneratedWorld generateWorld(GenerationRequest request);

    DescriptiveRecord generateNpc(NpcRequest request);
}
