package org.rgen.generation;

import java.util.List;

/**
 * Parameters of a single NPC generation, used when spawning into a running world.
 *
 * @param seed          world seed.
 * @param locationId    where the NPC will appear.
 * @param locationType  type of that location, lets generators pick fitting names and titles.
 * @param professions   requested professions, possibly empty.
 * @param race          requested race, or null to let the generator choose.
 * @param spawnSequence number that makes this request distinct from earlier spawns.
 */
public record NpcRequest(long seed, String locationId, String locationType, List<String> professions,
                         String race, long spawnSequence) {

    public NpcRequest {
        professions = List.copyOf(professions);
    }
}
