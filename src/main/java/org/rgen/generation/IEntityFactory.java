package org.rgen.generation;

import org.rgen.runtime.model.Location;
import org.rgen.runtime.model.Npc;

/**
 * Converts descriptive records into living entities. Conversions are pure: no side effects and
 * identical input yields equal entities.
 */
public interface IEntityFactory {

    /**
     * @throws IllegalArgumentException if the record lacks an id or has malformed fields.
     */
    Location createLocation(DescriptiveRecord record, long createdAtMinute);

    /**
     * @param id id assigned by the world.
     * @throws IllegalArgumentException if the record has malformed fields.
     */
    Npc createNpc(String id, DescriptiveRecord record, long createdAtMinute);
}
