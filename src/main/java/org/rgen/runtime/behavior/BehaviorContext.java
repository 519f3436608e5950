package org.rgen.runtime.behavior;

import org.rgen.runtime.api.CorruptDataException;
import org.rgen.runtime.events.EventKind;
import org.rgen.runtime.model.Location;
import org.rgen.runtime.model.Npc;
import org.rgen.runtime.spi.IRandomProvider;
import org.rgen.runtime.time.CalendarBoundary;
import org.rgen.runtime.time.ClockSnapshot;

import java.util.List;
import java.util.Map;

/**
 * What the {@link BehaviorEngine} may see and do during one tick. Implemented by the world, which
 * stays the only mutator of rosters and the only publisher of events.
 */
public interface BehaviorContext {

    /**
     * @return the clock after this tick's advance.
     */
    ClockSnapshot now();

    /**
     * @return length of this tick in minutes.
     */
    long deltaMinutes();

    /**
     * @return how many boundaries of the unit this tick crossed.
     */
    long crossed(CalendarBoundary boundary);

    IRandomProvider random();

    /**
     * Resolves a location id to a live location.
     *
     * @throws CorruptDataException if the id is null, unknown, inactive or not a location.
     */
    Location resolveLocation(String locationId) throws CorruptDataException;

    /**
     * @return ids of the other active NPCs at the NPC's location, in roster order.
     */
    List<String> companionsOf(Npc npc);

    /**
     * Moves an NPC between two locations, updating both rosters and its location id.
     */
    void move(Npc npc, Location from, Location to);

    void emit(EventKind kind, String sourceId, String locationId, Map<String, ?> payload);
}
