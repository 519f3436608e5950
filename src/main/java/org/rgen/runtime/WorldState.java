package org.rgen.runtime;

import org.rgen.runtime.events.WorldEvent;
import org.rgen.runtime.model.EntityView;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Immutable capture of everything needed to rebuild a {@link World}. Taken synchronously on the
 * tick thread, it can be encoded on any thread afterwards.
 *
 * @param name                 world name.
 * @param seed                 world seed.
 * @param clockMinutes         clock minute counter.
 * @param tickCount            ticks performed so far.
 * @param nextNpcNumber        next number used to mint an NPC id.
 * @param entities             every entity, active and inactive, in registration order.
 * @param eventTail            the most recent events, ascending.
 * @param nextEventSequence    sequence the next event will receive.
 * @param totalEventsPublished events published over the world's life.
 * @param rngState             serialized random provider state.
 */
public record WorldState(
    String name,
    long seed,
    long clockMinutes,
    long tickCount,
    long nextNpcNumber,
    List<EntityView> entities,
    List<WorldEvent> eventTail,
    long nextEventSequence,
    long totalEventsPublished,
    byte[] rngState
) {

    public WorldState {
        entities = List.copyOf(entities);
        eventTail = List.copyOf(eventTail);
        rngState = rngState.clone();
    }

    @Override
    public byte[] rngState() {
        return rngState.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WorldState)) return false;
        WorldState other = (WorldState) o;
        return seed == other.seed && clockMinutes == other.clockMinutes && tickCount == other.tickCount
            && nextNpcNumber == other.nextNpcNumber && nextEventSequence == other.nextEventSequence
            && totalEventsPublished == other.totalEventsPublished && name.equals(other.name)
            && entities.equals(other.entities) && eventTail.equals(other.eventTail)
            && Arrays.equals(rngState, other.rngState);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(name, seed, clockMinutes, tickCount, nextNpcNumber, entities, eventTail,
            nextEventSequence, totalEventsPublished);
        return 31 * result + Arrays.hashCode(rngState);
    }

    @Override
    public String toString() {
        return "WorldState{name=" + name + ", clockMinutes=" + clockMinutes + ", entities=" + entities.size()
            + ", eventTail=" + eventTail.size() + "}";
    }
}
