package org.rgen.runtime.persistence.snapshot;

import org.rgen.runtime.WorldState;
import org.rgen.runtime.api.CorruptDataException;
import org.rgen.runtime.events.EventKind;
import org.rgen.runtime.events.WorldEvent;
import org.rgen.runtime.model.EntityView;
import org.rgen.runtime.model.LocationView;
import org.rgen.runtime.model.MemoryEntry;
import org.rgen.runtime.model.NpcState;
import org.rgen.runtime.model.NpcView;
import org.rgen.runtime.model.Weather;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts between the in-memory {@link WorldState} and the on-disk {@link WorldSnapshot}.
 */
public final class SnapshotMapper {

    private SnapshotMapper() {
    }

    public static WorldSnapshot toSnapshot(WorldState state) {
        List<EntityRecord> entities = new ArrayList<>(state.entities().size());
        for (EntityView view : state.entities()) {
            entities.add(toRecord(view));
        }
        List<EventRecord> events = new ArrayList<>(state.eventTail().size());
        for (WorldEvent event : state.eventTail()) {
            events.add(new EventRecord(event.sequence(), event.kind().name(), event.simMinute(), event.sourceId(),
                event.locationId(), event.payload()));
        }
        return new WorldSnapshot(WorldSnapshot.CURRENT_VERSION, state.name(), state.seed(),
            ClockRecord.of(state.clockMinutes()), state.tickCount(), state.nextNpcNumber(), state.nextEventSequence(),
            state.totalEventsPublished(), state.rngState(), entities, events);
    }

    private static EntityRecord toRecord(EntityView view) {
        if (view instanceof NpcView) {
            NpcView npc = (NpcView) view;
            List<NpcRecord.MemoryRecord> memory = new ArrayList<>(npc.memory().size());
            for (MemoryEntry entry : npc.memory()) {
                memory.add(new NpcRecord.MemoryRecord(entry.minute(), entry.kind(), entry.impact(), entry.detail()));
            }
            return new NpcRecord(npc.id(), npc.name(), npc.active(), npc.createdAtMinute(), npc.race(), npc.title(),
                npc.professions(), npc.energy(), npc.hunger(), npc.mood(), npc.moodBaseline(), npc.state().name(),
                npc.locationId(), npc.workLocationId(), npc.travelPath(), npc.memoryCapacity(), memory);
        }
        LocationView location = (LocationView) view;
        return new LocationRecord(location.id(), location.name(), location.active(), location.createdAtMinute(),
            location.type(), location.biome(), location.tags(), location.connections(), location.npcIds(),
            location.weather().condition(), location.weather().temperature(), location.marketOpen(),
            location.foodAvailable(), location.marketCapable());
    }

    /**
     * @throws CorruptDataException if a field is missing, out of range or inconsistent.
     */
    public static WorldState fromSnapshot(WorldSnapshot snapshot) throws CorruptDataException {
        try {
            ClockRecord clock = require(snapshot.clock(), "clock");
            if (!ClockRecord.of(clock.totalMinutes()).equals(clock)) {
                throw new CorruptDataException("Clock fields do not match total_minutes " + clock.totalMinutes());
            }
            List<EntityView> entities = new ArrayList<>();
            for (EntityRecord record : require(snapshot.entities(), "entities")) {
                entities.add(toView(require(record, "entity")));
            }
            List<WorldEvent> events = new ArrayList<>();
            for (EventRecord record : require(snapshot.eventTail(), "event_tail")) {
                events.add(new WorldEvent(record.sequence(), EventKind.valueOf(require(record.kind(), "event kind")),
                    record.simMinute(), record.sourceId(), record.locationId(), record.payload()));
            }
            return new WorldState(require(snapshot.name(), "name"), snapshot.seed(), clock.totalMinutes(),
                snapshot.tickCount(), snapshot.nextNpcNumber(), entities, events, snapshot.nextEventSequence(),
                snapshot.totalEventsPublished(), require(snapshot.rngState(), "rng_state"));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new CorruptDataException("Snapshot content is invalid: " + e.getMessage(), e);
        }
    }

    private static EntityView toView(EntityRecord record) {
        if (record instanceof NpcRecord) {
            NpcRecord npc = (NpcRecord) record;
            List<MemoryEntry> memory = new ArrayList<>();
            for (NpcRecord.MemoryRecord entry : require(npc.memory(), "memory")) {
                memory.add(new MemoryEntry(entry.minute(), entry.kind(), entry.impact(), entry.detail()));
            }
            return new NpcView(require(npc.id(), "id"), npc.name(), npc.active(), npc.createdAtMinute(), npc.race(),
                npc.title(), require(npc.professions(), "professions"), npc.energy(), npc.hunger(), npc.mood(),
                NpcState.valueOf(require(npc.state(), "state")), npc.locationId(), npc.workLocationId(),
                require(npc.travelPath(), "travel_path"), memory, npc.moodBaseline(), npc.memoryCapacity());
        }
        LocationRecord location = (LocationRecord) record;
        return new LocationView(require(location.id(), "id"), location.name(), location.active(),
            location.createdAtMinute(), location.type(), location.biome(), require(location.tags(), "tags"),
            require(location.connections(), "connections"), require(location.npcIds(), "npc_ids"),
            new Weather(location.weather(), location.temperature()), location.marketOpen(),
            location.foodAvailable(), location.marketCapable());
    }

    private static <T> T require(T value, String field) {
        if (value == null) {
            throw new IllegalArgumentException("missing field '" + field + "'");
        }
        return value;
    }
}
