package org.rgen.runtime.persistence.snapshot;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * On-disk shape of a saved world, shared by both encodings.
 */
@JsonPropertyOrder({"version", "name", "seed", "clock", "tick_count", "next_npc_number", "next_event_sequence",
    "total_events_published", "rng_state", "entities", "event_tail"})
public record WorldSnapshot(
    @JsonProperty("version") int version,
    @JsonProperty("name") String name,
    @JsonProperty("seed") long seed,
    @JsonProperty("clock") ClockRecord clock,
    @JsonProperty("tick_count") long tickCount,
    @JsonProperty("next_npc_number") long nextNpcNumber,
    @JsonProperty("next_event_sequence") long nextEventSequence,
    @JsonProperty("total_events_published") long totalEventsPublished,
    @JsonProperty("rng_state") byte[] rngState,
    @JsonProperty("entities") List<EntityRecord> entities,
    @JsonProperty("event_tail") List<EventRecord> eventTail
) {

    /** Format version written by this build. */
    public static final int CURRENT_VERSION = 1;
}
