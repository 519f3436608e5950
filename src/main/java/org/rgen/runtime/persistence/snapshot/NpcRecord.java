package org.rgen.runtime.persistence.snapshot;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

@JsonPropertyOrder({"id", "name", "active", "created_at_minute", "race", "title", "professions", "energy", "hunger",
    "mood", "mood_baseline", "state", "location_id", "work_location_id", "travel_path", "memory_capacity", "memory"})
public record NpcRecord(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("active") boolean active,
    @JsonProperty("created_at_minute") long createdAtMinute,
    @JsonProperty("race") String race,
    @JsonProperty("title") String title,
    @JsonProperty("professions") List<String> professions,
    @JsonProperty("energy") double energy,
    @JsonProperty("hunger") double hunger,
    @JsonProperty("mood") double mood,
    @JsonProperty("mood_baseline") double moodBaseline,
    @JsonProperty("state") String state,
    @JsonProperty("location_id") String locationId,
    @JsonProperty("work_location_id") String workLocationId,
    @JsonProperty("travel_path") List<String> travelPath,
    @JsonProperty("memory_capacity") int memoryCapacity,
    @JsonProperty("memory") List<MemoryRecord> memory
) implements EntityRecord {

    @JsonPropertyOrder({"minute", "kind", "impact", "detail"})
    public record MemoryRecord(
        @JsonProperty("minute") long minute,
        @JsonProperty("kind") String kind,
        @JsonProperty("impact") double impact,
        @JsonProperty("detail") String detail
    ) {
    }
}
