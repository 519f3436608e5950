package org.rgen.runtime.persistence.snapshot;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

@JsonPropertyOrder({"id", "name", "active", "created_at_minute", "type", "biome", "tags", "connections", "npc_ids",
    "weather", "temperature", "market_open", "has_food", "market"})
public record LocationRecord(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("active") boolean active,
    @JsonProperty("created_at_minute") long createdAtMinute,
    @JsonProperty("type") String type,
    @JsonProperty("biome") String biome,
    @JsonProperty("tags") List<String> tags,
    @JsonProperty("connections") List<String> connections,
    @JsonProperty("npc_ids") List<String> npcIds,
    @JsonProperty("weather") String weather,
    @JsonProperty("temperature") double temperature,
    @JsonProperty("market_open") boolean marketOpen,
    @JsonProperty("has_food") boolean foodAvailable,
    @JsonProperty("market") boolean marketCapable
) implements EntityRecord {
}
