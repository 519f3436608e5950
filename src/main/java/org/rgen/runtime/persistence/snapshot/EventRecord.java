package org.rgen.runtime.persistence.snapshot;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Map;

@JsonPropertyOrder({"sequence", "kind", "sim_minute", "source_id", "location_id", "payload"})
public record EventRecord(
    @JsonProperty("sequence") long sequence,
    @JsonProperty("kind") String kind,
    @JsonProperty("sim_minute") long simMinute,
    @JsonProperty("source_id") String sourceId,
    @JsonProperty("location_id") String locationId,
    @JsonProperty("payload") Map<String, Object> payload
) {
}
