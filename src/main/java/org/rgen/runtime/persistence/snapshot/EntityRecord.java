package org.rgen.runtime.persistence.snapshot;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Saved entity, discriminated by {@code kind}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = NpcRecord.class, name = "NPC"),
    @JsonSubTypes.Type(value = LocationRecord.class, name = "LOCATION")
})
public interface EntityRecord {

    String id();
}
