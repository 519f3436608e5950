package org.rgen.runtime.events;

import java.util.Map;

/**
 * An immutable record of something that happened in the world.
 *
 * @param sequence   strictly increasing number assigned by the bus, starting at 1.
 * @param kind       the event kind.
 * @param simMinute  clock minute at which the event was published.
 * @param sourceId   id of the entity that caused the event, may be null for world-level events.
 * @param locationId id of the location where the event happened, may be null.
 * @param payload    ordered, immutable, JSON-like payload (see {@link EventPayloads}).
 */
public record WorldEvent(
    long sequence,
    EventKind kind,
    long simMinute,
    String sourceId,
    String locationId,
    Map<String, Object> payload
) {

    public WorldEvent {
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        payload = EventPayloads.normalize(payload);
    }

    /**
     * @return the payload value for the key, or null if absent.
     */
    public Object get(String key) {
        return payload.get(key);
    }
}
