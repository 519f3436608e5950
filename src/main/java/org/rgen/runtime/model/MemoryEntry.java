package org.rgen.runtime.model;

/**
 * One entry of an NPC's personal memory log.
 *
 * @param minute sim-minute at which it was recorded.
 * @param kind   short machine-readable kind, e.g. "ate" or "went_hungry".
 * @param impact signed mood impact.
 * @param detail free text, may be empty.
 */
public record MemoryEntry(long minute, String kind, double impact, String detail) {

    public MemoryEntry {
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("Memory kind must not be blank");
        }
        detail = detail == null ? "" : detail;
    }
}
