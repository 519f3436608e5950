package org.rgen.runtime;

import org.rgen.runtime.time.ClockSnapshot;

/**
 * Aggregate counters of a world, for status output.
 */
public record WorldSummary(
    String name,
    long seed,
    ClockSnapshot clock,
    long tickCount,
    int activeLocations,
    int activeNpcs,
    int inactiveEntities,
    long totalEventsPublished,
    int eventHistorySize,
    boolean halted
) {
}
