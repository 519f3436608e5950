package org.rgen.runtime;

import org.rgen.runtime.time.ClockSnapshot;

/**
 * Outcome of one {@link World#tick(long)}.
 *
 * @param tickNumber      1-based number of the tick within the world's life.
 * @param eventsEmitted   events published during the tick.
 * @param entitiesUpdated active entities visited.
 * @param entitiesChanged entities whose state, location, roster, weather or market changed.
 * @param clock           the clock after the tick.
 */
public record TickResult(long tickNumber, int eventsEmitted, int entitiesUpdated, int entitiesChanged,
                         ClockSnapshot clock) {
}
