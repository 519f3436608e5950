package org.rgen.runtime;

import org.rgen.runtime.time.ClockSnapshot;

/**
 * What one {@link Simulator#step(long)} did.
 *
 * @param stepNumber      1-based number of the step within the simulator's life.
 * @param minutes         minutes advanced.
 * @param entitiesChanged entities that changed during the step.
 * @param eventsEmitted   events published during the step.
 * @param clock           clock after the step.
 */
public record StepSummary(long stepNumber, long minutes, int entitiesChanged, int eventsEmitted, ClockSnapshot clock) {
}
