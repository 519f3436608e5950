package org.rgen.runtime;

/**
 * Counters kept by a {@link Simulator}.
 *
 * @param steps            steps performed.
 * @param minutesSimulated total minutes advanced.
 * @param eventsEmitted    events published during those steps.
 * @param observerFailures observer invocations that threw.
 */
public record SimulationStatistics(long steps, long minutesSimulated, long eventsEmitted, long observerFailures) {
}
