package org.rgen.runtime;

import java.util.List;

/**
 * Outcome of a multi-step run.
 *
 * @param status         how the run ended.
 * @param steps          summaries of the steps performed, in order.
 */
public record RunResult(Status status, List<StepSummary> steps) {

    public enum Status {
        /** All requested steps ran, or the stop condition was met. */
        COMPLETED,
        /** The cancellation token was set between two steps. */
        CANCELLED,
        /** {@link Simulator#runUntil} hit its step limit before the condition held. */
        LIMIT_REACHED
    }

    public RunResult {
        steps = List.copyOf(steps);
    }

    public int stepsCompleted() {
        return steps.size();
    }

    public long minutesSimulated() {
        long total = 0;
        for (StepSummary step : steps) {
            total += step.minutes();
        }
        return total;
    }
}
