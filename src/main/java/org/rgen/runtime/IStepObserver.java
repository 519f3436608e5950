package org.rgen.runtime;

/**
 * Notified after every simulator step, on the simulation thread.
 */
@FunctionalInterface
public interface IStepObserver {

    void onStep(World world, StepSummary summary);
}
