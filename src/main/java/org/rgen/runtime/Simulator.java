package org.rgen.runtime;

import org.rgen.runtime.api.CorruptDataException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

/**
 * Drives a {@link World} step by step. Holds nothing but observers and counters; every step is a
 * single synchronous {@link World#tick(long)} on the calling thread.
 */
public class Simulator {

    private static final Logger LOG = LoggerFactory.getLogger(Simulator.class);

    private final World world;
    private final List<IStepObserver> observers = new CopyOnWriteArrayList<>();

    private long steps;
    private long minutesSimulated;
    private long eventsEmitted;
    private long observerFailures;

    public Simulator(World world) {
        this.world = Objects.requireNonNull(world, "world");
    }

    public World getWorld() {
        return world;
    }

    public void addObserver(IStepObserver observer) {
        observers.add(Objects.requireNonNull(observer, "observer"));
    }

    public boolean removeObserver(IStepObserver observer) {
        return observers.remove(observer);
    }

    /**
     * Performs one tick and notifies observers. An observer that throws is logged and skipped.
     *
     * @param minutes minutes to advance, must be > 0.
     * @throws CorruptDataException if the world detected broken references and halted.
     */
    public StepSummary step(long minutes) throws CorruptDataException {
        TickResult tick = world.tick(minutes);
        steps++;
        minutesSimulated += minutes;
        eventsEmitted += tick.eventsEmitted();
        StepSummary summary = new StepSummary(steps, minutes, tick.entitiesChanged(), tick.eventsEmitted(), tick.clock());
        for (IStepObserver observer : observers) {
            try {
                observer.onStep(world, summary);
            } catch (RuntimeException e) {
                observerFailures++;
                LOG.warn("Step observer {} failed after step {}: {}", observer, steps, e.getMessage());
            }
        }
        return summary;
    }

    /**
     * Runs a fixed number of steps, checking the token before each one.
     *
     * @param intervalMinutes minutes per step, must be > 0.
     * @param stepCount       number of steps, must be >= 0.
     * @param cancellation    cooperative stop flag.
     * @return {@code COMPLETED} with every summary, or {@code CANCELLED} with the steps done so far.
     */
    public RunResult run(long intervalMinutes, int stepCount, CancellationToken cancellation) throws CorruptDataException {
        if (intervalMinutes <= 0) {
            throw new IllegalArgumentException("intervalMinutes must be > 0: " + intervalMinutes);
        }
        if (stepCount < 0) {
            throw new IllegalArgumentException("stepCount must be >= 0: " + stepCount);
        }
        Objects.requireNonNull(cancellation, "cancellation");
        List<StepSummary> summaries = new ArrayList<>(stepCount);
        for (int i = 0; i < stepCount; i++) {
            if (cancellation.isCancelled()) {
                LOG.info("Run cancelled after {} of {} steps", summaries.size(), stepCount);
                return new RunResult(RunResult.Status.CANCELLED, summaries);
            }
            summaries.add(step(intervalMinutes));
        }
        return new RunResult(RunResult.Status.COMPLETED, summaries);
    }

    /**
     * Steps until the condition holds for the world, checking it before each step.
     *
     * @return {@code COMPLETED} once the condition holds, {@code LIMIT_REACHED} after maxSteps.
     */
    public RunResult runUntil(Predicate<World> condition, int maxSteps, long minutesPerStep) throws CorruptDataException {
        if (maxSteps < 0) {
            throw new IllegalArgumentException("maxSteps must be >= 0: " + maxSteps);
        }
        List<StepSummary> summaries = new ArrayList<>();
        while (!condition.test(world)) {
            if (summaries.size() >= maxSteps) {
                LOG.warn("Stop condition not met after {} steps", maxSteps);
                return new RunResult(RunResult.Status.LIMIT_REACHED, summaries);
            }
            summaries.add(step(minutesPerStep));
        }
        return new RunResult(RunResult.Status.COMPLETED, summaries);
    }

    /**
     * Simulates whole hours in steps of {@code minutesPerStep}; a trailing partial step covers the rest.
     */
    public RunResult simulateHours(int hours, long minutesPerStep) throws CorruptDataException {
        if (hours < 0 || minutesPerStep <= 0) {
            throw new IllegalArgumentException("hours must be >= 0 and minutesPerStep > 0");
        }
        long total = hours * 60L;
        List<StepSummary> summaries = new ArrayList<>();
        while (total > 0) {
            long minutes = Math.min(minutesPerStep, total);
            summaries.add(step(minutes));
            total -= minutes;
        }
        return new RunResult(RunResult.Status.COMPLETED, summaries);
    }

    public RunResult simulateDays(int days, long minutesPerStep) throws CorruptDataException {
        return simulateHours(Math.multiplyExact(days, 24), minutesPerStep);
    }

    public SimulationStatistics getStatistics() {
        return new SimulationStatistics(steps, minutesSimulated, eventsEmitted, observerFailures);
    }
}
