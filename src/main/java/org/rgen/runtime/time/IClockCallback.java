package org.rgen.runtime.time;

/**
 * Work scheduled on the {@link WorldClock}.
 */
@FunctionalInterface
public interface IClockCallback {

    /**
     * Invoked when the clock has advanced to or past the trigger minute.
     * <p>
     * Callbacks run after the whole step has been applied, so {@code clock} reports the minute at
     * the end of the step, not the trigger minute. Use {@code triggerMinute} for the time the work
     * was due; several callbacks fired by one step all see the same clock time.
     * </p>
     *
     * @param triggerMinute the minute the callback was scheduled for.
     * @param clock the clock, already advanced to the end of the current step.
     */
    void onTrigger(long triggerMinute, WorldClock clock);
}
