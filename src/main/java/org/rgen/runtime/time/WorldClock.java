package org.rgen.runtime.time;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

/**
 * Owns simulated time. The clock is a single monotonic minute counter from which every calendar
 * field is derived on demand, so the fields can never drift out of sync with the counter.
 * <p>
 * The calendar has 60-minute hours, 24-hour days, 30-day months, 12 months per year and four
 * 90-day seasons. A new clock starts at Year 1, Day 1, 08:00.
 * </p>
 * <p>
 * Callbacks can be scheduled for a future minute, either once or recurring. They fire during
 * {@link #advance(long)} in trigger order, ties broken by insertion order. Scheduled callbacks are
 * runtime state only and are never serialized.
 * </p>
 * <p>
 * Not thread-safe. The clock is driven by the single tick thread of its world.
 * </p>
 */
public class WorldClock {

    private static final Logger LOG = LoggerFactory.getLogger(WorldClock.class);

    public static final int MINUTES_PER_HOUR = 60;
    public static final int HOURS_PER_DAY = 24;
    public static final int MINUTES_PER_DAY = MINUTES_PER_HOUR * HOURS_PER_DAY;
    public static final int DAYS_PER_MONTH = 30;
    public static final int MONTHS_PER_YEAR = 12;
    public static final int DAYS_PER_YEAR = DAYS_PER_MONTH * MONTHS_PER_YEAR;
    public static final int DAYS_PER_SEASON = DAYS_PER_YEAR / 4;
    public static final int DAYTIME_START_HOUR = 6;
    public static final int DAYTIME_END_HOUR = 19;

    /** Minute counter of a freshly created world: Year 1, Day 1, 08:00. */
    public static final long START_MINUTE = 8L * MINUTES_PER_HOUR;

    private static final Comparator<ScheduledTask> TRIGGER_ORDER =
        Comparator.comparingLong(ScheduledTask::getTriggerMinute)
            .thenComparingLong(ScheduledTask::getQueueSequence);

    private long totalMinutes;
    private final PriorityQueue<ScheduledTask> scheduled = new PriorityQueue<>(TRIGGER_ORDER);
    private long nextTaskId = 1;
    private long nextQueueSequence = 1;

    /**
     * Creates a clock at the fixed world start time.
     */
    public WorldClock() {
        this(START_MINUTE);
    }

    /**
     * Creates a clock at an arbitrary minute, used when restoring a snapshot.
     *
     * @param totalMinutes the minute counter, must be >= 0.
     */
    public WorldClock(long totalMinutes) {
        if (totalMinutes < 0) {
            throw new IllegalArgumentException("totalMinutes must be >= 0: " + totalMinutes);
        }
        this.totalMinutes = totalMinutes;
    }

    public long getTotalMinutes() {
        return totalMinutes;
    }

    /**
     * @return all calendar fields derived from the current minute.
     */
    public ClockSnapshot snapshot() {
        return ClockSnapshot.of(totalMinutes);
    }

    /**
     * Advances the clock and fires every scheduled callback that became due.
     *
     * @param minutes number of minutes to advance, must be > 0.
     * @return the crossed calendar boundaries and the callback outcome.
     * @throws IllegalArgumentException if minutes is zero or negative.
     */
    public AdvanceResult advance(long minutes) {
        if (minutes <= 0) {
            throw new IllegalArgumentException("Clock can only advance by a positive number of minutes: " + minutes);
        }
        ClockSnapshot before = snapshot();
        long from = totalMinutes;
        totalMinutes = Math.addExact(totalMinutes, minutes);

        Map<CalendarBoundary, Long> crossed = new EnumMap<>(CalendarBoundary.class);
        for (CalendarBoundary boundary : CalendarBoundary.values()) {
            long count = boundary.countCrossed(from, totalMinutes);
            if (count > 0) {
                crossed.put(boundary, count);
            }
        }

        int fired = 0;
        List<CallbackFailure> failures = new ArrayList<>();
        while (!scheduled.isEmpty() && scheduled.peek().getTriggerMinute() <= totalMinutes) {
            ScheduledTask task = scheduled.poll();
            if (task.isCancelled()) {
                continue;
            }
            long trigger = task.getTriggerMinute();
            fired++;
            try {
                task.getCallback().onTrigger(trigger, this);
            } catch (RuntimeException e) {
                LOG.warn("Scheduled callback {} due at minute {} failed: {}", task.getId(), trigger, e.getMessage());
                failures.add(new CallbackFailure(task.getId(), trigger, e));
            }
            if (task.isRecurring() && !task.isCancelled()) {
                task.reschedule();
                enqueue(task);
            }
        }

        if (LOG.isDebugEnabled()) {
            LOG.debug("Clock advanced {} min to {} ({} callbacks fired)", minutes, snapshot().fullDateTimeString(), fired);
        }
        return new AdvanceResult(before, snapshot(), crossed, fired, failures);
    }

    /**
     * Schedules a one-shot callback.
     *
     * @param delayMinutes minutes from now, must be > 0.
     * @param callback     the callback.
     * @return a handle usable with {@link #cancel(ScheduledTask)}.
     */
    public ScheduledTask schedule(long delayMinutes, IClockCallback callback) {
        return register(delayMinutes, 0, callback);
    }

    /**
     * Schedules a callback that first fires after {@code delayMinutes} and then every
     * {@code intervalMinutes}. If one advance spans several intervals the callback fires once per
     * due trigger.
     */
    public ScheduledTask scheduleRecurring(long delayMinutes, long intervalMinutes, IClockCallback callback) {
        if (intervalMinutes <= 0) {
            throw new IllegalArgumentException("intervalMinutes must be > 0: " + intervalMinutes);
        }
        return register(delayMinutes, intervalMinutes, callback);
    }

    /**
     * Cancels a scheduled callback. Cancelling twice, or cancelling a fired one-shot task, is a no-op.
     * A recurring task may cancel itself from inside its own callback; it is then not rescheduled.
     *
     * @return true if the task was still queued.
     */
    public boolean cancel(ScheduledTask task) {
        if (task == null || task.isCancelled()) {
            return false;
        }
        task.cancel();
        return scheduled.remove(task);
    }

    /**
     * @return number of callbacks waiting to fire.
     */
    public int pendingCallbacks() {
        return scheduled.size();
    }

    /**
     * @return minutes left until the next time-of-day bucket begins.
     */
    public int minutesUntilNextPeriod() {
        ClockSnapshot now = snapshot();
        int minuteOfDay = now.hour() * MINUTES_PER_HOUR + now.minute();
        return now.timeOfDay().getEndHour() * MINUTES_PER_HOUR - minuteOfDay;
    }

    /**
     * @return true if the current hour lies inside the given working window.
     */
    public boolean isWorkingHours(WorkingHours hours) {
        return hours.contains(snapshot().hour());
    }

    /**
     * @return true if the current hour lies inside the default 08:00-18:00 window.
     */
    public boolean isWorkingHours() {
        return isWorkingHours(WorkingHours.DEFAULT);
    }

    public boolean isDaytime() {
        return snapshot().daytime();
    }

    private ScheduledTask register(long delayMinutes, long intervalMinutes, IClockCallback callback) {
        if (delayMinutes <= 0) {
            throw new IllegalArgumentException("delayMinutes must be > 0: " + delayMinutes);
        }
        if (callback == null) {
            throw new IllegalArgumentException("callback must not be null");
        }
        ScheduledTask task = new ScheduledTask(nextTaskId++, totalMinutes + delayMinutes, intervalMinutes, callback);
        enqueue(task);
        return task;
    }

    private void enqueue(ScheduledTask task) {
        task.enqueueAs(nextQueueSequence++);
        scheduled.add(task);
    }
}
