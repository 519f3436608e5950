package org.rgen.runtime.time;

/**
 * Handle for a callback registered on the {@link WorldClock}. One-shot tasks have an interval of 0.
 */
public final class ScheduledTask {

    private final long id;
    private final long intervalMinutes;
    private final IClockCallback callback;
    private long triggerMinute;
    private long queueSequence;
    private boolean cancelled;

    ScheduledTask(long id, long triggerMinute, long intervalMinutes, IClockCallback callback) {
        this.id = id;
        this.triggerMinute = triggerMinute;
        this.intervalMinutes = intervalMinutes;
        this.callback = callback;
    }

    public long getId() {
        return id;
    }

    public long getTriggerMinute() {
        return triggerMinute;
    }

    public long getIntervalMinutes() {
        return intervalMinutes;
    }

    public boolean isRecurring() {
        return intervalMinutes > 0;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    IClockCallback getCallback() {
        return callback;
    }

    long getQueueSequence() {
        return queueSequence;
    }

    void enqueueAs(long sequence) {
        this.queueSequence = sequence;
    }

    void reschedule() {
        this.triggerMinute += intervalMinutes;
    }

    void cancel() {
        this.cancelled = true;
    }

    @Override
    public String toString() {
        return "ScheduledTask{id=" + id + ", trigger=" + triggerMinute + ", interval=" + intervalMinutes + "}";
    }
}
