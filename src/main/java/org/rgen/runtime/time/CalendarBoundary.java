package org.rgen.runtime.time;

/**
 * Calendar units whose boundaries can be crossed by a single clock advance.
 */
public enum CalendarBoundary {
    HOUR(WorldClock.MINUTES_PER_HOUR),
    DAY(WorldClock.MINUTES_PER_DAY),
    MONTH((long) WorldClock.MINUTES_PER_DAY * WorldClock.DAYS_PER_MONTH),
    SEASON((long) WorldClock.MINUTES_PER_DAY * WorldClock.DAYS_PER_SEASON),
    YEAR((long) WorldClock.MINUTES_PER_DAY * WorldClock.DAYS_PER_YEAR);

    private final long lengthInMinutes;

    CalendarBoundary(long lengthInMinutes) {
        this.lengthInMinutes = lengthInMinutes;
    }

    public long getLengthInMinutes() {
        return lengthInMinutes;
    }

    /**
     * Counts how many boundaries of this unit lie in the half-open interval (from, to].
     */
    public long countCrossed(long fromMinute, long toMinute) {
        return Math.floorDiv(toMinute, lengthInMinutes) - Math.floorDiv(fromMinute, lengthInMinutes);
    }
}
