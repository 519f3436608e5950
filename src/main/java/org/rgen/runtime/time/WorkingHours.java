package org.rgen.runtime.time;

/**
 * A daily working window in whole hours. The start hour is inclusive, the end hour exclusive.
 * A window whose start is after its end wraps around midnight (e.g. a night watch 22-6).
 *
 * @param startHour first working hour, 0-23.
 * @param endHour   hour at which work ends, 0-24.
 */
public record WorkingHours(int startHour, int endHour) {

    /** The window used when a profession declares none: 08:00 to 18:00. */
    public static final WorkingHours DEFAULT = new WorkingHours(8, 18);

    public WorkingHours {
        if (startHour < 0 || startHour > 23) {
            throw new IllegalArgumentException("startHour must be in [0, 23]: " + startHour);
        }
        if (endHour < 0 || endHour > 24) {
            throw new IllegalArgumentException("endHour must be in [0, 24]: " + endHour);
        }
        if (startHour == endHour) {
            throw new IllegalArgumentException("Working window must not be empty: " + startHour + "-" + endHour);
        }
    }

    /**
     * @param hour hour of day, 0-23.
     * @return true if the hour falls inside this window.
     */
    public boolean contains(int hour) {
        if (startHour < endHour) {
            return hour >= startHour && hour < endHour;
        }
        return hour >= startHour || hour < endHour;
    }
}
