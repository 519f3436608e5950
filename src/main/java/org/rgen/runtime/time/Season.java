package org.rgen.runtime.time;

import java.util.Locale;

/**
 * The four seasons of the simulated calendar, each spanning 90 days.
 */
public enum Season {
    SPRING,
    SUMMER,
    AUTUMN,
    WINTER;

    /**
     * @param dayOfYear 1-based day of the 360-day year.
     * @return the season that contains the given day.
     */
    public static Season ofDayOfYear(int dayOfYear) {
        if (dayOfYear < 1 || dayOfYear > WorldClock.DAYS_PER_YEAR) {
            throw new IllegalArgumentException("dayOfYear out of range: " + dayOfYear);
        }
        return values()[(dayOfYear - 1) / WorldClock.DAYS_PER_SEASON];
    }

    /**
     * @return the lowercase name used in configuration tables (e.g. "autumn").
     */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
