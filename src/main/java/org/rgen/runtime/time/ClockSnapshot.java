package org.rgen.runtime.time;

import java.util.Locale;

/**
 * Immutable, fully derived view of the clock at one sim-minute.
 *
 * @param totalMinutes absolute minute counter since Year 1, Day 1, 00:00.
 * @param year         1-based year.
 * @param month        1-12.
 * @param dayOfMonth   1-30.
 * @param dayOfYear    1-360.
 * @param hour         0-23.
 * @param minute       0-59.
 * @param season       season of the day.
 * @param timeOfDay    time-of-day bucket of the hour.
 * @param daytime      true between 06:00 and 19:00.
 */
public record ClockSnapshot(
    long totalMinutes,
    long year,
    int month,
    int dayOfMonth,
    int dayOfYear,
    int hour,
    int minute,
    Season season,
    TimeOfDay timeOfDay,
    boolean daytime
) {

    /**
     * Derives every calendar field from the minute counter.
     *
     * @param totalMinutes absolute minute counter, must be >= 0.
     * @return the derived snapshot.
     */
    public static ClockSnapshot of(long totalMinutes) {
        if (totalMinutes < 0) {
            throw new IllegalArgumentException("totalMinutes must be >= 0: " + totalMinutes);
        }
        long dayIndex = totalMinutes / WorldClock.MINUTES_PER_DAY;
        int minuteOfDay = (int) (totalMinutes % WorldClock.MINUTES_PER_DAY);
        int hour = minuteOfDay / WorldClock.MINUTES_PER_HOUR;
        int minute = minuteOfDay % WorldClock.MINUTES_PER_HOUR;
        long year = dayIndex / WorldClock.DAYS_PER_YEAR + 1;
        int dayOfYear = (int) (dayIndex % WorldClock.DAYS_PER_YEAR) + 1;
        int month = (dayOfYear - 1) / WorldClock.DAYS_PER_MONTH + 1;
        int dayOfMonth = (dayOfYear - 1) % WorldClock.DAYS_PER_MONTH + 1;
        return new ClockSnapshot(totalMinutes, year, month, dayOfMonth, dayOfYear, hour, minute,
            Season.ofDayOfYear(dayOfYear), TimeOfDay.ofHour(hour),
            hour >= WorldClock.DAYTIME_START_HOUR && hour < WorldClock.DAYTIME_END_HOUR);
    }

    /**
     * @return "HH:MM".
     */
    public String timeString() {
        return String.format("%02d:%02d", hour, minute);
    }

    /**
     * @return e.g. "Year 1, Autumn, Month 7, Day 12 - 14:30 (afternoon)".
     */
    public String fullDateTimeString() {
        String seasonName = season.key().substring(0, 1).toUpperCase(Locale.ROOT) + season.key().substring(1);
        return String.format("Year %d, %s, Month %d, Day %d - %s (%s)",
            year, seasonName, month, dayOfMonth, timeString(), timeOfDay.key());
    }
}
