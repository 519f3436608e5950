package org.rgen.runtime.time;

import java.util.Locale;

/**
 * Fixed hour ranges that classify the time of day. Start hour inclusive, end hour exclusive.
 */
public enum TimeOfDay {
    NIGHT(0, 6),
    DAWN(6, 8),
    MORNING(8, 12),
    AFTERNOON(12, 17),
    DUSK(17, 19),
    EVENING(19, 24);

    private final int startHour;
    private final int endHour;

    TimeOfDay(int startHour, int endHour) {
        this.startHour = startHour;
        this.endHour = endHour;
    }

    public int getStartHour() {
        return startHour;
    }

    public int getEndHour() {
        return endHour;
    }

    /**
     * @param hour hour of day, 0-23.
     * @return the bucket containing the hour.
     */
    public static TimeOfDay ofHour(int hour) {
        for (TimeOfDay period : values()) {
            if (hour >= period.startHour && hour < period.endHour) {
                return period;
            }
        }
        throw new IllegalArgumentException("hour out of range: " + hour);
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
