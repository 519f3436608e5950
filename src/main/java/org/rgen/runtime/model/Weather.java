package org.rgen.runtime.model;

/**
 * Current weather at a location.
 *
 * @param condition   e.g. "clear", "rain", "snow".
 * @param temperature degrees Celsius.
 */
public record Weather(String condition, double temperature) {

    /** Weather of a location before its first roll. */
    public static final Weather UNKNOWN = new Weather("unknown", 0.0);

    public Weather {
        if (condition == null || condition.isBlank()) {
            throw new IllegalArgumentException("Weather condition must not be blank");
        }
    }
}
