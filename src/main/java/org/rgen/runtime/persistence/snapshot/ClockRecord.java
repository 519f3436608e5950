package org.rgen.runtime.persistence.snapshot;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.rgen.runtime.time.ClockSnapshot;

/**
 * Saved clock. Only {@code total_minutes} is authoritative; the calendar fields are written for
 * readability and must agree with it on load.
 */
@JsonPropertyOrder({"total_minutes", "year", "month", "day", "hour", "minute", "season"})
public record ClockRecord(
    @JsonProperty("total_minutes") long totalMinutes,
    @JsonProperty("year") long year,
    @JsonProperty("month") int month,
    @JsonProperty("day") int day,
    @JsonProperty("hour") int hour,
    @JsonProperty("minute") int minute,
    @JsonProperty("season") String season
) {

    public static ClockRecord of(long totalMinutes) {
        ClockSnapshot clock = ClockSnapshot.of(totalMinutes);
        return new ClockRecord(totalMinutes, clock.year(), clock.month(), clock.dayOfMonth(), clock.hour(),
            clock.minute(), clock.season().key());
    }
}
