package org.rgen.runtime.time;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one {@link WorldClock#advance(long)} call.
 *
 * @param before           the clock before advancing.
 * @param after            the clock after advancing.
 * @param crossed          number of boundaries crossed per calendar unit; units with none are absent.
 * @param callbacksFired   number of scheduled callbacks invoked, failed ones included.
 * @param callbackFailures callbacks that threw, in firing order.
 */
public record AdvanceResult(
    ClockSnapshot before,
    ClockSnapshot after,
    Map<CalendarBoundary, Long> crossed,
    int callbacksFired,
    List<CallbackFailure> callbackFailures
) {

    public AdvanceResult {
        EnumMap<CalendarBoundary, Long> copy = new EnumMap<>(CalendarBoundary.class);
        copy.putAll(crossed);
        crossed = Collections.unmodifiableMap(copy);
        callbackFailures = List.copyOf(callbackFailures);
    }

    public long minutesAdvanced() {
        return after.totalMinutes() - before.totalMinutes();
    }

    /**
     * @return how many boundaries of the given unit were crossed, 0 if none.
     */
    public long crossedCount(CalendarBoundary boundary) {
        return crossed.getOrDefault(boundary, 0L);
    }
}
