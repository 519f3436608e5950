package org.rgen.runtime.time;

/**
 * A scheduled callback that threw while the clock advanced.
 *
 * @param taskId        id of the failing {@link ScheduledTask}.
 * @param triggerMinute minute the callback was due.
 * @param cause         the exception thrown by the callback.
 */
public record CallbackFailure(long taskId, long triggerMinute, RuntimeException cause) {
}
