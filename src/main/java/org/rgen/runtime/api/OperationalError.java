package org.rgen.runtime.api;

import java.time.Instant;

/**
 * Describes a failure that was isolated instead of propagated, such as a failed entity update
 * or an autosave write that did not succeed.
 * <p>
 * Components keep a bounded list of these records so that hosts can inspect them.
 *
 * @param timestamp The wall-clock time at which the error occurred.
 * @param errorType A category for the error (e.g., "AUTOSAVE_WRITE_FAILED").
 * @param message   A human-readable description of the error.
 * @param details   Optional additional context, such as the target file or sim-minute.
 */
public record OperationalError(
    Instant timestamp,
    String errorType,
    String message,
    String details
) {
}
