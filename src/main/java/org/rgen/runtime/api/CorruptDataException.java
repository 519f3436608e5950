package org.rgen.runtime.api;

/**
 * Signals that world data violates referential integrity.
 * <p>
 * Raised when a decoded snapshot references entities that do not exist, and when a tick
 * discovers an NPC whose location no longer resolves. In the latter case the world is
 * halted and refuses further ticks.
 */
public class CorruptDataException extends Exception {

    public CorruptDataException(String message) {
        super(message);
    }

    public CorruptDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
