package org.rgen.runtime.events;

/**
 * Receives events synchronously on the publishing thread.
 */
@FunctionalInterface
public interface IEventListener {

    void onEvent(WorldEvent event);
}
