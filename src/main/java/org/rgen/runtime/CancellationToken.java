package org.rgen.runtime;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag for {@link Simulator#run}. May be set from any thread; the
 * simulator only looks at it between ticks.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
