package org.rgen.runtime.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.LongSupplier;
import java.util.function.Predicate;

/**
 * Append-only, bounded history of world events with synchronous listener dispatch.
 * <p>
 * Every published event gets the next sequence number and the current sim-minute, is appended to
 * a ring buffer that evicts its oldest entry once the capacity is reached, and is then handed to
 * global listeners followed by listeners subscribed to its kind, each group in registration order.
 * A failing listener is logged and turned into an {@link EventKind#ERROR} event; it never reaches
 * the publisher.
 * </p>
 * <p>
 * Not thread-safe for publishing. Listener lists are copy-on-write so that a listener may
 * (un)subscribe while an event is being dispatched.
 * </p>
 */
public class EventBus {

    private static final Logger LOG = LoggerFactory.getLogger(EventBus.class);

    /** History capacity used when none is configured. */
    public static final int DEFAULT_HISTORY_CAPACITY = 1000;

    private final int capacity;
    private final LongSupplier clock;
    private final ArrayDeque<WorldEvent> history;
    private final List<IEventListener> globalListeners = new CopyOnWriteArrayList<>();
    private final Map<EventKind, List<IEventListener>> kindListeners = new EnumMap<>(EventKind.class);

    private long nextSequence = 1;
    private long totalPublished = 0;
    private long listenerFailures = 0;

    /**
     * @param capacity maximum number of events retained, must be > 0.
     * @param clock    supplies the current sim-minute for each published event.
     */
    public EventBus(int capacity, LongSupplier clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("History capacity must be > 0: " + capacity);
        }
        this.capacity = capacity;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.history = new ArrayDeque<>(Math.min(capacity, 4096));
    }

    /**
     * Publishes an event and dispatches it to listeners before returning.
     *
     * @param kind       the event kind.
     * @param sourceId   originating entity id, may be null.
     * @param locationId location id, may be null.
     * @param payload    JSON-like payload, may be null.
     * @return the stored event.
     */
    public WorldEvent publish(EventKind kind, String sourceId, String locationId, Map<String, ?> payload) {
        WorldEvent event = new WorldEvent(nextSequence, kind, clock.getAsLong(), sourceId, locationId,
            EventPayloads.normalize(payload));
        nextSequence++;
        totalPublished++;
        if (history.size() == capacity) {
            history.pollFirst();
        }
        history.addLast(event);
        dispatch(event);
        return event;
    }

    public WorldEvent publish(EventKind kind, String sourceId, Map<String, ?> payload) {
        return publish(kind, sourceId, null, payload);
    }

    private void dispatch(WorldEvent event) {
        for (IEventListener listener : globalListeners) {
            invoke(listener, event);
        }
        List<IEventListener> scoped = kindListeners.get(event.kind());
        if (scoped != null) {
            for (IEventListener listener : scoped) {
                invoke(listener, event);
            }
        }
    }

    private void invoke(IEventListener listener, WorldEvent event) {
        try {
            listener.onEvent(event);
        } catch (RuntimeException e) {
            listenerFailures++;
            if (event.kind() == EventKind.ERROR) {
                // No error event for a failure while handling an error event.
                LOG.error("Listener {} failed while handling error event #{}", listener, event.sequence(), e);
                return;
            }
            LOG.warn("Listener {} failed on event #{} ({}): {}", listener, event.sequence(), event.kind(), e.getMessage());
            publish(EventKind.ERROR, event.sourceId(), event.locationId(), EventPayloads.of(
                "error_type", "LISTENER_FAILURE",
                "message", String.valueOf(e.getMessage()),
                "exception", e.getClass().getName(),
                "failed_sequence", event.sequence(),
                "failed_kind", event.kind().name()));
        }
    }

    public void subscribe(EventKind kind, IEventListener listener) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(listener, "listener");
        kindListeners.computeIfAbsent(kind, k -> new CopyOnWriteArrayList<>()).add(listener);
    }

    /**
     * @return true if the listener was subscribed to the kind.
     */
    public boolean unsubscribe(EventKind kind, IEventListener listener) {
        List<IEventListener> scoped = kindListeners.get(kind);
        return scoped != null && scoped.remove(listener);
    }

    public void addGlobalListener(IEventListener listener) {
        globalListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public boolean removeGlobalListener(IEventListener listener) {
        return globalListeners.remove(listener);
    }

    /**
     * Returns the last {@code n} events in ascending sequence order.
     *
     * @param n number of events, must be >= 0. Larger values return the whole history.
     */
    public List<WorldEvent> recent(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("n must be >= 0: " + n);
        }
        int count = Math.min(n, history.size());
        List<WorldEvent> result = new ArrayList<>(count);
        Iterator<WorldEvent> it = history.descendingIterator();
        while (result.size() < count) {
            result.add(it.next());
        }
        Collections.reverse(result);
        return Collections.unmodifiableList(result);
    }

    public List<WorldEvent> byKind(EventKind kind) {
        return filter(e -> e.kind() == kind);
    }

    public List<WorldEvent> bySource(String sourceId) {
        return filter(e -> Objects.equals(e.sourceId(), sourceId));
    }

    public List<WorldEvent> byLocation(String locationId) {
        return filter(e -> Objects.equals(e.locationId(), locationId));
    }

    private List<WorldEvent> filter(Predicate<WorldEvent> predicate) {
        List<WorldEvent> result = new ArrayList<>();
        for (WorldEvent event : history) {
            if (predicate.test(event)) {
                result.add(event);
            }
        }
        return Collections.unmodifiableList(result);
    }

    public int historySize() {
        return history.size();
    }

    public int getCapacity() {
        return capacity;
    }

    public long getTotalPublished() {
        return totalPublished;
    }

    /**
     * @return sequence number the next published event will receive.
     */
    public long getNextSequence() {
        return nextSequence;
    }

    public long getListenerFailures() {
        return listenerFailures;
    }

    /**
     * Replaces the history with a restored tail and continues numbering after it. Listeners are
     * kept and are not notified of the restored events.
     *
     * @param tail           restored events in ascending sequence order.
     * @param nextSequence   sequence number for the next publish, greater than every restored one.
     * @param totalPublished total count carried over from the saved world.
     */
    public void restore(List<WorldEvent> tail, long nextSequence, long totalPublished) {
        long last = 0;
        for (WorldEvent event : tail) {
            if (event.sequence() <= last) {
                throw new IllegalArgumentException("Restored events are not strictly increasing at #" + event.sequence());
            }
            last = event.sequence();
        }
        if (nextSequence <= last) {
            throw new IllegalArgumentException("nextSequence " + nextSequence + " does not follow last restored event #" + last);
        }
        history.clear();
        int skip = Math.max(0, tail.size() - capacity);
        for (int i = skip; i < tail.size(); i++) {
            history.addLast(tail.get(i));
        }
        this.nextSequence = nextSequence;
        this.totalPublished = totalPublished;
    }
}
