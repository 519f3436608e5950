package org.rgen.runtime.persistence;

import org.rgen.runtime.IStepObserver;
import org.rgen.runtime.StepSummary;
import org.rgen.runtime.World;
import org.rgen.runtime.WorldState;
import org.rgen.runtime.api.OperationalError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Periodically saves a world into a ring of K slot files.
 * <p>
 * Registered as a step observer, it counts simulated minutes and ticks. When a trigger fires, the
 * world state is captured synchronously on the simulation thread; encoding and file I/O then run
 * on a dedicated writer thread so that the tick path never blocks on disk. Write failures are
 * logged, counted and kept as {@link OperationalError}s; they never reach the simulation thread.
 * </p>
 */
public class AutosaveService implements IStepObserver, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AutosaveService.class);
    private static final int MAX_ERRORS = 50;
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final StateManager stateManager;
    private final PersistenceSettings.Autosave settings;
    private final ExecutorService writer;
    private final AtomicLong savesWritten = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private final ConcurrentLinkedDeque<OperationalError> errors = new ConcurrentLinkedDeque<>();

    private volatile Path lastSave;
    private volatile boolean closed;

    // Touched only by the simulation thread.
    private long minutesSinceSave;
    private long ticksSinceSave;
    private int nextSlot;

    public AutosaveService(StateManager stateManager, PersistenceSettings.Autosave settings) {
        this.stateManager = Objects.requireNonNull(stateManager, "stateManager");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.writer = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "AutosaveWriter");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public void onStep(World world, StepSummary summary) {
        if (!settings.enabled()) {
            return;
        }
        ensureOpen();
        minutesSinceSave += summary.minutes();
        ticksSinceSave++;
        boolean minutesDue = settings.everyMinutes() > 0 && minutesSinceSave >= settings.everyMinutes();
        boolean ticksDue = settings.everyTicks() > 0 && ticksSinceSave >= settings.everyTicks();
        if (minutesDue || ticksDue) {
            saveNow(world);
        }
    }

    /**
     * Captures the world now and queues the write into the next slot.
     *
     * @return completes with the written file, or with null if the write failed.
     */
    public Future<Path> saveNow(World world) {
        ensureOpen();
        WorldState state = world.captureState(stateManager.getEventTail());
        String slot = slotName(nextSlot);
        nextSlot = (nextSlot + 1) % settings.slots();
        minutesSinceSave = 0;
        ticksSinceSave = 0;
        return writer.submit(() -> write(state, slot));
    }

    private Path write(WorldState state, String slot) {
        try {
            Path file = stateManager.writeSave(slot, stateManager.encode(state));
            savesWritten.incrementAndGet();
            lastSave = file;
            LOG.info("Autosaved '{}' at minute {} to {}", state.name(), state.clockMinutes(), file);
            return file;
        } catch (IOException | RuntimeException e) {
            failures.incrementAndGet();
            LOG.warn("Autosave of '{}' into slot {} failed: {}", state.name(), slot, e.getMessage());
            recordError("AUTOSAVE_WRITE_FAILED", "Autosave into " + slot + " failed", String.valueOf(e.getMessage()));
            return null;
        }
    }

    private void recordError(String type, String message, String details) {
        errors.addLast(new OperationalError(Instant.now(), type, message, details));
        while (errors.size() > MAX_ERRORS) {
            errors.pollFirst();
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("AutosaveService is closed");
        }
    }

    /**
     * @return the save names of all slots, in rotation order.
     */
    public List<String> slotNames() {
        List<String> names = new ArrayList<>(settings.slots());
        for (int i = 0; i < settings.slots(); i++) {
            names.add(slotName(i));
        }
        return names;
    }

    private String slotName(int slot) {
        return settings.namePrefix() + "_" + slot;
    }

    public long getSavesWritten() {
        return savesWritten.get();
    }

    public long getFailures() {
        return failures.get();
    }

    public Path getLastSave() {
        return lastSave;
    }

    public List<OperationalError> getOperationalErrors() {
        return List.copyOf(errors);
    }

    /**
     * Stops accepting saves and waits for queued writes to finish.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        writer.shutdown();
        try {
            if (!writer.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                LOG.warn("Autosave writer did not finish within {}s, abandoning pending writes", SHUTDOWN_TIMEOUT_SECONDS);
                writer.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            writer.shutdownNow();
        }
    }
}
