package org.rgen.runtime.persistence;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Typed view of {@code rgen.persistence}.
 *
 * @param format        encoding of written snapshots.
 * @param eventTail     trailing events kept per snapshot.
 * @param saveDirectory directory for named saves and autosaves.
 * @param compression   the raw {@code persistence} block, read by the compression factory.
 * @param autosave      autosave triggers and slots.
 */
public record PersistenceSettings(
    SnapshotFormat format,
    int eventTail,
    Path saveDirectory,
    Config compression,
    Autosave autosave
) {

    /**
     * @param everyMinutes save after this many simulated minutes, 0 disables.
     * @param everyTicks   save after this many ticks, 0 disables.
     * @param slots        number of rotating autosave files.
     * @param namePrefix   prefix of autosave file names.
     */
    public record Autosave(boolean enabled, long everyMinutes, long everyTicks, int slots, String namePrefix) {
        public Autosave {
            if (everyMinutes < 0 || everyTicks < 0) {
                throw new IllegalArgumentException("rgen.persistence.autosave triggers must be >= 0");
            }
            if (enabled && everyMinutes == 0 && everyTicks == 0) {
                throw new IllegalArgumentException(
                    "rgen.persistence.autosave is enabled but both every-minutes and every-ticks are 0");
            }
            if (slots <= 0) {
                throw new IllegalArgumentException("rgen.persistence.autosave.slots must be > 0: " + slots);
            }
            if (namePrefix == null || !namePrefix.matches("[A-Za-z0-9_-]+")) {
                throw new IllegalArgumentException("rgen.persistence.autosave.name-prefix is invalid: " + namePrefix);
            }
        }
    }

    public PersistenceSettings {
        if (eventTail < 0) {
            throw new IllegalArgumentException("rgen.persistence.event-tail must be >= 0: " + eventTail);
        }
    }

    /**
     * @param persistence the {@code rgen.persistence} block.
     */
    public static PersistenceSettings fromConfig(Config persistence) {
        try {
            Config autosave = persistence.getConfig("autosave");
            return new PersistenceSettings(
                SnapshotFormat.fromName(persistence.getString("format")),
                persistence.getInt("event-tail"),
                Paths.get(persistence.getString("save-directory")),
                persistence,
                new Autosave(
                    autosave.getBoolean("enabled"),
                    autosave.getLong("every-minutes"),
                    autosave.getLong("every-ticks"),
                    autosave.getInt("slots"),
                    autosave.getString("name-prefix")));
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid persistence configuration: " + e.getMessage(), e);
        }
    }

    /**
     * @return a copy writing to another directory.
     */
    public PersistenceSettings withSaveDirectory(Path directory) {
        return new PersistenceSettings(format, eventTail, directory, compression, autosave);
    }
}
