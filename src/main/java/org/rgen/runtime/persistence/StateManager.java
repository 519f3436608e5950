package org.rgen.runtime.persistence;

import org.rgen.generation.IContentGenerator;
import org.rgen.generation.IEntityFactory;
import org.rgen.runtime.SimulationParameters;
import org.rgen.runtime.World;
import org.rgen.runtime.WorldState;
import org.rgen.runtime.api.CorruptDataException;
import org.rgen.runtime.persistence.compression.CompressionCodecFactory;
import org.rgen.runtime.persistence.compression.CompressionException;
import org.rgen.runtime.persistence.compression.ICompressionCodec;
import org.rgen.runtime.persistence.snapshot.SnapshotMapper;
import org.rgen.runtime.persistence.snapshot.WorldSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Saves and restores worlds.
 * <p>
 * Writing uses the configured encoding and compression. Reading detects both from the data
 * itself: a zstd frame header means compressed, then {@code "RGWS"} means binary and {@code '{'}
 * means JSON. Files are written to a temporary sibling and atomically moved into place, so a
 * crash never leaves a half-written save.
 * </p>
 */
public class StateManager {

    private static final Logger LOG = LoggerFactory.getLogger(StateManager.class);

    private static final Pattern SAVE_NAME = Pattern.compile("[A-Za-z0-9_-][A-Za-z0-9_.-]*");
    private static final String TEMP_SUFFIX = ".tmp";

    private final ISnapshotCodec writeCodec;
    private final ICompressionCodec compression;
    private final int eventTail;
    private final Path saveDirectory;
    private final List<ISnapshotCodec> readCodecs = List.of(new BinarySnapshotCodec(), new JsonSnapshotCodec());

    public StateManager(SnapshotFormat format, ICompressionCodec compression, int eventTail, Path saveDirectory) {
        this.writeCodec = format == SnapshotFormat.BINARY ? new BinarySnapshotCodec() : new JsonSnapshotCodec();
        this.compression = Objects.requireNonNull(compression, "compression");
        if (eventTail < 0) {
            throw new IllegalArgumentException("eventTail must be >= 0: " + eventTail);
        }
        this.eventTail = eventTail;
        this.saveDirectory = Objects.requireNonNull(saveDirectory, "saveDirectory");
    }

    /**
     * @throws IllegalStateException if the configured compression codec cannot run here.
     */
    public StateManager(PersistenceSettings settings) {
        this(settings.format(), validatedCodec(settings), settings.eventTail(), settings.saveDirectory());
    }

    private static ICompressionCodec validatedCodec(PersistenceSettings settings) {
        try {
            ICompressionCodec codec = CompressionCodecFactory.createAndValidate(settings.compression());
            if (!"none".equals(codec.getName())) {
                LOG.debug("Saves use compression: codec={}, level={}", codec.getName(), codec.getLevel());
            }
            return codec;
        } catch (CompressionException e) {
            throw new IllegalStateException("Failed to initialize compression codec for saves in "
                + settings.saveDirectory(), e);
        }
    }

    public SnapshotFormat getFormat() {
        return writeCodec.getFormat();
    }

    public ICompressionCodec getCompression() {
        return compression;
    }

    public Path getSaveDirectory() {
        return saveDirectory;
    }

    public int getEventTail() {
        return eventTail;
    }

    // In-memory

    /**
     * Encodes the world with the configured format and compression.
     */
    public byte[] serialize(World world) throws IOException {
        return encode(world.captureState(eventTail));
    }

    /**
     * Encodes an already captured state. Safe to call from any thread.
     */
    public byte[] encode(WorldState state) throws IOException {
        WorldSnapshot snapshot = SnapshotMapper.toSnapshot(state);
        byte[] encoded = writeCodec.encode(snapshot);
        return compression.compress(encoded);
    }

    /**
     * Decodes bytes written by any format and compression into a world state.
     *
     * @throws VersionMismatchException if the snapshot version is unsupported.
     * @throws CorruptDataException     if the bytes cannot be decoded.
     */
    public WorldState decode(byte[] data) throws VersionMismatchException, CorruptDataException {
        if (data == null || data.length == 0) {
            throw new CorruptDataException("Snapshot is empty");
        }
        byte[] raw;
        ICompressionCodec detected = CompressionCodecFactory.detect(data);
        try {
            raw = detected.decompress(data);
        } catch (IOException | RuntimeException e) {
            throw new CorruptDataException("Snapshot cannot be decompressed with " + detected.getName() + ": "
                + e.getMessage(), e);
        }
        for (ISnapshotCodec codec : readCodecs) {
            if (codec.matches(raw)) {
                return SnapshotMapper.fromSnapshot(codec.decode(raw));
            }
        }
        throw new CorruptDataException("Snapshot encoding not recognized");
    }

    /**
     * Decodes bytes and rebuilds the world, verifying its referential integrity.
     */
    public World deserialize(byte[] data, SimulationParameters parameters, IContentGenerator generator,
                             IEntityFactory factory) throws VersionMismatchException, CorruptDataException {
        return World.restore(decode(data), parameters, generator, factory);
    }

    // Files

    /**
     * Writes the world under a name, replacing any earlier save of that name.
     *
     * @return the written file.
     */
    public Path save(World world, String name) throws IOException {
        Path file = writeSave(name, serialize(world));
        LOG.info("Saved world '{}' to {}", world.getName(), file);
        return file;
    }

    /**
     * Atomically writes already encoded bytes as a named save. Variants of the same name in other
     * formats are removed afterwards.
     */
    public Path writeSave(String name, byte[] data) throws IOException {
        validateName(name);
        Files.createDirectories(saveDirectory);
        Path file = saveDirectory.resolve(name + writeCodec.getFormat().getFileExtension() + compression.getFileExtension());
        Path temp = saveDirectory.resolve(file.getFileName() + "." + UUID.randomUUID() + TEMP_SUFFIX);
        Files.write(temp, data);
        try {
            Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanup) {
                LOG.warn("Failed to clean up temp file {} after move failure", temp, cleanup);
            }
            throw e;
        }
        for (Path variant : variants(name)) {
            if (!variant.equals(file)) {
                Files.deleteIfExists(variant);
            }
        }
        return file;
    }

    /**
     * Loads a named save.
     *
     * @throws NoSuchFileException if no save of that name exists.
     */
    public World load(String name, SimulationParameters parameters, IContentGenerator generator, IEntityFactory factory)
        throws IOException, VersionMismatchException, CorruptDataException {
        Path file = resolve(name);
        World world = deserialize(Files.readAllBytes(file), parameters, generator, factory);
        LOG.info("Loaded world '{}' from {}", world.getName(), file);
        return world;
    }

    /**
     * Reads the raw bytes of a named save.
     */
    public byte[] read(String name) throws IOException {
        return Files.readAllBytes(resolve(name));
    }

    /**
     * @return saves in the save directory, ordered by name.
     */
    public List<SaveInfo> listSaves() throws IOException {
        List<SaveInfo> saves = new ArrayList<>();
        if (!Files.isDirectory(saveDirectory)) {
            return saves;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(saveDirectory)) {
            for (Path path : stream) {
                String saveName = stripExtension(path.getFileName().toString());
                if (saveName != null && Files.isRegularFile(path)) {
                    saves.add(new SaveInfo(saveName, path, Files.size(path),
                        Files.getLastModifiedTime(path).toInstant()));
                }
            }
        }
        saves.sort(Comparator.comparing(SaveInfo::name).thenComparing(info -> info.path().toString()));
        return saves;
    }

    /**
     * Deletes every file of a named save.
     *
     * @return true if anything was deleted.
     */
    public boolean deleteSave(String name) throws IOException {
        validateName(name);
        boolean deleted = false;
        for (Path variant : variants(name)) {
            deleted |= Files.deleteIfExists(variant);
        }
        if (deleted) {
            LOG.info("Deleted save '{}'", name);
        }
        return deleted;
    }

    private Path resolve(String name) throws IOException {
        validateName(name);
        for (Path variant : variants(name)) {
            if (Files.isRegularFile(variant)) {
                return variant;
            }
        }
        throw new NoSuchFileException(saveDirectory.resolve(name).toString(), null, "no save named '" + name + "'");
    }

    private List<Path> variants(String name) {
        List<Path> paths = new ArrayList<>();
        for (SnapshotFormat format : SnapshotFormat.values()) {
            for (String compressed : List.of("", ".zst")) {
                paths.add(saveDirectory.resolve(name + format.getFileExtension() + compressed));
            }
        }
        return paths;
    }

    private static String stripExtension(String fileName) {
        String base = fileName.endsWith(".zst") ? fileName.substring(0, fileName.length() - 4) : fileName;
        for (SnapshotFormat format : SnapshotFormat.values()) {
            if (base.endsWith(format.getFileExtension())) {
                return base.substring(0, base.length() - format.getFileExtension().length());
            }
        }
        return null;
    }

    private static void validateName(String name) {
        if (name == null || !SAVE_NAME.matcher(name).matches() || name.contains("..")) {
            throw new IllegalArgumentException("Invalid save name '" + name
                + "': use letters, digits, '_', '-' and '.', and no '..'");
        }
    }
}
