package org.rgen.runtime.persistence;

import org.rgen.runtime.api.CorruptDataException;
import org.rgen.runtime.persistence.snapshot.WorldSnapshot;

import java.io.IOException;

/**
 * One snapshot encoding. Encoding is deterministic: the same snapshot always yields the same bytes.
 */
public interface ISnapshotCodec {

    SnapshotFormat getFormat();

    /**
     * Tells whether uncompressed data starts like this encoding.
     */
    boolean matches(byte[] data);

    byte[] encode(WorldSnapshot snapshot) throws IOException;

    /**
     * @throws VersionMismatchException if the data declares an unsupported version.
     * @throws CorruptDataException     if the data cannot be decoded.
     */
    WorldSnapshot decode(byte[] data) throws VersionMismatchException, CorruptDataException;
}
