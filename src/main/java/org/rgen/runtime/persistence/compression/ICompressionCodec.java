package org.rgen.runtime.persistence.compression;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Stream-based compression applied around an encoded snapshot.
 * <p>
 * Codec instances are stateless and may be shared between threads; the streams they create are not.
 * Callers must close a wrapped output stream to finish the compressed frame.
 * </p>
 *
 * @see CompressionCodecFactory
 */
public interface ICompressionCodec {

    OutputStream wrapOutputStream(OutputStream out) throws IOException;

    InputStream wrapInputStream(InputStream in) throws IOException;

    /**
     * @return lowercase codec name as used in configuration, e.g. "zstd".
     */
    String getName();

    /**
     * @return extension appended to save file names, including the dot, or "" for none.
     */
    String getFileExtension();

    /**
     * @return compression level, 0 for codecs without levels.
     */
    int getLevel();

    /**
     * Tells whether data starts with this codec's frame header.
     *
     * @param data the first bytes of a stored snapshot.
     */
    boolean matches(byte[] data);

    /**
     * Fails fast if the codec cannot work here, e.g. because a native library is missing.
     *
     * @throws CompressionException if the codec is unusable.
     */
    void validateEnvironment() throws CompressionException;

    /**
     * Compresses a whole byte array.
     */
    default byte[] compress(byte[] data) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(Math.max(64, data.length / 4));
        try (OutputStream out = wrapOutputStream(buffer)) {
            out.write(data);
        }
        return buffer.toByteArray();
    }

    /**
     * Decompresses a whole byte array.
     */
    default byte[] decompress(byte[] data) throws IOException {
        try (InputStream in = wrapInputStream(new ByteArrayInputStream(data))) {
            return in.readAllBytes();
        }
    }
}
