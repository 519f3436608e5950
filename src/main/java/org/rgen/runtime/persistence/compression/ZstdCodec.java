package org.rgen.runtime.persistence.compression;

import com.github.luben.zstd.Zstd;
import com.github.luben.zstd.ZstdInputStream;
import com.github.luben.zstd.ZstdOutputStream;
import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Zstandard codec backed by zstd-jni.
 * <pre>
 * compression {
 *   enabled = true
 *   codec = "zstd"
 *   level = 3  # optional, clamped to [1, 22]
 * }
 * </pre>
 */
public class ZstdCodec implements ICompressionCodec {

    private static final Logger LOG = LoggerFactory.getLogger(ZstdCodec.class);

    private static final int MIN_LEVEL = 1;
    private static final int MAX_LEVEL = 22;
    private static final int DEFAULT_LEVEL = 3;

    /** Little-endian frame magic 0xFD2FB528. */
    private static final byte[] FRAME_MAGIC = {(byte) 0x28, (byte) 0xB5, (byte) 0x2F, (byte) 0xFD};

    private final int level;

    public ZstdCodec() {
        this(DEFAULT_LEVEL);
    }

    /**
     * @param config block with an optional {@code level}.
     */
    public ZstdCodec(Config config) {
        int configuredLevel = config.hasPath("level") ? config.getInt("level") : DEFAULT_LEVEL;
        this.level = clamp(configuredLevel);
        if (configuredLevel != this.level) {
            LOG.warn("Zstd compression level {} is outside [{}, {}], using {}", configuredLevel, MIN_LEVEL, MAX_LEVEL, level);
        }
    }

    public ZstdCodec(int level) {
        this.level = clamp(level);
    }

    private static int clamp(int level) {
        return Math.max(MIN_LEVEL, Math.min(MAX_LEVEL, level));
    }

    @Override
    public OutputStream wrapOutputStream(OutputStream out) throws IOException {
        return new ZstdOutputStream(out, level);
    }

    @Override
    public InputStream wrapInputStream(InputStream in) throws IOException {
        return new ZstdInputStream(in);
    }

    @Override
    public String getName() {
        return "zstd";
    }

    @Override
    public String getFileExtension() {
        return ".zst";
    }

    @Override
    public int getLevel() {
        return level;
    }

    @Override
    public boolean matches(byte[] data) {
        return data != null && data.length >= FRAME_MAGIC.length
            && Arrays.equals(Arrays.copyOf(data, FRAME_MAGIC.length), FRAME_MAGIC);
    }

    /**
     * Compresses and decompresses a short sample to prove the native library is loaded.
     */
    @Override
    public void validateEnvironment() throws CompressionException {
        try {
            byte[] sample = "R-Gen compression check".getBytes(StandardCharsets.UTF_8);
            byte[] compressed = Zstd.compress(sample, level);
            byte[] restored = Zstd.decompress(compressed, sample.length);
            if (!Arrays.equals(sample, restored)) {
                throw new CompressionException("Zstd round trip returned different bytes; the zstd-jni installation is broken");
            }
        } catch (UnsatisfiedLinkError e) {
            throw new CompressionException("Zstd native library not available on this platform: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new CompressionException("Unexpected error while validating zstd: " + e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return String.format("ZstdCodec{level=%d}", level);
    }
}
