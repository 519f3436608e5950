package org.rgen.runtime.persistence.compression;

import com.typesafe.config.Config;

import java.util.List;
import java.util.Locale;

/**
 * Creates compression codecs from configuration and recognizes them from stored bytes.
 * <p>
 * A missing {@code compression} block or {@code enabled = false} yields {@link NoneCodec}.
 * With {@code enabled = true} the {@code codec} key is required and must be "zstd" or "none".
 * </p>
 */
public final class CompressionCodecFactory {

    private CompressionCodecFactory() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * @param config block that may contain a {@code compression} section.
     * @throws IllegalArgumentException if compression is enabled with a missing or unknown codec.
     */
    public static ICompressionCodec create(Config config) {
        if (!config.hasPath("compression")) {
            return new NoneCodec();
        }
        Config compression = config.getConfig("compression");
        boolean enabled = compression.hasPath("enabled") && compression.getBoolean("enabled");
        if (!enabled) {
            return new NoneCodec();
        }
        if (!compression.hasPath("codec")) {
            throw new IllegalArgumentException(
                "Compression is enabled but 'codec' is missing. Specify compression { enabled = true, codec = \"zstd\" }");
        }
        String codecName = compression.getString("codec").toLowerCase(Locale.ROOT);
        return switch (codecName) {
            case "zstd" -> new ZstdCodec(compression);
            case "none" -> new NoneCodec();
            default -> throw new IllegalArgumentException(
                "Unknown compression codec: '" + codecName + "'. Supported codecs: 'zstd', 'none'");
        };
    }

    /**
     * Creates the codec and validates its environment in one step.
     */
    public static ICompressionCodec createAndValidate(Config config) throws CompressionException {
        ICompressionCodec codec = create(config);
        codec.validateEnvironment();
        return codec;
    }

    /**
     * Picks the codec that produced the data by its frame header.
     *
     * @return the matching codec, or {@link NoneCodec} if the data is not compressed.
     */
    public static ICompressionCodec detect(byte[] data) {
        for (ICompressionCodec codec : List.<ICompressionCodec>of(new ZstdCodec())) {
            if (codec.matches(data)) {
                return codec;
            }
        }
        return new NoneCodec();
    }
}
