package org.rgen.runtime.persistence.compression;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.rgen.junit.extensions.logging.ExpectLog;
import org.rgen.junit.extensions.logging.LogLevel;
import org.rgen.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class CompressionCodecFactoryTest {

    private static Config config(String hocon) {
        return ConfigFactory.parseString(hocon);
    }

    @Test
    @DisplayName("No block or a disabled block means no compression")
    void create_disabled() {
        assertThat(CompressionCodecFactory.create(config(""))).isInstanceOf(NoneCodec.class);
        assertThat(CompressionCodecFactory.create(config("compression { enabled = false, codec = zstd }")))
            .isInstanceOf(NoneCodec.class);
        assertThat(CompressionCodecFactory.create(config("compression { codec = zstd }")))
            .isInstanceOf(NoneCodec.class);
    }

    @Test
    @DisplayName("An enabled zstd block yields a zstd codec with the configured level")
    void create_zstd() {
        ICompressionCodec codec = CompressionCodecFactory.create(
            config("compression { enabled = true, codec = ZSTD, level = 7 }"));

        assertThat(codec).isInstanceOf(ZstdCodec.class);
        assertThat(codec.getLevel()).isEqualTo(7);
        assertThat(codec.getFileExtension()).isEqualTo(".zst");
        assertThat(CompressionCodecFactory.create(config("compression { enabled = true, codec = none }")))
            .isInstanceOf(NoneCodec.class);
    }

    @Test
    @DisplayName("Out-of-range levels are clamped with a warning")
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*ZstdCodec", messagePattern = "Zstd compression level 40 is outside.*")
    void create_clampsLevel() {
        ICompressionCodec codec = CompressionCodecFactory.create(
            config("compression { enabled = true, codec = zstd, level = 40 }"));

        assertThat(codec.getLevel()).isEqualTo(22);
        assertThat(new ZstdCodec(0).getLevel()).isEqualTo(1);
    }

    @Test
    @DisplayName("A missing or unknown codec is rejected")
    void create_rejectsBadCodec() {
        assertThatThrownBy(() -> CompressionCodecFactory.create(config("compression { enabled = true }")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("'codec' is missing");
        assertThatThrownBy(() -> CompressionCodecFactory.create(config("compression { enabled = true, codec = lz4 }")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("lz4");
    }

    @Test
    @DisplayName("Compressed data is recognized by its frame header")
    void detect_recognizesZstdFrames() throws Exception {
        ZstdCodec zstd = new ZstdCodec();
        byte[] plain = "{\"version\": 1}".repeat(50).getBytes(StandardCharsets.UTF_8);
        byte[] compressed = zstd.compress(plain);

        assertThat(CompressionCodecFactory.detect(compressed)).isInstanceOf(ZstdCodec.class);
        assertThat(CompressionCodecFactory.detect(plain)).isInstanceOf(NoneCodec.class);
        assertThat(CompressionCodecFactory.detect(new byte[] {0x28})).isInstanceOf(NoneCodec.class);
        assertThat(zstd.decompress(compressed)).isEqualTo(plain);
    }

    @Test
    @DisplayName("The native zstd library is usable")
    void createAndValidate_zstd() throws Exception {
        ICompressionCodec codec = CompressionCodecFactory.createAndValidate(
            config("compression { enabled = true, codec = zstd }"));

        assertThat(codec.getName()).isEqualTo("zstd");
    }
}
