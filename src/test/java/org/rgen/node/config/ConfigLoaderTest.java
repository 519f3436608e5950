package org.rgen.node.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.rgen.runtime.SimulationParameters;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Verifies the layering of system properties, configuration file and reference defaults.
 */
@Tag("unit")
class ConfigLoaderTest {

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("test.value");
        System.clearProperty("rgen.simulation.seed");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("Resource values override reference defaults, other defaults remain")
    void loadResource_layersOverDefaults() {
        Config config = ConfigLoader.loadResource("org/rgen/node/config/test-config.conf");

        assertEquals(7, config.getLong("rgen.simulation.seed"));
        assertEquals("Testmarch", config.getString("rgen.simulation.world-name"));
        assertEquals(6, config.getInt("rgen.simulation.location-count"));
        assertEquals("file-value", config.getString("test.value"));
        assertEquals(250, SimulationParameters.fromConfig(config).historyCapacity());
    }

    @Test
    @DisplayName("System properties override the configuration file")
    void loadResource_systemPropertyWins() {
        System.setProperty("test.value", "system-value");
        System.setProperty("rgen.simulation.seed", "99");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadResource("org/rgen/node/config/test-config.conf");

        assertEquals("system-value", config.getString("test.value"));
        assertEquals("file-priority", config.getString("test.priority"));
        assertEquals(99, config.getLong("rgen.simulation.seed"));
    }

    @Test
    @DisplayName("An explicit configuration file is read from disk")
    void load_readsExplicitFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("custom.conf");
        Files.writeString(file, "rgen.simulation.world-name = \"Fromfile\"\nrgen.behavior.memory-capacity = 5\n");

        Config config = ConfigLoader.load(file);

        assertEquals("Fromfile", config.getString("rgen.simulation.world-name"));
        assertEquals(5, SimulationParameters.fromConfig(config).behavior().memoryCapacity());
    }

    @Test
    @DisplayName("Without a file the reference defaults are complete")
    void load_defaultsAreComplete() {
        Config config = ConfigLoader.load();

        assertTrue(config.hasPath("rgen.persistence.format"));
        assertEquals(1000, SimulationParameters.fromConfig(config).historyCapacity());
    }

    @Test
    @DisplayName("A missing or malformed explicit file is rejected")
    void load_rejectsMissingOrMalformedFile(@TempDir Path dir) throws Exception {
        assertThrows(IllegalArgumentException.class, () -> ConfigLoader.load(dir.resolve("absent.conf")));

        Path broken = dir.resolve("broken.conf");
        Files.writeString(broken, "rgen { simulation { seed = ");
        assertThrows(IllegalArgumentException.class, () -> ConfigLoader.load(broken));
        assertThrows(IllegalArgumentException.class, () -> ConfigLoader.loadResource("org/rgen/node/config/none.conf"));
    }
}
