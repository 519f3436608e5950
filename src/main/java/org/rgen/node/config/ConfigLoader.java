package org.rgen.node.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.file.Path;

/**
 * Loads the application configuration from various sources.
 * <p>
 * Precedence, highest first:
 * <ol>
 *   <li>Environment variables</li>
 *   <li>Java system properties ({@code -Dkey=value})</li>
 *   <li>A configuration file, {@code rgen.conf} in the working directory unless one is given</li>
 *   <li>Defaults from {@code reference.conf} on the classpath</li>
 * </ol>
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    public static final String CONFIG_FILE_NAME = "rgen.conf";

    private ConfigLoader() {
    }

    /**
     * Loads the configuration using {@code rgen.conf} from the working directory if present.
     */
    public static Config load() {
        return load((Path) null);
    }

    /**
     * Loads the configuration with an explicit file in place of {@code rgen.conf}.
     *
     * @param configFile the file, or null to look for {@code rgen.conf} in the working directory.
     * @throws IllegalArgumentException if an explicitly given file does not exist or cannot be parsed.
     */
    public static Config load(Path configFile) {
        final Config fileConfig;
        if (configFile != null) {
            File file = configFile.toFile();
            if (!file.isFile()) {
                throw new IllegalArgumentException("Configuration file not found: " + file.getAbsolutePath());
            }
            fileConfig = parseFile(file);
        } else {
            File file = new File(CONFIG_FILE_NAME);
            if (file.isFile()) {
                fileConfig = parseFile(file);
            } else {
                LOG.debug("Configuration file '{}' not found, using defaults", file.getPath());
                fileConfig = ConfigFactory.empty();
            }
        }
        return layer(fileConfig, ConfigFactory.parseResources("reference.conf"));
    }

    /**
     * Loads the configuration with a classpath resource in place of the file layer.
     */
    public static Config loadResource(String resource) {
        Config resourceConfig = ConfigFactory.parseResources(resource);
        if (resourceConfig.isEmpty()) {
            throw new IllegalArgumentException("Configuration resource not found or empty: " + resource);
        }
        return layer(resourceConfig, ConfigFactory.parseResources("reference.conf"));
    }

    private static Config parseFile(File file) {
        LOG.info("Loading configuration from file: {}", file.getAbsolutePath());
        try {
            return ConfigFactory.parseFile(file);
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid configuration file " + file + ": " + e.getMessage(), e);
        }
    }

    private static Config layer(Config fileConfig, Config defaults) {
        // The one provided first wins.
        return ConfigFactory.systemEnvironment()
            .withFallback(ConfigFactory.systemProperties())
            .withFallback(fileConfig)
            .withFallback(defaults)
            .resolve();
    }
}
