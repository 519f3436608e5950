package org.rgen.node.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies the {@code logging} block of the HOCON configuration to Logback at runtime.
 *
 * <pre>
 * logging {
 *   format = "PLAIN"        # PLAIN or DETAILED
 *   default-level = "INFO"  # root logger level
 *   levels {
 *     "org.rgen.runtime.World" = "DEBUG"
 *   }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);
    private static final String LOGGING_CONFIG_PATH = "logging";
    private static final String FORMAT_KEY = "format";
    private static final String DEFAULT_LEVEL_KEY = "default-level";
    private static final String LEVELS_KEY = "levels";

    static final String CONSOLE_APPENDER = "STDOUT";
    static final String DETAILED_PATTERN = "%d{HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n";

    private static boolean loggingConfigured = false;

    private LoggingConfigurator() {
    }

    /**
     * Configures logging from the given configuration. Later calls have no effect until {@link #reset()}.
     */
    public static void configure(final Config config) {
        if (loggingConfigured) {
            LOGGER.debug("Logging already configured, skipping.");
            return;
        }
        if (!config.hasPath(LOGGING_CONFIG_PATH)) {
            LOGGER.debug("No logging configuration found, using Logback defaults.");
            loggingConfigured = true;
            return;
        }
        try {
            final Config loggingConfig = config.getConfig(LOGGING_CONFIG_PATH);
            final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
            configureFormat(loggingConfig, context);
            configureDefaultLevel(loggingConfig, context);
            configureSpecificLevels(loggingConfig, context);
            LOGGER.debug("Logging configuration applied.");
        } catch (final RuntimeException e) {
            LOGGER.error("Failed to configure logging, using Logback defaults.", e);
        }
        loggingConfigured = true;
    }

    private static void configureFormat(final Config loggingConfig, final LoggerContext context) {
        final String format = loggingConfig.hasPath(FORMAT_KEY) ? loggingConfig.getString(FORMAT_KEY) : "PLAIN";
        if (!"DETAILED".equalsIgnoreCase(format)) {
            return;
        }
        final Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);

        final PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(DETAILED_PATTERN);
        encoder.start();

        final ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName(CONSOLE_APPENDER);
        appender.setEncoder(encoder);
        appender.start();

        root.detachAppender(CONSOLE_APPENDER);
        root.addAppender(appender);
        LOGGER.debug("Configured logging format: DETAILED");
    }

    private static void configureDefaultLevel(final Config loggingConfig, final LoggerContext context) {
        if (loggingConfig.hasPath(DEFAULT_LEVEL_KEY)) {
            final Level level = Level.toLevel(loggingConfig.getString(DEFAULT_LEVEL_KEY), Level.INFO);
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
            LOGGER.debug("Configured default log level: {}", level);
        }
    }

    private static void configureSpecificLevels(final Config loggingConfig, final LoggerContext context) {
        if (!loggingConfig.hasPath(LEVELS_KEY)) {
            return;
        }
        final Config levelsConfig = loggingConfig.getConfig(LEVELS_KEY);
        int configuredCount = 0;
        for (final Map.Entry<String, ConfigValue> entry : levelsConfig.root().entrySet()) {
            // Quoted keys keep dotted logger names as a single key.
            final String loggerName = entry.getKey();
            final String levelName = String.valueOf(entry.getValue().unwrapped());
            final Level level = Level.toLevel(levelName, null);
            if (level == null) {
                LOGGER.warn("Ignoring unknown level '{}' for logger '{}'", levelName, loggerName);
                continue;
            }
            context.getLogger(loggerName).setLevel(level);
            configuredCount++;
        }
        LOGGER.debug("Configured {} specific logger levels.", configuredCount);
    }

    /**
     * Allows {@link #configure(Config)} to run again. Used by tests.
     */
    public static void reset() {
        loggingConfigured = false;
    }
}
