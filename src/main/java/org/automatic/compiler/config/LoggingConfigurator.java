package org.automatic.compiler.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies the {@code logging} block of the configuration to Logback at runtime.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * logging {
 *   default-level = "WARN"
 *   levels {
 *     "org.automatic.compiler" = "INFO"
 *   }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);
    private static final String LOGGING_CONFIG_PATH = "logging";
    private static final String DEFAULT_LEVEL_KEY = "default-level";
    private static final String LEVELS_KEY = "levels";

    private static boolean loggingConfigured = false;

    private LoggingConfigurator() {}

    /**
     * Configures the logging system. Calling it again has no effect until {@link #reset()}.
     *
     * @param config The configuration containing logging settings.
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

        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            LOGGER.warn("Logging backend is not Logback, ignoring logging configuration.");
            loggingConfigured = true;
            return;
        }

        final Config loggingConfig = config.getConfig(LOGGING_CONFIG_PATH);
        configureDefaultLevel(loggingConfig, context);
        configureSpecificLevels(loggingConfig, context);
        loggingConfigured = true;
        LOGGER.debug("Logging configuration applied successfully.");
    }

    private static void configureDefaultLevel(final Config loggingConfig, final LoggerContext context) {
        if (loggingConfig.hasPath(DEFAULT_LEVEL_KEY)) {
            final Level level = Level.toLevel(loggingConfig.getString(DEFAULT_LEVEL_KEY), Level.WARN);
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
            LOGGER.debug("Configured default log level: {}", level);
        }
    }

    private static void configureSpecificLevels(final Config loggingConfig, final LoggerContext context) {
        if (!loggingConfig.hasPath(LEVELS_KEY)) {
            return;
        }

        int configuredCount = 0;
        for (final Map.Entry<String, ConfigValue> entry : loggingConfig.getConfig(LEVELS_KEY).root().entrySet()) {
            final String loggerName = entry.getKey();
            final String levelName = entry.getValue().unwrapped().toString();
            final Level level = Level.toLevel(levelName, null);
            if (level == null) {
                LOGGER.warn("Unknown level '{}' for logger '{}', keeping its current level.", levelName, loggerName);
                continue;
            }
            context.getLogger(loggerName).setLevel(level);
            configuredCount++;
            LOGGER.debug("Configured logger '{}' to level: {}", loggerName, level);
        }
        LOGGER.debug("Configured {} specific logger levels.", configuredCount);
    }

    /**
     * Resets the configured state, so the next {@link #configure(Config)} applies again.
     */
    public static void reset() {
        loggingConfigured = false;
    }
}
