package org.automatic.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the compiler configuration from its sources, in precedence order.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** Name of the optional configuration file in the working directory. */
    public static final String CONFIG_FILE_NAME = "automatic.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration with the file looked up in the working directory.
     *
     * @return A resolved {@link Config} containing the merged configuration.
     */
    public static Config load() {
        return load(new File(CONFIG_FILE_NAME));
    }

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. System properties (e.g. {@code -Dautomatic.compiler.verbosity=3})
     * 2. The given configuration file, if it exists
     * 3. Default values from reference.conf on the classpath
     *
     * @param configFile The configuration file to merge in.
     * @return A resolved {@link Config} containing the merged configuration.
     */
    public static Config load(final File configFile) {
        final Config propertiesConfig = ConfigFactory.systemProperties();

        final Config fileConfig;
        if (configFile.exists() && !configFile.isDirectory()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            LOG.debug("Configuration file '{}' not found or is a directory. Skipping file-based configuration.", configFile.getPath());
            fileConfig = ConfigFactory.empty();
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // The one provided first wins.
        final Config combinedConfig = propertiesConfig
            .withFallback(fileConfig)
            .withFallback(defaultConfig);

        return combinedConfig.resolve();
    }
}
