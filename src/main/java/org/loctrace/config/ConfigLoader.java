package org.loctrace.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Responsible for loading the library configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** Name of the configuration file looked up by {@link #load()}. */
    public static final String DEFAULT_CONFIG_FILE = "loctrace.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration using {@value #DEFAULT_CONFIG_FILE} as the configuration file.
     *
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load() {
        return load(DEFAULT_CONFIG_FILE);
    }

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. System Properties (e.g., -Dloctrace.context.initial-capacity=1024)
     * 2. Environment Variables
     * 3. Configuration File (from the working directory, or else from the classpath)
     * 4. Default values (from reference.conf on the classpath)
     *
     * @param configFile Path of the configuration file.
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load(final String configFile) {
        final Config cliConfig = ConfigFactory.systemProperties();

        // Maps variables like 'CONFIG_FORCE_loctrace_context_initial__capacity' to 'loctrace.context.initial-capacity'.
        final Config envConfig = ConfigFactory.systemEnvironmentOverrides();

        final Config fileConfig = loadFile(configFile);

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // The one provided first wins.
        final Config combinedConfig = cliConfig
            .withFallback(envConfig)
            .withFallback(fileConfig)
            .withFallback(defaultConfig);

        return combinedConfig.resolve();
    }

    private static Config loadFile(final String configFile) {
        final File file = new File(configFile);
        if (file.isFile()) {
            LOG.info("Loading configuration from file: {}", file.getAbsolutePath());
            return ConfigFactory.parseFile(file);
        }
        final Config resourceConfig = ConfigFactory.parseResources(configFile);
        if (!resourceConfig.isEmpty()) {
            LOG.info("Loading configuration from classpath resource: {}", configFile);
            return resourceConfig;
        }
        LOG.info("Configuration file '{}' not found or is empty. Using defaults.", configFile);
        return ConfigFactory.empty();
    }
}
