package org.loctrace.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Tuning options of a {@link org.loctrace.ir.context.LocationContext}, read from the
 * {@code loctrace.context} block of the configuration.
 *
 * @param initialCapacity       Initial capacity of the interning tables.
 * @param logStatisticsOnClose  Whether closing a context logs its statistics at INFO level.
 */
public record LocationContextOptions(int initialCapacity, boolean logStatisticsOnClose) {

    /** Configuration path of the context block. */
    public static final String CONFIG_PATH = "loctrace.context";

    public LocationContextOptions {
        if (initialCapacity < 1) {
            throw new IllegalArgumentException("initial-capacity must be positive, was " + initialCapacity);
        }
    }

    /**
     * Maps the {@value #CONFIG_PATH} block of a resolved configuration.
     *
     * @param config The resolved configuration.
     * @return The options.
     */
    public static LocationContextOptions fromConfig(Config config) {
        Config context = config.getConfig(CONFIG_PATH);
        return new LocationContextOptions(
                context.getInt("initial-capacity"),
                context.getBoolean("log-statistics-on-close"));
    }

    /**
     * @return The options defined by {@code reference.conf}.
     */
    public static LocationContextOptions defaults() {
        return Defaults.INSTANCE;
    }

    private static final class Defaults {
        private static final LocationContextOptions INSTANCE =
                fromConfig(ConfigFactory.parseResources("reference.conf").resolve());
    }
}
