package org.mapforge.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the compiler configuration from its layered sources.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    static final String CONFIG_FILE_NAME = "mapforge.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration using {@code mapforge.conf} in the working directory, if present.
     *
     * @return the resolved configuration.
     */
    public static Config load() {
        return load(null);
    }

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. Environment Variables
     * 2. System Properties (-Dkey=value)
     * 3. Configuration file (the given one, else mapforge.conf in the working directory)
     * 4. Default values (reference.conf on the classpath)
     *
     * @param configFile an explicit configuration file, or {@code null}.
     * @return A resolved {@link Config} containing the merged configuration.
     * @throws com.typesafe.config.ConfigException if a file cannot be parsed.
     */
    public static Config load(final File configFile) {
        final Config envConfig = ConfigFactory.systemEnvironment();
        final Config cliConfig = ConfigFactory.systemProperties();

        final File file = configFile != null ? configFile : new File(CONFIG_FILE_NAME);
        final Config fileConfig;
        if (file.isFile()) {
            LOG.info("Loading configuration from file: {}", file.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(file);
        } else {
            if (configFile != null) {
                LOG.warn("Configuration file '{}' not found, using defaults.", file.getPath());
            } else {
                LOG.debug("No '{}' in the working directory, using defaults.", file.getPath());
            }
            fileConfig = ConfigFactory.empty();
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // The one provided first wins.
        return envConfig
            .withFallback(cliConfig)
            .withFallback(fileConfig)
            .withFallback(defaultConfig)
            .resolve();
    }
}
