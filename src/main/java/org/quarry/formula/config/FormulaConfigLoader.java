package org.quarry.formula.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the formula engine configuration from various sources.
 * The loader respects a specific precedence order so that embedding applications can tune the engine
 * without code changes.
 */
public final class FormulaConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(FormulaConfigLoader.class);
    static final String CONFIG_FILE_NAME = "formula.conf";

    private FormulaConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration, looking for {@code formula.conf} in the working directory.
     * @return A resolved {@link Config} object containing the merged configuration.
     * @see #load(String)
     */
    public static Config load() {
        return load(CONFIG_FILE_NAME);
    }

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. Java System Properties (e.g., -Dformula.parser.cache-size=0)
     * 2. Configuration file (a path on the filesystem, or else a classpath resource of that name)
     * 3. Default values (from reference.conf on the classpath)
     *
     * @param configPath The configuration file to layer over the defaults.
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load(final String configPath) {
        // 1. System properties (highest precedence).
        final Config systemConfig = ConfigFactory.systemProperties();

        // 2. Configuration file from the filesystem, falling back to the classpath.
        final Config fileConfig = loadFile(configPath);

        // 3. Default values from reference.conf on the classpath (lowest precedence).
        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // The one provided first wins.
        return systemConfig
            .withFallback(fileConfig)
            .withFallback(defaultConfig)
            .resolve();
    }

    private static Config loadFile(final String configPath) {
        final File configFile = new File(configPath);
        if (configFile.isFile()) {
            LOG.info("Loading formula configuration from file: {}", configFile.getAbsolutePath());
            return ConfigFactory.parseFile(configFile);
        }
        final Config resourceConfig = ConfigFactory.parseResources(configPath);
        if (resourceConfig.isEmpty()) {
            LOG.debug("Configuration file '{}' not found or is empty. Using defaults.", configPath);
        } else {
            LOG.info("Loading formula configuration from classpath resource: {}", configPath);
        }
        return resourceConfig;
    }
}
