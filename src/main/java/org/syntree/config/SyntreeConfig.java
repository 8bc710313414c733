package org.syntree.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the library configuration from its sources, in this order of precedence:
 * <ol>
 *     <li>Environment variables</li>
 *     <li>Java system properties, e.g. {@code -Dsyntree.traversal.max-depth=500}</li>
 *     <li>The configuration file, {@code syntree.conf} in the working directory by default</li>
 *     <li>Default values from {@code reference.conf} on the classpath</li>
 * </ol>
 */
public final class SyntreeConfig {

    private static final Logger LOG = LoggerFactory.getLogger(SyntreeConfig.class);
    private static final String CONFIG_FILE_NAME = "syntree.conf";

    private SyntreeConfig() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration using {@code syntree.conf} in the working directory.
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load() {
        return load(new File(CONFIG_FILE_NAME));
    }

    /**
     * Loads the configuration using the given configuration file.
     * @param configFile The file; skipped if it does not exist.
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load(final File configFile) {
        final Config envConfig = ConfigFactory.systemEnvironment();
        final Config propertiesConfig = ConfigFactory.systemProperties();

        final Config fileConfig;
        if (configFile.exists() && !configFile.isDirectory()) {
            LOG.debug("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            LOG.debug("Configuration file '{}' not found, using defaults.", configFile.getPath());
            fileConfig = ConfigFactory.empty();
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // The one provided first wins.
        return envConfig
            .withFallback(propertiesConfig)
            .withFallback(fileConfig)
            .withFallback(defaultConfig)
            .resolve();
    }
}
