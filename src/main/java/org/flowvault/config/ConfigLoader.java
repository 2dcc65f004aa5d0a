package org.flowvault.config;

import java.io.File;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Loads the flowvault configuration.
 * <p>
 * Composes HOCON configuration from multiple sources with the following precedence
 * (highest to lowest):
 * <ol>
 *   <li>Java system properties ({@code -Dkey=value})</li>
 *   <li>Environment variables</li>
 *   <li>User configuration file (see {@link #resolve(File)})</li>
 *   <li>Default reference configuration ({@code reference.conf} on the classpath)</li>
 * </ol>
 * <p>
 * Uses {@link ConfigFactory#defaultReferenceUnresolved()} so that substitutions in
 * {@code reference.conf} see user overrides.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final String CONFIG_DIR = "config";
    private static final String CONFIG_FILE_NAME = "flowvault.conf";

    /** Path of the store options block. */
    public static final String STORE_PATH = "flowvault.store";

    private ConfigLoader() {
    }

    /**
     * Resolves configuration, looking for a user file in this order:
     * <ol>
     *   <li>the explicit file, if given</li>
     *   <li>the file named by the {@code -Dconfig.file} system property</li>
     *   <li>{@code config/flowvault.conf} in the working directory</li>
     * </ol>
     * Without any of them only classpath defaults are used.
     *
     * @param explicitConfigFile config file chosen by the caller, or {@code null} for discovery
     * @return the fully resolved configuration
     * @throws IllegalArgumentException            if an explicitly named file does not exist
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed or resolved
     */
    public static Config resolve(final File explicitConfigFile) {
        if (explicitConfigFile != null) {
            if (!explicitConfigFile.exists()) {
                throw new IllegalArgumentException(
                    "Configuration file not found: " + explicitConfigFile.getAbsolutePath());
            }
            log.info("Using configuration file {}", explicitConfigFile.getAbsolutePath());
            return loadFromFile(explicitConfigFile);
        }

        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            if (!systemConfigFile.exists()) {
                throw new IllegalArgumentException(
                    "Configuration file specified via -Dconfig.file not found: " + systemConfigFile.getAbsolutePath());
            }
            log.info("Using configuration file specified via -Dconfig.file: {}", systemConfigFile.getAbsolutePath());
            return loadFromFile(systemConfigFile);
        }

        final File cwdConfigFile = new File(CONFIG_DIR, CONFIG_FILE_NAME);
        if (cwdConfigFile.exists()) {
            log.info("Using configuration file found in current directory: {}", cwdConfigFile.getAbsolutePath());
            return loadFromFile(cwdConfigFile);
        }

        log.debug("No '{}/{}' found, using default configuration from classpath", CONFIG_DIR, CONFIG_FILE_NAME);
        return loadDefaults();
    }

    /**
     * Returns the store options block of a resolved configuration.
     *
     * @param config resolved configuration
     * @return the {@code flowvault.store} block
     */
    public static Config storeOptions(final Config config) {
        return config.getConfig(STORE_PATH);
    }

    static Config loadFromFile(final File configFile) {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.parseFile(configFile))
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    static Config loadDefaults() {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }
}
