package org.tabula.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigOriginFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Responsible for loading the checker configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    private static final String CONFIG_FILE_NAME = "tabula.conf";
    private static final String CONFIG_FILE_PROPERTY = "config.file";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration without an explicit configuration file.
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load() {
        return load(null);
    }

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. Environment Variables
     * 2. Java System Properties (e.g., -Dtabula.indent.size=2)
     * 3. Configuration File: the explicit file if given, else the file named by
     *    {@code -Dconfig.file}, else tabula.conf in the working directory
     * 4. Default values (from reference.conf on the classpath)
     *
     * @param explicitConfigFile A configuration file chosen on the command line, or null.
     * @return A resolved {@link Config} object containing the merged configuration.
     * @throws ConfigException.IO if an explicitly chosen file does not exist.
     */
    public static Config load(final File explicitConfigFile) {
        // 1. Environment Variables (highest precedence).
        final Config envConfig = ConfigFactory.systemEnvironment();

        // 2. System properties passed as -Dkey=value.
        final Config propertiesConfig = ConfigFactory.systemProperties();

        // 3. Configuration file from the filesystem.
        final Config fileConfig = loadFile(explicitConfigFile);

        // 4. Default values from reference.conf in the classpath (lowest precedence).
        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // Chain the configs together. The one provided first wins.
        final Config combinedConfig = envConfig
            .withFallback(propertiesConfig)
            .withFallback(fileConfig)
            .withFallback(defaultConfig);

        // Resolve all substitutions (e.g., ${?some_value}) within the configuration.
        return combinedConfig.resolve();
    }

    private static Config loadFile(final File explicitConfigFile) {
        if (explicitConfigFile != null) {
            if (!explicitConfigFile.isFile()) {
                throw new ConfigException.IO(ConfigOriginFactory.newFile(explicitConfigFile.getPath()), "Configuration file not found");
            }
            LOG.info("Loading configuration from file: {}", explicitConfigFile.getAbsolutePath());
            return ConfigFactory.parseFile(explicitConfigFile);
        }

        final String propertyFile = System.getProperty(CONFIG_FILE_PROPERTY);
        final File configFile = propertyFile != null ? new File(propertyFile) : new File(CONFIG_FILE_NAME);
        if (configFile.exists() && !configFile.isDirectory()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            return ConfigFactory.parseFile(configFile);
        }
        LOG.debug("Configuration file '{}' not found or is a directory. Skipping file-based configuration.", configFile.getPath());
        return ConfigFactory.empty();
    }
}
