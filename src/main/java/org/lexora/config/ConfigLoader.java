package org.lexora.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Responsible for loading the application configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    private static final String DEFAULT_RESOURCE_NAME = "lexora.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration with {@code lexora.conf} from the classpath as the application file.
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load() {
        return load(DEFAULT_RESOURCE_NAME);
    }

    /**
     * Loads the application configuration, respecting the precedence order:
     * 1. Java System Properties (e.g., -Dlexora.lexer.line-comments=true)
     * 2. The named configuration resource on the classpath
     * 3. Default values (from reference.conf on the classpath)
     *
     * @param resourceName The classpath resource holding the application configuration.
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load(final String resourceName) {
        final Config systemConfig = ConfigFactory.systemProperties();

        final Config resourceConfig = ConfigFactory.parseResources(resourceName);
        if (resourceConfig.isEmpty()) {
            LOG.warn("Configuration file '{}' not found or is empty. Using defaults.", resourceName);
        } else {
            LOG.info("Loaded configuration from resource: {}", resourceName);
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // Chain the configs together. The one provided first wins.
        final Config combinedConfig = systemConfig
            .withFallback(resourceConfig)
            .withFallback(defaultConfig);

        // Resolve all substitutions (e.g., ${?some_value}) within the configuration.
        return combinedConfig.resolve();
    }
}
