package org.ls8.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Builds the simulator configuration from layered HOCON sources.
 * <p>
 * Layers, highest precedence first:
 * <ol>
 *   <li>system properties, e.g. {@code -Dls8.trace=true}</li>
 *   <li>environment variables</li>
 *   <li>the file passed with {@code --config}, if any</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    private static final String DEFAULTS_RESOURCE = "reference.conf";

    private ConfigLoader() {}

    /**
     * Loads and resolves the layered configuration.
     *
     * @param configFile an optional HOCON file, or {@code null} to run on defaults.
     * @return the resolved configuration.
     */
    public static Config load(final File configFile) {
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(userLayer(configFile))
                .withFallback(ConfigFactory.parseResources(DEFAULTS_RESOURCE))
                .resolve();
    }

    private static Config userLayer(final File configFile) {
        if (configFile == null) {
            return ConfigFactory.empty();
        }
        if (!configFile.isFile()) {
            LOG.warn("Configuration file '{}' not found or is a directory. Using defaults.", configFile.getPath());
            return ConfigFactory.empty();
        }
        LOG.info("Using configuration file {}", configFile.getAbsolutePath());
        return ConfigFactory.parseFile(configFile);
    }
}
