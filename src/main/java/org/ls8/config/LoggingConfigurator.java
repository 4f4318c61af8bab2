package org.ls8.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the {@code logging} block of the configuration to Logback:
 * <pre>
 * logging {
 *   default-level = "WARN"
 *   levels { "org.ls8.runtime.ExecutionEngine" = "DEBUG" }
 * }
 * </pre>
 * Levels are applied once per process; later calls are ignored until {@link #reset()}.
 */
public final class LoggingConfigurator {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingConfigurator.class);
    private static final String ROOT_PATH = "logging";
    private static final String DEFAULT_LEVEL_KEY = "default-level";
    private static final String LEVELS_KEY = "levels";

    private static boolean applied = false;

    private LoggingConfigurator() {}

    /**
     * Sets the root level and the per-logger levels. Unknown level names are skipped with a warning.
     *
     * @param config the resolved application configuration.
     */
    public static void configure(final Config config) {
        if (applied) {
            return;
        }
        applied = true;
        if (!config.hasPath(ROOT_PATH)) {
            return;
        }

        final Config logging = config.getConfig(ROOT_PATH);
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        if (logging.hasPath(DEFAULT_LEVEL_KEY)) {
            applyLevel(context, Logger.ROOT_LOGGER_NAME, logging.getString(DEFAULT_LEVEL_KEY));
        }
        if (logging.hasPath(LEVELS_KEY)) {
            logging.getObject(LEVELS_KEY).forEach((loggerName, value) ->
                    applyLevel(context, loggerName, String.valueOf(value.unwrapped())));
        }
    }

    private static void applyLevel(final LoggerContext context, final String loggerName, final String levelName) {
        final Level level = Level.toLevel(levelName, null);
        if (level == null) {
            LOG.warn("Ignoring unknown level '{}' for logger '{}'", levelName, loggerName);
            return;
        }
        context.getLogger(loggerName).setLevel(level);
        LOG.debug("Logger '{}' set to {}", loggerName, level);
    }

    /**
     * Allows the next {@link #configure(Config)} call to apply levels again. Intended for tests.
     */
    public static void reset() {
        applied = false;
    }
}
