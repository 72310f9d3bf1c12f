package org.lexora.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Applies the {@code lexora.logging} block of a configuration to Logback at runtime, so the
 * per-token TRACE output of the lexer can be switched on without editing {@code logback.xml}.
 *
 * <pre>
 * lexora.logging {
 *   default-level = "WARN"   # root logger, left untouched when absent
 *   levels {
 *     "org.lexora.tokenizer.lexer.Lexer" = "TRACE"
 *   }
 * }
 * </pre>
 *
 * Every call applies the block again. Unknown level names are skipped with a warning.
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOG = LoggerFactory.getLogger(LoggingConfigurator.class);

    /** The configuration path of the logging block. */
    public static final String LOGGING_PATH = "lexora.logging";

    private LoggingConfigurator() {}

    /**
     * Sets the logger levels named in the {@code lexora.logging} block.
     * @param config The loaded application configuration.
     * @return The levels that were set, keyed by logger name ({@code ROOT} for the default level).
     */
    public static Map<String, Level> apply(final Config config) {
        if (!config.hasPath(LOGGING_PATH)) {
            LOG.debug("No {} block, keeping the Logback levels.", LOGGING_PATH);
            return Map.of();
        }
        final Config logging = config.getConfig(LOGGING_PATH);
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        final Map<String, Level> applied = new LinkedHashMap<>();

        if (logging.hasPath("default-level")) {
            setLevel(context, Logger.ROOT_LOGGER_NAME, logging.getString("default-level"), applied);
        }
        if (logging.hasPath("levels")) {
            // Quoted keys such as "org.lexora.Foo" are single entries of the object, not nested paths.
            logging.getObject("levels").forEach((loggerName, value) ->
                    setLevel(context, loggerName, String.valueOf(value.unwrapped()), applied));
        }

        LOG.debug("Applied {} logger level(s) from {}", applied.size(), LOGGING_PATH);
        return Collections.unmodifiableMap(applied);
    }

    private static void setLevel(LoggerContext context, String loggerName, String levelName, Map<String, Level> applied) {
        final Level level = Level.toLevel(levelName, null);
        if (level == null) {
            LOG.warn("Ignoring unknown log level '{}' for logger '{}'", levelName, loggerName);
            return;
        }
        context.getLogger(loggerName).setLevel(level);
        applied.put(loggerName, level);
    }
}
