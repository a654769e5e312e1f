package org.depscope.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigUtil;
import com.typesafe.config.ConfigValue;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies logger levels from the {@code logging.levels} block to Logback:
 * <pre>
 * logging.levels {
 *   "org.depscope.source" = DEBUG
 * }
 * </pre>
 * Does nothing when SLF4J is bound to a different backend.
 */
public final class LoggingConfigurator {

    private static final Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

    static final String LEVELS_PATH = "logging.levels";

    private LoggingConfigurator() {}

    public static void configure(final Config config) {
        if (!config.hasPath(LEVELS_PATH)) {
            return;
        }
        // Flattened entries, so both quoted ("a.b" = X) and nested (a.b = X) logger names work.
        for (Map.Entry<String, ConfigValue> entry : config.getConfig(LEVELS_PATH).entrySet()) {
            String loggerName = String.join(".", ConfigUtil.splitPath(entry.getKey()));
            setLevel(loggerName, String.valueOf(entry.getValue().unwrapped()));
        }
    }

    /**
     * @param loggerName Logger name, or {@code ROOT}.
     * @param levelName  Logback level name; unknown names fall back to {@code DEBUG}.
     */
    public static void setLevel(final String loggerName, final String levelName) {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext)) {
            return;
        }
        LoggerContext context = (LoggerContext) factory;
        Level level = Level.toLevel(levelName, Level.DEBUG);
        context.getLogger(loggerName).setLevel(level);
        log.debug("Logger '{}' set to {}", loggerName, level);
    }
}
