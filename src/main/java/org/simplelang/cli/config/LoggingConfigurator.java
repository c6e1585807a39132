package org.simplelang.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigUtil;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies the {@code logging} section of the configuration to Logback.
 * <p>
 * {@code logging.level} sets the root level; {@code logging.loggers} maps logger names
 * to levels. Dotted names may be written nested or quoted, so
 * {@code org.simplelang.compiler = DEBUG} and {@code "org.simplelang.compiler" = DEBUG}
 * configure the same logger.
 */
public final class LoggingConfigurator {

    private LoggingConfigurator() {
    }

    /**
     * @param config The application configuration.
     * @throws IllegalArgumentException if a level is not a Logback level name.
     */
    public static void configure(Config config) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        if (config.hasPath("logging.level")) {
            Level level = parseLevel("logging.level", config.getString("logging.level"));
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
        }
        if (config.hasPath("logging.loggers")) {
            Config loggers = config.getConfig("logging.loggers");
            for (Map.Entry<String, ConfigValue> entry : loggers.entrySet()) {
                String loggerName = String.join(".", ConfigUtil.splitPath(entry.getKey()));
                String value = String.valueOf(entry.getValue().unwrapped());
                context.getLogger(loggerName).setLevel(parseLevel("logging.loggers." + entry.getKey(), value));
            }
        }
    }

    private static Level parseLevel(String path, String value) {
        Level level = Level.toLevel(value, null);
        if (level == null) {
            throw new IllegalArgumentException("Unknown log level '" + value + "' at " + path);
        }
        return level;
    }
}
