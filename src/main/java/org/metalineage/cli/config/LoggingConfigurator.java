package org.metalineage.cli.config;

import java.util.Map;

import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;

/**
 * Applies log levels from configuration to Logback.
 * <pre>
 * logging {
 *   default-level = INFO
 *   levels {
 *     "org.metalineage.pipeline.alignment" = DEBUG
 *   }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private LoggingConfigurator() {
    }

    public static void configure(Config config) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        if (config.hasPath("logging.default-level")) {
            Level level = Level.toLevel(config.getString("logging.default-level"), Level.INFO);
            context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).setLevel(level);
        }
        if (config.hasPath("logging.levels")) {
            for (Map.Entry<String, ConfigValue> entry : config.getObject("logging.levels").entrySet()) {
                // Logger names must be quoted, otherwise HOCON splits them into nested objects
                if (entry.getValue().valueType() != ConfigValueType.STRING) {
                    continue;
                }
                Logger logger = context.getLogger(unquote(entry.getKey()));
                logger.setLevel(Level.toLevel((String) entry.getValue().unwrapped(), Level.INFO));
            }
        }
    }

    private static String unquote(String key) {
        return key.length() > 1 && key.startsWith("\"") && key.endsWith("\"")
                ? key.substring(1, key.length() - 1) : key;
    }
}
