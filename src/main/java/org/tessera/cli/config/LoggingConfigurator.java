package org.tessera.cli.config;

import java.util.Map;

import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;

/**
 * Applies log levels from the {@code logging} config block to Logback.
 * <pre>
 * logging {
 *   default-level = INFO
 *   levels {
 *     "org.tessera.mosaic" = DEBUG
 *   }
 * }
 * </pre>
 * Unknown level names fall back to DEBUG, as {@link Level#toLevel(String)} does.
 */
public final class LoggingConfigurator {

    private LoggingConfigurator() {
    }

    public static void configure(Config config) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        if (config.hasPath("logging.default-level")) {
            context.getLogger(Logger.ROOT_LOGGER_NAME)
                .setLevel(Level.toLevel(config.getString("logging.default-level"), Level.INFO));
        }
        if (config.hasPath("logging.levels")) {
            for (Map.Entry<String, ConfigValue> entry : config.getObject("logging.levels").entrySet()) {
                String loggerName = entry.getKey();
                String level = String.valueOf(entry.getValue().unwrapped());
                context.getLogger(loggerName).setLevel(Level.toLevel(level));
            }
        }
    }
}
