package org.olympiac.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies the {@code logging} block of the configuration to Logback:
 * <pre>
 * logging {
 *   default-level = WARN
 *   levels { "org.olympiac.compiler.frontend.parser" = DEBUG }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private LoggingConfigurator() {}

    /**
     * Sets the root level and the per-logger levels found in the configuration.
     * Missing keys leave the levels of {@code logback.xml} untouched.
     * @param config The resolved configuration.
     */
    public static void configure(Config config) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        if (config.hasPath("logging.default-level")) {
            context.getLogger(Logger.ROOT_LOGGER_NAME)
                    .setLevel(Level.toLevel(config.getString("logging.default-level"), Level.WARN));
        }
        if (config.hasPath("logging.levels")) {
            for (Map.Entry<String, ConfigValue> entry : config.getObject("logging.levels").entrySet()) {
                String loggerName = entry.getKey();
                String level = String.valueOf(entry.getValue().unwrapped());
                context.getLogger(loggerName).setLevel(Level.toLevel(level, Level.INFO));
            }
        }
    }
}
