package org.rtlgraph.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigObject;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies log levels from the {@code logging} section:
 * <pre>
 * logging {
 *   default-level = "WARN"
 *   levels { "org.rtlgraph.builder" = "DEBUG" }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private LoggingConfigurator() {
    }

    /**
     * Sets the root level and the per-logger levels. Unknown level names fall back to INFO.
     *
     * @param config the resolved application configuration.
     */
    public static void configure(Config config) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        if (config.hasPath("logging.default-level")) {
            context.getLogger(Logger.ROOT_LOGGER_NAME)
                    .setLevel(Level.toLevel(config.getString("logging.default-level"), Level.INFO));
        }
        if (config.hasPath("logging.levels")) {
            ConfigObject levels = config.getObject("logging.levels");
            for (Map.Entry<String, Object> entry : levels.unwrapped().entrySet()) {
                context.getLogger(entry.getKey()).setLevel(Level.toLevel(String.valueOf(entry.getValue()), Level.INFO));
            }
        }
    }
}
