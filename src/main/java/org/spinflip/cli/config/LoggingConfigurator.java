package org.spinflip.cli.config;

import java.util.Map;

import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigUtil;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;

/**
 * Applies the {@code logging.levels} configuration block to Logback.
 * <p>
 * Keys are logger names ({@code ROOT} for the root logger), values are level names.
 * Dotted names may be quoted or not:
 * <pre>
 * logging.levels {
 *   ROOT = WARN
 *   "org.spinflip.runtime" = DEBUG
 *   org.spinflip.cli = INFO
 * }
 * </pre>
 * Entries whose value is not a known level name are skipped with a warning.
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOG = LoggerFactory.getLogger(LoggingConfigurator.class);

    private LoggingConfigurator() {
    }

    /**
     * @param config The application configuration. A missing {@code logging.levels} block is ignored.
     */
    public static void configure(Config config) {
        if (!config.hasPath("logging.levels")) {
            return;
        }
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        // entrySet() flattens nested objects, so unquoted dotted keys arrive as full paths
        for (Map.Entry<String, ConfigValue> entry : config.getConfig("logging.levels").entrySet()) {
            String loggerName = String.join(".", ConfigUtil.splitPath(entry.getKey()));
            ConfigValue value = entry.getValue();
            if (value.valueType() != ConfigValueType.STRING) {
                LOG.warn("Ignoring log level for '{}': expected a level name but got {}",
                        loggerName, value.render());
                continue;
            }
            String levelName = (String) value.unwrapped();
            Level level = Level.toLevel(levelName, null);
            if (level == null) {
                LOG.warn("Ignoring unknown log level '{}' for '{}'", levelName, loggerName);
                continue;
            }
            Logger logger = "ROOT".equalsIgnoreCase(loggerName)
                    ? context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME)
                    : context.getLogger(loggerName);
            logger.setLevel(level);
        }
    }
}
