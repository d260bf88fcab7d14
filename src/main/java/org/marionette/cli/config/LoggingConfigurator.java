package org.marionette.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;

/**
 * Applies the {@code logging} block of the marionette configuration to Logback.
 * <p>
 * marionette only ever logs to stderr, because stdout carries the rendered catalog.
 * {@code format} chooses between the two stderr appenders declared in {@code logback.xml}:
 * {@code PLAIN} prints the level and the message, {@code DETAILED} adds the timestamp, thread
 * and logger name. {@code default-level} sets the root logger and {@code levels} overrides
 * single loggers:
 * <pre>
 * logging {
 *   format = "PLAIN"
 *   default-level = "WARN"
 *   levels { "org.marionette.compiler" = "DEBUG" }
 * }
 * </pre>
 * The first call wins; later calls are ignored until {@link #reset()}.
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);

    /** Context and system property read by {@code logback.xml} to pick the stderr appender. */
    static final String FORMAT_PROPERTY = "marionette.logging.format";

    private static boolean applied = false;

    /**
     * The two stderr layouts and the Logback appender behind each.
     */
    enum Format {
        PLAIN("STDERR_PLAIN"),
        DETAILED("STDERR");

        private final String appender;

        Format(String appender) {
            this.appender = appender;
        }

        static Format fromName(String name) {
            try {
                return valueOf(name.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                LOGGER.warn("Unknown logging format '{}', using PLAIN", name);
                return PLAIN;
            }
        }
    }

    private LoggingConfigurator() {}

    /**
     * Applies the {@code logging} block of {@code config}, if it has one.
     *
     * @param config The merged application configuration.
     */
    public static synchronized void configure(final Config config) {
        if (applied) {
            return;
        }
        applied = true;
        if (!config.hasPath("logging")) {
            LOGGER.debug("No logging block, keeping logback.xml settings");
            return;
        }

        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        try {
            final Config logging = config.getConfig("logging");
            selectAppender(logging, context);
            if (logging.hasPath("default-level")) {
                final Level root = Level.toLevel(logging.getString("default-level"), Level.WARN);
                context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(root);
            }
            if (logging.hasPath("levels")) {
                applyLoggerLevels(logging.getConfig("levels"), context);
            }
        } catch (final ConfigException e) {
            LOGGER.error("Invalid logging configuration, keeping logback.xml settings", e);
        }
    }

    private static void selectAppender(final Config logging, final LoggerContext context) {
        final Format format = logging.hasPath("format") ? Format.fromName(logging.getString("format")) : Format.PLAIN;
        context.putProperty(FORMAT_PROPERTY, format.appender);
        System.setProperty(FORMAT_PROPERTY, format.appender);
    }

    private static void applyLoggerLevels(final Config levels, final LoggerContext context) {
        for (final Map.Entry<String, ConfigValue> entry : levels.root().entrySet()) {
            final String name = String.valueOf(entry.getValue().unwrapped());
            final Level level = Level.toLevel(name, null);
            if (level == null) {
                LOGGER.warn("Ignoring unknown log level '{}' for logger '{}'", name, entry.getKey());
            } else {
                context.getLogger(entry.getKey()).setLevel(level);
            }
        }
    }

    /**
     * Allows the next {@link #configure(Config)} call to apply its settings again.
     */
    public static synchronized void reset() {
        applied = false;
    }
}
