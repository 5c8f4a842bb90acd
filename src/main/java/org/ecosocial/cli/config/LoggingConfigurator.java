package org.ecosocial.cli.config;

import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;

/**
 * Applies the {@code logging} block of the configuration to Logback.
 * <pre>
 * logging {
 *   format = "PLAIN"           # PLAIN or COLOR
 *   default-level = "INFO"     # root logger
 *   levels { "org.ecosocial.runtime" = "DEBUG" }
 * }
 * </pre>
 * Applied at most once per JVM until {@link #reset()} is called.
 */
public final class LoggingConfigurator {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingConfigurator.class);

    /** System and context property read by {@code logback.xml} to pick the console appender. */
    public static final String FORMAT_PROPERTY = "ecosocial.logging.format";

    private static final AtomicBoolean APPLIED = new AtomicBoolean();

    private LoggingConfigurator() {
    }

    /**
     * Applies format, root level and per-logger levels. Later calls are ignored.
     *
     * @param config the full application configuration
     */
    public static void configure(final Config config) {
        configure(config, appender -> { });
    }

    /**
     * Applies format, root level and per-logger levels. Later calls are ignored.
     * <p>
     * When {@code logging.format} is set, {@code appenderSwitch} receives the chosen appender
     * name before any level is applied. It only runs on the call that applies the settings.
     *
     * @param config the full application configuration
     * @param appenderSwitch activates the named console appender, e.g. by reloading {@code logback.xml}
     * @return {@code true} if this call applied the settings
     */
    public static boolean configure(final Config config, final Consumer<String> appenderSwitch) {
        if (!APPLIED.compareAndSet(false, true)) {
            LOG.debug("Logging settings were applied before, ignoring");
            return false;
        }
        if (!config.hasPath("logging")) {
            LOG.debug("No logging block, keeping Logback defaults");
            return true;
        }
        final Config logging = config.getConfig("logging");
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

        final String appender = appenderFor(logging.hasPath("format") ? logging.getString("format") : null);
        System.setProperty(FORMAT_PROPERTY, appender);
        if (logging.hasPath("format")) {
            appenderSwitch.accept(appender);
        }
        // A reload resets the context, so the property and levels go in afterwards
        context.putProperty(FORMAT_PROPERTY, appender);

        if (logging.hasPath("default-level")) {
            final Level rootLevel = Level.toLevel(logging.getString("default-level"), Level.INFO);
            context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).setLevel(rootLevel);
        }
        if (logging.hasPath("levels")) {
            for (final Map.Entry<String, ConfigValue> entry : logging.getConfig("levels").root().entrySet()) {
                applyLevel(context, entry.getKey(), String.valueOf(entry.getValue().unwrapped()));
            }
        }
        LOG.debug("Logging settings applied: appender={}", appender);
        return true;
    }

    private static void applyLevel(final LoggerContext context, final String loggerName, final String levelName) {
        final Level level = Level.toLevel(levelName, null);
        if (level == null) {
            LOG.warn("Ignoring unknown log level '{}' for logger '{}'", levelName, loggerName);
            return;
        }
        context.getLogger(loggerName).setLevel(level);
    }

    /**
     * Maps a {@code logging.format} value to the name of the console appender in {@code logback.xml}.
     *
     * @param format {@code PLAIN}, {@code COLOR} or {@code null}
     * @return {@code STDOUT_PLAIN} for null or PLAIN, {@code STDOUT} otherwise
     */
    public static String appenderFor(final String format) {
        return format == null || "PLAIN".equalsIgnoreCase(format) ? "STDOUT_PLAIN" : "STDOUT";
    }

    /**
     * Allows the next {@link #configure(Config)} call to apply its settings again.
     */
    public static void reset() {
        APPLIED.set(false);
    }
}
