package org.extractfx.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URL;
import java.util.Map;

/**
 * Applies the {@code logging} block of the configuration to Logback:
 * <pre>
 * logging {
 *   format = "PLAIN"          # PLAIN or JSON
 *   default-level = "WARN"    # root logger level
 *   levels {
 *     "org.extractfx.rewriter" = "DEBUG"
 *   }
 * }
 * </pre>
 * Both formats write to standard error; standard output is reserved for rewritten source.
 */
public final class LoggingConfigurator {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingConfigurator.class);

    /** Logback property naming the appender {@code logback.xml} attaches to the root logger. */
    public static final String FORMAT_PROPERTY = "extractfx.logging.format";

    private static final String LOGBACK_RESOURCE = "logback.xml";

    /** Output formats and the {@code logback.xml} appender that produces each. */
    enum LogFormat {
        PLAIN("STDERR_PLAIN"),
        JSON("STDERR_JSON");

        final String appender;

        LogFormat(String appender) {
            this.appender = appender;
        }

        static LogFormat parse(String name) {
            return "JSON".equalsIgnoreCase(name) ? JSON : PLAIN;
        }
    }

    private static volatile boolean applied = false;

    private LoggingConfigurator() {}

    /**
     * Applies the logging settings once per process; later calls do nothing until {@link #reset()}.
     *
     * @param config The application configuration. A missing {@code logging} block keeps the
     *               settings of {@code logback.xml}.
     */
    public static synchronized void configure(final Config config) {
        if (applied) {
            return;
        }
        applied = true;
        if (!config.hasPath("logging")) {
            LOG.debug("No logging block in configuration, keeping logback.xml settings.");
            return;
        }

        final Config logging = config.getConfig("logging");
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        try {
            if (logging.hasPath("format")) {
                selectFormat(LogFormat.parse(logging.getString("format")), context);
            }
        } catch (final JoranException e) {
            LOG.error("Could not reload {}; log format unchanged.", LOGBACK_RESOURCE, e);
        }
        if (logging.hasPath("default-level")) {
            context.getLogger(Logger.ROOT_LOGGER_NAME)
                    .setLevel(Level.toLevel(logging.getString("default-level"), Level.WARN));
        }
        if (logging.hasPath("levels")) {
            applyLevels(logging.getConfig("levels"), context);
        }
    }

    private static void selectFormat(final LogFormat format, final LoggerContext context) throws JoranException {
        if (format.appender.equals(context.getProperty(FORMAT_PROPERTY))) {
            return;
        }
        // logback.xml resolves the appender reference from this property when it is parsed.
        System.setProperty(FORMAT_PROPERTY, format.appender);
        final URL resource = LoggingConfigurator.class.getClassLoader().getResource(LOGBACK_RESOURCE);
        if (resource != null) {
            final JoranConfigurator joran = new JoranConfigurator();
            joran.setContext(context);
            context.reset();
            joran.doConfigure(resource);
        }
        context.putProperty(FORMAT_PROPERTY, format.appender);
        LOG.debug("Log format set to {}", format);
    }

    private static void applyLevels(final Config levels, final LoggerContext context) {
        for (final Map.Entry<String, ConfigValue> entry : levels.root().entrySet()) {
            final String value = String.valueOf(entry.getValue().unwrapped());
            final Level level = Level.toLevel(value, null);
            if (level == null) {
                LOG.warn("Ignoring unknown level '{}' for logger '{}'", value, entry.getKey());
                continue;
            }
            context.getLogger(entry.getKey()).setLevel(level);
        }
    }

    /**
     * Allows {@link #configure(Config)} to run again. Used by tests.
     */
    public static synchronized void reset() {
        applied = false;
    }
}
