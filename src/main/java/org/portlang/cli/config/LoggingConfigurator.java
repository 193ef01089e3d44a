package org.portlang.cli.config;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.typesafe.config.Config;
import org.slf4j.LoggerFactory;

import java.net.URL;

/**
 * Applies {@link LoggingSettings} to a Logback context.
 * <p>
 * The output format is chosen by reloading {@value #LOGBACK_RESOURCE} with the
 * {@value #FORMAT_PROPERTY} property set to the appender of the format; the reload only happens
 * when the root logger is not already attached to that appender. Levels are set afterwards, so
 * they survive the reload.
 */
public final class LoggingConfigurator {

    /** Context property naming the root appender in {@code logback.xml}. */
    public static final String FORMAT_PROPERTY = "portlang.logging.format";
    static final String LOGBACK_RESOURCE = "logback.xml";

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);

    private LoggingConfigurator() {}

    /**
     * Applies the {@code logging} block to the active Logback context. Does nothing if the block is absent.
     *
     * @param config The application configuration.
     * @throws com.typesafe.config.ConfigException.BadValue if the block names an unknown format or level.
     */
    public static void configure(Config config) {
        if (!config.hasPath(LoggingSettings.CONFIG_PATH)) {
            LOGGER.debug("No logging configuration found, keeping the Logback defaults");
            return;
        }
        apply(LoggingSettings.fromConfig(config), (LoggerContext) LoggerFactory.getILoggerFactory());
    }

    static void apply(LoggingSettings settings, LoggerContext context) {
        String appender = settings.format().appenderName();
        if (context.getLogger(Logger.ROOT_LOGGER_NAME).getAppender(appender) == null) {
            reload(context, appender);
        }
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(settings.defaultLevel());
        settings.levels().forEach((name, level) -> context.getLogger(name).setLevel(level));
        LOGGER.debug("Logging set to {} output at {}, {} logger override(s)",
                settings.format(), settings.defaultLevel(), settings.levels().size());
    }

    private static void reload(LoggerContext context, String appender) {
        URL resource = LoggingConfigurator.class.getClassLoader().getResource(LOGBACK_RESOURCE);
        if (resource == null) {
            LOGGER.warn("Cannot switch log output to {}: {} not found on the classpath", appender, LOGBACK_RESOURCE);
            return;
        }
        context.reset();
        // reset() clears the context properties, so the format has to be set afterwards
        context.putProperty(FORMAT_PROPERTY, appender);
        JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        try {
            configurator.doConfigure(resource);
        } catch (JoranException e) {
            throw new IllegalStateException("Cannot reload " + resource, e);
        }
    }
}
