package org.portlang.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * Tests for the LoggingConfigurator class. Format switches are applied to a private
 * {@link LoggerContext} so that the test run's own logging stays untouched.
 */
@Tag("unit")
class LoggingConfiguratorTest {

    private static final String PARSER_LOGGER = "org.portlang.compiler.frontend.parser";

    private final LoggerContext context = new LoggerContext();

    @AfterEach
    void tearDown() {
        context.stop();
    }

    @Test
    void apply_withJsonFormat_shouldReloadWithJsonAppender() {
        // Given
        LoggingSettings settings = new LoggingSettings(LoggingSettings.Format.JSON, Level.INFO, Map.of());

        // When
        LoggingConfigurator.apply(settings, context);

        // Then
        ch.qos.logback.classic.Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        assertEquals("STDOUT", context.getProperty(LoggingConfigurator.FORMAT_PROPERTY));
        assertNotNull(root.getAppender("STDOUT"));
        assertNull(root.getAppender("STDOUT_PLAIN"));
        assertEquals(Level.INFO, root.getLevel());
    }

    @Test
    void apply_switchingBackToPlain_shouldReplaceAppender() {
        LoggingConfigurator.apply(new LoggingSettings(LoggingSettings.Format.JSON, Level.WARN, Map.of()), context);
        LoggingConfigurator.apply(LoggingSettings.defaults(), context);

        ch.qos.logback.classic.Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        assertNotNull(root.getAppender("STDOUT_PLAIN"));
        assertNull(root.getAppender("STDOUT"));
    }

    @Test
    void apply_withSpecificLevels_shouldSetLoggerLevelsAfterReload() {
        // Given
        LoggingSettings settings = new LoggingSettings(LoggingSettings.Format.JSON, Level.ERROR,
                Map.of(PARSER_LOGGER, Level.DEBUG));

        // When
        LoggingConfigurator.apply(settings, context);

        // Then
        assertEquals(Level.DEBUG, context.getLogger(PARSER_LOGGER).getLevel());
        assertEquals(Level.ERROR, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
    }

    @Test
    void configure_withoutLoggingBlock_shouldLeaveActiveContextUntouched() {
        LoggerContext active = (LoggerContext) LoggerFactory.getILoggerFactory();
        Level rootLevel = active.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();

        LoggingConfigurator.configure(ConfigFactory.empty());

        assertEquals(rootLevel, active.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
        assertNull(active.getLogger(PARSER_LOGGER).getLevel());
    }
}
