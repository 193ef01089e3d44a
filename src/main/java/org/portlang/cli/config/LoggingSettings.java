package org.portlang.cli.config;

import ch.qos.logback.classic.Level;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigUtil;
import com.typesafe.config.ConfigValue;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * The validated {@code logging} block of the configuration.
 * <pre>
 * logging {
 *   format = "PLAIN"          # PLAIN or JSON
 *   default-level = "WARN"
 *   levels {
 *     "org.portlang.compiler.frontend.parser" = "DEBUG"
 *   }
 * }
 * </pre>
 * Logger names under {@code levels} may be quoted or written as plain dotted paths.
 *
 * @param format The console output format.
 * @param defaultLevel The level of the root logger.
 * @param levels Levels of individual loggers, by logger name.
 */
public record LoggingSettings(Format format, Level defaultLevel, Map<String, Level> levels) {

    public static final String CONFIG_PATH = "logging";

    /**
     * Console output formats, each backed by an appender declared in {@code logback.xml}.
     */
    public enum Format {
        PLAIN("STDOUT_PLAIN"),
        JSON("STDOUT");

        private final String appenderName;

        Format(String appenderName) {
            this.appenderName = appenderName;
        }

        public String appenderName() {
            return appenderName;
        }
    }

    public LoggingSettings {
        levels = Map.copyOf(levels);
    }

    public static LoggingSettings defaults() {
        return new LoggingSettings(Format.PLAIN, Level.WARN, Map.of());
    }

    /**
     * Reads the {@value #CONFIG_PATH} block, falling back to {@link #defaults()} for missing keys.
     *
     * @param config The application configuration.
     * @return The settings.
     * @throws ConfigException.BadValue if a format or level name is not recognized.
     */
    public static LoggingSettings fromConfig(Config config) {
        if (!config.hasPath(CONFIG_PATH)) {
            return defaults();
        }
        Config logging = config.getConfig(CONFIG_PATH);
        Format format = logging.hasPath("format") ? format(logging, "format") : Format.PLAIN;
        Level defaultLevel = logging.hasPath("default-level")
                ? level(logging, "default-level", logging.getString("default-level"))
                : Level.WARN;

        Map<String, Level> levels = new LinkedHashMap<>();
        if (logging.hasPath("levels")) {
            Config byLogger = logging.getConfig("levels");
            for (Map.Entry<String, ConfigValue> entry : byLogger.entrySet()) {
                String loggerName = String.join(".", ConfigUtil.splitPath(entry.getKey()));
                levels.put(loggerName, level(byLogger, entry.getKey(), String.valueOf(entry.getValue().unwrapped())));
            }
        }
        return new LoggingSettings(format, defaultLevel, levels);
    }

    private static Format format(Config logging, String path) {
        String name = logging.getString(path);
        try {
            return Format.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigException.BadValue(logging.origin(), path, "unknown logging format '" + name + "', use PLAIN or JSON");
        }
    }

    private static Level level(Config config, String path, String name) {
        // toLevel falls back to DEBUG for unknown names unless given a default
        Level level = Level.toLevel(name.trim(), null);
        if (level == null) {
            throw new ConfigException.BadValue(config.origin(), path, "unknown log level '" + name + "'");
        }
        return level;
    }
}
