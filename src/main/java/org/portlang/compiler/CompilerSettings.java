package org.portlang.compiler;

import com.typesafe.config.Config;
import org.portlang.compiler.frontend.semantics.ValidationSettings;
import org.portlang.report.ReportFormat;

import java.nio.file.Path;

/**
 * Settings of a compiler run: validation thresholds and the report options.
 * <pre>
 * portlang {
 *   validation { ... }
 *   report { enabled = true, format = PDF, output-directory = "." }
 * }
 * </pre>
 *
 * @param validation The validation thresholds.
 * @param reportEnabled Whether a report is rendered for valid portfolios.
 * @param reportFormat The format reports are rendered in.
 * @param reportDirectory The directory reports are written to.
 */
public record CompilerSettings(ValidationSettings validation, boolean reportEnabled, ReportFormat reportFormat,
                               Path reportDirectory) {

    private static final String REPORT_PATH = "portlang.report";

    /**
     * Reads the settings from the {@code portlang} block, falling back to defaults for missing keys.
     * @param config The application configuration.
     * @return The settings.
     */
    public static CompilerSettings fromConfig(Config config) {
        boolean enabled = true;
        ReportFormat format = ReportFormat.PDF;
        Path directory = Path.of(".");
        if (config.hasPath(REPORT_PATH)) {
            Config report = config.getConfig(REPORT_PATH);
            if (report.hasPath("enabled")) {
                enabled = report.getBoolean("enabled");
            }
            if (report.hasPath("format")) {
                format = report.getEnum(ReportFormat.class, "format");
            }
            if (report.hasPath("output-directory")) {
                directory = Path.of(report.getString("output-directory"));
            }
        }
        return new CompilerSettings(ValidationSettings.fromConfig(config), enabled, format, directory);
    }

    public CompilerSettings withReportEnabled(boolean enabled) {
        return new CompilerSettings(validation, enabled, reportFormat, reportDirectory);
    }

    public CompilerSettings withReportFormat(ReportFormat format) {
        return new CompilerSettings(validation, reportEnabled, format, reportDirectory);
    }

    public CompilerSettings withReportDirectory(Path directory) {
        return new CompilerSettings(validation, reportEnabled, reportFormat, directory);
    }
}
