package org.portlang.report;

import org.portlang.compiler.frontend.semantics.ValidationSettings;

import java.time.Clock;

/**
 * The output formats a report can be rendered in.
 */
public enum ReportFormat {
    PDF("pdf"),
    TEXT("txt");

    private final String extension;

    ReportFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    /**
     * Creates a renderer for this format.
     *
     * @param clock The clock providing the generation timestamp.
     * @param settings The thresholds used by the analysis and recommendations.
     * @return A new renderer.
     */
    public IReportRenderer createRenderer(Clock clock, ValidationSettings settings) {
        return switch (this) {
            case PDF -> new PdfReportRenderer(clock, settings);
            case TEXT -> new TextReportRenderer(clock, settings);
        };
    }
}
