package org.portlang.compiler.api;

import org.portlang.compiler.diagnostics.Diagnostic;
import org.portlang.compiler.diagnostics.DiagnosticFormatter;
import org.portlang.compiler.model.PortfolioDocument;
import org.portlang.report.RenderedReport;

import java.util.List;

/**
 * The outcome of one compilation.
 *
 * @param document The parsed document, or {@code null} if the source was structurally unusable.
 * @param diagnostics All diagnostics, errors first, then warnings, then infos.
 * @param report The rendered report, or {@code null} if none was produced.
 */
public record CompilationResult(PortfolioDocument document, List<Diagnostic> diagnostics, RenderedReport report) {

    public CompilationResult {
        diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return {@code true} if any diagnostic has severity {@link Diagnostic.Severity#ERROR}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.severity() == Diagnostic.Severity.ERROR);
    }

    public boolean hasDocument() {
        return document != null;
    }

    public boolean hasReport() {
        return report != null;
    }

    public List<Diagnostic> errors() {
        return ofSeverity(Diagnostic.Severity.ERROR);
    }

    public List<Diagnostic> warnings() {
        return ofSeverity(Diagnostic.Severity.WARNING);
    }

    /**
     * @return A human-readable listing of all diagnostics, grouped by severity.
     */
    public String summary() {
        return DiagnosticFormatter.format(diagnostics);
    }

    private List<Diagnostic> ofSeverity(Diagnostic.Severity severity) {
        return diagnostics.stream().filter(d -> d.severity() == severity).toList();
    }
}
