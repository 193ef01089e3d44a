package org.portlang.compiler;

import org.portlang.compiler.api.CompilationResult;
import org.portlang.compiler.api.ICompiler;
import org.portlang.compiler.diagnostics.DiagnosticCode;
import org.portlang.compiler.diagnostics.DiagnosticsEngine;
import org.portlang.compiler.frontend.lexer.Lexer;
import org.portlang.compiler.frontend.lexer.Token;
import org.portlang.compiler.frontend.parser.Parser;
import org.portlang.compiler.frontend.semantics.SemanticAnalyzer;
import org.portlang.compiler.frontend.semantics.ValidationSettings;
import org.portlang.compiler.model.PortfolioDocument;
import org.portlang.report.IReportRenderer;
import org.portlang.report.RenderedReport;
import org.portlang.report.ReportGenerationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * The main compiler implementation. It runs the pipeline lexer, parser and semantic analyzer
 * over one source text and collects every finding into a {@link CompilationResult}.
 * <p>
 * Each call uses a fresh {@link DiagnosticsEngine}, so instances hold no per-run state and
 * compiling the same source twice yields equal results.
 */
public class Compiler implements ICompiler {

    private static final Logger LOGGER = LoggerFactory.getLogger(Compiler.class);

    private final ValidationSettings settings;
    private final IReportRenderer reportRenderer;

    /**
     * Creates a compiler with default thresholds and no report renderer.
     */
    public Compiler() {
        this(ValidationSettings.defaults(), null);
    }

    /**
     * @param settings The validation thresholds.
     * @param reportRenderer The renderer used by {@link #compileAndRender(String)}, or {@code null} if none is available.
     */
    public Compiler(ValidationSettings settings, IReportRenderer reportRenderer) {
        this.settings = settings;
        this.reportRenderer = reportRenderer;
    }

    public Optional<IReportRenderer> getReportRenderer() {
        return Optional.ofNullable(reportRenderer);
    }

    @Override
    public CompilationResult compile(String source) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        PortfolioDocument document = runPipeline(source, diagnostics);
        return new CompilationResult(document, diagnostics.getDiagnostics(), null);
    }

    /**
     * Compiles the source and, when it has no errors, renders a report for it.
     * <p>
     * A missing renderer adds {@link DiagnosticCode#RENDERER_UNAVAILABLE}; a failing one adds
     * {@link DiagnosticCode#REPORT_GENERATION_FAILED}. A source with errors is never rendered.
     *
     * @param source The portfolio source.
     * @return The compilation result, carrying the report if one was rendered.
     */
    public CompilationResult compileAndRender(String source) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        PortfolioDocument document = runPipeline(source, diagnostics);
        if (diagnostics.hasErrors()) {
            LOGGER.debug("Skipping report rendering, source has {} error(s)", diagnostics.errorCount());
            return new CompilationResult(document, diagnostics.getDiagnostics(), null);
        }

        RenderedReport report = null;
        if (reportRenderer == null) {
            diagnostics.report(DiagnosticCode.RENDERER_UNAVAILABLE,
                    "No report renderer available",
                    null,
                    "Construct the compiler with a report renderer");
        } else {
            try {
                report = reportRenderer.render(document);
            } catch (ReportGenerationException e) {
                LOGGER.warn("Report rendering failed: {}", e.getMessage(), e);
                diagnostics.report(DiagnosticCode.REPORT_GENERATION_FAILED,
                        "Report generation failed: " + e.getMessage(),
                        null,
                        null);
            }
        }
        return new CompilationResult(document, diagnostics.getDiagnostics(), report);
    }

    private PortfolioDocument runPipeline(String source, DiagnosticsEngine diagnostics) {
        // Phase 1: Lexing
        Lexer lexer = new Lexer(source == null ? "" : source, diagnostics);
        List<Token> tokens = lexer.scanTokens();

        // Phase 2: Parsing
        Parser parser = new Parser(tokens, diagnostics);
        PortfolioDocument document = parser.parse();

        // Phase 3: Semantic validation
        SemanticAnalyzer analyzer = new SemanticAnalyzer(diagnostics, settings);
        boolean valid = analyzer.validate(document);

        LOGGER.debug("Compilation finished: document={}, valid={}, errors={}, warnings={}",
                document != null, valid, diagnostics.errorCount(), diagnostics.getWarnings().size());
        return document;
    }
}
