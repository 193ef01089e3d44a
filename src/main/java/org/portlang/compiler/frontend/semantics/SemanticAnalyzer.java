package org.portlang.compiler.frontend.semantics;

import org.portlang.compiler.diagnostics.DiagnosticCode;
import org.portlang.compiler.diagnostics.DiagnosticsEngine;
import org.portlang.compiler.frontend.semantics.analysis.AllocationSumRule;
import org.portlang.compiler.frontend.semantics.analysis.IValidationRule;
import org.portlang.compiler.frontend.semantics.analysis.PercentageRangeRule;
import org.portlang.compiler.frontend.semantics.analysis.RestrictionBoundsRule;
import org.portlang.compiler.frontend.semantics.analysis.RiskProfileConsistencyRule;
import org.portlang.compiler.model.PortfolioDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Performs semantic validation of a parsed {@link PortfolioDocument}. It runs an ordered
 * battery of domain rules, each independently of the outcome of the others:
 * <ol>
 *     <li>allocation presence and sum</li>
 *     <li>per-asset percentage range</li>
 *     <li>risk profile consistency</li>
 *     <li>restriction bounds</li>
 * </ol>
 * Validation is a read-only pass over the document.
 */
public class SemanticAnalyzer {

    private static final Logger LOGGER = LoggerFactory.getLogger(SemanticAnalyzer.class);

    private final DiagnosticsEngine diagnostics;
    private final ValidationSettings settings;
    private final List<IValidationRule> rules;

    /**
     * Constructs a new semantic analyzer with the default thresholds.
     * @param diagnostics The diagnostics engine for reporting findings.
     */
    public SemanticAnalyzer(DiagnosticsEngine diagnostics) {
        this(diagnostics, ValidationSettings.defaults());
    }

    /**
     * Constructs a new semantic analyzer.
     * @param diagnostics The diagnostics engine for reporting findings.
     * @param settings The thresholds to apply.
     */
    public SemanticAnalyzer(DiagnosticsEngine diagnostics, ValidationSettings settings) {
        this.diagnostics = diagnostics;
        this.settings = settings;
        this.rules = List.of(
                new AllocationSumRule(),
                new PercentageRangeRule(),
                new RiskProfileConsistencyRule(),
                new RestrictionBoundsRule());
    }

    /**
     * Validates the given document.
     *
     * @param document The document to validate, or {@code null} if parsing produced none.
     * @return {@code true} if validation raised no error. Warnings and infos never fail validation,
     *         and errors reported by earlier stages are not counted.
     */
    public boolean validate(PortfolioDocument document) {
        if (document == null) {
            diagnostics.report(DiagnosticCode.MISSING_DOCUMENT,
                    "Portfolio data is invalid or missing",
                    null,
                    null);
            return false;
        }

        int errorsBefore = diagnostics.errorCount();
        for (IValidationRule rule : rules) {
            rule.analyze(document, settings, diagnostics);
        }
        int raised = diagnostics.errorCount() - errorsBefore;
        LOGGER.debug("Semantic validation finished with {} error(s)", raised);
        return raised == 0;
    }
}
