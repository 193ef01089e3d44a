package org.portlang.compiler.frontend.semantics.analysis;

import org.portlang.compiler.diagnostics.DiagnosticsEngine;
import org.portlang.compiler.frontend.semantics.ValidationSettings;
import org.portlang.compiler.model.PortfolioDocument;

/**
 * Interface for the individual checks of semantic validation.
 * Rules are read-only: they report findings and never modify the document.
 */
@FunctionalInterface
public interface IValidationRule {
    /**
     * Checks a document.
     * @param document The document to check, never {@code null}.
     * @param settings The thresholds to apply.
     * @param diagnostics The engine for reporting findings.
     */
    void analyze(PortfolioDocument document, ValidationSettings settings, DiagnosticsEngine diagnostics);
}
