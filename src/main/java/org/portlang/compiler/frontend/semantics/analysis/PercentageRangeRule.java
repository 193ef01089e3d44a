package org.portlang.compiler.frontend.semantics.analysis;

import org.portlang.compiler.diagnostics.DiagnosticCode;
import org.portlang.compiler.diagnostics.DiagnosticsEngine;
import org.portlang.compiler.frontend.semantics.ValidationSettings;
import org.portlang.compiler.model.AssetClass;
import org.portlang.compiler.model.PortfolioDocument;
import org.portlang.compiler.model.Percentages;

import java.util.Map;

/**
 * Checks that every allocated percentage lies in [0, 100]. Each violation is reported
 * on its own, regardless of the outcome of the sum check.
 */
public class PercentageRangeRule implements IValidationRule {

    @Override
    public void analyze(PortfolioDocument document, ValidationSettings settings, DiagnosticsEngine diagnostics) {
        for (Map.Entry<AssetClass, Double> entry : document.allocation().percentages().entrySet()) {
            double percentage = entry.getValue();
            if (percentage < 0 || percentage > 100) {
                diagnostics.report(DiagnosticCode.PERCENTAGE_OUT_OF_RANGE,
                        "Allocation " + entry.getKey().keyword() + ": " + Percentages.compact(percentage)
                                + "% is outside [0, 100]",
                        null,
                        "Use percentages between 0% and 100%");
            }
        }
    }
}
