package org.portlang.compiler.frontend.semantics.analysis;

import org.portlang.compiler.diagnostics.DiagnosticCode;
import org.portlang.compiler.diagnostics.DiagnosticsEngine;
import org.portlang.compiler.frontend.semantics.ValidationSettings;
import org.portlang.compiler.model.PortfolioDocument;
import org.portlang.compiler.model.Percentages;
import org.portlang.compiler.model.Restrictions;

/**
 * Checks the declared restriction limits against their admissible ranges.
 * Each limit is only checked when it is declared.
 */
public class RestrictionBoundsRule implements IValidationRule {

    @Override
    public void analyze(PortfolioDocument document, ValidationSettings settings, DiagnosticsEngine diagnostics) {
        Restrictions restrictions = document.restrictions();

        Double volatility = restrictions.maxVolatility();
        if (volatility != null && (volatility < 0 || volatility > settings.maxVolatilityLimit())) {
            diagnostics.report(DiagnosticCode.MAX_VOLATILITY_OUT_OF_RANGE,
                    "Invalid maximum volatility: " + Percentages.compact(volatility) + "%",
                    null,
                    "Use values between 0% and " + Percentages.compact(settings.maxVolatilityLimit()) + "%");
        }

        Double fee = restrictions.maxManagementFee();
        if (fee != null && (fee < 0 || fee > settings.maxManagementFeeLimit())) {
            diagnostics.report(DiagnosticCode.MAX_MANAGEMENT_FEE_OUT_OF_RANGE,
                    "Invalid maximum management fee: " + Percentages.compact(fee) + "%",
                    null,
                    "Use values between 0% and " + Percentages.compact(settings.maxManagementFeeLimit()) + "%");
        }
    }
}
