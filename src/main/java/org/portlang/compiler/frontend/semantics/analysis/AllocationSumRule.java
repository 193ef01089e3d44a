package org.portlang.compiler.frontend.semantics.analysis;

import org.portlang.compiler.diagnostics.DiagnosticCode;
import org.portlang.compiler.diagnostics.DiagnosticsEngine;
import org.portlang.compiler.frontend.semantics.ValidationSettings;
import org.portlang.compiler.model.Allocation;
import org.portlang.compiler.model.PortfolioDocument;
import org.portlang.compiler.model.Percentages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks that an allocation exists and that its percentages add up to 100%,
 * within the configured tolerance.
 */
public class AllocationSumRule implements IValidationRule {

    private static final Logger LOGGER = LoggerFactory.getLogger(AllocationSumRule.class);
    private static final double TARGET = 100.0;

    @Override
    public void analyze(PortfolioDocument document, ValidationSettings settings, DiagnosticsEngine diagnostics) {
        Allocation allocation = document.allocation();
        if (allocation.isEmpty()) {
            diagnostics.report(DiagnosticCode.EMPTY_ALLOCATION,
                    "No asset allocation defined",
                    null,
                    "Add at least one asset class to the 'alocação' section");
            return;
        }

        double total = allocation.total();
        if (Math.abs(total - TARGET) <= settings.sumTolerance()) {
            LOGGER.debug("Allocation sum check passed: {}%", Percentages.compact(total));
            return;
        }

        if (total > TARGET) {
            diagnostics.report(DiagnosticCode.ALLOCATION_EXCEEDS_TOTAL,
                    "Allocation total is " + Percentages.compact(total) + "%, exceeds 100%",
                    null,
                    "Reduce the allocations by " + Percentages.fixed(total - TARGET) + "%");
        } else {
            String missing = Percentages.fixed(TARGET - total);
            diagnostics.report(DiagnosticCode.ALLOCATION_BELOW_TOTAL,
                    "Allocation total is " + Percentages.compact(total) + "%, missing " + missing + "%",
                    null,
                    "Add " + missing + "% to other asset classes");
        }
    }
}
