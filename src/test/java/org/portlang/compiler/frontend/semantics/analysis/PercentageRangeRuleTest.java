package org.portlang.compiler.frontend.semantics.analysis;

import org.portlang.compiler.diagnostics.Diagnostic;
import org.portlang.compiler.diagnostics.DiagnosticsEngine;
import org.portlang.compiler.frontend.semantics.ValidationSettings;
import org.portlang.compiler.model.Allocation;
import org.portlang.compiler.model.AssetClass;
import org.portlang.compiler.model.Configuration;
import org.portlang.compiler.model.PortfolioDocument;
import org.portlang.compiler.model.RebalancePolicy;
import org.portlang.compiler.model.Restrictions;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class PercentageRangeRuleTest {

    private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();

    private void analyze(Allocation allocation) {
        PortfolioDocument document = new PortfolioDocument(
                Configuration.empty(), allocation, Restrictions.empty(), RebalancePolicy.empty());
        new PercentageRangeRule().analyze(document, ValidationSettings.defaults(), diagnostics);
    }

    @Test
    void boundsAreInclusive() {
        analyze(Allocation.builder().put(AssetClass.FIXED_INCOME, 100).put(AssetClass.REAL_ESTATE_FUNDS, 0).build());

        assertThat(diagnostics.getDiagnostics()).isEmpty();
    }

    @Test
    void eachViolationIsReported() {
        analyze(Allocation.builder()
                .put(AssetClass.INTERNATIONAL_EQUITIES, 150)
                .put(AssetClass.FIXED_INCOME, -50)
                .put(AssetClass.REAL_ESTATE_FUNDS, 100.5)
                .build());

        assertThat(diagnostics.getErrors()).extracting(Diagnostic::message).containsExactly(
                "Allocation ações_internacionais: 150% is outside [0, 100]",
                "Allocation renda_fixa: -50% is outside [0, 100]",
                "Allocation fundos_imobiliarios: 100.5% is outside [0, 100]");
    }
}
