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
class RestrictionBoundsRuleTest {

    private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();

    private void analyze(Restrictions restrictions, ValidationSettings settings) {
        PortfolioDocument document = new PortfolioDocument(Configuration.empty(),
                Allocation.builder().put(AssetClass.FIXED_INCOME, 100).build(), restrictions, RebalancePolicy.empty());
        new RestrictionBoundsRule().analyze(document, settings, diagnostics);
    }

    @Test
    void absentRestrictionsAreNotChecked() {
        analyze(Restrictions.empty(), ValidationSettings.defaults());

        assertThat(diagnostics.getDiagnostics()).isEmpty();
    }

    @Test
    void boundariesAreAccepted() {
        analyze(new Restrictions(50.0, 0.0), ValidationSettings.defaults());
        analyze(new Restrictions(0.0, 5.0), ValidationSettings.defaults());

        assertThat(diagnostics.getDiagnostics()).isEmpty();
    }

    @Test
    void eachOutOfRangeLimitIsReportedIndependently() {
        analyze(new Restrictions(50.5, null), ValidationSettings.defaults());
        analyze(new Restrictions(null, 5.01), ValidationSettings.defaults());

        assertThat(diagnostics.getErrors()).extracting(Diagnostic::code).containsExactly("SEM013", "SEM018");
        assertThat(diagnostics.getErrors().get(0).suggestion()).isEqualTo("Use values between 0% and 50%");
        assertThat(diagnostics.getErrors().get(1).suggestion()).isEqualTo("Use values between 0% and 5%");
    }

    @Test
    void limitsComeFromSettings() {
        ValidationSettings strict = new ValidationSettings(0.01, 30, 20, 70, 50, 20, 2);

        analyze(new Restrictions(25.0, 3.0), strict);

        assertThat(diagnostics.getErrors()).extracting(Diagnostic::code).containsExactly("SEM013", "SEM018");
    }
}
