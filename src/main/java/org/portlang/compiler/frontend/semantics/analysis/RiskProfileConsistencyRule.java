package org.portlang.compiler.frontend.semantics.analysis;

import org.portlang.compiler.diagnostics.DiagnosticCode;
import org.portlang.compiler.diagnostics.DiagnosticsEngine;
import org.portlang.compiler.frontend.semantics.ValidationSettings;
import org.portlang.compiler.model.PortfolioDocument;
import org.portlang.compiler.model.Percentages;
import org.portlang.compiler.model.RiskProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Checks that the high-risk exposure of the allocation fits the declared risk profile.
 * <ul>
 *     <li>conservador: exposure above the conservative maximum is an error.</li>
 *     <li>moderado: exposure outside the moderate band is a warning.</li>
 *     <li>arrojado: exposure below the aggressive minimum is a warning.</li>
 * </ul>
 * A missing or blank profile is a warning; a profile outside the three known values is not checked.
 */
public class RiskProfileConsistencyRule implements IValidationRule {

    private static final Logger LOGGER = LoggerFactory.getLogger(RiskProfileConsistencyRule.class);

    @Override
    public void analyze(PortfolioDocument document, ValidationSettings settings, DiagnosticsEngine diagnostics) {
        String declared = document.configuration().riskProfile();
        if (declared == null || declared.isBlank()) {
            diagnostics.report(DiagnosticCode.MISSING_RISK_PROFILE,
                    "Risk profile not defined",
                    null,
                    "Set 'perfil' to \"conservador\", \"moderado\" or \"arrojado\"");
            return;
        }

        Optional<RiskProfile> profile = RiskProfile.fromLabel(declared);
        if (profile.isEmpty()) {
            LOGGER.debug("No exposure thresholds for risk profile '{}'", declared);
            return;
        }

        double exposure = document.allocation().riskExposure();
        String shown = Percentages.compact(exposure);
        switch (profile.get()) {
            case CONSERVATIVE -> {
                if (exposure > settings.conservativeMaxExposure()) {
                    diagnostics.report(DiagnosticCode.CONSERVATIVE_EXPOSURE_EXCEEDED,
                            "Conservative profile with " + shown + "% in high-risk assets",
                            null,
                            "Reduce equities and multi-market funds to at most "
                                    + Percentages.compact(settings.conservativeMaxExposure()) + "%");
                    return;
                }
            }
            case MODERATE -> {
                if (exposure < settings.moderateMinExposure() || exposure > settings.moderateMaxExposure()) {
                    diagnostics.report(DiagnosticCode.MODERATE_EXPOSURE_OUT_OF_BAND,
                            "Moderate profile with " + shown + "% in high-risk assets",
                            null,
                            "Keep high-risk exposure between " + Percentages.compact(settings.moderateMinExposure())
                                    + "% and " + Percentages.compact(settings.moderateMaxExposure()) + "% for a moderate profile");
                    return;
                }
            }
            case AGGRESSIVE -> {
                if (exposure < settings.aggressiveMinExposure()) {
                    diagnostics.report(DiagnosticCode.AGGRESSIVE_EXPOSURE_TOO_LOW,
                            "Aggressive profile with only " + shown + "% in high-risk assets",
                            null,
                            "Consider raising high-risk exposure to at least "
                                    + Percentages.compact(settings.aggressiveMinExposure()) + "%");
                    return;
                }
            }
        }
        LOGGER.debug("Risk profile '{}' matches high-risk exposure of {}%", declared, shown);
    }
}
