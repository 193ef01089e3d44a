package org.portlang.report;

import org.portlang.compiler.frontend.semantics.ValidationSettings;
import org.portlang.compiler.model.Allocation;
import org.portlang.compiler.model.AssetClass;
import org.portlang.compiler.model.PortfolioDocument;
import org.portlang.compiler.model.RiskProfile;

import java.util.Optional;

/**
 * Summary figures of a portfolio's allocation, as shown in the analysis section of a report.
 *
 * @param assetClassCount The number of allocated asset classes.
 * @param totalAllocated The sum of all percentages.
 * @param riskExposure The sum of the high-risk percentages.
 * @param conservativeExposure The sum of the fixed income and real estate fund percentages.
 * @param largestAllocation The largest single percentage, or 0 for an empty allocation.
 * @param allocationComplete Whether the total is 100% within the sum tolerance.
 * @param profileCompatible Whether the risk exposure fits the declared risk profile.
 */
public record PortfolioMetrics(
        int assetClassCount,
        double totalAllocated,
        double riskExposure,
        double conservativeExposure,
        double largestAllocation,
        boolean allocationComplete,
        boolean profileCompatible
) {

    /**
     * A three-step rating used for diversification and exposure figures.
     */
    public enum Rating {
        LOW("Low"),
        MEDIUM("Medium"),
        MODERATE("Moderate"),
        HIGH("High");

        private final String label;

        Rating(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    /**
     * Computes the metrics of a document.
     *
     * @param document The portfolio.
     * @param settings The thresholds used for the completeness and profile checks.
     * @return The metrics.
     */
    public static PortfolioMetrics of(PortfolioDocument document, ValidationSettings settings) {
        Allocation allocation = document.allocation();
        double total = allocation.total();
        double risk = allocation.riskExposure();
        double conservative = allocation.percentageOf(AssetClass.FIXED_INCOME)
                + allocation.percentageOf(AssetClass.REAL_ESTATE_FUNDS);
        double largest = 0;
        for (double p : allocation.percentages().values()) {
            largest = Math.max(largest, p);
        }
        boolean complete = Math.abs(total - 100.0) <= settings.sumTolerance();
        Optional<RiskProfile> profile = RiskProfile.fromLabel(document.configuration().riskProfile());
        boolean compatible = profile.map(p -> fits(p, risk, settings)).orElse(false);
        return new PortfolioMetrics(allocation.size(), total, risk, conservative, largest, complete, compatible);
    }

    private static boolean fits(RiskProfile profile, double exposure, ValidationSettings settings) {
        return switch (profile) {
            case CONSERVATIVE -> exposure <= settings.conservativeMaxExposure();
            case MODERATE -> exposure >= settings.moderateMinExposure() && exposure <= settings.moderateMaxExposure();
            case AGGRESSIVE -> exposure >= settings.aggressiveMinExposure();
        };
    }

    /**
     * @return High for four or more classes, Medium for two or three, Low otherwise.
     */
    public Rating diversificationRating() {
        if (assetClassCount >= 4) {
            return Rating.HIGH;
        }
        return assetClassCount >= 2 ? Rating.MEDIUM : Rating.LOW;
    }

    public Rating riskExposureRating() {
        return exposureRating(riskExposure);
    }

    public Rating conservativeExposureRating() {
        return exposureRating(conservativeExposure);
    }

    static Rating exposureRating(double exposure) {
        if (exposure > 60) {
            return Rating.HIGH;
        }
        return exposure > 30 ? Rating.MODERATE : Rating.LOW;
    }
}
