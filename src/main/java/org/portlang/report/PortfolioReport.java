package org.portlang.report;

import org.portlang.compiler.frontend.semantics.ValidationSettings;
import org.portlang.compiler.model.AssetClass;
import org.portlang.compiler.model.Configuration;
import org.portlang.compiler.model.Percentages;
import org.portlang.compiler.model.PortfolioDocument;
import org.portlang.compiler.model.RebalancePolicy;
import org.portlang.compiler.model.Restrictions;
import org.portlang.compiler.model.RiskProfile;

import java.text.Normalizer;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * The content of a portfolio report, independent of its output format. Renderers lay out
 * the sections in this order: general information, asset allocation, analysis, visual
 * distribution, restrictions, rebalancing and recommendations.
 *
 * @param generatedAt The formatted generation timestamp.
 * @param generalInformation Name, risk profile and time horizon.
 * @param allocation The allocated asset classes, largest percentage first. Empty if none is allocated.
 * @param totalAllocated The sum of all percentages.
 * @param analysis The analysis figures, empty when nothing is allocated.
 * @param restrictions The declared restrictions, empty when none is declared.
 * @param rebalancing The rebalancing policy, empty when none is declared.
 * @param recommendations Recommendations for improving the portfolio, never empty.
 */
public record PortfolioReport(
        String generatedAt,
        List<Row> generalInformation,
        List<AllocationLine> allocation,
        double totalAllocated,
        List<Row> analysis,
        List<Row> restrictions,
        List<Row> rebalancing,
        List<String> recommendations
) {
    public static final String TITLE = "INVESTMENT PORTFOLIO REPORT";
    public static final String NOT_SPECIFIED = "Not specified";
    /** Percentage represented by one bar unit in the visual distribution. */
    public static final double PERCENT_PER_BAR = 5.0;

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm:ss", Locale.ROOT);
    private static final double CONCENTRATION_LIMIT = 80.0;
    private static final int MIN_DIVERSIFIED_CLASSES = 3;

    /**
     * A labelled value.
     */
    public record Row(String label, String value) {
    }

    /**
     * One allocated asset class.
     */
    public record AllocationLine(AssetClass assetClass, double percentage) {

        public String displayName() {
            return assetClass.displayName();
        }

        public String riskLabel() {
            return assetClass.isHighRisk() ? "High risk" : "Low risk";
        }

        /**
         * @return The number of whole {@link #PERCENT_PER_BAR} units in the percentage.
         */
        public int bars() {
            return (int) Math.max(0, percentage / PERCENT_PER_BAR);
        }
    }

    public PortfolioReport {
        generalInformation = List.copyOf(generalInformation);
        allocation = List.copyOf(allocation);
        analysis = List.copyOf(analysis);
        restrictions = List.copyOf(restrictions);
        rebalancing = List.copyOf(rebalancing);
        recommendations = List.copyOf(recommendations);
    }

    /**
     * Collects the report content of a document.
     *
     * @param document The portfolio.
     * @param settings The thresholds used by the analysis and recommendations.
     * @param clock The clock providing the generation timestamp.
     * @return The report content.
     * @throws ReportGenerationException if {@code document} is {@code null}.
     */
    public static PortfolioReport of(PortfolioDocument document, ValidationSettings settings, Clock clock)
            throws ReportGenerationException {
        if (document == null) {
            throw new ReportGenerationException("No portfolio to render");
        }
        PortfolioMetrics metrics = PortfolioMetrics.of(document, settings);
        return new PortfolioReport(
                LocalDateTime.now(clock).format(TIMESTAMP),
                generalInformation(document.configuration()),
                sortedByPercentage(document),
                metrics.totalAllocated(),
                document.allocation().isEmpty() ? List.of() : analysis(metrics),
                restrictions(document.restrictions()),
                rebalancing(document.rebalancePolicy()),
                recommendations(document, metrics, settings));
    }

    /**
     * Derives a report file name from the portfolio name: accents are dropped, ASCII letters, digits,
     * spaces, '-' and '_' are kept, spaces become '_' and the result is lower-cased.
     *
     * @param document The portfolio.
     * @param extension The file extension without the dot.
     * @return A name such as {@code fundos_de_inovacao_report.pdf}.
     */
    public static String fileName(PortfolioDocument document, String extension) {
        String name = document == null ? null : document.configuration().name();
        StringBuilder safe = new StringBuilder();
        if (name != null) {
            // decompose accented letters so that only their ASCII base survives
            Normalizer.normalize(name, Normalizer.Form.NFD).codePoints()
                    .filter(c -> c < 128 && (Character.isLetterOrDigit(c) || c == ' ' || c == '-' || c == '_'))
                    .forEach(safe::appendCodePoint);
        }
        String base = safe.toString().strip().replace(' ', '_').toLowerCase(Locale.ROOT);
        if (base.isEmpty()) {
            base = "portfolio";
        }
        return base + "_report." + extension;
    }

    private static List<Row> generalInformation(Configuration configuration) {
        return List.of(
                new Row("Portfolio name", orNotSpecified(configuration.name())),
                new Row("Risk profile", orNotSpecified(configuration.riskProfile())),
                new Row("Time horizon", configuration.horizon() == null ? NOT_SPECIFIED : configuration.horizon().toString()));
    }

    private static List<Row> analysis(PortfolioMetrics metrics) {
        return List.of(
                new Row("Asset classes", metrics.assetClassCount() + " (" + metrics.diversificationRating().label() + ")"),
                new Row("Total allocated", Percentages.compact(metrics.totalAllocated()) + "% ("
                        + (metrics.allocationComplete() ? "correct" : "incorrect") + ")"),
                new Row("High-risk exposure", Percentages.compact(metrics.riskExposure()) + "% ("
                        + metrics.riskExposureRating().label() + ")"),
                new Row("Conservative exposure", Percentages.compact(metrics.conservativeExposure()) + "% ("
                        + metrics.conservativeExposureRating().label() + ")"),
                new Row("Profile compatibility", metrics.profileCompatible() ? "Suitable for profile" : "Needs attention"));
    }

    private static List<Row> restrictions(Restrictions restrictions) {
        List<Row> rows = new ArrayList<>();
        if (restrictions.maxVolatility() != null) {
            rows.add(new Row("Maximum volatility", Percentages.compact(restrictions.maxVolatility()) + "%"));
        }
        if (restrictions.maxManagementFee() != null) {
            rows.add(new Row("Maximum management fee", Percentages.compact(restrictions.maxManagementFee()) + "%"));
        }
        return rows;
    }

    private static List<Row> rebalancing(RebalancePolicy policy) {
        List<Row> rows = new ArrayList<>();
        if (policy.frequency() != null) {
            rows.add(new Row("Frequency", policy.frequency().displayName()));
        }
        if (policy.tolerance() != null) {
            rows.add(new Row("Tolerance", Percentages.compact(policy.tolerance()) + "%"));
        }
        return rows;
    }

    static List<String> recommendations(PortfolioDocument document, PortfolioMetrics metrics, ValidationSettings settings) {
        List<String> result = new ArrayList<>();
        if (!document.allocation().isEmpty()) {
            double total = metrics.totalAllocated();
            if (!metrics.allocationComplete()) {
                if (total > 100) {
                    result.add("Adjust allocation: reduce " + Percentages.fixed(total - 100) + "% to reach 100%");
                } else {
                    result.add("Complete allocation: add " + Percentages.fixed(100 - total) + "% to reach 100%");
                }
            }
            RiskProfile profile = RiskProfile.fromLabel(document.configuration().riskProfile()).orElse(null);
            if (profile == RiskProfile.CONSERVATIVE && metrics.riskExposure() > settings.conservativeMaxExposure()) {
                result.add("Reduce exposure to high-risk assets to suit a conservative profile");
            } else if (profile == RiskProfile.AGGRESSIVE && metrics.riskExposure() < settings.aggressiveMinExposure()) {
                result.add("Consider increasing exposure to risk assets for an aggressive profile");
            }
            if (metrics.assetClassCount() < MIN_DIVERSIFIED_CLASSES) {
                result.add("Improve diversification by adding more asset classes");
            }
            if (metrics.largestAllocation() > CONCENTRATION_LIMIT) {
                result.add("Reduce concentration: no asset class should exceed 80%");
            }
        }
        if (result.isEmpty()) {
            result.add("Portfolio is well structured, keep monitoring it regularly");
            result.add("Review periodically as market conditions change");
            result.add("Consider rebalancing according to the defined tolerance");
        }
        return result;
    }

    private static List<AllocationLine> sortedByPercentage(PortfolioDocument document) {
        List<Map.Entry<AssetClass, Double>> entries = new ArrayList<>(document.allocation().percentages().entrySet());
        entries.sort(Map.Entry.<AssetClass, Double>comparingByValue(Comparator.reverseOrder()));
        List<AllocationLine> lines = new ArrayList<>(entries.size());
        for (Map.Entry<AssetClass, Double> entry : entries) {
            lines.add(new AllocationLine(entry.getKey(), entry.getValue()));
        }
        return lines;
    }

    private static String orNotSpecified(String value) {
        return value == null ? NOT_SPECIFIED : value;
    }
}
