package org.portlang.report;

import org.portlang.compiler.frontend.semantics.ValidationSettings;
import org.portlang.compiler.model.Percentages;
import org.portlang.compiler.model.PortfolioDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.List;
import java.util.Locale;

/**
 * Renders a portfolio report as UTF-8 plain text, with a {@code '#'} bar chart for the distribution.
 * <p>
 * The generation timestamp comes from the injected {@link Clock}, so output is reproducible in tests.
 */
public class TextReportRenderer implements IReportRenderer {

    private static final Logger LOGGER = LoggerFactory.getLogger(TextReportRenderer.class);
    private static final String RULE = "=".repeat(64);

    private final Clock clock;
    private final ValidationSettings settings;

    public TextReportRenderer() {
        this(Clock.systemDefaultZone(), ValidationSettings.defaults());
    }

    /**
     * @param clock The clock providing the generation timestamp.
     * @param settings The thresholds used by the analysis and recommendations.
     */
    public TextReportRenderer(Clock clock, ValidationSettings settings) {
        this.clock = clock;
        this.settings = settings;
    }

    @Override
    public RenderedReport render(PortfolioDocument document) throws ReportGenerationException {
        String text = format(PortfolioReport.of(document, settings, clock));
        LOGGER.debug("Rendered text report of {} characters", text.length());
        return new RenderedReport(PortfolioReport.fileName(document, ReportFormat.TEXT.extension()),
                text.getBytes(StandardCharsets.UTF_8));
    }

    String format(PortfolioReport report) {
        StringBuilder out = new StringBuilder();
        out.append(RULE).append('\n');
        out.append(PortfolioReport.TITLE).append('\n');
        out.append(RULE).append('\n');
        out.append("Generated at: ").append(report.generatedAt()).append('\n');

        section(out, "GENERAL INFORMATION");
        rows(out, report.generalInformation());

        section(out, "ASSET ALLOCATION");
        if (report.allocation().isEmpty()) {
            out.append("No allocation defined").append('\n');
        } else {
            out.append(String.format(Locale.ROOT, "%-26s %10s  %s\n", "Asset class", "Percent", "Risk"));
            for (PortfolioReport.AllocationLine line : report.allocation()) {
                out.append(String.format(Locale.ROOT, "%-26s %10s  %s\n",
                        line.displayName(), Percentages.compact(line.percentage()) + "%", line.riskLabel()));
            }
            out.append(String.format(Locale.ROOT, "%-26s %10s\n",
                    "TOTAL", Percentages.compact(report.totalAllocated()) + "%"));
        }

        if (!report.analysis().isEmpty()) {
            section(out, "PORTFOLIO ANALYSIS");
            rows(out, report.analysis());

            section(out, "VISUAL DISTRIBUTION (each # = 5%)");
            for (PortfolioReport.AllocationLine line : report.allocation()) {
                out.append(String.format(Locale.ROOT, "%-26s %8s  %s\n",
                        line.displayName(), Percentages.compact(line.percentage()) + "%", "#".repeat(line.bars())));
            }
        }

        if (!report.restrictions().isEmpty()) {
            section(out, "RESTRICTIONS");
            rows(out, report.restrictions());
        }
        if (!report.rebalancing().isEmpty()) {
            section(out, "REBALANCING");
            rows(out, report.rebalancing());
        }

        section(out, "RECOMMENDATIONS");
        for (String recommendation : report.recommendations()) {
            out.append("- ").append(recommendation).append('\n');
        }
        return out.toString();
    }

    private static void section(StringBuilder out, String title) {
        out.append('\n').append(title).append('\n');
        out.append("-".repeat(title.length())).append('\n');
    }

    private static void rows(StringBuilder out, List<PortfolioReport.Row> rows) {
        for (PortfolioReport.Row row : rows) {
            out.append(String.format(Locale.ROOT, "%-24s %s\n", row.label() + ":", row.value()));
        }
    }
}
