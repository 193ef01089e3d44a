package org.portlang.report;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.portlang.compiler.frontend.semantics.ValidationSettings;
import org.portlang.compiler.model.Allocation;
import org.portlang.compiler.model.AssetClass;
import org.portlang.compiler.model.Configuration;
import org.portlang.compiler.model.Horizon;
import org.portlang.compiler.model.PortfolioDocument;
import org.portlang.compiler.model.RebalanceFrequency;
import org.portlang.compiler.model.RebalancePolicy;
import org.portlang.compiler.model.Restrictions;
import org.portlang.compiler.model.TimeUnit;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Calendar;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link PdfReportRenderer}. Rendered reports are written to disk and read
 * back with PDFBox.
 */
@Tag("unit")
class PdfReportRendererTest {

    private static final Clock FIXED = Clock.fixed(Instant.parse("2024-03-05T14:30:00Z"), ZoneOffset.UTC);

    private final PdfReportRenderer renderer = new PdfReportRenderer(FIXED, ValidationSettings.defaults());

    @TempDir
    Path tempDir;

    private static PortfolioDocument innovationFunds() {
        return new PortfolioDocument(
                new Configuration("Fundos de Inovação", "arrojado", new Horizon(15, TimeUnit.YEARS)),
                Allocation.builder()
                        .put(AssetClass.INTERNATIONAL_EQUITIES, 50)
                        .put(AssetClass.DOMESTIC_EQUITIES, 30)
                        .put(AssetClass.MULTI_MARKET_FUNDS, 15)
                        .put(AssetClass.FIXED_INCOME, 5)
                        .build(),
                new Restrictions(30.0, 3.5),
                new RebalancePolicy(RebalanceFrequency.MONTHLY, 4.0));
    }

    private Path write(RenderedReport report) throws IOException {
        Path target = tempDir.resolve(report.fileName());
        Files.write(target, report.content());
        return target;
    }

    private static String extractText(Path file) throws IOException {
        try (PDDocument pdf = PDDocument.load(file.toFile())) {
            return new PDFTextStripper().getText(pdf);
        }
    }

    @Test
    void testWritesPdfWithAllSections() throws Exception {
        // Act
        RenderedReport report = renderer.render(innovationFunds());
        Path file = write(report);

        // Assert
        assertThat(report.fileName()).isEqualTo("fundos_de_inovacao_report.pdf");
        assertThat(new String(report.content(), 0, 5, StandardCharsets.US_ASCII)).isEqualTo("%PDF-");
        String text = extractText(file);
        assertThat(text)
                .contains(PortfolioReport.TITLE)
                .contains("Generated at: 05/03/2024 14:30:00")
                .contains("GENERAL INFORMATION")
                .contains("Fundos de Inovação")
                .contains("15 anos")
                .contains("ASSET ALLOCATION")
                .contains("International Equities")
                .contains("PORTFOLIO ANALYSIS")
                .contains("Suitable for profile")
                .contains("VISUAL DISTRIBUTION")
                .contains("RESTRICTIONS")
                .contains("3.5%")
                .contains("REBALANCING")
                .contains("Monthly")
                .contains("RECOMMENDATIONS")
                .contains("Portfolio is well structured, keep monitoring it regularly");
        assertThat(text.indexOf("International Equities")).isLessThan(text.indexOf("Domestic Equities"));
    }

    @Test
    void testDocumentInformation() throws Exception {
        Path file = write(renderer.render(innovationFunds()));

        try (PDDocument pdf = PDDocument.load(file.toFile())) {
            assertThat(pdf.getNumberOfPages()).isPositive();
            assertThat(pdf.getDocumentInformation().getTitle()).isEqualTo("Investment portfolio report - Fundos de Inovação");
            assertThat(pdf.getDocumentInformation().getCreator()).isEqualTo("PortLang");
            assertThat(pdf.getDocumentInformation().getCreationDate().get(Calendar.YEAR)).isEqualTo(2024);
        }
    }

    /**
     * Verifies that an empty portfolio renders the placeholder instead of the analysis sections.
     */
    @Test
    void testEmptyAllocationSkipsAnalysis() throws Exception {
        PortfolioDocument document = new PortfolioDocument(Configuration.empty(), Allocation.empty(),
                Restrictions.empty(), RebalancePolicy.empty());

        RenderedReport report = renderer.render(document);
        String text = extractText(write(report));

        assertThat(report.fileName()).isEqualTo("portfolio_report.pdf");
        assertThat(text)
                .contains("No allocation defined")
                .contains("Not specified")
                .doesNotContain("PORTFOLIO ANALYSIS")
                .doesNotContain("RESTRICTIONS");
    }

    @Test
    void testCharactersOutsideTheFontAreReplaced() throws Exception {
        PortfolioDocument document = new PortfolioDocument(
                new Configuration("Carteira 🚀", "moderado", null),
                Allocation.builder().put(AssetClass.FIXED_INCOME, 60).put(AssetClass.DOMESTIC_EQUITIES, 40).build(),
                Restrictions.empty(),
                RebalancePolicy.empty());

        String text = extractText(write(renderer.render(document)));

        assertThat(text).contains("Carteira ?");
    }

    @Test
    void testPrintable() {
        assertThat(PdfReportRenderer.printable("ações\tmúltiplas")).isEqualTo("ações múltiplas");
        assertThat(PdfReportRenderer.printable("漢字")).isEqualTo("??");
        assertThat(PdfReportRenderer.printable("a\u00ADb")).isEqualTo("ab");
    }

    @Test
    void testNullDocumentIsRejected() {
        assertThatThrownBy(() -> renderer.render(null)).isInstanceOf(ReportGenerationException.class);
    }
}
