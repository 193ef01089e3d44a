package org.portlang.report;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.portlang.compiler.frontend.semantics.ValidationSettings;
import org.portlang.compiler.model.Percentages;
import org.portlang.compiler.model.PortfolioDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Color;
import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetEncoder;
import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.GregorianCalendar;
import java.util.List;

/**
 * Renders a portfolio report as an A4 PDF document with Apache PDFBox. Each section is drawn as a
 * table with a coloured header row; the visual distribution is drawn as horizontal bars.
 * <p>
 * Text is set in the standard Helvetica fonts, which only cover the WinAnsi character set.
 * Characters outside it are printed as {@code '?'}.
 */
public class PdfReportRenderer implements IReportRenderer {

    private static final Logger LOGGER = LoggerFactory.getLogger(PdfReportRenderer.class);

    private static final float MARGIN = 50f;
    private static final float CONTENT_WIDTH = PDRectangle.A4.getWidth() - 2 * MARGIN;
    private static final float ROW_HEIGHT = 18f;
    private static final float CELL_PADDING = 5f;
    private static final float TITLE_SIZE = 16f;
    private static final float HEADING_SIZE = 12f;
    private static final float BODY_SIZE = 10f;
    private static final float NOTE_SIZE = 8f;

    private static final PDFont REGULAR = PDType1Font.HELVETICA;
    private static final PDFont BOLD = PDType1Font.HELVETICA_BOLD;
    private static final PDFont ITALIC = PDType1Font.HELVETICA_OBLIQUE;

    private static final Color DARK_BLUE = new Color(0, 0, 139);
    private static final Color DARK_GREEN = new Color(0, 100, 0);
    private static final Color PURPLE = new Color(128, 0, 128);
    private static final Color RED = new Color(178, 34, 34);
    private static final Color ORANGE = new Color(230, 126, 34);
    private static final Color TEAL = new Color(0, 128, 128);
    private static final Color LIGHT_GREY = new Color(220, 220, 220);
    private static final Color GREY = Color.GRAY;

    private static final Charset WIN_ANSI = Charset.forName("windows-1252");

    private final Clock clock;
    private final ValidationSettings settings;

    public PdfReportRenderer() {
        this(Clock.systemDefaultZone(), ValidationSettings.defaults());
    }

    /**
     * @param clock The clock providing the generation timestamp and the document creation date.
     * @param settings The thresholds used by the analysis and recommendations.
     */
    public PdfReportRenderer(Clock clock, ValidationSettings settings) {
        this.clock = clock;
        this.settings = settings;
    }

    @Override
    public RenderedReport render(PortfolioDocument document) throws ReportGenerationException {
        PortfolioReport report = PortfolioReport.of(document, settings, clock);
        String fileName = PortfolioReport.fileName(document, ReportFormat.PDF.extension());

        try (PDDocument pdf = new PDDocument()) {
            describe(pdf, document);
            try (PageLayout layout = new PageLayout(pdf)) {
                draw(layout, report);
            }
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            pdf.save(out);
            LOGGER.debug("Rendered PDF report {} with {} page(s), {} bytes", fileName, pdf.getNumberOfPages(), out.size());
            return new RenderedReport(fileName, out.toByteArray());
        } catch (IOException e) {
            throw new ReportGenerationException("Cannot render PDF report: " + e.getMessage(), e);
        }
    }

    private void describe(PDDocument pdf, PortfolioDocument document) {
        PDDocumentInformation info = pdf.getDocumentInformation();
        String name = document.configuration().name();
        info.setTitle(name == null ? "Investment portfolio report" : "Investment portfolio report - " + name);
        info.setCreator("PortLang");
        info.setCreationDate(GregorianCalendar.from(ZonedDateTime.now(clock)));
    }

    private void draw(PageLayout layout, PortfolioReport report) throws IOException {
        layout.text(MARGIN, layout.reserve(TITLE_SIZE + 4), BOLD, TITLE_SIZE, DARK_BLUE, PortfolioReport.TITLE);
        layout.text(MARGIN, layout.reserve(NOTE_SIZE + 8), ITALIC, NOTE_SIZE, GREY, "Generated at: " + report.generatedAt());

        heading(layout, "GENERAL INFORMATION");
        table(layout, DARK_BLUE, new float[]{0.4f, 0.6f}, new String[]{"Field", "Value"}, cells(report.generalInformation()));

        heading(layout, "ASSET ALLOCATION");
        if (report.allocation().isEmpty()) {
            layout.text(MARGIN, layout.reserve(ROW_HEIGHT), REGULAR, BODY_SIZE, Color.BLACK, "No allocation defined");
        } else {
            List<String[]> rows = new ArrayList<>();
            for (PortfolioReport.AllocationLine line : report.allocation()) {
                rows.add(new String[]{line.displayName(), Percentages.compact(line.percentage()) + "%", line.riskLabel()});
            }
            rows.add(new String[]{"TOTAL", Percentages.compact(report.totalAllocated()) + "%", ""});
            table(layout, DARK_GREEN, new float[]{0.5f, 0.2f, 0.3f}, new String[]{"Asset class", "Percent", "Risk"}, rows);
        }

        if (!report.analysis().isEmpty()) {
            heading(layout, "PORTFOLIO ANALYSIS");
            table(layout, PURPLE, new float[]{0.4f, 0.6f}, new String[]{"Metric", "Value"}, cells(report.analysis()));

            heading(layout, "VISUAL DISTRIBUTION");
            distribution(layout, report.allocation());
        }

        if (!report.restrictions().isEmpty()) {
            heading(layout, "RESTRICTIONS");
            table(layout, ORANGE, new float[]{0.6f, 0.4f}, new String[]{"Restriction", "Limit"}, cells(report.restrictions()));
        }
        if (!report.rebalancing().isEmpty()) {
            heading(layout, "REBALANCING");
            table(layout, TEAL, new float[]{0.5f, 0.5f}, new String[]{"Setting", "Value"}, cells(report.rebalancing()));
        }

        heading(layout, "RECOMMENDATIONS");
        for (String recommendation : report.recommendations()) {
            for (String line : wrap("- " + recommendation, REGULAR, BODY_SIZE, CONTENT_WIDTH)) {
                layout.text(MARGIN, layout.reserve(BODY_SIZE + 5), REGULAR, BODY_SIZE, Color.BLACK, line);
            }
        }

        layout.gap(ROW_HEIGHT);
        layout.text(MARGIN, layout.reserve(NOTE_SIZE + 4), ITALIC, NOTE_SIZE, GREY, "Generated automatically by PortLang");
    }

    private static void heading(PageLayout layout, String title) throws IOException {
        layout.gap(ROW_HEIGHT);
        // keep a heading on the same page as the first row below it
        layout.keepTogether(HEADING_SIZE + 6 + 2 * ROW_HEIGHT);
        layout.text(MARGIN, layout.reserve(HEADING_SIZE + 6), BOLD, HEADING_SIZE, Color.BLACK, title);
    }

    private static void table(PageLayout layout, Color headerColor, float[] fractions, String[] header, List<String[]> rows)
            throws IOException {
        row(layout, fractions, header, BOLD, Color.WHITE, headerColor);
        for (int i = 0; i < rows.size(); i++) {
            row(layout, fractions, rows.get(i), REGULAR, Color.BLACK, i % 2 == 1 ? LIGHT_GREY : null);
        }
    }

    private static void row(PageLayout layout, float[] fractions, String[] cells, PDFont font, Color textColor, Color background)
            throws IOException {
        float bottom = layout.reserve(ROW_HEIGHT);
        float x = MARGIN;
        for (int i = 0; i < fractions.length; i++) {
            float width = fractions[i] * CONTENT_WIDTH;
            if (background != null) {
                layout.fill(x, bottom, width, ROW_HEIGHT, background);
            }
            layout.outline(x, bottom, width, ROW_HEIGHT);
            String cell = i < cells.length ? cells[i] : "";
            layout.text(x + CELL_PADDING, bottom + 6, font, BODY_SIZE, textColor, fit(cell, font, BODY_SIZE, width - 2 * CELL_PADDING));
            x += width;
        }
    }

    private static void distribution(PageLayout layout, List<PortfolioReport.AllocationLine> lines) throws IOException {
        float[] fractions = {0.35f, 0.15f, 0.5f};
        row(layout, fractions, new String[]{"Asset class", "Percent", "Share"}, BOLD, Color.WHITE, RED);
        float barSpan = fractions[2] * CONTENT_WIDTH - 2 * CELL_PADDING;
        float barX = MARGIN + (fractions[0] + fractions[1]) * CONTENT_WIDTH + CELL_PADDING;
        for (PortfolioReport.AllocationLine line : lines) {
            row(layout, fractions, new String[]{line.displayName(), Percentages.compact(line.percentage()) + "%", ""},
                    REGULAR, Color.BLACK, null);
            float share = (float) Math.min(100.0, Math.max(0.0, line.percentage())) / 100f;
            if (share > 0) {
                layout.fill(barX, layout.cursor() + 4, share * barSpan, ROW_HEIGHT - 8, line.assetClass().isHighRisk() ? RED : DARK_GREEN);
            }
        }
    }

    private static List<String[]> cells(List<PortfolioReport.Row> rows) {
        List<String[]> cells = new ArrayList<>(rows.size());
        for (PortfolioReport.Row row : rows) {
            cells.add(new String[]{row.label(), row.value()});
        }
        return cells;
    }

    /**
     * Replaces everything the standard fonts cannot show: control and format characters become
     * spaces or are dropped, other characters outside WinAnsi become {@code '?'}.
     */
    static String printable(String text) {
        CharsetEncoder encoder = WIN_ANSI.newEncoder();
        StringBuilder out = new StringBuilder(text.length());
        text.codePoints().forEach(cp -> {
            if (Character.isISOControl(cp) || Character.isSpaceChar(cp)) {
                out.append(' ');
            } else if (Character.getType(cp) == Character.FORMAT) {
                return;
            } else if (encoder.canEncode(new String(Character.toChars(cp)))) {
                out.appendCodePoint(cp);
            } else {
                out.append('?');
            }
        });
        return out.toString();
    }

    private static String fit(String text, PDFont font, float size, float width) throws IOException {
        String printable = printable(text);
        if (width(printable, font, size) <= width) {
            return printable;
        }
        String shortened = printable;
        while (!shortened.isEmpty() && width(shortened + "...", font, size) > width) {
            shortened = shortened.substring(0, shortened.length() - 1);
        }
        return shortened + "...";
    }

    private static List<String> wrap(String text, PDFont font, float size, float width) throws IOException {
        List<String> lines = new ArrayList<>();
        StringBuilder line = new StringBuilder();
        for (String word : printable(text).split(" ")) {
            String candidate = line.length() == 0 ? word : line + " " + word;
            if (line.length() > 0 && width(candidate, font, size) > width) {
                lines.add(line.toString());
                line = new StringBuilder("  ").append(word);
            } else {
                line = new StringBuilder(candidate);
            }
        }
        lines.add(line.toString());
        return lines;
    }

    private static float width(String text, PDFont font, float size) throws IOException {
        return font.getStringWidth(text) / 1000f * size;
    }

    /**
     * A top-down writing cursor over the pages of a document. Starts a new page whenever the next
     * block would cross the bottom margin.
     */
    private static final class PageLayout implements Closeable {

        private final PDDocument pdf;
        private PDPageContentStream stream;
        private float y;

        PageLayout(PDDocument pdf) throws IOException {
            this.pdf = pdf;
            newPage();
        }

        private void newPage() throws IOException {
            if (stream != null) {
                stream.close();
            }
            PDPage page = new PDPage(PDRectangle.A4);
            pdf.addPage(page);
            stream = new PDPageContentStream(pdf, page);
            y = page.getMediaBox().getHeight() - MARGIN;
        }

        /**
         * Reserves a block of the given height below the cursor.
         * @return The y coordinate of the bottom of the reserved block.
         */
        float reserve(float height) throws IOException {
            if (y - height < MARGIN) {
                newPage();
            }
            y -= height;
            return y;
        }

        void keepTogether(float height) throws IOException {
            if (y - height < MARGIN) {
                newPage();
            }
        }

        void gap(float height) {
            y -= height;
        }

        float cursor() {
            return y;
        }

        void text(float x, float baseline, PDFont font, float size, Color color, String text) throws IOException {
            stream.setNonStrokingColor(color);
            stream.beginText();
            stream.setFont(font, size);
            stream.newLineAtOffset(x, baseline);
            stream.showText(printable(text));
            stream.endText();
        }

        void fill(float x, float bottom, float width, float height, Color color) throws IOException {
            stream.setNonStrokingColor(color);
            stream.addRect(x, bottom, width, height);
            stream.fill();
        }

        void outline(float x, float bottom, float width, float height) throws IOException {
            stream.setStrokingColor(Color.BLACK);
            stream.setLineWidth(0.5f);
            stream.addRect(x, bottom, width, height);
            stream.stroke();
        }

        @Override
        public void close() throws IOException {
            stream.close();
        }
    }
}
