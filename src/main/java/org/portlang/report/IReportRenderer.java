package org.portlang.report;

import org.portlang.compiler.model.PortfolioDocument;

/**
 * Renders a human-readable report for a validated portfolio.
 */
public interface IReportRenderer {

    /**
     * Renders the report.
     *
     * @param document The portfolio to describe. Only documents without validation errors are passed in.
     * @return The encoded report and the file name it should be written to.
     * @throws ReportGenerationException if the report cannot be produced.
     */
    RenderedReport render(PortfolioDocument document) throws ReportGenerationException;
}
