package org.portlang.report;

/**
 * Thrown by an {@link IReportRenderer} when a report cannot be produced.
 */
public class ReportGenerationException extends Exception {

    public ReportGenerationException(String message) {
        super(message);
    }

    public ReportGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
