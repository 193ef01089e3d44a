package org.portlang.compiler.diagnostics;

import org.portlang.compiler.api.SourceInfo;

/**
 * Represents a single diagnostic message (error, warning, info)
 * that occurs during the compilation process.
 *
 * @param category The compiler stage that raised the diagnostic.
 * @param severity The severity of the diagnostic.
 * @param code The stable short identifier of the diagnostic (e.g. {@code SEM003}).
 * @param message The human-readable diagnostic message.
 * @param location The position in the source text, or {@code null} if the diagnostic is not tied to one.
 * @param suggestion A remediation hint, or {@code null}.
 */
public record Diagnostic(
        Category category,
        Severity severity,
        String code,
        String message,
        SourceInfo location,
        String suggestion
) {
    /**
     * The compiler stage a diagnostic originates from.
     */
    public enum Category {
        /** Raised while converting characters into tokens. */
        LEXICAL,
        /** Raised while matching tokens against the grammar. */
        SYNTACTIC,
        /** Raised by the domain rules of the validator. */
        SEMANTIC,
        /** Raised by validation outside of the semantic rules. */
        VALIDATION,
        /** Raised while rendering a report for a validated document. */
        GENERATION
    }

    /**
     * The severity of a diagnostic message.
     */
    public enum Severity {
        /** An error that rejects the input. */
        ERROR,
        /** A warning that does not reject the input. */
        WARNING,
        /** An informational message. */
        INFO
    }

    /**
     * @return {@code true} if this diagnostic carries a source location.
     */
    public boolean hasLocation() {
        return location != null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(code).append("] ").append(message);
        if (hasLocation()) {
            sb.append(" (").append(location).append(')');
        }
        return sb.toString();
    }
}
