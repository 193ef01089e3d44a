package org.portlang.compiler.diagnostics;

import java.util.List;

/**
 * Formats diagnostics for humans, grouped by severity.
 */
public final class DiagnosticFormatter {

    private DiagnosticFormatter() {}

    /**
     * Formats the given diagnostics as blocks of errors, warnings and infos.
     * Empty groups are omitted; an empty list yields an empty string.
     *
     * @param diagnostics The diagnostics to format.
     * @return The formatted text, without a trailing line break.
     */
    public static String format(List<Diagnostic> diagnostics) {
        StringBuilder sb = new StringBuilder();
        appendGroup(sb, diagnostics, Diagnostic.Severity.ERROR, "error(s)");
        appendGroup(sb, diagnostics, Diagnostic.Severity.WARNING, "warning(s)");
        appendGroup(sb, diagnostics, Diagnostic.Severity.INFO, "info(s)");
        if (sb.length() > 0) {
            sb.setLength(sb.length() - 1);
        }
        return sb.toString();
    }

    private static void appendGroup(StringBuilder sb, List<Diagnostic> diagnostics, Diagnostic.Severity severity, String label) {
        List<Diagnostic> group = diagnostics.stream().filter(d -> d.severity() == severity).toList();
        if (group.isEmpty()) {
            return;
        }
        sb.append(group.size()).append(' ').append(label).append(':').append('\n');
        for (Diagnostic d : group) {
            sb.append("  ").append(d).append('\n');
            if (d.suggestion() != null) {
                sb.append("      suggestion: ").append(d.suggestion()).append('\n');
            }
        }
    }
}
