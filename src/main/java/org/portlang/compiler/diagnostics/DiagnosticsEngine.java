package org.portlang.compiler.diagnostics;

import org.portlang.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An engine for collecting and managing diagnostic messages (errors, warnings, infos)
 * that occur during one compilation.
 * <p>
 * This decouples error reporting from the actual compiler logic (lexer, parser, validator).
 * One instance is shared by all stages of a single compile and must not be shared
 * between concurrent compiles.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> errors = new ArrayList<>();
    private final List<Diagnostic> warnings = new ArrayList<>();
    private final List<Diagnostic> infos = new ArrayList<>();

    /**
     * Adds a diagnostic, routing it into the bucket of its severity.
     *
     * @param diagnostic The diagnostic to add.
     */
    public void add(Diagnostic diagnostic) {
        switch (diagnostic.severity()) {
            case ERROR -> errors.add(diagnostic);
            case WARNING -> warnings.add(diagnostic);
            case INFO -> infos.add(diagnostic);
        }
    }

    /**
     * Reports a diagnostic whose category and severity are fixed by its code.
     *
     * @param code       The diagnostic code.
     * @param message    The message.
     * @param location   The source location, or {@code null}.
     * @param suggestion A remediation hint, or {@code null}.
     */
    public void report(DiagnosticCode code, String message, SourceInfo location, String suggestion) {
        add(new Diagnostic(code.category(), code.severity(), code.code(), message, location, suggestion));
    }

    /**
     * Reports a diagnostic at the given line and column.
     *
     * @param code       The diagnostic code.
     * @param message    The message.
     * @param line       The line number.
     * @param column     The column number.
     * @param suggestion A remediation hint, or {@code null}.
     */
    public void report(DiagnosticCode code, String message, int line, int column, String suggestion) {
        report(code, message, new SourceInfo(line, column), suggestion);
    }

    /**
     * Checks if blocking errors have been reported. This is the only signal downstream
     * consumers use to decide whether the input was rejected.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * @return The number of errors reported so far.
     */
    public int errorCount() {
        return errors.size();
    }

    public List<Diagnostic> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public List<Diagnostic> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public List<Diagnostic> getInfos() {
        return Collections.unmodifiableList(infos);
    }

    /**
     * Returns all collected diagnostics: errors first, then warnings, then infos,
     * each in the order they were reported.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        List<Diagnostic> all = new ArrayList<>(errors.size() + warnings.size() + infos.size());
        all.addAll(errors);
        all.addAll(warnings);
        all.addAll(infos);
        return Collections.unmodifiableList(all);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return DiagnosticFormatter.format(getDiagnostics());
    }
}
