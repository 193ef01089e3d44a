package org.portlang.compiler.api;

/**
 * A pure data class representing a position in the source text.
 * It is part of the public compiler API and free of implementation details.
 *
 * @param lineNumber The 1-based line number.
 * @param columnNumber The 1-based column number.
 */
public record SourceInfo(int lineNumber, int columnNumber) {

    @Override
    public String toString() {
        return String.format("line %d, column %d", lineNumber, columnNumber);
    }
}
