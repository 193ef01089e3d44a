package org.portlang.compiler.frontend.lexer;

import org.portlang.compiler.api.SourceInfo;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., Keyword, Number, String).
 * @param text The exact text of the token from the source code.
 * @param value The processed value of the token: the content of a string, an {@link Integer} or
 *              {@link Double} for a number, the word for identifiers and keywords, {@code null} otherwise.
 * @param line The line number where the token begins.
 * @param column The column number where the token begins.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int line,
        int column
) {
    /**
     * @return The position of this token as a {@link SourceInfo}.
     */
    public SourceInfo sourceInfo() {
        return new SourceInfo(line, column);
    }
}
