package org.portlang.compiler.frontend.parser;

import org.portlang.compiler.diagnostics.DiagnosticsEngine;
import org.portlang.compiler.frontend.lexer.Token;
import org.portlang.compiler.frontend.lexer.TokenType;

/**
 * An interface that encapsulates the contextual state during parsing.
 * It provides section parsers with access to the token stream and the diagnostics
 * engine without coupling them directly to the {@link Parser} implementation.
 */
public interface ParsingContext {
    /**
     * Checks if the current token matches any of the given types. If so, consumes it.
     * @param types The token types to match.
     * @return true if the current token matches one of the types, false otherwise.
     */
    boolean match(TokenType... types);

    /**
     * Checks if the current token is of one of the given types without consuming it.
     * @param types The token types to check.
     * @return true if the current token is of one of the given types, false otherwise.
     */
    boolean check(TokenType... types);

    /**
     * Checks the type of the token {@code offset} positions ahead of the current one
     * without consuming anything. Offsets past the end resolve to the end-of-file token.
     * @param offset The lookahead distance; 0 is the current token.
     * @param types The token types to check.
     * @return true if that token is of one of the given types.
     */
    boolean checkAhead(int offset, TokenType... types);

    /**
     * Consumes the current token and returns it. The end-of-file token is never consumed.
     * @return The consumed token.
     */
    Token advance();

    /**
     * Returns the current token without consuming it.
     * @return The current token.
     */
    Token peek();

    /**
     * Consumes the current token if it is of one of the expected types.
     * If not, it reports an error at the current token and leaves it unconsumed.
     * @param types The expected token types.
     * @return The consumed token, or {@code null} if the type did not match.
     */
    Token expect(TokenType... types);

    /**
     * Gets the diagnostics engine for reporting errors and warnings.
     * @return The diagnostics engine.
     */
    DiagnosticsEngine getDiagnostics();

    /**
     * Checks if the end of the token stream has been reached.
     * @return true if at the end of the stream, false otherwise.
     */
    boolean isAtEnd();
}
