package org.portlang.compiler.frontend.lexer;

import org.portlang.compiler.diagnostics.DiagnosticCode;
import org.portlang.compiler.diagnostics.DiagnosticsEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source code) into a sequence of tokens.
 * <p>
 * Lexing never stops on malformed input: every problem is reported to the
 * {@link DiagnosticsEngine} and scanning continues with the next character.
 * The returned list always ends with an {@link TokenType#END_OF_FILE} token.
 */
public class Lexer {

    private static final Logger LOGGER = LoggerFactory.getLogger(Lexer.class);

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this.source = source;
        this.diagnostics = diagnostics;
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return A list of the recognized tokens, terminated by an end-of-file token.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            startLine = line;
            startColumn = column;
            scanToken();
        }
        tokens.add(new Token(TokenType.END_OF_FILE, "", null, line, column));
        LOGGER.debug("Scanned {} tokens from {} characters", tokens.size(), source.length());
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '=': addToken(TokenType.EQUALS); break;
            case '{': addToken(TokenType.LEFT_BRACE); break;
            case '}': addToken(TokenType.RIGHT_BRACE); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case '%': addToken(TokenType.PERCENT); break;
            case '"': string(); break;
            // Ignore whitespace and line breaks
            case ' ', '\r', '\t', '\n':
                break;
            default:
                if (isDigit(c)) {
                    number();
                } else if (isIdentifierStart(c)) {
                    identifier();
                } else {
                    diagnostics.report(DiagnosticCode.UNRECOGNIZED_CHARACTER,
                            "Unrecognized character: '" + c + "'",
                            startLine, startColumn,
                            "Remove the character; only letters, digits, '_', '\"', '.', '=', '{', '}', ';' and '%' are allowed");
                }
                break;
        }
    }

    private void string() {
        boolean brokenByNewline = false;
        while (peek() != '"' && !isAtEnd()) {
            if (peek() == '\n') {
                diagnostics.report(DiagnosticCode.STRING_LINE_BREAK,
                        "String cannot contain a line break",
                        startLine, startColumn,
                        "Close the string on the same line");
                brokenByNewline = true;
                break;
            }
            advance();
        }

        String value = source.substring(start + 1, current);

        if (!brokenByNewline && peek() == '"') {
            // The closing "
            advance();
        } else {
            diagnostics.report(DiagnosticCode.UNTERMINATED_STRING,
                    "Unterminated string",
                    startLine, startColumn,
                    "Add a closing '\"' at the end of the string");
        }

        addToken(TokenType.STRING, value);
    }

    private void number() {
        int dots = 0;
        while (isDigit(peek()) || peek() == '.') {
            if (peek() == '.') {
                dots++;
                if (dots > 1) {
                    diagnostics.report(DiagnosticCode.MULTIPLE_DECIMAL_POINTS,
                            "Number has more than one decimal point",
                            startLine, startColumn,
                            "Use a single '.' as the decimal separator");
                    break;
                }
            }
            advance();
        }

        String numberString = source.substring(start, current);
        Number value;
        try {
            if (numberString.indexOf('.') >= 0) {
                value = Double.parseDouble(numberString);
            } else {
                value = Integer.parseInt(numberString);
            }
        } catch (NumberFormatException e) {
            diagnostics.report(DiagnosticCode.INVALID_NUMBER,
                    "Invalid number: " + numberString,
                    startLine, startColumn,
                    null);
            value = 0;
        }
        addToken(TokenType.NUMBER, value);
    }

    private void identifier() {
        while (isIdentifierPart(peek())) advance();
        String text = source.substring(start, current);
        TokenType type = TokenType.fromKeyword(text).orElse(TokenType.IDENTIFIER);
        addToken(type, text);
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, startLine, startColumn));
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }
}
