package org.portlang.compiler.frontend;

import org.portlang.compiler.api.SourceInfo;
import org.portlang.compiler.diagnostics.Diagnostic;
import org.portlang.compiler.diagnostics.DiagnosticsEngine;
import org.portlang.compiler.frontend.lexer.Lexer;
import org.portlang.compiler.frontend.lexer.Token;
import org.portlang.compiler.frontend.lexer.TokenType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link Lexer}.
 * These tests verify that source text is converted into the expected token stream and that
 * malformed input is reported without stopping tokenization.
 */
public class LexerTest {

    private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();

    private List<Token> scan(String source) {
        return new Lexer(source, diagnostics).scanTokens();
    }

    private List<TokenType> types(List<Token> tokens) {
        return tokens.stream().map(Token::type).toList();
    }

    private List<String> errorCodes() {
        return diagnostics.getErrors().stream().map(Diagnostic::code).toList();
    }

    /**
     * Verifies that a configuration assignment is tokenized into keyword, punctuation and string literal.
     */
    @Test
    @Tag("unit")
    void testAssignmentTokenization() {
        // Act
        List<Token> tokens = scan("nome = \"Fundos de Inovação\";");

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(types(tokens)).containsExactly(
                TokenType.NOME, TokenType.EQUALS, TokenType.STRING, TokenType.SEMICOLON, TokenType.END_OF_FILE);
        assertThat(tokens.get(2)).extracting(Token::text, Token::value)
                .containsExactly("\"Fundos de Inovação\"", "Fundos de Inovação");
    }

    @Test
    @Tag("unit")
    void testIntegerAndDecimalLiterals() {
        List<Token> tokens = scan("30% 3.5");

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(types(tokens)).containsExactly(
                TokenType.NUMBER, TokenType.PERCENT, TokenType.NUMBER, TokenType.END_OF_FILE);
        assertThat(tokens.get(0).value()).isEqualTo(30);
        assertThat(tokens.get(2).value()).isEqualTo(3.5);
    }

    /**
     * Verifies that keywords spelled with accents are recognized, and that matching is case-sensitive.
     */
    @Test
    @Tag("unit")
    void testAccentedKeywordsAndCaseSensitivity() {
        List<Token> tokens = scan("alocação ações_nacionais ações_internacionais restrições Carteira desconhecido");

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(types(tokens)).containsExactly(
                TokenType.ALOCACAO, TokenType.ACOES_NACIONAIS, TokenType.ACOES_INTERNACIONAIS,
                TokenType.RESTRICOES, TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.END_OF_FILE);
    }

    @Test
    @Tag("unit")
    void testTokenPositionsAreStartPositions() {
        List<Token> tokens = scan("carteira {\n  nome = \"x\";");

        assertThat(tokens.get(0).sourceInfo()).isEqualTo(new SourceInfo(1, 1));
        assertThat(tokens.get(1).sourceInfo()).isEqualTo(new SourceInfo(1, 10));
        assertThat(tokens.get(2).sourceInfo()).isEqualTo(new SourceInfo(2, 3));
        assertThat(tokens.get(4).sourceInfo()).isEqualTo(new SourceInfo(2, 10));
    }

    /**
     * Verifies that an unsupported symbol is reported and that tokenization continues after it.
     */
    @Test
    @Tag("unit")
    void testUnrecognizedCharacterIsReportedAndSkipped() {
        // Act
        List<Token> tokens = scan("carteira # {");

        // Assert
        assertThat(errorCodes()).containsExactly("LEX005");
        assertThat(diagnostics.getErrors().get(0).location()).isEqualTo(new SourceInfo(1, 10));
        assertThat(types(tokens)).containsExactly(TokenType.CARTEIRA, TokenType.LEFT_BRACE, TokenType.END_OF_FILE);
    }

    @Test
    @Tag("unit")
    void testEachBadCharacterIsReported() {
        scan("@@ renda_fixa");

        assertThat(errorCodes()).containsExactly("LEX005", "LEX005");
    }

    @Test
    @Tag("unit")
    void testSlashesAreNotAComment() {
        List<Token> tokens = scan("// renda_fixa");

        assertThat(errorCodes()).containsExactly("LEX005", "LEX005");
        assertThat(types(tokens)).containsExactly(TokenType.RENDA_FIXA, TokenType.END_OF_FILE);
    }

    /**
     * Verifies that a string interrupted by a line break raises both the line-break and the
     * unterminated-string diagnostics at the literal's start position.
     */
    @Test
    @Tag("unit")
    void testStringWithLineBreak() {
        // Act
        List<Token> tokens = scan("nome = \"abc\n;");

        // Assert
        assertThat(errorCodes()).containsExactly("LEX001", "LEX002");
        assertThat(diagnostics.getErrors())
                .extracting(Diagnostic::location)
                .containsOnly(new SourceInfo(1, 8));
        assertThat(types(tokens)).containsExactly(
                TokenType.NOME, TokenType.EQUALS, TokenType.STRING, TokenType.SEMICOLON, TokenType.END_OF_FILE);
        assertThat(tokens.get(2).value()).isEqualTo("abc");
    }

    @Test
    @Tag("unit")
    void testUnterminatedStringAtEndOfInput() {
        List<Token> tokens = scan("\"abc");

        assertThat(errorCodes()).containsExactly("LEX002");
        assertThat(tokens.get(0)).extracting(Token::type, Token::value).containsExactly(TokenType.STRING, "abc");
        assertThat(tokens.get(1).type()).isEqualTo(TokenType.END_OF_FILE);
    }

    /**
     * Verifies that a second decimal point stops the number; the dot is then reported as an
     * unrecognized character and the trailing digits form a new number.
     */
    @Test
    @Tag("unit")
    void testMultipleDecimalPoints() {
        // Act
        List<Token> tokens = scan("1.2.3");

        // Assert
        assertThat(errorCodes()).containsExactly("LEX003", "LEX005");
        assertThat(types(tokens)).containsExactly(TokenType.NUMBER, TokenType.NUMBER, TokenType.END_OF_FILE);
        assertThat(tokens.get(0)).extracting(Token::text, Token::value).containsExactly("1.2", 1.2);
        assertThat(tokens.get(1).value()).isEqualTo(3);
    }

    @Test
    @Tag("unit")
    void testIntegerOverflowYieldsZero() {
        List<Token> tokens = scan("99999999999");

        assertThat(errorCodes()).containsExactly("LEX004");
        assertThat(tokens.get(0).value()).isEqualTo(0);
    }

    @Test
    @Tag("unit")
    void testEmptySourceYieldsOnlyEndOfFile() {
        List<Token> tokens = scan("");

        assertThat(diagnostics.getDiagnostics()).isEmpty();
        assertThat(tokens).hasSize(1);
        assertThat(tokens.get(0)).extracting(Token::type, Token::line, Token::column)
                .containsExactly(TokenType.END_OF_FILE, 1, 1);
    }
}
