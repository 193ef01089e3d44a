package org.portlang.compiler.frontend.lexer;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 * Keyword types carry their exact (case-sensitive) spelling in the source language.
 */
public enum TokenType {
    // Section and field keywords.
    CARTEIRA("carteira"),
    NOME("nome"),
    PERFIL("perfil"),
    HORIZONTE_TEMPORAL("horizonte_temporal"),
    ALOCACAO("alocação"),
    RESTRICOES("restrições"),
    REBALANCEAMENTO("rebalanceamento"),

    // Asset class keywords.
    ACOES_NACIONAIS("ações_nacionais"),
    ACOES_INTERNACIONAIS("ações_internacionais"),
    FUNDOS_IMOBILIARIOS("fundos_imobiliarios"),
    FUNDOS_MULTIMERCADO("fundos_multimercado"),
    RENDA_FIXA("renda_fixa"),

    // Restriction keywords.
    VOLATILIDADE_MAXIMA("volatilidade_maxima"),
    TAXA_ADMINISTRATIVA_MAXIMA("taxa_administrativa_maxima"),

    // Rebalancing keywords.
    FREQUENCIA("frequencia"),
    TOLERANCIA("tolerancia"),

    // Time units.
    ANOS("anos"),
    MESES("meses"),

    // Rebalancing frequencies.
    TRIMESTRAL("trimestral"),
    SEMESTRAL("semestral"),
    ANUAL("anual"),
    MENSAL("mensal"),

    // Single-character tokens.
    /** The '=' character. */
    EQUALS(null),
    /** The '{' character. */
    LEFT_BRACE(null),
    /** The '}' character. */
    RIGHT_BRACE(null),
    /** The ';' character. */
    SEMICOLON(null),
    /** The '%' character. */
    PERCENT(null),

    // Literals.
    /** A double-quoted string literal. */
    STRING(null),
    /** An integer or decimal numeric literal. */
    NUMBER(null),
    /** A word that is not a keyword. */
    IDENTIFIER(null),

    /** Represents the end of the source text. */
    END_OF_FILE(null);

    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> keywords = new HashMap<>();
        for (TokenType type : values()) {
            if (type.keyword != null) {
                keywords.put(type.keyword, type);
            }
        }
        KEYWORDS = Collections.unmodifiableMap(keywords);
    }

    private final String keyword;

    TokenType(String keyword) {
        this.keyword = keyword;
    }

    /**
     * Looks up the keyword type for an identifier. The lookup is case-sensitive.
     * @param text The identifier text.
     * @return The keyword type, or empty if the text is not a keyword.
     */
    public static Optional<TokenType> fromKeyword(String text) {
        return Optional.ofNullable(KEYWORDS.get(text));
    }

    /**
     * @return A short human-readable description used in diagnostics.
     */
    public String describe() {
        if (keyword != null) {
            return "'" + keyword + "'";
        }
        return switch (this) {
            case EQUALS -> "'='";
            case LEFT_BRACE -> "'{'";
            case RIGHT_BRACE -> "'}'";
            case SEMICOLON -> "';'";
            case PERCENT -> "'%'";
            case STRING -> "string";
            case NUMBER -> "number";
            case IDENTIFIER -> "identifier";
            default -> "end of input";
        };
    }
}
