package org.portlang.compiler.diagnostics;

import org.portlang.compiler.diagnostics.Diagnostic.Category;
import org.portlang.compiler.diagnostics.Diagnostic.Severity;

/**
 * Defines unique, testable codes for all diagnostics the compiler can raise.
 * Each code fixes the category and severity of its diagnostics, which decouples
 * test logic from the message texts.
 */
public enum DiagnosticCode {
    // region Lexer
    /** A string literal contains a line break. */
    STRING_LINE_BREAK("LEX001", Category.LEXICAL, Severity.ERROR),
    /** A string literal is not closed before the end of the input. */
    UNTERMINATED_STRING("LEX002", Category.LEXICAL, Severity.ERROR),
    /** A numeric literal contains more than one decimal point. */
    MULTIPLE_DECIMAL_POINTS("LEX003", Category.LEXICAL, Severity.ERROR),
    /** A numeric literal could not be converted to a number. */
    INVALID_NUMBER("LEX004", Category.LEXICAL, Severity.ERROR),
    /** A character that does not start any token. */
    UNRECOGNIZED_CHARACTER("LEX005", Category.LEXICAL, Severity.ERROR),
    // endregion

    // region Parser
    /** The current token does not match the token the grammar expects. */
    UNEXPECTED_TOKEN("SYN001", Category.SYNTACTIC, Severity.ERROR),
    /** The time horizon amount is not a whole number. */
    FRACTIONAL_HORIZON("SYN002", Category.SYNTACTIC, Severity.ERROR),
    /** The parser failed for a reason unrelated to the input. */
    INTERNAL_PARSER_ERROR("SYN999", Category.SYNTACTIC, Severity.ERROR),
    // endregion

    // region Semantic Analysis
    /** No document was produced by the parser. */
    MISSING_DOCUMENT("SEM001", Category.SEMANTIC, Severity.ERROR),
    /** The allocation section assigns no asset class. */
    EMPTY_ALLOCATION("SEM002", Category.SEMANTIC, Severity.ERROR),
    /** The allocation percentages add up to more than 100%. */
    ALLOCATION_EXCEEDS_TOTAL("SEM003", Category.SEMANTIC, Severity.ERROR),
    /** The allocation percentages add up to less than 100%. */
    ALLOCATION_BELOW_TOTAL("SEM004", Category.SEMANTIC, Severity.ERROR),
    /** A single allocation percentage lies outside [0, 100]. */
    PERCENTAGE_OUT_OF_RANGE("SEM005", Category.SEMANTIC, Severity.ERROR),
    /** No risk profile is declared. */
    MISSING_RISK_PROFILE("SEM007", Category.SEMANTIC, Severity.WARNING),
    /** A conservative portfolio holds too much in high-risk asset classes. */
    CONSERVATIVE_EXPOSURE_EXCEEDED("SEM008", Category.SEMANTIC, Severity.ERROR),
    /** A moderate portfolio's high-risk exposure lies outside the moderate band. */
    MODERATE_EXPOSURE_OUT_OF_BAND("SEM009", Category.SEMANTIC, Severity.WARNING),
    /** An aggressive portfolio holds too little in high-risk asset classes. */
    AGGRESSIVE_EXPOSURE_TOO_LOW("SEM011", Category.SEMANTIC, Severity.WARNING),
    /** The maximum volatility restriction is out of range. */
    MAX_VOLATILITY_OUT_OF_RANGE("SEM013", Category.SEMANTIC, Severity.ERROR),
    /** The maximum management fee restriction is out of range. */
    MAX_MANAGEMENT_FEE_OUT_OF_RANGE("SEM018", Category.SEMANTIC, Severity.ERROR),
    // endregion

    // region Report Generation
    /** No report renderer was configured. */
    RENDERER_UNAVAILABLE("GEN001", Category.GENERATION, Severity.WARNING),
    /** The report renderer failed. */
    REPORT_GENERATION_FAILED("GEN003", Category.GENERATION, Severity.ERROR);
    // endregion

    private final String code;
    private final Category category;
    private final Severity severity;

    DiagnosticCode(String code, Category category, Severity severity) {
        this.code = code;
        this.category = category;
        this.severity = severity;
    }

    /**
     * @return The stable short identifier, e.g. {@code LEX001}.
     */
    public String code() {
        return code;
    }

    public Category category() {
        return category;
    }

    public Severity severity() {
        return severity;
    }
}
