package org.portlang.compiler.frontend.parser;

import org.portlang.compiler.api.SourceInfo;
import org.portlang.compiler.diagnostics.DiagnosticCode;
import org.portlang.compiler.diagnostics.DiagnosticsEngine;
import org.portlang.compiler.frontend.lexer.Token;
import org.portlang.compiler.frontend.lexer.TokenType;
import org.portlang.compiler.frontend.parser.features.allocation.AllocationSectionParser;
import org.portlang.compiler.frontend.parser.features.configuration.ConfigurationSectionParser;
import org.portlang.compiler.frontend.parser.features.rebalance.RebalanceSectionParser;
import org.portlang.compiler.frontend.parser.features.restrictions.RestrictionsSectionParser;
import org.portlang.compiler.model.Allocation;
import org.portlang.compiler.model.Configuration;
import org.portlang.compiler.model.PortfolioDocument;
import org.portlang.compiler.model.RebalancePolicy;
import org.portlang.compiler.model.Restrictions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The recursive-descent parser for the portfolio language. It consumes a list of tokens
 * from the {@link org.portlang.compiler.frontend.lexer.Lexer} and produces a
 * {@link PortfolioDocument}.
 * <pre>
 * Portfolio := 'carteira' '{' ConfigSection AllocationSection [RestrictionsSection] [RebalanceSection] '}'
 * </pre>
 * Recovery works by keyword relevance: a failed expectation leaves the offending token in
 * place, and the loop of the enclosing section decides whether it is a keyword it knows.
 * A malformed field followed by a token that is neither the expected terminator nor a known
 * keyword therefore ends the section early.
 */
public class Parser implements ParsingContext {

    private static final Logger LOGGER = LoggerFactory.getLogger(Parser.class);

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private final ISectionParser<Configuration> configurationParser = new ConfigurationSectionParser();
    private final ISectionParser<Allocation> allocationParser = new AllocationSectionParser();
    private final ISectionParser<Restrictions> restrictionsParser = new RestrictionsSectionParser();
    private final ISectionParser<RebalancePolicy> rebalanceParser = new RebalanceSectionParser();
    private int current = 0;

    /**
     * Constructs a new Parser.
     * @param tokens The list of tokens to parse, terminated by an end-of-file token.
     * @param diagnostics The engine for reporting errors and warnings.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics) {
        this.tokens = tokens;
        this.diagnostics = diagnostics;
    }

    /**
     * Parses the entire token stream.
     * <p>
     * A fault inside the parser itself (for instance a token list without an end-of-file
     * token) is reported as a single {@link DiagnosticCode#INTERNAL_PARSER_ERROR} and
     * yields no document.
     *
     * @return The parsed document, possibly with empty sections, or {@code null} if a
     *         structurally required element could not be matched.
     */
    public PortfolioDocument parse() {
        try {
            return portfolio();
        } catch (RuntimeException e) {
            LOGGER.error("Internal parser error at token index {}", current, e);
            diagnostics.report(DiagnosticCode.INTERNAL_PARSER_ERROR,
                    "Internal parser error: " + e.getMessage(),
                    faultLocation(),
                    null);
            return null;
        }
    }

    private PortfolioDocument portfolio() {
        if (expect(TokenType.CARTEIRA) == null) {
            return null;
        }
        if (expect(TokenType.LEFT_BRACE) == null) {
            return null;
        }

        Configuration configuration = configurationParser.parse(this);
        Allocation allocation = allocationParser.parse(this);
        if (allocation == null) {
            return null;
        }

        Restrictions restrictions = Restrictions.empty();
        RebalancePolicy rebalancePolicy = RebalancePolicy.empty();

        if (check(TokenType.RESTRICOES)) {
            restrictions = restrictionsParser.parse(this);
        }
        if (check(TokenType.REBALANCEAMENTO)) {
            rebalancePolicy = rebalanceParser.parse(this);
        }

        expect(TokenType.RIGHT_BRACE);

        LOGGER.debug("Parsed portfolio '{}' with {} allocated asset classes",
                configuration.name(), allocation.size());
        return new PortfolioDocument(configuration, allocation, restrictions, rebalancePolicy);
    }

    @Override
    public boolean match(TokenType... types) {
        if (check(types)) {
            advance();
            return true;
        }
        return false;
    }

    @Override
    public boolean check(TokenType... types) {
        return checkAhead(0, types);
    }

    @Override
    public boolean checkAhead(int offset, TokenType... types) {
        TokenType actual = peek(offset).type();
        for (TokenType type : types) {
            if (actual == type) {
                return true;
            }
        }
        return false;
    }

    @Override
    public Token advance() {
        Token token = peek();
        if (!isAtEnd()) current++;
        return token;
    }

    @Override
    public boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }

    @Override
    public Token peek() {
        return peek(0);
    }

    /**
     * Returns the token {@code offset} positions ahead without consuming anything.
     * Offsets beyond the end resolve to the last token.
     * @param offset The lookahead distance.
     * @return The token at that position.
     */
    public Token peek(int offset) {
        int index = current + offset;
        if (index >= tokens.size()) {
            if (tokens.get(tokens.size() - 1).type() != TokenType.END_OF_FILE) {
                throw new IllegalStateException("token stream exhausted without an end-of-file token");
            }
            return tokens.get(tokens.size() - 1);
        }
        return tokens.get(index);
    }

    @Override
    public Token expect(TokenType... types) {
        if (check(types)) {
            return advance();
        }
        Token unexpected = peek();
        String expected = describe(types);
        diagnostics.report(DiagnosticCode.UNEXPECTED_TOKEN,
                "Expected " + expected + ", found " + describeFound(unexpected),
                unexpected.sourceInfo(),
                "Insert " + expected);
        return null;
    }

    @Override
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    private static String describe(TokenType... types) {
        if (types.length == 1) {
            return types[0].describe();
        }
        List<String> names = Arrays.stream(types).map(TokenType::describe).collect(Collectors.toList());
        return String.join(", ", names.subList(0, names.size() - 1)) + " or " + names.get(names.size() - 1);
    }

    private static String describeFound(Token token) {
        return switch (token.type()) {
            case STRING -> "string \"" + token.value() + "\"";
            case NUMBER -> "number " + token.text();
            case IDENTIFIER -> "identifier '" + token.text() + "'";
            default -> token.type().describe();
        };
    }

    private SourceInfo faultLocation() {
        if (tokens.isEmpty()) {
            return null;
        }
        Token at = tokens.get(Math.min(current, tokens.size() - 1));
        return at.sourceInfo();
    }
}
