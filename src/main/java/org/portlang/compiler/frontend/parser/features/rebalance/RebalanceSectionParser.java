package org.portlang.compiler.frontend.parser.features.rebalance;

import org.portlang.compiler.frontend.lexer.Token;
import org.portlang.compiler.frontend.lexer.TokenType;
import org.portlang.compiler.frontend.parser.ISectionParser;
import org.portlang.compiler.frontend.parser.ParsingContext;
import org.portlang.compiler.model.RebalanceFrequency;
import org.portlang.compiler.model.RebalancePolicy;

/**
 * Parses the optional rebalancing section. The caller has already checked that the
 * current token is {@code rebalanceamento}.
 * <pre>
 * RebalanceSection := 'rebalanceamento' '{' [FrequencyAssign] [ToleranceAssign] '}'
 * FrequencyAssign  := 'frequencia' '=' ('mensal'|'trimestral'|'semestral'|'anual') ';'
 * ToleranceAssign  := 'tolerancia' '=' Number '%' ';'
 * </pre>
 * Each assignment may appear at most once and frequency comes first.
 * Never returns {@code null}; a missing opening brace yields an empty policy.
 */
public class RebalanceSectionParser implements ISectionParser<RebalancePolicy> {

    @Override
    public RebalancePolicy parse(ParsingContext context) {
        context.advance(); // consume 'rebalanceamento'
        if (context.expect(TokenType.LEFT_BRACE) == null) {
            return RebalancePolicy.empty();
        }

        RebalanceFrequency frequency = null;
        Double tolerance = null;

        if (context.match(TokenType.FREQUENCIA)) {
            if (context.expect(TokenType.EQUALS) != null) {
                Token value = context.expect(TokenType.MENSAL, TokenType.TRIMESTRAL, TokenType.SEMESTRAL, TokenType.ANUAL);
                if (value != null) {
                    frequency = toFrequency(value.type());
                }
                context.expect(TokenType.SEMICOLON);
            }
        }

        if (context.match(TokenType.TOLERANCIA)) {
            if (context.expect(TokenType.EQUALS) != null) {
                Token value = context.expect(TokenType.NUMBER);
                if (value != null && context.expect(TokenType.PERCENT) != null) {
                    tolerance = ((Number) value.value()).doubleValue();
                }
                context.expect(TokenType.SEMICOLON);
            }
        }

        context.expect(TokenType.RIGHT_BRACE);
        return new RebalancePolicy(frequency, tolerance);
    }

    private static RebalanceFrequency toFrequency(TokenType type) {
        return switch (type) {
            case MENSAL -> RebalanceFrequency.MONTHLY;
            case TRIMESTRAL -> RebalanceFrequency.QUARTERLY;
            case SEMESTRAL -> RebalanceFrequency.SEMIANNUAL;
            case ANUAL -> RebalanceFrequency.ANNUAL;
            default -> throw new IllegalArgumentException("Not a rebalancing frequency: " + type);
        };
    }
}
