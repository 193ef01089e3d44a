package org.portlang.compiler.frontend.parser.features.restrictions;

import org.portlang.compiler.frontend.lexer.Token;
import org.portlang.compiler.frontend.lexer.TokenType;
import org.portlang.compiler.frontend.parser.ISectionParser;
import org.portlang.compiler.frontend.parser.ParsingContext;
import org.portlang.compiler.model.Restrictions;

/**
 * Parses the optional restrictions section. The caller has already checked that the
 * current token is {@code restrições}.
 * <pre>
 * RestrictionsSection := 'restrições' '{' ( MaxVolAssign | MaxFeeAssign )* '}'
 * MaxVolAssign        := 'volatilidade_maxima' '=' Number '%' ';'
 * MaxFeeAssign        := 'taxa_administrativa_maxima' '=' Number '%' ';'
 * </pre>
 * Never returns {@code null}; a missing opening brace yields empty restrictions.
 */
public class RestrictionsSectionParser implements ISectionParser<Restrictions> {

    @Override
    public Restrictions parse(ParsingContext context) {
        context.advance(); // consume 'restrições'
        if (context.expect(TokenType.LEFT_BRACE) == null) {
            return Restrictions.empty();
        }

        Double maxVolatility = null;
        Double maxManagementFee = null;

        while (context.check(TokenType.VOLATILIDADE_MAXIMA, TokenType.TAXA_ADMINISTRATIVA_MAXIMA)) {
            Token keyword = context.advance();
            if (context.expect(TokenType.EQUALS) == null) {
                continue;
            }
            Token value = context.expect(TokenType.NUMBER);
            if (value != null && context.expect(TokenType.PERCENT) != null) {
                double percentage = ((Number) value.value()).doubleValue();
                if (keyword.type() == TokenType.VOLATILIDADE_MAXIMA) {
                    maxVolatility = percentage;
                } else {
                    maxManagementFee = percentage;
                }
            }
            context.expect(TokenType.SEMICOLON);
        }

        context.expect(TokenType.RIGHT_BRACE);
        return new Restrictions(maxVolatility, maxManagementFee);
    }
}
