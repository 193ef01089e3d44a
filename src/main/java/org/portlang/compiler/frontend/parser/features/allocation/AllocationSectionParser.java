package org.portlang.compiler.frontend.parser.features.allocation;

import org.portlang.compiler.frontend.lexer.Token;
import org.portlang.compiler.frontend.lexer.TokenType;
import org.portlang.compiler.frontend.parser.ISectionParser;
import org.portlang.compiler.frontend.parser.ParsingContext;
import org.portlang.compiler.model.Allocation;
import org.portlang.compiler.model.AssetClass;

import java.util.EnumMap;
import java.util.Map;

/**
 * Parses the mandatory allocation section.
 * <pre>
 * AllocationSection := 'alocação' '{' AssetAssign* '}'
 * AssetAssign       := AssetClassKeyword '=' Number '%' ';'
 * </pre>
 */
public class AllocationSectionParser implements ISectionParser<Allocation> {

    private static final Map<TokenType, AssetClass> ASSET_CLASSES = new EnumMap<>(TokenType.class);

    static {
        ASSET_CLASSES.put(TokenType.ACOES_NACIONAIS, AssetClass.DOMESTIC_EQUITIES);
        ASSET_CLASSES.put(TokenType.ACOES_INTERNACIONAIS, AssetClass.INTERNATIONAL_EQUITIES);
        ASSET_CLASSES.put(TokenType.FUNDOS_IMOBILIARIOS, AssetClass.REAL_ESTATE_FUNDS);
        ASSET_CLASSES.put(TokenType.FUNDOS_MULTIMERCADO, AssetClass.MULTI_MARKET_FUNDS);
        ASSET_CLASSES.put(TokenType.RENDA_FIXA, AssetClass.FIXED_INCOME);
    }

    /**
     * Parses the allocation section.
     * @param context The parsing context.
     * @return The allocation, or {@code null} if the section keyword or its opening brace is missing.
     */
    @Override
    public Allocation parse(ParsingContext context) {
        if (context.expect(TokenType.ALOCACAO) == null) {
            return null;
        }
        if (context.expect(TokenType.LEFT_BRACE) == null) {
            return null;
        }

        Allocation.Builder allocation = Allocation.builder();
        while (context.check(TokenType.ACOES_NACIONAIS, TokenType.ACOES_INTERNACIONAIS,
                TokenType.FUNDOS_IMOBILIARIOS, TokenType.FUNDOS_MULTIMERCADO, TokenType.RENDA_FIXA)) {
            AssetClass assetClass = ASSET_CLASSES.get(context.advance().type());

            if (context.expect(TokenType.EQUALS) == null) {
                continue;
            }
            Token percentage = context.expect(TokenType.NUMBER);
            if (percentage != null && context.expect(TokenType.PERCENT) != null) {
                allocation.put(assetClass, ((Number) percentage.value()).doubleValue());
            }
            context.expect(TokenType.SEMICOLON);
        }

        context.expect(TokenType.RIGHT_BRACE);
        return allocation.build();
    }
}
