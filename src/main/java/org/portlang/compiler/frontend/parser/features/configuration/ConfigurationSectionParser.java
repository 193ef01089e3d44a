package org.portlang.compiler.frontend.parser.features.configuration;

import org.portlang.compiler.diagnostics.DiagnosticCode;
import org.portlang.compiler.frontend.lexer.Token;
import org.portlang.compiler.frontend.lexer.TokenType;
import org.portlang.compiler.frontend.parser.ISectionParser;
import org.portlang.compiler.frontend.parser.ParsingContext;
import org.portlang.compiler.model.Configuration;
import org.portlang.compiler.model.Horizon;
import org.portlang.compiler.model.TimeUnit;

/**
 * Parses the configuration assignments at the top of a portfolio.
 * <pre>
 * ConfigSection := ( NameAssign | ProfileAssign | HorizonAssign )*
 * NameAssign    := 'nome' '=' String ';'
 * ProfileAssign := 'perfil' '=' String ';'
 * HorizonAssign := 'horizonte_temporal' '=' Number ('anos'|'meses') ';'
 * </pre>
 * Assignments may appear in any order; a repeated assignment overwrites the earlier value.
 * A blank name or profile is not recorded, so it counts as not declared.
 * Never returns {@code null}.
 */
public class ConfigurationSectionParser implements ISectionParser<Configuration> {

    @Override
    public Configuration parse(ParsingContext context) {
        String name = null;
        String riskProfile = null;
        Horizon horizon = null;

        while (context.check(TokenType.NOME, TokenType.PERFIL, TokenType.HORIZONTE_TEMPORAL)) {
            Token keyword = context.advance();
            if (context.expect(TokenType.EQUALS) == null) {
                continue;
            }
            switch (keyword.type()) {
                case NOME -> {
                    String value = stringValue(context);
                    if (value != null) {
                        name = value;
                    }
                }
                case PERFIL -> {
                    String value = stringValue(context);
                    if (value != null) {
                        riskProfile = value;
                    }
                }
                default -> {
                    Horizon parsed = horizonValue(context);
                    if (parsed != null) {
                        horizon = parsed;
                    }
                }
            }
            context.expect(TokenType.SEMICOLON);
        }

        return new Configuration(name, riskProfile, horizon);
    }

    private String stringValue(ParsingContext context) {
        Token value = context.expect(TokenType.STRING);
        if (value == null) {
            return null;
        }
        String text = (String) value.value();
        return text.isBlank() ? null : text;
    }

    private Horizon horizonValue(ParsingContext context) {
        Token amount;
        Token unit;
        if (context.check(TokenType.NUMBER) && context.checkAhead(1, TokenType.ANOS, TokenType.MESES)) {
            amount = context.advance();
            unit = context.advance();
        } else {
            amount = context.expect(TokenType.NUMBER);
            if (amount == null) {
                return null;
            }
            unit = context.expect(TokenType.ANOS, TokenType.MESES);
            if (unit == null) {
                return null;
            }
        }

        Number value = (Number) amount.value();
        double raw = value.doubleValue();
        if (raw != Math.rint(raw)) {
            context.getDiagnostics().report(DiagnosticCode.FRACTIONAL_HORIZON,
                    "Time horizon must be a whole number, found " + amount.text(),
                    amount.sourceInfo(),
                    "Use a whole number of years or months");
            return null;
        }
        if (raw > Integer.MAX_VALUE) {
            context.getDiagnostics().report(DiagnosticCode.INVALID_NUMBER,
                    "Invalid number: " + amount.text(),
                    amount.sourceInfo(),
                    "Use a whole number of years or months");
            return null;
        }
        TimeUnit timeUnit = unit.type() == TokenType.ANOS ? TimeUnit.YEARS : TimeUnit.MONTHS;
        return new Horizon(value.intValue(), timeUnit);
    }
}
