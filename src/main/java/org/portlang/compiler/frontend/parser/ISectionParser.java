package org.portlang.compiler.frontend.parser;

/**
 * The base interface for the parsers of the individual portfolio sections.
 * Section parsers are optimistic: a failed expectation is reported through the
 * context's diagnostics and the affected field is skipped, never thrown.
 *
 * @param <T> The section type produced.
 */
@FunctionalInterface
public interface ISectionParser<T> {

    /**
     * Parses one section starting at the current token.
     *
     * @param context The context that provides access to the token stream.
     * @return The parsed section. Implementations document whether {@code null} can be returned.
     */
    T parse(ParsingContext context);
}
