package org.portlang.compiler.model;

/**
 * The configuration section of a portfolio. Every field is optional and is
 * {@code null} when the source does not assign it.
 *
 * @param name The portfolio name.
 * @param riskProfile The declared risk profile, verbatim.
 * @param horizon The investment time horizon.
 */
public record Configuration(String name, String riskProfile, Horizon horizon) {

    private static final Configuration EMPTY = new Configuration(null, null, null);

    public static Configuration empty() {
        return EMPTY;
    }
}
