package org.portlang.compiler.model;

/**
 * The restrictions section. Both limits are optional percentages and are
 * {@code null} when not assigned.
 *
 * @param maxVolatility The maximum tolerated volatility.
 * @param maxManagementFee The maximum tolerated management fee.
 */
public record Restrictions(Double maxVolatility, Double maxManagementFee) {

    private static final Restrictions EMPTY = new Restrictions(null, null);

    public static Restrictions empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return maxVolatility == null && maxManagementFee == null;
    }
}
