package org.portlang.compiler.model;

/**
 * The rebalancing section. Both fields are optional and {@code null} when not assigned.
 *
 * @param frequency How often to rebalance.
 * @param tolerance The drift, in percent, tolerated before rebalancing.
 */
public record RebalancePolicy(RebalanceFrequency frequency, Double tolerance) {

    private static final RebalancePolicy EMPTY = new RebalancePolicy(null, null);

    public static RebalancePolicy empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return frequency == null && tolerance == null;
    }
}
