package org.portlang.compiler.model;

/**
 * How often a portfolio is rebalanced.
 */
public enum RebalanceFrequency {
    MONTHLY("Monthly"),
    QUARTERLY("Quarterly"),
    SEMIANNUAL("Semiannual"),
    ANNUAL("Annual");

    private final String displayName;

    RebalanceFrequency(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
