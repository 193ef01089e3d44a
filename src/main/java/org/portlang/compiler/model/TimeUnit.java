package org.portlang.compiler.model;

/**
 * Unit of an investment time horizon.
 */
public enum TimeUnit {
    YEARS("anos"),
    MONTHS("meses");

    private final String keyword;

    TimeUnit(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }
}
