package org.portlang.compiler.model;

/**
 * The closed set of investable asset classes an allocation can assign percentages to.
 */
public enum AssetClass {
    DOMESTIC_EQUITIES("ações_nacionais", "Domestic Equities", true),
    INTERNATIONAL_EQUITIES("ações_internacionais", "International Equities", true),
    REAL_ESTATE_FUNDS("fundos_imobiliarios", "Real Estate Funds", false),
    MULTI_MARKET_FUNDS("fundos_multimercado", "Multi-Market Funds", true),
    FIXED_INCOME("renda_fixa", "Fixed Income", false);

    private final String keyword;
    private final String displayName;
    private final boolean highRisk;

    AssetClass(String keyword, String displayName, boolean highRisk) {
        this.keyword = keyword;
        this.displayName = displayName;
        this.highRisk = highRisk;
    }

    /**
     * @return The keyword naming this asset class in source text.
     */
    public String keyword() {
        return keyword;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * @return {@code true} if percentages of this class count towards risk exposure.
     */
    public boolean isHighRisk() {
        return highRisk;
    }
}
