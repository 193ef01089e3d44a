package org.portlang.compiler.model;

import java.util.Objects;

/**
 * The structured representation of one portfolio source. It is built once by the
 * parser and read-only afterwards. All four sections are always present, possibly empty.
 * <p>
 * A document may be semantically invalid (e.g. its allocation does not add up to 100%);
 * such findings are diagnostics, not construction failures.
 *
 * @param configuration Name, risk profile and horizon.
 * @param allocation Percentages by asset class.
 * @param restrictions Volatility and fee limits.
 * @param rebalancePolicy Rebalancing frequency and tolerance.
 */
public record PortfolioDocument(
        Configuration configuration,
        Allocation allocation,
        Restrictions restrictions,
        RebalancePolicy rebalancePolicy
) {
    public PortfolioDocument {
        Objects.requireNonNull(configuration, "configuration");
        Objects.requireNonNull(allocation, "allocation");
        Objects.requireNonNull(restrictions, "restrictions");
        Objects.requireNonNull(rebalancePolicy, "rebalancePolicy");
    }
}
