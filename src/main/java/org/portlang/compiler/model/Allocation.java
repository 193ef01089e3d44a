package org.portlang.compiler.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The allocation section: an ordered mapping from asset class to percentage.
 * Keys are unique; assigning a class twice keeps its first position and the last value.
 * Instances are immutable once built.
 */
public final class Allocation {

    private static final Allocation EMPTY = new Allocation(Map.of());

    private final Map<AssetClass, Double> percentages;

    private Allocation(Map<AssetClass, Double> percentages) {
        this.percentages = Collections.unmodifiableMap(new LinkedHashMap<>(percentages));
    }

    public static Allocation empty() {
        return EMPTY;
    }

    /**
     * Creates an allocation from the given entries, keeping their iteration order.
     * @param percentages The percentages by asset class.
     * @return A new allocation.
     */
    public static Allocation of(Map<AssetClass, Double> percentages) {
        return new Allocation(percentages);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return The percentages in declaration order, unmodifiable.
     */
    public Map<AssetClass, Double> percentages() {
        return percentages;
    }

    public boolean isEmpty() {
        return percentages.isEmpty();
    }

    public int size() {
        return percentages.size();
    }

    /**
     * @param assetClass The asset class.
     * @return The assigned percentage, or 0 if the class is not allocated.
     */
    public double percentageOf(AssetClass assetClass) {
        return percentages.getOrDefault(assetClass, 0.0);
    }

    /**
     * @return The sum of all percentages.
     */
    public double total() {
        double sum = 0;
        for (double p : percentages.values()) {
            sum += p;
        }
        return sum;
    }

    /**
     * @return The sum of the percentages assigned to high-risk asset classes.
     */
    public double riskExposure() {
        double sum = 0;
        for (Map.Entry<AssetClass, Double> e : percentages.entrySet()) {
            if (e.getKey().isHighRisk()) {
                sum += e.getValue();
            }
        }
        return sum;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Allocation other)) return false;
        return percentages.equals(other.percentages);
    }

    @Override
    public int hashCode() {
        return Objects.hash(percentages);
    }

    @Override
    public String toString() {
        return "Allocation" + percentages;
    }

    /**
     * Accumulates percentages while the allocation section is parsed.
     */
    public static final class Builder {
        private final Map<AssetClass, Double> percentages = new LinkedHashMap<>();

        private Builder() {}

        public Builder put(AssetClass assetClass, double percentage) {
            percentages.put(assetClass, percentage);
            return this;
        }

        public Allocation build() {
            return new Allocation(percentages);
        }
    }
}
