package org.portlang.compiler.model;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class AllocationTest {

    @Test
    void totalAndRiskExposure() {
        Allocation allocation = Allocation.builder()
                .put(AssetClass.DOMESTIC_EQUITIES, 20)
                .put(AssetClass.INTERNATIONAL_EQUITIES, 15)
                .put(AssetClass.MULTI_MARKET_FUNDS, 5)
                .put(AssetClass.REAL_ESTATE_FUNDS, 10)
                .put(AssetClass.FIXED_INCOME, 50)
                .build();

        assertThat(allocation.total()).isEqualTo(100.0);
        assertThat(allocation.riskExposure()).isEqualTo(40.0);
        assertThat(allocation.percentageOf(AssetClass.FIXED_INCOME)).isEqualTo(50.0);
    }

    @Test
    void missingClassCountsAsZero() {
        Allocation allocation = Allocation.builder().put(AssetClass.FIXED_INCOME, 100).build();

        assertThat(allocation.percentageOf(AssetClass.DOMESTIC_EQUITIES)).isZero();
        assertThat(allocation.riskExposure()).isZero();
    }

    @Test
    void copiesAreImmutable() {
        Map<AssetClass, Double> source = new LinkedHashMap<>();
        source.put(AssetClass.FIXED_INCOME, 100.0);
        Allocation allocation = Allocation.of(source);
        source.put(AssetClass.DOMESTIC_EQUITIES, 10.0);

        assertThat(allocation.size()).isEqualTo(1);
        assertThatThrownBy(() -> allocation.percentages().put(AssetClass.DOMESTIC_EQUITIES, 1.0))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void percentagesFormatting() {
        assertThat(Percentages.compact(110.0)).isEqualTo("110");
        assertThat(Percentages.compact(3.50)).isEqualTo("3.5");
        assertThat(Percentages.compact(33.333)).isEqualTo("33.33");
        assertThat(Percentages.compact(-0.001)).isEqualTo("0");
        assertThat(Percentages.fixed(10)).isEqualTo("10.00");
    }

    @Test
    void riskProfileLabelsAreCaseInsensitive() {
        assertThat(RiskProfile.fromLabel("Moderado")).contains(RiskProfile.MODERATE);
        assertThat(RiskProfile.fromLabel("conservative")).isEmpty();
        assertThat(RiskProfile.fromLabel(null)).isEmpty();
    }
}
