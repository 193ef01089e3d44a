package org.portlang.compiler.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * Formatting helpers for percentage values in messages and reports.
 */
public final class Percentages {

    private Percentages() {}

    /**
     * Formats a percentage compactly: rounded to two decimals, trailing zeros dropped.
     * {@code 110.0} becomes {@code "110"}, {@code 3.50} becomes {@code "3.5"}.
     * @param value The value.
     * @return The formatted value, without the percent sign.
     */
    public static String compact(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        BigDecimal rounded = BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).stripTrailingZeros();
        if (rounded.signum() == 0) {
            return "0";
        }
        return rounded.toPlainString();
    }

    /**
     * Formats a value with exactly two decimals, e.g. {@code "10.00"}.
     * @param value The value.
     * @return The formatted value, without the percent sign.
     */
    public static String fixed(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
