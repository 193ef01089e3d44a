package org.portlang.compiler.frontend.semantics;

import com.typesafe.config.Config;

/**
 * Thresholds used by the semantic validation rules.
 * <p>
 * Configuration structure (all keys optional, defaults shown):
 * <pre>
 * portlang.validation {
 *   sum-tolerance = 0.01
 *   conservative-max-exposure = 30
 *   moderate-min-exposure = 20
 *   moderate-max-exposure = 70
 *   aggressive-min-exposure = 50
 *   max-volatility-limit = 50
 *   max-management-fee-limit = 5
 * }
 * </pre>
 *
 * @param sumTolerance Absolute deviation from 100% tolerated by the allocation sum check.
 * @param conservativeMaxExposure Highest high-risk exposure of a conservative portfolio.
 * @param moderateMinExposure Lowest high-risk exposure of a moderate portfolio.
 * @param moderateMaxExposure Highest high-risk exposure of a moderate portfolio.
 * @param aggressiveMinExposure Lowest high-risk exposure of an aggressive portfolio.
 * @param maxVolatilityLimit Upper bound for the declared maximum volatility.
 * @param maxManagementFeeLimit Upper bound for the declared maximum management fee.
 */
public record ValidationSettings(
        double sumTolerance,
        double conservativeMaxExposure,
        double moderateMinExposure,
        double moderateMaxExposure,
        double aggressiveMinExposure,
        double maxVolatilityLimit,
        double maxManagementFeeLimit
) {
    /** The configuration path of the validation block. */
    public static final String CONFIG_PATH = "portlang.validation";

    private static final ValidationSettings DEFAULTS = new ValidationSettings(0.01, 30, 20, 70, 50, 50, 5);

    public ValidationSettings {
        if (sumTolerance < 0) {
            throw new IllegalArgumentException("sum-tolerance must not be negative: " + sumTolerance);
        }
        if (moderateMinExposure > moderateMaxExposure) {
            throw new IllegalArgumentException("moderate-min-exposure must not exceed moderate-max-exposure");
        }
    }

    public static ValidationSettings defaults() {
        return DEFAULTS;
    }

    /**
     * Reads the settings from {@value #CONFIG_PATH}, falling back to the defaults for missing keys.
     * @param config The application configuration.
     * @return The settings.
     */
    public static ValidationSettings fromConfig(Config config) {
        if (!config.hasPath(CONFIG_PATH)) {
            return DEFAULTS;
        }
        Config c = config.getConfig(CONFIG_PATH);
        return new ValidationSettings(
                read(c, "sum-tolerance", DEFAULTS.sumTolerance),
                read(c, "conservative-max-exposure", DEFAULTS.conservativeMaxExposure),
                read(c, "moderate-min-exposure", DEFAULTS.moderateMinExposure),
                read(c, "moderate-max-exposure", DEFAULTS.moderateMaxExposure),
                read(c, "aggressive-min-exposure", DEFAULTS.aggressiveMinExposure),
                read(c, "max-volatility-limit", DEFAULTS.maxVolatilityLimit),
                read(c, "max-management-fee-limit", DEFAULTS.maxManagementFeeLimit));
    }

    private static double read(Config config, String key, double fallback) {
        return config.hasPath(key) ? config.getDouble(key) : fallback;
    }
}
