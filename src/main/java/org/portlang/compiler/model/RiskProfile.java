package org.portlang.compiler.model;

import java.util.Locale;
import java.util.Optional;

/**
 * The risk profiles the validator knows thresholds for.
 */
public enum RiskProfile {
    CONSERVATIVE("conservador"),
    MODERATE("moderado"),
    AGGRESSIVE("arrojado");

    private final String label;

    RiskProfile(String label) {
        this.label = label;
    }

    /**
     * Resolves a declared profile string, ignoring case.
     * @param text The declared profile.
     * @return The matching profile, or empty if the text names no known profile.
     */
    public static Optional<RiskProfile> fromLabel(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String normalized = text.toLowerCase(Locale.ROOT);
        for (RiskProfile profile : values()) {
            if (profile.label.equals(normalized)) {
                return Optional.of(profile);
            }
        }
        return Optional.empty();
    }
}
