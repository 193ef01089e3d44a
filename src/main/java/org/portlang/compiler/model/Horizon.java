package org.portlang.compiler.model;

/**
 * An investment time horizon, e.g. {@code 15 anos}.
 *
 * @param amount The number of units.
 * @param unit The unit.
 */
public record Horizon(int amount, TimeUnit unit) {

    @Override
    public String toString() {
        return amount + " " + unit.keyword();
    }
}
