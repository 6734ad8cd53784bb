package com.safetysentinel.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Comparison applied by an {@link AlertRule} between a metric value and the
 * rule threshold.
 *
 * <p>
 * Equality is exact, matching how rules are written against gauges that
 * take discrete values.
 * </p>
 */
public enum Comparator {
    GREATER_THAN(">"),
    LESS_THAN("<"),
    EQUAL_TO("==");

    private final String symbol;

    Comparator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * @param value     observed value
     * @param threshold rule threshold
     * @return {@code true} if {@code value symbol threshold} holds
     */
    public boolean matches(double value, double threshold) {
        return switch (this) {
            case GREATER_THAN -> value > threshold;
            case LESS_THAN -> value < threshold;
            case EQUAL_TO -> value == threshold;
        };
    }

    /**
     * Look up a comparator by its symbol.
     *
     * @param symbol one of {@code >}, {@code <}, {@code ==}
     * @return the comparator, or empty if the symbol is not supported
     */
    public static Optional<Comparator> fromSymbol(String symbol) {
        if (symbol == null) {
            return Optional.empty();
        }
        String trimmed = symbol.trim();
        return Arrays.stream(values())
                .filter(c -> c.symbol.equals(trimmed))
                .findFirst();
    }

    @Override
    public String toString() {
        return symbol;
    }
}
