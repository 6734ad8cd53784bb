package com.safetysentinel.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Severity shared by alerts, safety events and security events.
 *
 * <p>
 * Constants are declared in ascending order, so {@link #compareTo(Enum)}
 * and {@link #isAtLeast(Severity)} can be used to apply severity floors.
 * </p>
 *
 * @since 1.0.0
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL,
    EMERGENCY;

    /**
     * @param other the floor to compare against
     * @return {@code true} if this severity is equal to or above {@code other}
     */
    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }

    /**
     * Lowercase label used in event payloads and YAML ({@code "medium"}).
     *
     * @return the label
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a severity label, ignoring case.
     *
     * @param label e.g. {@code "high"} or {@code "EMERGENCY"}
     * @return the matching severity
     * @throws NullPointerException     if {@code label} is {@code null}
     * @throws IllegalArgumentException if the label is unknown
     */
    public static Severity fromLabel(String label) {
        Objects.requireNonNull(label, "Severity label must not be null");
        try {
            return valueOf(label.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown severity: '" + label
                    + "'. Supported: low, medium, high, critical, emergency", e);
        }
    }
}
