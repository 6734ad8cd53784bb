package com.safetysentinel.core.model;

/**
 * Lifecycle state of an {@link Alert}.
 *
 * <pre>
 *   ACTIVE ──► ACKNOWLEDGED ──► RESOLVED
 *     │  └───────────────────────▲
 *     └──► SUPPRESSED
 * </pre>
 *
 * {@code RESOLVED} and {@code SUPPRESSED} are terminal.
 */
public enum AlertStatus {
    ACTIVE,
    ACKNOWLEDGED,
    RESOLVED,
    SUPPRESSED;

    /**
     * @return {@code true} while the alert can still be re-triggered or moved on
     */
    public boolean isOpen() {
        return this == ACTIVE || this == ACKNOWLEDGED;
    }

    /**
     * @return {@code true} for states with no outgoing transition
     */
    public boolean isTerminal() {
        return this == RESOLVED || this == SUPPRESSED;
    }
}
