package com.safetysentinel.core.model;

/**
 * Which part of the engine raised an {@link Alert}.
 */
public enum AlertOrigin {
    /** A registered threshold rule matched a metric. */
    RULE,
    /** Sliding-window pattern detection over child-safety events. */
    SAFETY_PATTERN,
    /** Fast-path escalation of a single child-safety event. */
    SAFETY_EMERGENCY,
    /** Security event tracking, e.g. repeated authentication failures. */
    SECURITY
}
