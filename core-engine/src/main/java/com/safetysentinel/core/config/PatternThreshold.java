package com.safetysentinel.core.config;

import java.util.Objects;

/**
 * How many events of one type a child may produce within the pattern window
 * before a pattern alert is raised.
 *
 * @since 1.0.0
 */
public final class PatternThreshold {

    private final String eventType;
    private final int threshold;
    private final String patternName;

    /**
     * @param eventType   safety event type, e.g. {@code inappropriate_content}
     * @param threshold   event count that triggers the pattern; must be &gt;= 1
     * @param patternName alert title; {@code null} derives
     *                    {@code excessive_<eventType>}
     */
    public PatternThreshold(String eventType, int threshold, String patternName) {
        this.eventType = Objects.requireNonNull(eventType, "eventType must not be null");
        if (eventType.isBlank()) {
            throw new IllegalArgumentException("eventType must not be blank");
        }
        if (threshold < 1) {
            throw new IllegalArgumentException(
                    "threshold for '" + eventType + "' must be >= 1, got: " + threshold);
        }
        this.threshold = threshold;
        this.patternName = patternName != null && !patternName.isBlank()
                ? patternName
                : "excessive_" + eventType;
    }

    public String getEventType() {
        return eventType;
    }

    public int getThreshold() {
        return threshold;
    }

    public String getPatternName() {
        return patternName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PatternThreshold that))
            return false;
        return threshold == that.threshold
                && eventType.equals(that.eventType)
                && patternName.equals(that.patternName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventType, threshold, patternName);
    }

    @Override
    public String toString() {
        return eventType + ">=" + threshold + " (" + patternName + ")";
    }
}
