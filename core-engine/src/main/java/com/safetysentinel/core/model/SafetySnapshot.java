package com.safetysentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Objects;

/**
 * Derived safety view of one child, computed on demand and never stored.
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class SafetySnapshot {

    private final String childId;
    private final int recentEventCount;
    private final int activeAlertCount;
    private final double safetyScore;
    private final Instant lastActivity;

    public SafetySnapshot(String childId, int recentEventCount, int activeAlertCount,
            double safetyScore, Instant lastActivity) {
        this.childId = Objects.requireNonNull(childId, "childId must not be null");
        this.recentEventCount = recentEventCount;
        this.activeAlertCount = activeAlertCount;
        if (safetyScore < 0 || safetyScore > 100) {
            throw new IllegalArgumentException("safetyScore must be in [0, 100], got: " + safetyScore);
        }
        this.safetyScore = safetyScore;
        this.lastActivity = lastActivity;
    }

    public String getChildId() {
        return childId;
    }

    public int getRecentEventCount() {
        return recentEventCount;
    }

    public int getActiveAlertCount() {
        return activeAlertCount;
    }

    /**
     * @return score in [0, 100]; 100 means no negative events in the window
     */
    public double getSafetyScore() {
        return safetyScore;
    }

    /**
     * @return timestamp of the most recent event in the window, or
     *         {@code null} if there was none
     */
    public Instant getLastActivity() {
        return lastActivity;
    }

    @Override
    public String toString() {
        return "SafetySnapshot{" +
                "childId='" + childId + '\'' +
                ", recentEventCount=" + recentEventCount +
                ", activeAlertCount=" + activeAlertCount +
                ", safetyScore=" + safetyScore +
                ", lastActivity=" + lastActivity +
                '}';
    }
}
