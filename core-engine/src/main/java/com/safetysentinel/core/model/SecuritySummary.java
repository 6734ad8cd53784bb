package com.safetysentinel.core.model;

import java.util.Map;

/**
 * Aggregated view over retained security events and failed-auth counters.
 *
 * <p>
 * Map values are ordered: {@link #getTopEventTypes()} and
 * {@link #getTopFailedAuthIdentities()} iterate from the highest count down.
 * </p>
 *
 * @since 1.0.0
 */
public final class SecuritySummary {

    private final int totalEvents;
    private final Map<Severity, Integer> countsBySeverity;
    private final Map<String, Integer> topEventTypes;
    private final Map<String, Integer> topFailedAuthIdentities;

    public SecuritySummary(int totalEvents, Map<Severity, Integer> countsBySeverity,
            Map<String, Integer> topEventTypes, Map<String, Integer> topFailedAuthIdentities) {
        this.totalEvents = totalEvents;
        this.countsBySeverity = countsBySeverity;
        this.topEventTypes = topEventTypes;
        this.topFailedAuthIdentities = topFailedAuthIdentities;
    }

    public int getTotalEvents() {
        return totalEvents;
    }

    public Map<Severity, Integer> getCountsBySeverity() {
        return countsBySeverity;
    }

    public Map<String, Integer> getTopEventTypes() {
        return topEventTypes;
    }

    public Map<String, Integer> getTopFailedAuthIdentities() {
        return topFailedAuthIdentities;
    }

    @Override
    public String toString() {
        return "SecuritySummary{" +
                "totalEvents=" + totalEvents +
                ", countsBySeverity=" + countsBySeverity +
                ", topEventTypes=" + topEventTypes +
                '}';
    }
}
