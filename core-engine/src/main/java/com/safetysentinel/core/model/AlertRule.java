package com.safetysentinel.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Threshold rule evaluated against every metric written under
 * {@link #getMetricName()}.
 *
 * <p>
 * Immutable once created. A rule is changed by unregistering it and
 * registering a replacement.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertRule {

    private final String id;
    private final String name;
    private final String description;
    private final Severity severity;
    private final String metricName;
    private final double threshold;
    private final Comparator comparator;

    public AlertRule(String name, String description, Severity severity,
            String metricName, double threshold, Comparator comparator) {
        this.name = Objects.requireNonNull(name, "Rule name must not be null");
        this.id = idFor(name);
        this.description = description != null ? description : "";
        this.severity = Objects.requireNonNull(severity, "Rule severity must not be null");
        this.metricName = Objects.requireNonNull(metricName, "Rule metricName must not be null");
        this.threshold = threshold;
        this.comparator = Objects.requireNonNull(comparator, "Rule comparator must not be null");
    }

    /**
     * Derive the rule id from its display name: lowercase, with every run of
     * non-alphanumeric characters collapsed to {@code _}.
     * {@code "High Error Rate"} becomes {@code high_error_rate}.
     *
     * @param name display name
     * @return the rule id
     */
    public static String idFor(String name) {
        return name.trim()
                .toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "_")
                .replaceAll("^_|_$", "");
    }

    /**
     * @param value observed metric value
     * @return {@code true} if the value violates this rule
     */
    public boolean isViolatedBy(double value) {
        return comparator.matches(value, threshold);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getMetricName() {
        return metricName;
    }

    public double getThreshold() {
        return threshold;
    }

    public Comparator getComparator() {
        return comparator;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AlertRule that))
            return false;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "AlertRule{" +
                "id='" + id + '\'' +
                ", metricName='" + metricName + '\'' +
                ", condition='" + comparator.symbol() + ' ' + threshold + '\'' +
                ", severity=" + severity +
                '}';
    }
}
