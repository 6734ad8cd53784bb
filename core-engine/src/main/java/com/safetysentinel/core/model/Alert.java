package com.safetysentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Stateful record of a condition requiring attention.
 *
 * <p>
 * Alerts are raised by rule matches, safety pattern detection, emergency
 * escalation and security tracking. Every state change is applied by the
 * alert lifecycle manager, which replaces the stored instance with an
 * updated copy built via {@link #toBuilder()}; instances themselves are
 * immutable and can be handed to callers and notification sinks freely.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code id}, {@code key}, {@code origin},
 * {@code title}, {@code severity}, {@code status} and {@code createdAt} are
 * required; omitting any of them throws {@link NullPointerException} at
 * build time.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "id", "title", "severity", "status", "origin" })
public final class Alert {

    /** Attribute set on emergency alerts. */
    public static final String REQUIRES_IMMEDIATE_ATTENTION = "requires_immediate_attention";

    /** Attribute set on safety pattern alerts. */
    public static final String REQUIRES_PARENT_NOTIFICATION = "requires_parent_notification";

    /** Attribute carrying the number of events that formed a pattern. */
    public static final String EVENT_COUNT = "event_count";

    /** Attribute carrying the pattern name, e.g. {@code excessive_inappropriate_content}. */
    public static final String PATTERN_TYPE = "pattern_type";

    /** Attribute carrying the triggering safety or security event type. */
    public static final String EVENT_TYPE = "event_type";

    private final String id;
    private final String key;
    private final AlertOrigin origin;
    private final String title;
    private final String description;
    private final Severity severity;
    private final AlertStatus status;
    private final Instant createdAt;
    private final String metricName;
    private final double currentValue;
    private final double thresholdValue;
    private final int triggerCount;
    private final Instant lastTriggered;
    private final Instant acknowledgedAt;
    private final Instant resolvedAt;
    private final String childId;
    private final Map<String, Object> attributes;

    private Alert(Builder b) {
        this.id = Objects.requireNonNull(b.id, "id must not be null");
        this.key = Objects.requireNonNull(b.key, "key must not be null");
        this.origin = Objects.requireNonNull(b.origin, "origin must not be null");
        this.title = Objects.requireNonNull(b.title, "title must not be null");
        this.description = b.description != null ? b.description : "";
        this.severity = Objects.requireNonNull(b.severity, "severity must not be null");
        this.status = Objects.requireNonNull(b.status, "status must not be null");
        this.createdAt = Objects.requireNonNull(b.createdAt, "createdAt must not be null");
        this.metricName = b.metricName != null ? b.metricName : "";
        this.currentValue = b.currentValue;
        this.thresholdValue = b.thresholdValue;
        if (b.triggerCount < 1) {
            throw new IllegalArgumentException("triggerCount must be >= 1, got: " + b.triggerCount);
        }
        this.triggerCount = b.triggerCount;
        this.lastTriggered = b.lastTriggered != null ? b.lastTriggered : b.createdAt;
        this.acknowledgedAt = b.acknowledgedAt;
        if ((b.status == AlertStatus.RESOLVED) != (b.resolvedAt != null)) {
            throw new IllegalArgumentException(
                    "resolvedAt must be set if and only if status is RESOLVED (status=" + b.status + ")");
        }
        this.resolvedAt = b.resolvedAt;
        this.childId = b.childId;
        this.attributes = Details.copyOf(b.attributes);
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-populated with every field of this alert
     */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .key(key)
                .origin(origin)
                .title(title)
                .description(description)
                .severity(severity)
                .status(status)
                .createdAt(createdAt)
                .metricName(metricName)
                .currentValue(currentValue)
                .thresholdValue(thresholdValue)
                .triggerCount(triggerCount)
                .lastTriggered(lastTriggered)
                .acknowledgedAt(acknowledgedAt)
                .resolvedAt(resolvedAt)
                .childId(childId)
                .attributes(attributes);
    }

    /**
     * Fluent builder for {@link Alert} instances.
     */
    public static class Builder {
        private String id;
        private String key;
        private AlertOrigin origin;
        private String title;
        private String description;
        private Severity severity;
        private AlertStatus status = AlertStatus.ACTIVE;
        private Instant createdAt;
        private String metricName;
        private double currentValue;
        private double thresholdValue;
        private int triggerCount = 1;
        private Instant lastTriggered;
        private Instant acknowledgedAt;
        private Instant resolvedAt;
        private String childId;
        private Map<String, Object> attributes;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder key(String key) {
            this.key = key;
            return this;
        }

        public Builder origin(AlertOrigin origin) {
            this.origin = origin;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder status(AlertStatus status) {
            this.status = status;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder metricName(String metricName) {
            this.metricName = metricName;
            return this;
        }

        public Builder currentValue(double currentValue) {
            this.currentValue = currentValue;
            return this;
        }

        public Builder thresholdValue(double thresholdValue) {
            this.thresholdValue = thresholdValue;
            return this;
        }

        public Builder triggerCount(int triggerCount) {
            this.triggerCount = triggerCount;
            return this;
        }

        public Builder lastTriggered(Instant lastTriggered) {
            this.lastTriggered = lastTriggered;
            return this;
        }

        public Builder acknowledgedAt(Instant acknowledgedAt) {
            this.acknowledgedAt = acknowledgedAt;
            return this;
        }

        public Builder resolvedAt(Instant resolvedAt) {
            this.resolvedAt = resolvedAt;
            return this;
        }

        public Builder childId(String childId) {
            this.childId = childId;
            return this;
        }

        public Builder attributes(Map<String, Object> attributes) {
            this.attributes = attributes;
            return this;
        }

        /**
         * @return a new {@link Alert}
         * @throws NullPointerException     if a required field is missing
         * @throws IllegalArgumentException if {@code triggerCount < 1} or
         *                                  {@code resolvedAt} disagrees with
         *                                  the status
         */
        public Alert build() {
            return new Alert(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    /**
     * @return deduplication key; at most one open alert exists per key
     */
    public String getKey() {
        return key;
    }

    public AlertOrigin getOrigin() {
        return origin;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public Severity getSeverity() {
        return severity;
    }

    public AlertStatus getStatus() {
        return status;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public String getMetricName() {
        return metricName;
    }

    public double getCurrentValue() {
        return currentValue;
    }

    public double getThresholdValue() {
        return thresholdValue;
    }

    public int getTriggerCount() {
        return triggerCount;
    }

    public Instant getLastTriggered() {
        return lastTriggered;
    }

    public Instant getAcknowledgedAt() {
        return acknowledgedAt;
    }

    public Instant getResolvedAt() {
        return resolvedAt;
    }

    public String getChildId() {
        return childId;
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    /**
     * @return {@code true} if the alert carries
     *         {@link #REQUIRES_IMMEDIATE_ATTENTION}
     */
    @JsonIgnore
    public boolean requiresImmediateAttention() {
        return Boolean.TRUE.equals(attributes.get(REQUIRES_IMMEDIATE_ATTENTION));
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Alert alert))
            return false;
        return triggerCount == alert.triggerCount
                && id.equals(alert.id)
                && status == alert.status
                && Double.compare(currentValue, alert.currentValue) == 0
                && Objects.equals(lastTriggered, alert.lastTriggered);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, status, triggerCount, currentValue, lastTriggered);
    }

    @Override
    public String toString() {
        return "Alert{" +
                "id='" + id + '\'' +
                ", key='" + key + '\'' +
                ", title='" + title + '\'' +
                ", severity=" + severity +
                ", status=" + status +
                ", triggerCount=" + triggerCount +
                ", currentValue=" + currentValue +
                ", thresholdValue=" + thresholdValue +
                '}';
    }
}
