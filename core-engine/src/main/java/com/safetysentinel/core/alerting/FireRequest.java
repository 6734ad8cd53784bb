package com.safetysentinel.core.alerting;

import com.safetysentinel.core.model.AlertOrigin;
import com.safetysentinel.core.model.Severity;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Everything {@link AlertLifecycleManager#fire(FireRequest)} needs to raise
 * or re-trigger an alert.
 *
 * <p>
 * The {@code key} identifies the condition: while an alert for a key is
 * open, firing the same key again updates that alert instead of creating a
 * new one.
 * </p>
 *
 * @since 1.0.0
 */
public final class FireRequest {

    private final String key;
    private final AlertOrigin origin;
    private final Severity severity;
    private final String title;
    private final String description;
    private final String metricName;
    private final double currentValue;
    private final double threshold;
    private final String childId;
    private final Map<String, Object> attributes;

    private FireRequest(Builder b) {
        this.key = Objects.requireNonNull(b.key, "key must not be null");
        this.origin = Objects.requireNonNull(b.origin, "origin must not be null");
        this.severity = Objects.requireNonNull(b.severity, "severity must not be null");
        this.title = Objects.requireNonNull(b.title, "title must not be null");
        this.description = b.description;
        this.metricName = b.metricName;
        this.currentValue = b.currentValue;
        this.threshold = b.threshold;
        this.childId = b.childId;
        this.attributes = Map.copyOf(b.attributes);
    }

    public static Builder builder(String key, AlertOrigin origin) {
        return new Builder().key(key).origin(origin);
    }

    public String getKey() {
        return key;
    }

    public AlertOrigin getOrigin() {
        return origin;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public String getMetricName() {
        return metricName;
    }

    public double getCurrentValue() {
        return currentValue;
    }

    public double getThreshold() {
        return threshold;
    }

    public String getChildId() {
        return childId;
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public static class Builder {
        private String key;
        private AlertOrigin origin;
        private Severity severity;
        private String title;
        private String description;
        private String metricName;
        private double currentValue;
        private double threshold;
        private String childId;
        private final Map<String, Object> attributes = new LinkedHashMap<>();

        public Builder key(String key) {
            this.key = key;
            return this;
        }

        public Builder origin(AlertOrigin origin) {
            this.origin = origin;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
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

        public Builder metric(String metricName, double currentValue, double threshold) {
            this.metricName = metricName;
            this.currentValue = currentValue;
            this.threshold = threshold;
            return this;
        }

        public Builder childId(String childId) {
            this.childId = childId;
            return this;
        }

        /**
         * Add an attribute; {@code null} values are ignored.
         */
        public Builder attribute(String name, Object value) {
            if (value != null) {
                attributes.put(name, value);
            }
            return this;
        }

        public FireRequest build() {
            return new FireRequest(this);
        }
    }

    @Override
    public String toString() {
        return "FireRequest{key='" + key + "', severity=" + severity + ", title='" + title + "'}";
    }
}
