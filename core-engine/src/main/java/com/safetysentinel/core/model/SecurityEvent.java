package com.safetysentinel.core.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A security-relevant observation such as {@code auth_failure} or
 * {@code notification_failures}. Immutable.
 *
 * @since 1.0.0
 */
public final class SecurityEvent {

    /** Event type that drives failed-authentication counting. */
    public static final String AUTH_FAILURE = "auth_failure";

    /** Event type recorded when a notification sink throws. */
    public static final String NOTIFICATION_FAILURES = "notification_failures";

    /** Event type recorded for requests slower than the configured limit. */
    public static final String HIGH_LATENCY = "high_latency";

    private final String eventType;
    private final Map<String, Object> details;
    private final Severity severity;
    private final Instant timestamp;

    public SecurityEvent(String eventType, Map<String, Object> details, Severity severity, Instant timestamp) {
        this.eventType = Objects.requireNonNull(eventType, "eventType must not be null");
        this.details = Details.copyOf(details);
        this.severity = Objects.requireNonNull(severity, "severity must not be null");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    public String getEventType() {
        return eventType;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    public Severity getSeverity() {
        return severity;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "SecurityEvent{" +
                "eventType='" + eventType + '\'' +
                ", severity=" + severity +
                ", timestamp=" + timestamp +
                '}';
    }
}
