package com.safetysentinel.core.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A child-safety observation reported by the conversation pipeline, for
 * example {@code inappropriate_content} or {@code emotional_distress}.
 *
 * <p>
 * The event type is a free-form label; only the labels configured for
 * pattern detection or emergency escalation receive special handling.
 * Immutable.
 * </p>
 *
 * @since 1.0.0
 */
public final class SafetyEvent {

    private final String childId;
    private final String eventType;
    private final Severity severity;
    private final Map<String, Object> details;
    private final Instant timestamp;

    public SafetyEvent(String childId, String eventType, Severity severity,
            Map<String, Object> details, Instant timestamp) {
        this.childId = Objects.requireNonNull(childId, "childId must not be null");
        this.eventType = Objects.requireNonNull(eventType, "eventType must not be null");
        this.severity = Objects.requireNonNull(severity, "severity must not be null");
        this.details = Details.copyOf(details);
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    public String getChildId() {
        return childId;
    }

    public String getEventType() {
        return eventType;
    }

    public Severity getSeverity() {
        return severity;
    }

    /**
     * @return unmodifiable detail map; values are opaque to the engine
     */
    public Map<String, Object> getDetails() {
        return details;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * @param child child id to compare
     * @param type  event type to compare
     * @return {@code true} if this event belongs to the given child and type
     */
    public boolean matches(String child, String type) {
        return childId.equals(child) && eventType.equals(type);
    }

    @Override
    public String toString() {
        return "SafetyEvent{" +
                "childId='" + childId + '\'' +
                ", eventType='" + eventType + '\'' +
                ", severity=" + severity +
                ", timestamp=" + timestamp +
                '}';
    }
}
