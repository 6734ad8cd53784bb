package com.safetysentinel.core.security;

import com.safetysentinel.core.alerting.AlertLifecycleManager;
import com.safetysentinel.core.alerting.FireRequest;
import com.safetysentinel.core.buffer.BoundedBuffer;
import com.safetysentinel.core.config.MonitorConfig;
import com.safetysentinel.core.model.Alert;
import com.safetysentinel.core.model.AlertOrigin;
import com.safetysentinel.core.model.SecurityEvent;
import com.safetysentinel.core.model.SecuritySummary;
import com.safetysentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Records security events and escalates repeated authentication failures.
 *
 * <p>
 * {@code auth_failure} events increment a counter for the reporting client,
 * identified by the {@code client_identity} detail, falling back to
 * {@code client_ip} and then {@code "unknown"}. Once a counter exceeds the
 * configured threshold a HIGH alert keyed {@code auth:<identity>} is fired;
 * later failures re-trigger that alert while it is open.
 * </p>
 *
 * <p>
 * Counters are reset in bulk by {@link #resetFailedAuthCounters()}, which the
 * health loop calls once per UTC day. There is no per-identity expiry.
 * </p>
 *
 * <p>
 * Events are logged at a level derived from their severity. Detail keys that
 * may carry personal data are left out of the log line; they are still kept
 * on the stored event.
 * </p>
 *
 * @since 1.0.0
 */
public class SecurityEventTracker {

    private static final Logger LOG = LoggerFactory.getLogger(SecurityEventTracker.class);

    /** Detail keys never written to the log. */
    static final Set<String> SENSITIVE_KEYS = Set.of("user_data", "child_info", "personal_info", "raw_content");

    static final String KEY_PREFIX = "auth:";
    static final String UNKNOWN_IDENTITY = "unknown";

    private static final int TOP_N = 10;

    private final AlertLifecycleManager alerts;
    private final Clock clock;
    private final int failedAuthThreshold;
    private final BoundedBuffer<SecurityEvent> events;

    private final Object lock = new Object();
    private final Map<String, Integer> failedAuthCounters = new HashMap<>();

    /**
     * @param config monitor configuration
     * @param alerts alert registry that receives authentication alerts
     * @param clock  time source for event timestamps
     */
    public SecurityEventTracker(MonitorConfig config, AlertLifecycleManager alerts, Clock clock) {
        Objects.requireNonNull(config, "MonitorConfig must not be null");
        this.alerts = Objects.requireNonNull(alerts, "AlertLifecycleManager must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.failedAuthThreshold = config.getFailedAuthThreshold();
        this.events = new BoundedBuffer<>(config.getSecurityEventCapacity());
    }

    // ---------------------------------------------------------------
    // Ingestion
    // ---------------------------------------------------------------

    /**
     * Record a security event.
     *
     * @param eventType event label, e.g. {@link SecurityEvent#AUTH_FAILURE}
     * @param details   detail map; may be {@code null}
     * @param severity  event severity
     * @return the stored event
     */
    public SecurityEvent record(String eventType, Map<String, Object> details, Severity severity) {
        Objects.requireNonNull(eventType, "eventType must not be null");
        if (eventType.isBlank()) {
            throw new IllegalArgumentException("eventType must not be blank");
        }
        Objects.requireNonNull(severity, "severity must not be null");

        SecurityEvent event = new SecurityEvent(eventType, details, severity, clock.instant());
        events.push(event);
        log(event);

        if (SecurityEvent.AUTH_FAILURE.equals(eventType)) {
            countFailedAuth(identityOf(event.getDetails()));
        }
        return event;
    }

    /**
     * Record that delivering {@code alert} to the notification sink failed.
     *
     * @param alert the alert that could not be delivered
     * @param cause what the sink threw
     */
    public void recordNotificationFailure(Alert alert, Exception cause) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("alert_id", alert.getId());
        details.put("alert_title", alert.getTitle());
        details.put("alert_severity", alert.getSeverity().label());
        details.put("error", cause != null ? String.valueOf(cause.getMessage()) : "unknown");
        record(SecurityEvent.NOTIFICATION_FAILURES, details, Severity.HIGH);
    }

    // ---------------------------------------------------------------
    // Counters
    // ---------------------------------------------------------------

    /**
     * @param identity client identity
     * @return failed authentications counted since the last reset
     */
    public int failedAuthCount(String identity) {
        synchronized (lock) {
            return failedAuthCounters.getOrDefault(identity, 0);
        }
    }

    /**
     * Clear every failed-auth counter.
     *
     * @return number of identities that were being tracked
     */
    public int resetFailedAuthCounters() {
        int cleared;
        synchronized (lock) {
            cleared = failedAuthCounters.size();
            failedAuthCounters.clear();
        }
        LOG.info("Reset failed authentication counters for {} identities", cleared);
        return cleared;
    }

    // ---------------------------------------------------------------
    // Reads
    // ---------------------------------------------------------------

    /**
     * @return totals over the retained events and current counters
     */
    public SecuritySummary summary() {
        Map<Severity, Integer> bySeverity = new EnumMap<>(Severity.class);
        Map<String, Integer> byType = new HashMap<>();
        List<SecurityEvent> retained = events.snapshot();
        for (SecurityEvent event : retained) {
            bySeverity.merge(event.getSeverity(), 1, Integer::sum);
            byType.merge(event.getEventType(), 1, Integer::sum);
        }
        Map<String, Integer> counters;
        synchronized (lock) {
            counters = new HashMap<>(failedAuthCounters);
        }
        return new SecuritySummary(retained.size(),
                Collections.unmodifiableMap(bySeverity),
                top(byType),
                top(counters));
    }

    /**
     * @return number of retained events
     */
    public int eventCount() {
        return events.size();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void countFailedAuth(String identity) {
        int count;
        synchronized (lock) {
            count = failedAuthCounters.merge(identity, 1, Integer::sum);
        }
        if (count > failedAuthThreshold) {
            alerts.fire(FireRequest.builder(KEY_PREFIX + identity, AlertOrigin.SECURITY)
                    .severity(Severity.HIGH)
                    .title("Excessive Authentication Failures")
                    .description(String.format("%d failed authentication attempts from %s (threshold: %d)",
                            count, identity, failedAuthThreshold))
                    .metric("failed_auth_attempts", count, failedAuthThreshold)
                    .attribute("client_identity", identity)
                    .build());
        }
    }

    static String identityOf(Map<String, Object> details) {
        Object identity = details.get("client_identity");
        if (identity == null) {
            identity = details.get("client_ip");
        }
        return identity != null ? identity.toString() : UNKNOWN_IDENTITY;
    }

    static Map<String, Object> redact(Map<String, Object> details) {
        Map<String, Object> safe = new LinkedHashMap<>();
        details.forEach((k, v) -> {
            if (!SENSITIVE_KEYS.contains(k)) {
                safe.put(k, v);
            }
        });
        return safe;
    }

    private static void log(SecurityEvent event) {
        Map<String, Object> safe = redact(event.getDetails());
        switch (event.getSeverity()) {
            case EMERGENCY, CRITICAL -> LOG.error("Security event: {} {}", event.getEventType(), safe);
            case HIGH -> LOG.warn("Security event: {} {}", event.getEventType(), safe);
            case MEDIUM -> LOG.info("Security event: {} {}", event.getEventType(), safe);
            case LOW -> LOG.debug("Security event: {} {}", event.getEventType(), safe);
        }
    }

    private static Map<String, Integer> top(Map<String, Integer> counts) {
        Map<String, Integer> result = new LinkedHashMap<>();
        counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(TOP_N)
                .forEach(e -> result.put(e.getKey(), e.getValue()));
        return Collections.unmodifiableMap(result);
    }
}
