package com.safetysentinel.core.safety;

import com.safetysentinel.core.alerting.AlertLifecycleManager;
import com.safetysentinel.core.alerting.FireRequest;
import com.safetysentinel.core.buffer.BoundedBuffer;
import com.safetysentinel.core.config.MonitorConfig;
import com.safetysentinel.core.config.PatternThreshold;
import com.safetysentinel.core.model.Alert;
import com.safetysentinel.core.model.AlertOrigin;
import com.safetysentinel.core.model.SafetyEvent;
import com.safetysentinel.core.model.SafetySnapshot;
import com.safetysentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Child-safety event monitor.
 *
 * <p>
 * Every {@link #record} call appends a {@link SafetyEvent} and then takes
 * one of two paths:
 * </p>
 * <ul>
 * <li><b>Emergency</b>: severity {@link Severity#EMERGENCY}, or an event type
 * in the configured critical set, fires an EMERGENCY alert immediately.
 * Pattern counting is skipped for that event.</li>
 * <li><b>Pattern</b>: counts the child's events of the same type within the
 * pattern window. Once the count reaches the type's {@link PatternThreshold}
 * a HIGH alert is fired; further events in the window re-trigger it.</li>
 * </ul>
 *
 * <h3>Scoring</h3>
 * <p>
 * {@link #status(String)} derives a 0-100 safety score from the events in the
 * scoring window: EMERGENCY -20, CRITICAL -15, HIGH -10, MEDIUM -5, LOW -1,
 * floored at 0.
 * </p>
 *
 * <h3>State</h3>
 * <p>
 * Events live in a single {@link BoundedBuffer}; the oldest event is dropped
 * once capacity is reached. Thread-safe: recording, counting and firing for
 * one child and event type happen under a single lock stripe, so a pattern
 * alert's count never goes backwards between concurrent calls.
 * </p>
 *
 * @since 1.0.0
 */
public class SafetyEventMonitor {

    private static final Logger LOG = LoggerFactory.getLogger(SafetyEventMonitor.class);

    /** Metric name carried by pattern and emergency alerts. */
    public static final String METRIC_NAME = "child_safety_events";

    static final String PATTERN_KEY_PREFIX = "pattern:";
    static final String EMERGENCY_KEY_PREFIX = "emergency:";

    private static final double MAX_SCORE = 100.0;
    private static final int LOCK_STRIPES = 64;

    private final AlertLifecycleManager alerts;
    private final Clock clock;
    private final Duration patternWindow;
    private final Duration scoringWindow;
    private final Map<String, PatternThreshold> thresholds;
    private final Set<String> criticalEventTypes;
    private final BoundedBuffer<SafetyEvent> events;
    private final Object[] stripes = new Object[LOCK_STRIPES];

    /**
     * @param config monitor configuration
     * @param alerts alert registry that receives pattern and emergency alerts
     * @param clock  time source for event timestamps and windows
     */
    public SafetyEventMonitor(MonitorConfig config, AlertLifecycleManager alerts, Clock clock) {
        Objects.requireNonNull(config, "MonitorConfig must not be null");
        this.alerts = Objects.requireNonNull(alerts, "AlertLifecycleManager must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.patternWindow = config.getPatternWindow();
        this.scoringWindow = config.getScoringWindow();
        this.thresholds = config.getPatternThresholds();
        this.criticalEventTypes = config.getCriticalEventTypes();
        this.events = new BoundedBuffer<>(config.getSafetyEventCapacity());
        for (int i = 0; i < stripes.length; i++) {
            stripes[i] = new Object();
        }
    }

    // ---------------------------------------------------------------
    // Ingestion
    // ---------------------------------------------------------------

    /**
     * Record a safety event and run emergency or pattern detection on it.
     *
     * @param childId   child the event belongs to
     * @param eventType event label, e.g. {@code emotional_distress}
     * @param severity  event severity
     * @param details   opaque detail map; may be {@code null}
     * @return the alert fired or re-triggered by this event, if any
     */
    public Optional<Alert> record(String childId, String eventType, Severity severity,
            Map<String, Object> details) {
        requireText(childId, "childId");
        requireText(eventType, "eventType");
        Objects.requireNonNull(severity, "severity must not be null");

        synchronized (stripeFor(childId, eventType)) {
            SafetyEvent event = new SafetyEvent(childId, eventType, severity, details, clock.instant());
            events.push(event);
            LOG.debug("Safety event recorded: child={} type={} severity={}",
                    childId, eventType, severity.label());

            if (severity == Severity.EMERGENCY || criticalEventTypes.contains(eventType)) {
                return Optional.of(escalate(event));
            }
            return checkPattern(event);
        }
    }

    // ---------------------------------------------------------------
    // Reads
    // ---------------------------------------------------------------

    /**
     * Derive the child's safety snapshot from the trailing scoring window.
     *
     * @param childId child id
     * @return snapshot; a child without events scores 100
     */
    public SafetySnapshot status(String childId) {
        Objects.requireNonNull(childId, "childId must not be null");
        List<SafetyEvent> recent = eventsSince(childId, clock.instant().minus(scoringWindow));

        double score = MAX_SCORE;
        Instant lastActivity = null;
        for (SafetyEvent event : recent) {
            score -= deduction(event.getSeverity());
            if (lastActivity == null || event.getTimestamp().isAfter(lastActivity)) {
                lastActivity = event.getTimestamp();
            }
        }
        return new SafetySnapshot(childId, recent.size(), alerts.activeCountForChild(childId),
                Math.max(0.0, score), lastActivity);
    }

    /**
     * @param childId child id
     * @return the child's events within the scoring window, oldest first
     */
    public List<SafetyEvent> recentEvents(String childId) {
        Objects.requireNonNull(childId, "childId must not be null");
        return eventsSince(childId, clock.instant().minus(scoringWindow));
    }

    /**
     * @return number of retained events across all children
     */
    public int eventCount() {
        return events.size();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Alert escalate(SafetyEvent event) {
        LOG.error("Emergency safety event: child={} type={}", event.getChildId(), event.getEventType());
        return alerts.fire(FireRequest
                .builder(EMERGENCY_KEY_PREFIX + event.getChildId() + ":" + event.getEventType(),
                        AlertOrigin.SAFETY_EMERGENCY)
                .severity(Severity.EMERGENCY)
                .title("Emergency: " + event.getEventType())
                .description(String.format("Emergency safety event '%s' for child %s",
                        event.getEventType(), event.getChildId()))
                .metric(METRIC_NAME, 1, 1)
                .childId(event.getChildId())
                .attribute(Alert.EVENT_TYPE, event.getEventType())
                .attribute(Alert.REQUIRES_IMMEDIATE_ATTENTION, Boolean.TRUE)
                .build());
    }

    private Optional<Alert> checkPattern(SafetyEvent event) {
        PatternThreshold threshold = thresholds.get(event.getEventType());
        if (threshold == null) {
            return Optional.empty();
        }

        Instant windowStart = event.getTimestamp().minus(patternWindow);
        int count = eventsSince(event.getChildId(), windowStart, event.getEventType()).size();
        if (count < threshold.getThreshold()) {
            return Optional.empty();
        }

        LOG.debug("Pattern [{}] matched: child={} count={} threshold={}",
                threshold.getPatternName(), event.getChildId(), count, threshold.getThreshold());

        return Optional.of(alerts.fire(FireRequest
                .builder(PATTERN_KEY_PREFIX + event.getChildId() + ":" + event.getEventType(),
                        AlertOrigin.SAFETY_PATTERN)
                .severity(Severity.HIGH)
                .title(threshold.getPatternName())
                .description(String.format("%d '%s' events for child %s within %d minutes (threshold: %d)",
                        count, event.getEventType(), event.getChildId(),
                        patternWindow.toMinutes(), threshold.getThreshold()))
                .metric(METRIC_NAME, count, threshold.getThreshold())
                .childId(event.getChildId())
                .attribute(Alert.PATTERN_TYPE, threshold.getPatternName())
                .attribute(Alert.EVENT_COUNT, count)
                .attribute(Alert.REQUIRES_PARENT_NOTIFICATION, Boolean.TRUE)
                .build()));
    }

    private List<SafetyEvent> eventsSince(String childId, Instant since) {
        return eventsSince(childId, since, null);
    }

    private List<SafetyEvent> eventsSince(String childId, Instant since, String eventType) {
        List<SafetyEvent> result = new ArrayList<>();
        for (SafetyEvent event : events.snapshot()) {
            if (!event.getChildId().equals(childId) || event.getTimestamp().isBefore(since)) {
                continue;
            }
            if (eventType == null || event.getEventType().equals(eventType)) {
                result.add(event);
            }
        }
        return result;
    }

    private Object stripeFor(String childId, String eventType) {
        int hash = 31 * childId.hashCode() + eventType.hashCode();
        return stripes[Math.floorMod(hash, stripes.length)];
    }

    static double deduction(Severity severity) {
        return switch (severity) {
            case EMERGENCY -> 20;
            case CRITICAL -> 15;
            case HIGH -> 10;
            case MEDIUM -> 5;
            case LOW -> 1;
        };
    }

    private static void requireText(String value, String name) {
        Objects.requireNonNull(value, name + " must not be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}
