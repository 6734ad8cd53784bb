package com.safetysentinel.monitor;

import com.safetysentinel.core.alerting.AlertLifecycleManager;
import com.safetysentinel.core.alerting.NotificationSink;
import com.safetysentinel.core.config.MonitorConfig;
import com.safetysentinel.core.metrics.MetricStore;
import com.safetysentinel.core.metrics.RequestTimeRecorder;
import com.safetysentinel.core.model.Alert;
import com.safetysentinel.core.model.Metric;
import com.safetysentinel.core.model.MetricAggregate;
import com.safetysentinel.core.model.MetricKind;
import com.safetysentinel.core.model.MetricsSummary;
import com.safetysentinel.core.model.SafetySnapshot;
import com.safetysentinel.core.model.SecurityEvent;
import com.safetysentinel.core.model.SecuritySummary;
import com.safetysentinel.core.model.Severity;
import com.safetysentinel.core.rules.AlertRuleEngine;
import com.safetysentinel.core.rules.RuleDefinition;
import com.safetysentinel.core.safety.SafetyEventMonitor;
import com.safetysentinel.core.security.SecurityEventTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point of the monitoring core.
 *
 * <h3>Wiring</h3>
 *
 * <pre>
 *   recordMetric / recordRequestTime ─→ MetricStore ─→ AlertRuleEngine ─┐
 *   recordChildSafetyEvent ─────────→ SafetyEventMonitor ───────────────┤
 *   recordSecurityEvent ────────────→ SecurityEventTracker ─────────────┤
 *                                                                       ↓
 *                                  AlertLifecycleManager ─→ NotificationSink
 *   HealthLoop (every tick) ─→ MetricStore, AlertLifecycleManager, SecurityEventTracker
 * </pre>
 *
 * <p>
 * A sink failure is recorded as a {@code notification_failures} security
 * event and counter metric. All ingestion is synchronous and safe to call
 * from any number of threads.
 * </p>
 *
 * @since 1.0.0
 */
public class MonitoringEngine implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(MonitoringEngine.class);

    static final String REQUEST_DURATION = "request_duration";
    static final String NOTIFICATION_FAILURES = "notification_failures";

    private final MonitorConfig config;
    private final Clock clock;
    private final AlertLifecycleManager alerts;
    private final AlertRuleEngine rules;
    private final MetricStore metrics;
    private final RequestTimeRecorder requests;
    private final SafetyEventMonitor safety;
    private final SecurityEventTracker security;
    private final HealthLoop healthLoop;
    private final AtomicInteger activeConnections = new AtomicInteger();

    /**
     * Create an engine on the system UTC clock.
     *
     * @param config configuration
     * @param sink   notification egress; {@code null} disables notifications
     */
    public MonitoringEngine(MonitorConfig config, NotificationSink sink) {
        this(config, sink, Clock.systemUTC());
    }

    /**
     * @param config configuration
     * @param sink   notification egress; {@code null} disables notifications
     * @param clock  time source for every timestamp and window
     */
    public MonitoringEngine(MonitorConfig config, NotificationSink sink, Clock clock) {
        this(config, sink, clock, TickScheduler.latch());
    }

    MonitoringEngine(MonitorConfig config, NotificationSink sink, Clock clock, TickScheduler scheduler) {
        this.config = Objects.requireNonNull(config, "MonitorConfig must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");

        this.alerts = new AlertLifecycleManager(clock, config.getNotificationFloor());
        this.rules = new AlertRuleEngine(alerts);
        this.metrics = new MetricStore(config.getMetricBufferCapacity(), config.getMaxMetricNames(), rules, clock);
        this.requests = new RequestTimeRecorder(config.getRequestBufferCapacity(), clock);
        this.safety = new SafetyEventMonitor(config, alerts, clock);
        this.security = new SecurityEventTracker(config, alerts, clock);
        this.healthLoop = new HealthLoop(config, metrics, requests, alerts, security,
                activeConnections::get, clock, scheduler);

        alerts.setNotificationSink(sink);
        alerts.setNotificationFailureHandler(this::onNotificationFailure);
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    public void start() {
        LOG.info("Starting monitoring engine with {}", config);
        healthLoop.start();
    }

    /**
     * Stop the health loop, waiting at most the configured shutdown timeout.
     *
     * @return {@code true} if the loop stopped in time
     */
    public boolean shutdown() {
        boolean stopped = healthLoop.shutdown();
        LOG.info("Monitoring engine shut down (clean={})", stopped);
        return stopped;
    }

    @Override
    public void close() {
        shutdown();
    }

    // ---------------------------------------------------------------
    // Ingestion
    // ---------------------------------------------------------------

    /**
     * Record a metric and evaluate alert rules against it.
     *
     * @param name  metric name
     * @param value observed value
     * @param kind  metric kind
     * @param tags  optional tags; may be {@code null}
     * @return the stored metric
     */
    public Metric recordMetric(String name, double value, MetricKind kind, Map<String, String> tags) {
        return metrics.record(name, value, kind, tags);
    }

    /**
     * Record one served request. Also records a {@code request_duration}
     * timer; requests slower than the configured limit additionally record a
     * {@code high_latency} security event.
     *
     * @param endpoint        request path
     * @param durationSeconds time taken
     * @param statusCode      HTTP status; 400 and above count as errors
     */
    public void recordRequestTime(String endpoint, double durationSeconds, int statusCode) {
        requests.record(endpoint, durationSeconds, statusCode);

        Map<String, String> tags = new LinkedHashMap<>();
        tags.put("endpoint", endpoint);
        tags.put("status_code", String.valueOf(statusCode));
        metrics.record(REQUEST_DURATION, durationSeconds, MetricKind.TIMER, tags);

        if (durationSeconds > config.getSlowRequestSeconds()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("endpoint", endpoint);
            details.put("duration_ms", Math.round(durationSeconds * 1000));
            details.put("status_code", statusCode);
            security.record(SecurityEvent.HIGH_LATENCY, details, Severity.MEDIUM);
        }
    }

    /**
     * Record a security event.
     *
     * @param eventType event label, e.g. {@code auth_failure}
     * @param details   detail map; may be {@code null}
     * @param severity  event severity
     * @return the stored event
     */
    public SecurityEvent recordSecurityEvent(String eventType, Map<String, Object> details, Severity severity) {
        return security.record(eventType, details, severity);
    }

    /**
     * Record a child-safety event, run emergency and pattern detection, and
     * count it in the {@code child_safety_events} metric.
     *
     * @param childId   child the event belongs to
     * @param eventType event label
     * @param severity  event severity
     * @param details   detail map; may be {@code null}
     * @return the alert fired or re-triggered by this event, if any
     */
    public Optional<Alert> recordChildSafetyEvent(String childId, String eventType, Severity severity,
            Map<String, Object> details) {
        Optional<Alert> alert = safety.record(childId, eventType, severity, details);

        Map<String, String> tags = new LinkedHashMap<>();
        tags.put("child_id", childId);
        tags.put("event_type", eventType);
        tags.put("severity", severity.label());
        metrics.record(SafetyEventMonitor.METRIC_NAME, 1, MetricKind.COUNTER, tags);
        return alert;
    }

    public void connectionOpened() {
        activeConnections.incrementAndGet();
    }

    public void connectionClosed() {
        activeConnections.updateAndGet(n -> Math.max(0, n - 1));
    }

    // ---------------------------------------------------------------
    // Reads
    // ---------------------------------------------------------------

    public MetricsSummary metricsSummary() {
        return new MetricsSummary(
                metrics.nameCount(),
                alerts.activeCount(),
                requests.totalRequests(),
                requests.errorRate(),
                requests.averageResponseTime(),
                activeConnections.get(),
                safety.eventCount());
    }

    public SafetySnapshot childSafetyStatus(String childId) {
        return safety.status(childId);
    }

    /**
     * @return ACTIVE alerts, newest first
     */
    public List<Alert> listActiveAlerts() {
        return alerts.activeAlerts();
    }

    /**
     * @param severity exact severity to match
     * @return ACTIVE alerts of that severity, newest first
     */
    public List<Alert> listActiveAlerts(Severity severity) {
        Objects.requireNonNull(severity, "severity must not be null");
        return alerts.activeAlerts(severity);
    }

    public SecuritySummary securitySummary() {
        return security.summary();
    }

    /**
     * @param name   metric name
     * @param window trailing window
     * @return aggregate over the window; empty if nothing matched
     */
    public MetricAggregate aggregate(String name, Duration window) {
        return metrics.aggregate(name, window);
    }

    /**
     * @return error counts per endpoint over the retained request samples
     */
    public Map<String, Integer> requestErrorsByEndpoint() {
        return requests.errorCountsByEndpoint();
    }

    public Optional<Alert> findAlert(String id) {
        return alerts.find(id);
    }

    // ---------------------------------------------------------------
    // Rule & alert management
    // ---------------------------------------------------------------

    /**
     * @param definition rule to register
     * @return the id of the registered rule
     * @throws com.safetysentinel.core.rules.RuleValidationException if the
     *         rule is invalid or its id is taken
     */
    public String registerRule(RuleDefinition definition) {
        return rules.register(definition);
    }

    /**
     * @param ruleId id returned by {@link #registerRule}
     * @return {@code true} if a rule was removed
     */
    public boolean unregisterRule(String ruleId) {
        return rules.unregister(ruleId);
    }

    public Alert acknowledgeAlert(String alertId) {
        return alerts.acknowledge(alertId);
    }

    public Alert resolveAlert(String alertId) {
        return alerts.resolve(alertId);
    }

    public Alert suppressAlert(String alertId) {
        return alerts.suppress(alertId);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    HealthLoop healthLoop() {
        return healthLoop;
    }

    SecurityEventTracker securityTracker() {
        return security;
    }

    private void onNotificationFailure(Alert alert, Exception cause) {
        security.recordNotificationFailure(alert, cause);
        metrics.record(NOTIFICATION_FAILURES, 1, MetricKind.COUNTER,
                Map.of("severity", alert.getSeverity().label()));
    }
}
