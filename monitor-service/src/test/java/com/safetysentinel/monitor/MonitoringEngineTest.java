package com.safetysentinel.monitor;

import com.safetysentinel.core.alerting.AlertNotFoundException;
import com.safetysentinel.core.config.MonitorConfig;
import com.safetysentinel.core.model.Alert;
import com.safetysentinel.core.model.AlertStatus;
import com.safetysentinel.core.model.MetricKind;
import com.safetysentinel.core.model.MetricsSummary;
import com.safetysentinel.core.model.SafetySnapshot;
import com.safetysentinel.core.model.SecurityEvent;
import com.safetysentinel.core.model.Severity;
import com.safetysentinel.core.rules.RuleDefinition;
import com.safetysentinel.core.rules.RuleValidationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * End-to-end tests for {@link MonitoringEngine}.
 */
class MonitoringEngineTest {

    private MutableClock clock;
    private final List<Alert> notified = Collections.synchronizedList(new ArrayList<>());
    private MonitoringEngine engine;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-03-01T10:00:00Z");
        engine = new MonitoringEngine(MonitorConfig.defaults(), notified::add, clock);
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    // ------------------------------------------------------------------
    // Scenarios
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should raise one pattern alert for repeated inappropriate content")
    void shouldRaisePatternAlertForRepeatedContent() {
        for (int i = 0; i < 5; i++) {
            engine.recordChildSafetyEvent("c1", "inappropriate_content", Severity.MEDIUM, Map.of());
            clock.advance(Duration.ofMinutes(2));
        }

        List<Alert> active = engine.listActiveAlerts();
        assertThat(active).singleElement().satisfies(alert -> {
            assertThat(alert.getTitle()).isEqualTo("excessive_inappropriate_content");
            assertThat(alert.getAttributes()).containsEntry(Alert.EVENT_COUNT, 5);
        });

        engine.recordChildSafetyEvent("c1", "inappropriate_content", Severity.MEDIUM, Map.of());

        assertThat(engine.listActiveAlerts()).singleElement()
                .extracting(Alert::getTriggerCount)
                .isEqualTo(2);
        assertThat(notified).hasSize(2);
    }

    @Test
    @DisplayName("Should escalate abuse immediately")
    void shouldEscalateAbuseImmediately() {
        Optional<Alert> alert = engine.recordChildSafetyEvent("c2", "abuse_detected", Severity.EMERGENCY,
                Map.of("conversation_id", "conv-9"));

        assertThat(alert).isPresent();
        assertThat(engine.listActiveAlerts(Severity.EMERGENCY)).singleElement()
                .satisfies(a -> assertThat(a.requiresImmediateAttention()).isTrue());
        assertThat(notified).extracting(Alert::getSeverity).containsExactly(Severity.EMERGENCY);
    }

    @Test
    @DisplayName("Should raise one HIGH alert for excessive authentication failures")
    void shouldEscalateAuthFailures() {
        for (int i = 0; i < 11; i++) {
            engine.recordSecurityEvent("auth_failure", Map.of("client_identity", "1.2.3.4"), Severity.MEDIUM);
        }

        assertThat(engine.securityTracker().failedAuthCount("1.2.3.4")).isEqualTo(11);
        assertThat(engine.listActiveAlerts(Severity.HIGH)).singleElement()
                .extracting(Alert::getKey)
                .isEqualTo("auth:1.2.3.4");
        assertThat(engine.securitySummary().getTopFailedAuthIdentities()).containsEntry("1.2.3.4", 11);
    }

    @Test
    @DisplayName("Should fire a registered rule when a metric crosses it")
    void shouldFireRegisteredRule() {
        engine.registerRule(new RuleDefinition("High Error Rate", null, "high", "error_rate", 0.05, ">"));

        engine.recordMetric("error_rate", 0.10, MetricKind.GAUGE, Map.of());

        assertThat(engine.listActiveAlerts()).singleElement().satisfies(alert -> {
            assertThat(alert.getTitle()).isEqualTo("High Error Rate");
            assertThat(alert.getCurrentValue()).isEqualTo(0.10);
        });
    }

    // ------------------------------------------------------------------
    // Ingestion side effects
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should summarise requests, connections and safety events")
    void shouldBuildMetricsSummary() {
        engine.recordRequestTime("/chat", 0.2, 200);
        engine.recordRequestTime("/chat", 0.4, 503);
        engine.connectionOpened();
        engine.connectionOpened();
        engine.connectionClosed();
        engine.recordChildSafetyEvent("c1", "note", Severity.LOW, null);

        MetricsSummary summary = engine.metricsSummary();

        assertThat(summary.getTotalRequests()).isEqualTo(2);
        assertThat(summary.getErrorRate()).isCloseTo(0.5, within(1e-9));
        assertThat(summary.getAvgResponseTime()).isCloseTo(0.3, within(1e-9));
        assertThat(summary.getActiveConnections()).isEqualTo(1);
        assertThat(summary.getChildSafetyEventCount()).isEqualTo(1);
        assertThat(summary.getActiveAlerts()).isZero();
        assertThat(summary.getTotalMetrics()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should never report negative connection counts")
    void shouldClampConnections() {
        engine.connectionClosed();

        assertThat(engine.metricsSummary().getActiveConnections()).isZero();
    }

    @Test
    @DisplayName("Should record request durations and flag slow requests")
    void shouldRecordRequestDurations() {
        engine.recordRequestTime("/chat", 0.5, 200);
        engine.recordRequestTime("/report", 6.0, 200);

        assertThat(engine.aggregate(MonitoringEngine.REQUEST_DURATION, Duration.ofMinutes(1)).getCount())
                .isEqualTo(2);
        assertThat(engine.securitySummary().getTopEventTypes())
                .containsEntry(SecurityEvent.HIGH_LATENCY, 1);
    }

    @Test
    @DisplayName("Should count child safety events as a metric")
    void shouldCountSafetyEventsAsMetric() {
        engine.recordChildSafetyEvent("c1", "note", Severity.LOW, Map.of());
        engine.recordChildSafetyEvent("c2", "note", Severity.HIGH, Map.of());

        assertThat(engine.aggregate("child_safety_events", Duration.ofHours(1)).getCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should derive a child's safety status")
    void shouldReportChildSafetyStatus() {
        engine.recordChildSafetyEvent("c1", "emotional_distress", Severity.HIGH, Map.of());
        engine.recordChildSafetyEvent("c1", "emotional_distress", Severity.HIGH, Map.of());
        engine.recordChildSafetyEvent("c1", "emotional_distress", Severity.HIGH, Map.of());

        SafetySnapshot status = engine.childSafetyStatus("c1");

        assertThat(status.getSafetyScore()).isEqualTo(70.0);
        assertThat(status.getRecentEventCount()).isEqualTo(3);
        assertThat(status.getActiveAlertCount()).isEqualTo(1);
    }

    // ------------------------------------------------------------------
    // Notifications
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should record a failed notification as a security event and metric")
    void shouldRecordNotificationFailure() {
        engine.close();
        engine = new MonitoringEngine(MonitorConfig.defaults(), alert -> {
            throw new IllegalStateException("pager offline");
        }, clock);

        engine.recordChildSafetyEvent("c2", "abuse_detected", Severity.EMERGENCY, Map.of());

        assertThat(engine.listActiveAlerts()).hasSize(1);
        assertThat(engine.securitySummary().getTopEventTypes())
                .containsEntry(SecurityEvent.NOTIFICATION_FAILURES, 1);
        assertThat(engine.aggregate(MonitoringEngine.NOTIFICATION_FAILURES, Duration.ofMinutes(1)).getCount())
                .isEqualTo(1);
    }

    @Test
    @DisplayName("Should not loop when a rule watches notification failures and the sink is down")
    void shouldNotLoopOnFailingSinkWithFailureRule() {
        engine.close();
        engine = new MonitoringEngine(MonitorConfig.defaults(), alert -> {
            throw new IllegalStateException("smtp down");
        }, clock);
        engine.registerRule(new RuleDefinition("Notification Failures", null, "high",
                MonitoringEngine.NOTIFICATION_FAILURES, 0, ">"));
        engine.registerRule(new RuleDefinition("High Error Rate", null, "high", "error_rate", 0.05, ">"));

        assertThatCode(() -> engine.recordMetric("error_rate", 0.10, MetricKind.GAUGE, Map.of()))
                .doesNotThrowAnyException();

        assertThat(engine.listActiveAlerts()).extracting(Alert::getTitle)
                .containsExactlyInAnyOrder("High Error Rate", "Notification Failures");
        assertThat(engine.aggregate(MonitoringEngine.NOTIFICATION_FAILURES, Duration.ofMinutes(1)).getCount())
                .isEqualTo(1);
        assertThat(engine.securitySummary().getTopEventTypes())
                .containsEntry(SecurityEvent.NOTIFICATION_FAILURES, 1);
    }

    // ------------------------------------------------------------------
    // Rule & alert management
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should manage rules and alert transitions through the engine")
    void shouldManageRulesAndAlerts() {
        String ruleId = engine.registerRule(
                new RuleDefinition("Memory Usage High", null, "medium", "memory_usage", 0.85, ">"));
        assertThatThrownBy(() -> engine.registerRule(
                new RuleDefinition("Memory Usage High", null, "medium", "memory_usage", 0.9, ">")))
                .isInstanceOf(RuleValidationException.class);

        engine.recordMetric("memory_usage", 0.9, MetricKind.GAUGE, null);
        Alert alert = engine.listActiveAlerts().get(0);

        assertThat(engine.acknowledgeAlert(alert.getId()).getStatus()).isEqualTo(AlertStatus.ACKNOWLEDGED);
        assertThat(engine.listActiveAlerts()).isEmpty();
        assertThat(engine.resolveAlert(alert.getId()).getStatus()).isEqualTo(AlertStatus.RESOLVED);
        assertThat(engine.findAlert(alert.getId())).get()
                .extracting(Alert::getResolvedAt)
                .isNotNull();

        assertThat(engine.unregisterRule(ruleId)).isTrue();
        engine.recordMetric("memory_usage", 0.95, MetricKind.GAUGE, null);
        assertThat(engine.listActiveAlerts()).isEmpty();

        assertThatThrownBy(() -> engine.suppressAlert("missing")).isInstanceOf(AlertNotFoundException.class);
    }

    @Test
    @DisplayName("Should suppress an active alert")
    void shouldSuppressAlert() {
        engine.registerRule(new RuleDefinition("High Response Time", null, "medium", "avg_response_time", 2.0, ">"));
        engine.recordMetric("avg_response_time", 3.0, MetricKind.GAUGE, Map.of());
        Alert alert = engine.listActiveAlerts().get(0);

        assertThat(engine.suppressAlert(alert.getId()).getStatus()).isEqualTo(AlertStatus.SUPPRESSED);
        assertThat(engine.listActiveAlerts()).isEmpty();
        assertThatThrownBy(() -> engine.resolveAlert(alert.getId())).isInstanceOf(IllegalStateException.class);
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should start and stop the health loop within the shutdown timeout")
    void shouldStartAndShutdown() {
        MonitorConfig config = MonitorConfig.builder()
                .tickInterval(Duration.ofMillis(20))
                .shutdownTimeout(Duration.ofSeconds(2))
                .build();
        engine.close();
        engine = new MonitoringEngine(config, null, clock);

        engine.start();
        engine.start();

        assertThat(engine.shutdown()).isTrue();
        assertThat(engine.aggregate(HealthLoop.ACTIVE_CONNECTIONS, Duration.ofHours(1)).getCount())
                .isGreaterThanOrEqualTo(1);
    }
}
