package com.safetysentinel.core.safety;

import com.safetysentinel.core.MutableClock;
import com.safetysentinel.core.alerting.AlertLifecycleManager;
import com.safetysentinel.core.config.MonitorConfig;
import com.safetysentinel.core.config.PatternThreshold;
import com.safetysentinel.core.model.Alert;
import com.safetysentinel.core.model.AlertOrigin;
import com.safetysentinel.core.model.SafetySnapshot;
import com.safetysentinel.core.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

/**
 * Unit tests for {@link SafetyEventMonitor}.
 */
class SafetyEventMonitorTest {

    private MutableClock clock;
    private AlertLifecycleManager alerts;
    private SafetyEventMonitor monitor;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-03-01T10:00:00Z");
        alerts = new AlertLifecycleManager(clock, Severity.HIGH);
        monitor = new SafetyEventMonitor(MonitorConfig.defaults(), alerts, clock);
    }

    // ------------------------------------------------------------------
    // Pattern detection
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should raise one pattern alert at the threshold and re-trigger it afterwards")
    void shouldDetectInappropriateContentPattern() {
        Optional<Alert> last = Optional.empty();
        for (int i = 0; i < 5; i++) {
            last = monitor.record("c1", "inappropriate_content", Severity.MEDIUM, Map.of());
            clock.advance(Duration.ofMinutes(2));
        }

        assertThat(last).isPresent();
        Alert alert = last.get();
        assertThat(alert.getTitle()).isEqualTo("excessive_inappropriate_content");
        assertThat(alert.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(alert.getOrigin()).isEqualTo(AlertOrigin.SAFETY_PATTERN);
        assertThat(alert.getKey()).isEqualTo("pattern:c1:inappropriate_content");
        assertThat(alert.getChildId()).isEqualTo("c1");
        assertThat(alert.getAttributes()).contains(
                entry(Alert.EVENT_COUNT, 5),
                entry(Alert.PATTERN_TYPE, "excessive_inappropriate_content"),
                entry(Alert.REQUIRES_PARENT_NOTIFICATION, true));

        Optional<Alert> sixth = monitor.record("c1", "inappropriate_content", Severity.MEDIUM, Map.of());

        assertThat(alerts.alerts()).hasSize(1);
        assertThat(sixth).get().extracting(Alert::getTriggerCount).isEqualTo(2);
        assertThat(sixth.get().getAttributes()).containsEntry(Alert.EVENT_COUNT, 6);
    }

    @Test
    @DisplayName("Should NOT fire below the threshold")
    void shouldNotFireBelowThreshold() {
        for (int i = 0; i < 4; i++) {
            assertThat(monitor.record("c1", "inappropriate_content", Severity.MEDIUM, null)).isEmpty();
        }
        assertThat(alerts.alerts()).isEmpty();
    }

    @Test
    @DisplayName("Should only count events inside the pattern window")
    void shouldIgnoreEventsOutsideWindow() {
        monitor.record("c1", "emotional_distress", Severity.HIGH, Map.of());
        monitor.record("c1", "emotional_distress", Severity.HIGH, Map.of());
        clock.advance(Duration.ofMinutes(61));

        Optional<Alert> third = monitor.record("c1", "emotional_distress", Severity.HIGH, Map.of());

        assertThat(third).isEmpty();
        assertThat(monitor.record("c1", "emotional_distress", Severity.HIGH, Map.of())).isEmpty();
        assertThat(monitor.record("c1", "emotional_distress", Severity.HIGH, Map.of()))
                .get()
                .extracting(Alert::getTitle)
                .isEqualTo("repeated_emotional_distress");
    }

    @Test
    @DisplayName("Should count events per child and per type")
    void shouldKeepChildrenAndTypesApart() {
        for (int i = 0; i < 3; i++) {
            monitor.record("c1", "inappropriate_content", Severity.MEDIUM, Map.of());
            monitor.record("c2", "inappropriate_content", Severity.MEDIUM, Map.of());
            monitor.record("c1", "emotional_distress", Severity.LOW, Map.of());
        }

        assertThat(alerts.alerts()).extracting(Alert::getKey)
                .containsExactly("pattern:c1:emotional_distress");
    }

    @Test
    @DisplayName("Should ignore event types without a configured threshold")
    void shouldIgnoreUnconfiguredTypes() {
        for (int i = 0; i < 50; i++) {
            assertThat(monitor.record("c1", "login", Severity.LOW, Map.of())).isEmpty();
        }
    }

    @Test
    @DisplayName("Should use custom pattern thresholds from configuration")
    void shouldUseConfiguredThresholds() {
        MonitorConfig config = MonitorConfig.builder()
                .clearPatternThresholds()
                .patternThreshold(new PatternThreshold("bullying", 2, null))
                .build();
        monitor = new SafetyEventMonitor(config, alerts, clock);

        monitor.record("c1", "bullying", Severity.MEDIUM, Map.of());
        Optional<Alert> alert = monitor.record("c1", "bullying", Severity.MEDIUM, Map.of());

        assertThat(alert).get().extracting(Alert::getTitle).isEqualTo("excessive_bullying");
        assertThat(monitor.record("c1", "inappropriate_content", Severity.MEDIUM, Map.of())).isEmpty();
    }

    // ------------------------------------------------------------------
    // Emergency escalation
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should escalate critical event types immediately")
    void shouldEscalateCriticalType() {
        Optional<Alert> alert = monitor.record("c2", "abuse_detected", Severity.EMERGENCY,
                Map.of("source", "conversation"));

        assertThat(alert).isPresent();
        assertThat(alert.get().getSeverity()).isEqualTo(Severity.EMERGENCY);
        assertThat(alert.get().getOrigin()).isEqualTo(AlertOrigin.SAFETY_EMERGENCY);
        assertThat(alert.get().getKey()).isEqualTo("emergency:c2:abuse_detected");
        assertThat(alert.get().requiresImmediateAttention()).isTrue();
        assertThat(alerts.activeAlerts()).hasSize(1);
    }

    @Test
    @DisplayName("Should escalate a critical type even when reported with low severity")
    void shouldEscalateCriticalTypeRegardlessOfSeverity() {
        Optional<Alert> alert = monitor.record("c2", "severe_distress", Severity.LOW, Map.of());

        assertThat(alert).get().extracting(Alert::getSeverity).isEqualTo(Severity.EMERGENCY);
    }

    @Test
    @DisplayName("Should escalate EMERGENCY severity and skip pattern counting")
    void shouldEscalateEmergencySeverity() {
        for (int i = 0; i < 5; i++) {
            monitor.record("c3", "inappropriate_content", Severity.EMERGENCY, Map.of());
        }

        assertThat(alerts.alerts()).singleElement().satisfies(a -> {
            assertThat(a.getKey()).isEqualTo("emergency:c3:inappropriate_content");
            assertThat(a.getTriggerCount()).isEqualTo(5);
        });
    }

    // ------------------------------------------------------------------
    // Status
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should report a perfect score for a child without events")
    void shouldScoreUnknownChild() {
        SafetySnapshot snapshot = monitor.status("nobody");

        assertThat(snapshot.getSafetyScore()).isEqualTo(100.0);
        assertThat(snapshot.getRecentEventCount()).isZero();
        assertThat(snapshot.getActiveAlertCount()).isZero();
        assertThat(snapshot.getLastActivity()).isNull();
    }

    @Test
    @DisplayName("Should deduct per event severity within the scoring window")
    void shouldDeductBySeverity() {
        monitor.record("c1", "note", Severity.LOW, Map.of());
        monitor.record("c1", "note", Severity.MEDIUM, Map.of());
        monitor.record("c1", "note", Severity.HIGH, Map.of());
        monitor.record("c1", "note", Severity.CRITICAL, Map.of());
        clock.advance(Duration.ofMinutes(5));
        monitor.record("c1", "note", Severity.EMERGENCY, Map.of());

        SafetySnapshot snapshot = monitor.status("c1");

        assertThat(snapshot.getSafetyScore()).isEqualTo(100.0 - 1 - 5 - 10 - 15 - 20);
        assertThat(snapshot.getRecentEventCount()).isEqualTo(5);
        assertThat(snapshot.getActiveAlertCount()).isEqualTo(1);
        assertThat(snapshot.getLastActivity()).isEqualTo(Instant.parse("2024-03-01T10:05:00Z"));
    }

    @Test
    @DisplayName("Should never increase the score as events accumulate and never go below zero")
    void shouldKeepScoreMonotonicAndClamped() {
        double previous = monitor.status("c1").getSafetyScore();
        for (int i = 0; i < 20; i++) {
            monitor.record("c1", "note", i % 2 == 0 ? Severity.HIGH : Severity.LOW, Map.of());
            double score = monitor.status("c1").getSafetyScore();
            assertThat(score).isLessThanOrEqualTo(previous).isBetween(0.0, 100.0);
            previous = score;
        }
        assertThat(previous).isZero();
    }

    @Test
    @DisplayName("Should drop events older than the scoring window from the status")
    void shouldForgetOldEvents() {
        monitor.record("c1", "note", Severity.HIGH, Map.of());
        clock.advance(Duration.ofHours(25));

        assertThat(monitor.status("c1").getSafetyScore()).isEqualTo(100.0);
        assertThat(monitor.recentEvents("c1")).isEmpty();
        assertThat(monitor.eventCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reject blank child ids and event types")
    void shouldRejectBlankIdentifiers() {
        assertThatThrownBy(() -> monitor.record(" ", "x", Severity.LOW, Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> monitor.record("c1", null, Severity.LOW, Map.of()))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("Should finish concurrent pattern events with the full event count on the alert")
    void shouldKeepPatternCountMonotonicUnderConcurrency() throws InterruptedException {
        int threads = 8;
        int eventsPerThread = 50;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        for (int t = 0; t < threads; t++) {
            pool.submit(() -> {
                start.await();
                for (int i = 0; i < eventsPerThread; i++) {
                    monitor.record("c1", "inappropriate_content", Severity.MEDIUM, Map.of());
                }
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        int total = threads * eventsPerThread;
        Alert alert = alerts.findOpen("pattern:c1:inappropriate_content").orElseThrow();
        assertThat(alert.getAttributes()).containsEntry(Alert.EVENT_COUNT, total);
        assertThat(alert.getCurrentValue()).isEqualTo(total);
        assertThat(alert.getTriggerCount()).isEqualTo(total - 5 + 1);
    }
}
