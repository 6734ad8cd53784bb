package com.safetysentinel.core.metrics;

import com.safetysentinel.core.MutableClock;
import com.safetysentinel.core.alerting.AlertLifecycleManager;
import com.safetysentinel.core.model.Alert;
import com.safetysentinel.core.model.Metric;
import com.safetysentinel.core.model.MetricAggregate;
import com.safetysentinel.core.model.MetricKind;
import com.safetysentinel.core.model.Severity;
import com.safetysentinel.core.rules.AlertRuleEngine;
import com.safetysentinel.core.rules.RuleDefinition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link MetricStore}.
 */
class MetricStoreTest {

    private MutableClock clock;
    private AlertLifecycleManager alerts;
    private AlertRuleEngine rules;
    private MetricStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-03-01T10:00:00Z");
        alerts = new AlertLifecycleManager(clock, Severity.HIGH);
        rules = new AlertRuleEngine(alerts);
        store = new MetricStore(5, 3, rules, clock);
    }

    @Test
    @DisplayName("Should keep only the newest entries per name")
    void shouldEvictOldestPerName() {
        for (int i = 1; i <= 7; i++) {
            store.recordGauge("cpu", i);
        }

        assertThat(store.snapshot("cpu"))
                .extracting(Metric::getValue)
                .containsExactly(3.0, 4.0, 5.0, 6.0, 7.0);
    }

    @Test
    @DisplayName("Should aggregate only entries inside the window")
    void shouldAggregateWithinWindow() {
        store.recordGauge("latency", 10);
        clock.advance(Duration.ofMinutes(10));
        store.recordGauge("latency", 2);
        clock.advance(Duration.ofMinutes(1));
        store.recordGauge("latency", 4);

        MetricAggregate recent = store.aggregate("latency", Duration.ofMinutes(5));
        MetricAggregate all = store.aggregate("latency");

        assertThat(recent.getCount()).isEqualTo(2);
        assertThat(recent.getMin()).isEqualTo(2.0);
        assertThat(recent.getMax()).isEqualTo(4.0);
        assertThat(recent.getAvg()).isCloseTo(3.0, within(1e-9));
        assertThat(recent.getLatest()).isEqualTo(4.0);
        assertThat(all.getCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should return an empty aggregate for unknown names")
    void shouldReturnEmptyAggregateForUnknownName() {
        assertThat(store.aggregate("missing", Duration.ofHours(1)).isEmpty()).isTrue();
        assertThat(store.latest("missing")).isEmpty();
        assertThat(store.snapshot("missing")).isEmpty();
    }

    @Test
    @DisplayName("Should reject negative windows and blank names")
    void shouldRejectInvalidArguments() {
        assertThatThrownBy(() -> store.aggregate("x", Duration.ofSeconds(-1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.recordGauge(" ", 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.record("x", 1, null, Map.of()))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("Should keep timestamps monotonic when the clock steps back")
    void shouldKeepTimestampsMonotonic() {
        Metric first = store.recordGauge("cpu", 1);
        clock.set(Instant.parse("2024-03-01T09:00:00Z"));
        Metric second = store.recordGauge("cpu", 2);

        assertThat(second.getTimestamp()).isEqualTo(first.getTimestamp());
    }

    @Test
    @DisplayName("Should drop the least recently used series beyond the name limit")
    void shouldBoundNameKeySpace() {
        store.recordGauge("a", 1);
        store.recordGauge("b", 1);
        store.recordGauge("c", 1);
        store.recordGauge("a", 2);
        store.recordGauge("d", 1);

        assertThat(store.metricNames()).containsExactlyInAnyOrder("a", "c", "d");
        assertThat(store.nameCount()).isEqualTo(3);
        assertThat(store.droppedSeriesCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should evaluate rules on every recorded value")
    void shouldEvaluateRulesOnRecord() {
        rules.register(new RuleDefinition("Memory Usage High", null, "medium", "memory_usage", 0.85, ">"));

        store.recordGauge("memory_usage", 0.5);
        assertThat(alerts.activeAlerts()).isEmpty();

        store.record("memory_usage", 0.9, MetricKind.GAUGE, Map.of("host", "web-1"));
        assertThat(alerts.activeAlerts()).hasSize(1);
        assertThat(alerts.activeAlerts().get(0).getCurrentValue()).isEqualTo(0.9);
        assertThat(store.latest("memory_usage")).get()
                .extracting(Metric::getTags)
                .isEqualTo(Map.of("host", "web-1"));
    }

    @Test
    @DisplayName("Should accept tags with null values")
    void shouldAcceptNullTagValues() {
        Map<String, String> tags = new HashMap<>();
        tags.put("host", null);
        tags.put("region", "eu-1");

        Metric metric = store.record("cpu", 0.4, MetricKind.GAUGE, tags);
        tags.put("region", "us-2");

        assertThat(metric.getTags()).containsEntry("host", null).containsEntry("region", "eu-1");
        assertThat(store.latest("cpu")).get().isEqualTo(metric);
    }

    @Test
    @DisplayName("Should leave the alert on the last stored value under concurrent writes to one name")
    void shouldEvaluateSameNameWritesInStoredOrder() throws InterruptedException {
        rules.register(new RuleDefinition("Load Seen", null, "low", "load", -1, ">"));
        int threads = 8;
        int writesPerThread = 200;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        for (int t = 0; t < threads; t++) {
            int base = t * 1000;
            pool.submit(() -> {
                start.await();
                for (int i = 0; i < writesPerThread; i++) {
                    store.recordGauge("load", base + i);
                }
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        Alert alert = alerts.findOpen("rule:load_seen").orElseThrow();
        assertThat(alert.getTriggerCount()).isEqualTo(threads * writesPerThread);
        assertThat(alert.getCurrentValue()).isEqualTo(store.latest("load").orElseThrow().getValue());
    }
}
