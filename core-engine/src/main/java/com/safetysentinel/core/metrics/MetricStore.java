package com.safetysentinel.core.metrics;

import com.safetysentinel.core.buffer.BoundedBuffer;
import com.safetysentinel.core.model.Metric;
import com.safetysentinel.core.model.MetricAggregate;
import com.safetysentinel.core.model.MetricKind;
import com.safetysentinel.core.rules.AlertRuleEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Per-name metric time series backed by {@link BoundedBuffer}s.
 *
 * <p>
 * Every {@link #record} call stores the metric and then hands it to the
 * {@link AlertRuleEngine}. Rule evaluation runs after the store lock has been
 * released, so rules that raise alerts (and sinks that record further
 * metrics) never re-enter the lock.
 * </p>
 * <p>
 * Writes to the same name are serialized on that name's series from push
 * through evaluation, so alerts see values in the order they were stored.
 * Writes to different names do not block each other.
 * </p>
 *
 * <h3>Timestamps</h3>
 * <p>
 * Timestamps come from the injected {@link Clock} and are monotonic per
 * name: if the clock steps backwards, the previous timestamp for that name
 * is reused.
 * </p>
 *
 * <h3>Name key space</h3>
 * <p>
 * At most {@code maxNames} series are retained. Registering a new name
 * beyond that drops the least recently used series.
 * </p>
 *
 * @since 1.0.0
 */
public class MetricStore {

    private static final Logger LOG = LoggerFactory.getLogger(MetricStore.class);

    private final int bufferCapacity;
    private final AlertRuleEngine ruleEngine;
    private final Clock clock;

    private final Object lock = new Object();
    private final LinkedHashMap<String, Series> series;
    private long droppedSeries;

    /**
     * @param bufferCapacity per-name buffer capacity; must be &gt;= 1
     * @param maxNames       maximum number of retained names; must be &gt;= 1
     * @param ruleEngine     engine evaluated on every write
     * @param clock          time source for metric timestamps
     */
    public MetricStore(int bufferCapacity, int maxNames, AlertRuleEngine ruleEngine, Clock clock) {
        if (bufferCapacity < 1) {
            throw new IllegalArgumentException("bufferCapacity must be >= 1, got: " + bufferCapacity);
        }
        if (maxNames < 1) {
            throw new IllegalArgumentException("maxNames must be >= 1, got: " + maxNames);
        }
        this.bufferCapacity = bufferCapacity;
        this.ruleEngine = Objects.requireNonNull(ruleEngine, "ruleEngine must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.series = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Series> eldest) {
                if (size() > maxNames) {
                    droppedSeries++;
                    LOG.debug("Dropping least recently used metric series '{}'", eldest.getKey());
                    return true;
                }
                return false;
            }
        };
    }

    // ---------------------------------------------------------------
    // Writes
    // ---------------------------------------------------------------

    /**
     * Record a metric value and evaluate alert rules against it.
     *
     * @param name  metric name; must not be {@code null} or blank
     * @param value observed value
     * @param kind  metric kind; must not be {@code null}
     * @param tags  optional tags
     * @return the stored metric
     */
    public Metric record(String name, double value, MetricKind kind, Map<String, String> tags) {
        Objects.requireNonNull(name, "Metric name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Metric name must not be blank");
        }
        Objects.requireNonNull(kind, "Metric kind must not be null");

        Series s;
        synchronized (lock) {
            s = series.computeIfAbsent(name, n -> new Series(bufferCapacity));
        }

        synchronized (s.writeLock) {
            Metric metric;
            synchronized (lock) {
                // re-attach if the series was evicted between lookup and write
                Series target = series.computeIfAbsent(name, n -> s);
                Instant now = clock.instant();
                Instant timestamp = target.lastTimestamp != null && now.isBefore(target.lastTimestamp)
                        ? target.lastTimestamp
                        : now;
                metric = new Metric(name, value, kind, timestamp, tags);
                target.buffer.push(metric);
                target.lastTimestamp = timestamp;
            }
            LOG.debug("Metric recorded: {}={} ({})", name, value, kind);

            ruleEngine.evaluate(metric);
            return metric;
        }
    }

    /**
     * Shorthand for a tag-less gauge.
     */
    public Metric recordGauge(String name, double value) {
        return record(name, value, MetricKind.GAUGE, Map.of());
    }

    // ---------------------------------------------------------------
    // Reads
    // ---------------------------------------------------------------

    /**
     * Aggregate the entries of {@code name} recorded within {@code window}
     * of now.
     *
     * @param name   metric name
     * @param window trailing window; must not be {@code null} or negative
     * @return the aggregate, or {@link MetricAggregate#empty()} if the name is
     *         unknown or no entry falls in the window
     */
    public MetricAggregate aggregate(String name, Duration window) {
        Objects.requireNonNull(window, "window must not be null");
        if (window.isNegative()) {
            throw new IllegalArgumentException("window must not be negative, got: " + window);
        }
        Instant cutoff = clock.instant().minus(window);
        return aggregate(snapshot(name), cutoff);
    }

    /**
     * Aggregate every retained entry of {@code name}.
     *
     * @param name metric name
     * @return the aggregate, or {@link MetricAggregate#empty()} if unknown
     */
    public MetricAggregate aggregate(String name) {
        return aggregate(snapshot(name), Instant.MIN);
    }

    /**
     * @param name metric name
     * @return the most recent metric for {@code name}
     */
    public Optional<Metric> latest(String name) {
        synchronized (lock) {
            Series s = series.get(name);
            return s == null ? Optional.empty() : Optional.ofNullable(s.buffer.peekLast());
        }
    }

    /**
     * @param name metric name
     * @return immutable copy of the retained entries, oldest first
     */
    public List<Metric> snapshot(String name) {
        synchronized (lock) {
            Series s = series.get(name);
            return s == null ? List.of() : s.buffer.snapshot();
        }
    }

    /**
     * @return immutable copy of the retained metric names
     */
    public Set<String> metricNames() {
        synchronized (lock) {
            return Set.copyOf(series.keySet());
        }
    }

    public int nameCount() {
        synchronized (lock) {
            return series.size();
        }
    }

    /**
     * @return number of series dropped because the name limit was reached
     */
    public long droppedSeriesCount() {
        synchronized (lock) {
            return droppedSeries;
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static MetricAggregate aggregate(List<Metric> entries, Instant cutoff) {
        int count = 0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        double sum = 0;
        double latest = 0;

        for (Metric m : entries) {
            if (m.getTimestamp().isBefore(cutoff)) {
                continue;
            }
            double v = m.getValue();
            count++;
            min = Math.min(min, v);
            max = Math.max(max, v);
            sum += v;
            latest = v;
        }

        if (count == 0) {
            return MetricAggregate.empty();
        }
        return new MetricAggregate(count, min, max, sum / count, latest);
    }

    private static final class Series {
        private final Object writeLock = new Object();
        private final BoundedBuffer<Metric> buffer;
        private Instant lastTimestamp;

        private Series(int capacity) {
            this.buffer = new BoundedBuffer<>(capacity);
        }
    }
}
