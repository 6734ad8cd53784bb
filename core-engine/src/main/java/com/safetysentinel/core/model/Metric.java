package com.safetysentinel.core.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A named, timestamped numeric observation.
 *
 * <p>
 * Instances are created by the metric store on every ingestion call; the
 * timestamp is assigned by the engine, never by the caller. Immutable and
 * therefore safe to share between threads.
 * </p>
 *
 * @since 1.0.0
 */
public final class Metric {

    private final String name;
    private final double value;
    private final MetricKind kind;
    private final Instant timestamp;
    private final Map<String, String> tags;

    /**
     * @param name      metric name; must not be {@code null}
     * @param value     observed value
     * @param kind      metric kind; must not be {@code null}
     * @param timestamp engine-assigned timestamp; must not be {@code null}
     * @param tags      optional tags, copied; {@code null} means none and
     *                  {@code null} tag values are kept
     */
    public Metric(String name, double value, MetricKind kind, Instant timestamp, Map<String, String> tags) {
        this.name = Objects.requireNonNull(name, "Metric name must not be null");
        this.value = value;
        this.kind = Objects.requireNonNull(kind, "Metric kind must not be null");
        this.timestamp = Objects.requireNonNull(timestamp, "Metric timestamp must not be null");
        this.tags = Details.copyOf(tags);
    }

    public String getName() {
        return name;
    }

    public double getValue() {
        return value;
    }

    public MetricKind getKind() {
        return kind;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * @return unmodifiable tag map
     */
    public Map<String, String> getTags() {
        return tags;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Metric that))
            return false;
        return Double.compare(value, that.value) == 0
                && name.equals(that.name)
                && kind == that.kind
                && timestamp.equals(that.timestamp)
                && tags.equals(that.tags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, value, kind, timestamp, tags);
    }

    @Override
    public String toString() {
        return "Metric{" +
                "name='" + name + '\'' +
                ", value=" + value +
                ", kind=" + kind +
                ", timestamp=" + timestamp +
                ", tags=" + tags +
                '}';
    }
}
