package com.safetysentinel.core.config;

import com.safetysentinel.core.model.Severity;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Typed, immutable configuration for the monitoring engine.
 *
 * <p>
 * Supplied at construction time; nothing inside the engine parses
 * configuration. Use {@link #fromEnvironment()} for production, where every
 * value can be overridden by a {@code SENTINEL_*} environment variable, or
 * the {@link Builder} for programmatic and test scenarios. The builder
 * validates inputs at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class MonitorConfig {

    /** Event types escalated straight to an emergency alert by default. */
    public static final Set<String> DEFAULT_CRITICAL_EVENT_TYPES = Set.of("abuse_detected", "severe_distress");

    // ---------------------------------------------------------------
    // Buffers
    // ---------------------------------------------------------------
    private final int metricBufferCapacity;
    private final int maxMetricNames;
    private final int requestBufferCapacity;
    private final int safetyEventCapacity;
    private final int securityEventCapacity;

    // ---------------------------------------------------------------
    // Background loop
    // ---------------------------------------------------------------
    private final Duration tickInterval;
    private final Duration errorBackoff;
    private final Duration shutdownTimeout;
    private final Duration autoResolveCutoff;

    // ---------------------------------------------------------------
    // Child safety
    // ---------------------------------------------------------------
    private final Duration patternWindow;
    private final Duration scoringWindow;
    private final Map<String, PatternThreshold> patternThresholds;
    private final Set<String> criticalEventTypes;

    // ---------------------------------------------------------------
    // Security / requests / notifications
    // ---------------------------------------------------------------
    private final int failedAuthThreshold;
    private final double slowRequestSeconds;
    private final Severity notificationFloor;

    private MonitorConfig(Builder b) {
        this.metricBufferCapacity = b.metricBufferCapacity;
        this.maxMetricNames = b.maxMetricNames;
        this.requestBufferCapacity = b.requestBufferCapacity;
        this.safetyEventCapacity = b.safetyEventCapacity;
        this.securityEventCapacity = b.securityEventCapacity;
        this.tickInterval = b.tickInterval;
        this.errorBackoff = b.errorBackoff;
        this.shutdownTimeout = b.shutdownTimeout;
        this.autoResolveCutoff = b.autoResolveCutoff;
        this.patternWindow = b.patternWindow;
        this.scoringWindow = b.scoringWindow;
        this.patternThresholds = Map.copyOf(b.patternThresholds);
        this.criticalEventTypes = Set.copyOf(b.criticalEventTypes);
        this.failedAuthThreshold = b.failedAuthThreshold;
        this.slowRequestSeconds = b.slowRequestSeconds;
        this.notificationFloor = b.notificationFloor;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the default configuration
     */
    public static MonitorConfig defaults() {
        return new Builder().build();
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a configuration from {@code SENTINEL_*} environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if a value cannot be parsed
     * @throws IllegalArgumentException if a value is out of range
     */
    public static MonitorConfig fromEnvironment() {
        return builderFromEnvironment(System::getenv).build();
    }

    /**
     * Pre-populate a builder from an environment lookup, so callers can layer
     * file-based settings (e.g. YAML pattern thresholds) on top.
     *
     * @param env variable lookup, typically {@code System::getenv}
     * @return a builder carrying every environment override
     * @throws IllegalStateException if a numeric value cannot be parsed
     */
    public static Builder builderFromEnvironment(Function<String, String> env) {
        Objects.requireNonNull(env, "env lookup must not be null");
        Builder b = new Builder();
        try {
            b.metricBufferCapacity(parseInt(env, "SENTINEL_METRIC_BUFFER_CAPACITY", b.metricBufferCapacity))
                    .maxMetricNames(parseInt(env, "SENTINEL_MAX_METRIC_NAMES", b.maxMetricNames))
                    .requestBufferCapacity(parseInt(env, "SENTINEL_REQUEST_BUFFER_CAPACITY", b.requestBufferCapacity))
                    .safetyEventCapacity(parseInt(env, "SENTINEL_SAFETY_EVENT_CAPACITY", b.safetyEventCapacity))
                    .securityEventCapacity(parseInt(env, "SENTINEL_SECURITY_EVENT_CAPACITY", b.securityEventCapacity))
                    .tickInterval(seconds(env, "SENTINEL_TICK_INTERVAL_SECONDS", b.tickInterval))
                    .errorBackoff(seconds(env, "SENTINEL_ERROR_BACKOFF_SECONDS", b.errorBackoff))
                    .shutdownTimeout(seconds(env, "SENTINEL_SHUTDOWN_TIMEOUT_SECONDS", b.shutdownTimeout))
                    .autoResolveCutoff(seconds(env, "SENTINEL_AUTO_RESOLVE_SECONDS", b.autoResolveCutoff))
                    .patternWindow(seconds(env, "SENTINEL_PATTERN_WINDOW_SECONDS", b.patternWindow))
                    .scoringWindow(seconds(env, "SENTINEL_SCORING_WINDOW_SECONDS", b.scoringWindow))
                    .failedAuthThreshold(parseInt(env, "SENTINEL_FAILED_AUTH_THRESHOLD", b.failedAuthThreshold))
                    .slowRequestSeconds(parseDouble(env, "SENTINEL_SLOW_REQUEST_SECONDS", b.slowRequestSeconds));
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }

        String critical = value(env, "SENTINEL_CRITICAL_EVENT_TYPES");
        if (critical != null) {
            b.criticalEventTypes(Arrays.stream(critical.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .collect(Collectors.toCollection(LinkedHashSet::new)));
        }
        String floor = value(env, "SENTINEL_NOTIFICATION_SEVERITY");
        if (floor != null) {
            b.notificationFloor(Severity.fromLabel(floor));
        }
        return b;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public int getMetricBufferCapacity() {
        return metricBufferCapacity;
    }

    public int getMaxMetricNames() {
        return maxMetricNames;
    }

    public int getRequestBufferCapacity() {
        return requestBufferCapacity;
    }

    public int getSafetyEventCapacity() {
        return safetyEventCapacity;
    }

    public int getSecurityEventCapacity() {
        return securityEventCapacity;
    }

    public Duration getTickInterval() {
        return tickInterval;
    }

    public Duration getErrorBackoff() {
        return errorBackoff;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public Duration getAutoResolveCutoff() {
        return autoResolveCutoff;
    }

    public Duration getPatternWindow() {
        return patternWindow;
    }

    public Duration getScoringWindow() {
        return scoringWindow;
    }

    /**
     * @return unmodifiable map of event type to pattern threshold
     */
    public Map<String, PatternThreshold> getPatternThresholds() {
        return patternThresholds;
    }

    public Set<String> getCriticalEventTypes() {
        return criticalEventTypes;
    }

    public int getFailedAuthThreshold() {
        return failedAuthThreshold;
    }

    public double getSlowRequestSeconds() {
        return slowRequestSeconds;
    }

    public Severity getNotificationFloor() {
        return notificationFloor;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link MonitorConfig}.
     *
     * <p>
     * Defaults: 10&nbsp;000 metrics per name, 1&nbsp;000 names, 1&nbsp;000
     * request samples, 10&nbsp;000 safety events, 1&nbsp;000 security events,
     * 60s tick, 30s error back-off, 5s shutdown join, 24h auto-resolve, 1h
     * pattern window, 24h scoring window, 10 failed authentications, 5s slow
     * request, notifications from HIGH upwards.
     * </p>
     */
    public static class Builder {
        private int metricBufferCapacity = 10_000;
        private int maxMetricNames = 1_000;
        private int requestBufferCapacity = 1_000;
        private int safetyEventCapacity = 10_000;
        private int securityEventCapacity = 1_000;
        private Duration tickInterval = Duration.ofSeconds(60);
        private Duration errorBackoff = Duration.ofSeconds(30);
        private Duration shutdownTimeout = Duration.ofSeconds(5);
        private Duration autoResolveCutoff = Duration.ofHours(24);
        private Duration patternWindow = Duration.ofHours(1);
        private Duration scoringWindow = Duration.ofHours(24);
        private final Map<String, PatternThreshold> patternThresholds = new LinkedHashMap<>();
        private Set<String> criticalEventTypes = new LinkedHashSet<>(DEFAULT_CRITICAL_EVENT_TYPES);
        private int failedAuthThreshold = 10;
        private double slowRequestSeconds = 5.0;
        private Severity notificationFloor = Severity.HIGH;

        public Builder() {
            patternThreshold(new PatternThreshold("inappropriate_content", 5, "excessive_inappropriate_content"));
            patternThreshold(new PatternThreshold("emotional_distress", 3, "repeated_emotional_distress"));
            patternThreshold(new PatternThreshold("unusual_activity", 20, "excessive_unusual_activity"));
        }

        public Builder metricBufferCapacity(int v) {
            this.metricBufferCapacity = v;
            return this;
        }

        public Builder maxMetricNames(int v) {
            this.maxMetricNames = v;
            return this;
        }

        public Builder requestBufferCapacity(int v) {
            this.requestBufferCapacity = v;
            return this;
        }

        public Builder safetyEventCapacity(int v) {
            this.safetyEventCapacity = v;
            return this;
        }

        public Builder securityEventCapacity(int v) {
            this.securityEventCapacity = v;
            return this;
        }

        public Builder tickInterval(Duration v) {
            this.tickInterval = v;
            return this;
        }

        public Builder errorBackoff(Duration v) {
            this.errorBackoff = v;
            return this;
        }

        public Builder shutdownTimeout(Duration v) {
            this.shutdownTimeout = v;
            return this;
        }

        public Builder autoResolveCutoff(Duration v) {
            this.autoResolveCutoff = v;
            return this;
        }

        public Builder patternWindow(Duration v) {
            this.patternWindow = v;
            return this;
        }

        public Builder scoringWindow(Duration v) {
            this.scoringWindow = v;
            return this;
        }

        /**
         * Add or replace the threshold for the threshold's event type.
         */
        public Builder patternThreshold(PatternThreshold threshold) {
            Objects.requireNonNull(threshold, "PatternThreshold must not be null");
            patternThresholds.put(threshold.getEventType(), threshold);
            return this;
        }

        /**
         * Add or replace several thresholds.
         */
        public Builder patternThresholds(Collection<PatternThreshold> thresholds) {
            Objects.requireNonNull(thresholds, "thresholds must not be null");
            thresholds.forEach(this::patternThreshold);
            return this;
        }

        /**
         * Drop every threshold, including the defaults.
         */
        public Builder clearPatternThresholds() {
            patternThresholds.clear();
            return this;
        }

        public Builder criticalEventTypes(Set<String> v) {
            this.criticalEventTypes = v != null ? new LinkedHashSet<>(v) : null;
            return this;
        }

        public Builder failedAuthThreshold(int v) {
            this.failedAuthThreshold = v;
            return this;
        }

        public Builder slowRequestSeconds(double v) {
            this.slowRequestSeconds = v;
            return this;
        }

        public Builder notificationFloor(Severity v) {
            this.notificationFloor = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link MonitorConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public MonitorConfig build() {
            requirePositive(metricBufferCapacity, "metricBufferCapacity");
            requirePositive(maxMetricNames, "maxMetricNames");
            requirePositive(requestBufferCapacity, "requestBufferCapacity");
            requirePositive(safetyEventCapacity, "safetyEventCapacity");
            requirePositive(securityEventCapacity, "securityEventCapacity");
            requirePositive(tickInterval, "tickInterval");
            requirePositive(errorBackoff, "errorBackoff");
            requirePositive(shutdownTimeout, "shutdownTimeout");
            requirePositive(autoResolveCutoff, "autoResolveCutoff");
            requirePositive(patternWindow, "patternWindow");
            requirePositive(scoringWindow, "scoringWindow");
            requirePositive(failedAuthThreshold, "failedAuthThreshold");
            if (!(slowRequestSeconds > 0)) {
                throw new IllegalArgumentException("slowRequestSeconds must be > 0, got: " + slowRequestSeconds);
            }
            Objects.requireNonNull(criticalEventTypes, "criticalEventTypes must not be null");
            Objects.requireNonNull(notificationFloor, "notificationFloor must not be null");
            return new MonitorConfig(this);
        }

        private static void requirePositive(int value, String name) {
            if (value < 1) {
                throw new IllegalArgumentException(name + " must be >= 1, got: " + value);
            }
        }

        private static void requirePositive(Duration value, String name) {
            Objects.requireNonNull(value, name + " must not be null");
            if (value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be positive, got: " + value);
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String value(Function<String, String> env, String name) {
        String v = env.apply(name);
        return (v != null && !v.isBlank()) ? v.trim() : null;
    }

    private static int parseInt(Function<String, String> env, String name, int defaultValue) {
        String v = value(env, name);
        return v == null ? defaultValue : Integer.parseInt(v);
    }

    private static double parseDouble(Function<String, String> env, String name, double defaultValue) {
        String v = value(env, name);
        return v == null ? defaultValue : Double.parseDouble(v);
    }

    private static Duration seconds(Function<String, String> env, String name, Duration defaultValue) {
        String v = value(env, name);
        return v == null ? defaultValue : Duration.ofSeconds(Long.parseLong(v));
    }

    @Override
    public String toString() {
        return "MonitorConfig{" +
                "metricBufferCapacity=" + metricBufferCapacity +
                ", maxMetricNames=" + maxMetricNames +
                ", tickInterval=" + tickInterval +
                ", errorBackoff=" + errorBackoff +
                ", autoResolveCutoff=" + autoResolveCutoff +
                ", patternWindow=" + patternWindow +
                ", patternThresholds=" + patternThresholds.values() +
                ", criticalEventTypes=" + criticalEventTypes +
                ", failedAuthThreshold=" + failedAuthThreshold +
                ", notificationFloor=" + notificationFloor +
                '}';
    }
}
