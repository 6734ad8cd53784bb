package com.safetysentinel.monitor;

import com.safetysentinel.core.alerting.AlertLifecycleManager;
import com.safetysentinel.core.config.MonitorConfig;
import com.safetysentinel.core.metrics.MetricStore;
import com.safetysentinel.core.metrics.RequestTimeRecorder;
import com.safetysentinel.core.model.MetricKind;
import com.safetysentinel.core.security.SecurityEventTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.IntSupplier;

/**
 * Background task that re-derives health signals on a fixed interval.
 *
 * <h3>Tick</h3>
 * <ol>
 * <li>If any requests were recorded, record {@code error_rate} and
 * {@code avg_response_time} gauges. Recording goes through the
 * {@link MetricStore}, so alert rules see the new values.</li>
 * <li>Record the {@code active_connections} gauge.</li>
 * <li>Auto-resolve ACTIVE alerts older than the configured cutoff.</li>
 * <li>Reset failed-auth counters when a UTC day boundary has been crossed
 * since the previous reset.</li>
 * </ol>
 *
 * <h3>Failure isolation</h3>
 * <p>
 * An exception thrown by a tick is logged, counted and recorded as a
 * {@code health_loop_failures} counter. The loop keeps running and waits the
 * shorter error back-off before the next tick.
 * </p>
 *
 * @since 1.0.0
 */
public class HealthLoop {

    private static final Logger LOG = LoggerFactory.getLogger(HealthLoop.class);

    static final String ERROR_RATE = "error_rate";
    static final String AVG_RESPONSE_TIME = "avg_response_time";
    static final String ACTIVE_CONNECTIONS = "active_connections";
    static final String HEALTH_LOOP_FAILURES = "health_loop_failures";

    private final MetricStore metrics;
    private final RequestTimeRecorder requests;
    private final AlertLifecycleManager alerts;
    private final SecurityEventTracker security;
    private final IntSupplier activeConnections;
    private final Clock clock;
    private final TickScheduler scheduler;

    private final Duration tickInterval;
    private final Duration errorBackoff;
    private final Duration shutdownTimeout;
    private final Duration autoResolveCutoff;

    private final AtomicLong failures = new AtomicLong();
    private final Object tickLock = new Object();
    private LocalDate lastCounterReset;
    private Thread worker;

    HealthLoop(MonitorConfig config, MetricStore metrics, RequestTimeRecorder requests,
            AlertLifecycleManager alerts, SecurityEventTracker security,
            IntSupplier activeConnections, Clock clock, TickScheduler scheduler) {
        Objects.requireNonNull(config, "MonitorConfig must not be null");
        this.metrics = Objects.requireNonNull(metrics, "MetricStore must not be null");
        this.requests = Objects.requireNonNull(requests, "RequestTimeRecorder must not be null");
        this.alerts = Objects.requireNonNull(alerts, "AlertLifecycleManager must not be null");
        this.security = Objects.requireNonNull(security, "SecurityEventTracker must not be null");
        this.activeConnections = Objects.requireNonNull(activeConnections, "activeConnections must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "TickScheduler must not be null");
        this.tickInterval = config.getTickInterval();
        this.errorBackoff = config.getErrorBackoff();
        this.shutdownTimeout = config.getShutdownTimeout();
        this.autoResolveCutoff = config.getAutoResolveCutoff();
        this.lastCounterReset = today();
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Start the background thread. Calling it again is a no-op.
     */
    public synchronized void start() {
        if (worker != null) {
            LOG.debug("Health loop already started");
            return;
        }
        worker = new Thread(this::run, "health-loop");
        worker.setDaemon(true);
        worker.start();
        LOG.info("Health loop started (interval={}, backoff={})", tickInterval, errorBackoff);
    }

    /**
     * Signal the loop to stop and wait for it, bounded by the shutdown timeout.
     *
     * @return {@code true} if the thread has terminated (or never started)
     */
    public synchronized boolean shutdown() {
        scheduler.stop();
        if (worker == null) {
            return true;
        }
        try {
            worker.join(shutdownTimeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for health loop to stop");
        }
        boolean stopped = !worker.isAlive();
        if (stopped) {
            LOG.info("Health loop stopped");
        } else {
            LOG.warn("Health loop did not stop within {}", shutdownTimeout);
        }
        return stopped;
    }

    // ---------------------------------------------------------------
    // Tick
    // ---------------------------------------------------------------

    /**
     * Run one tick on the calling thread. Exceptions propagate.
     */
    public void tick() {
        synchronized (tickLock) {
            if (requests.totalRequests() > 0) {
                metrics.recordGauge(ERROR_RATE, requests.errorRate());
                metrics.recordGauge(AVG_RESPONSE_TIME, requests.averageResponseTime());
            }
            metrics.recordGauge(ACTIVE_CONNECTIONS, activeConnections.getAsInt());

            int resolved = alerts.autoResolveStale(autoResolveCutoff);
            if (resolved > 0) {
                LOG.info("Auto-resolved {} stale alert(s)", resolved);
            }

            LocalDate today = today();
            if (today.isAfter(lastCounterReset)) {
                security.resetFailedAuthCounters();
                lastCounterReset = today;
            }
        }
    }

    /**
     * Run one tick and isolate any failure.
     *
     * @return the delay before the next tick
     */
    Duration runTick() {
        try {
            tick();
            return tickInterval;
        } catch (RuntimeException e) {
            long count = failures.incrementAndGet();
            LOG.error("Health loop tick failed (failure #{}): {}", count, e.getMessage(), e);
            try {
                metrics.record(HEALTH_LOOP_FAILURES, 1, MetricKind.COUNTER, Map.of());
            } catch (RuntimeException metricError) {
                LOG.error("Failed to record {} metric", HEALTH_LOOP_FAILURES, metricError);
            }
            return errorBackoff;
        }
    }

    /**
     * @return number of ticks that threw
     */
    public long failureCount() {
        return failures.get();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void run() {
        try {
            Duration next = runTick();
            while (!scheduler.await(next)) {
                next = runTick();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Health loop interrupted");
        }
    }

    private LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
    }
}
