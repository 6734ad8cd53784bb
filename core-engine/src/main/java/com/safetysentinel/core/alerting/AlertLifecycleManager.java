package com.safetysentinel.core.alerting;

import com.safetysentinel.core.model.Alert;
import com.safetysentinel.core.model.AlertStatus;
import com.safetysentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Owns every {@link Alert} and applies all of its state changes.
 *
 * <h3>Deduplication</h3>
 * <p>
 * {@link #fire(FireRequest)} keeps at most one open (ACTIVE or ACKNOWLEDGED)
 * alert per key. Firing a key that already has an open alert increments its
 * trigger count and refreshes its value instead of creating a second record.
 * </p>
 *
 * <h3>Transitions</h3>
 * <pre>
 *   ACTIVE → ACKNOWLEDGED → RESOLVED
 *   ACTIVE → RESOLVED
 *   ACTIVE → SUPPRESSED
 * </pre>
 * <p>
 * RESOLVED and SUPPRESSED are terminal. Alerts are never deleted.
 * </p>
 *
 * <h3>Notifications</h3>
 * <p>
 * Alerts at or above the notification floor are passed to the
 * {@link NotificationSink} after the registry lock is released. A throwing
 * sink is logged, counted and reported to the
 * {@link NotificationFailureHandler}; the alert stays stored either way.
 * </p>
 * <p>
 * The failure handler is not re-entered on its own thread. A delivery that
 * fails while the handler is running (for example because the handler
 * records a metric that a rule alerts on) is logged and counted only.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * A single lock guards the registry, so trigger-count increments on the same
 * alert are atomic with respect to concurrent {@code fire} calls. Stored
 * alerts are immutable and returned as-is.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertLifecycleManager {

    private static final Logger LOG = LoggerFactory.getLogger(AlertLifecycleManager.class);

    private static final Comparator<Alert> NEWEST_FIRST =
            Comparator.comparing(Alert::getCreatedAt).reversed();

    private final Clock clock;
    private final Severity notificationFloor;
    private final Supplier<String> idGenerator;

    private final Object lock = new Object();
    private final Map<String, Alert> alertsById = new LinkedHashMap<>();
    private final Map<String, String> openIdByKey = new HashMap<>();

    private volatile NotificationSink sink = NotificationSink.NONE;
    private volatile NotificationFailureHandler failureHandler = NotificationFailureHandler.NONE;
    private final AtomicLong notificationFailures = new AtomicLong();
    private final ThreadLocal<Boolean> handlingFailure = ThreadLocal.withInitial(() -> Boolean.FALSE);

    /**
     * @param clock             time source for alert timestamps
     * @param notificationFloor lowest severity that is passed to the sink
     */
    public AlertLifecycleManager(Clock clock, Severity notificationFloor) {
        this(clock, notificationFloor, () -> UUID.randomUUID().toString());
    }

    AlertLifecycleManager(Clock clock, Severity notificationFloor, Supplier<String> idGenerator) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.notificationFloor = Objects.requireNonNull(notificationFloor, "notificationFloor must not be null");
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator must not be null");
    }

    // ---------------------------------------------------------------
    // Wiring
    // ---------------------------------------------------------------

    public void setNotificationSink(NotificationSink sink) {
        this.sink = sink != null ? sink : NotificationSink.NONE;
    }

    public void setNotificationFailureHandler(NotificationFailureHandler handler) {
        this.failureHandler = handler != null ? handler : NotificationFailureHandler.NONE;
    }

    // ---------------------------------------------------------------
    // Creation / re-trigger
    // ---------------------------------------------------------------

    /**
     * Raise a new alert for the request's key, or re-trigger the open one.
     *
     * @param request what fired; must not be {@code null}
     * @return the alert as stored after this call
     */
    public Alert fire(FireRequest request) {
        Objects.requireNonNull(request, "FireRequest must not be null");
        Instant now = clock.instant();
        Alert stored;
        boolean created;

        synchronized (lock) {
            Alert open = openAlert(request.getKey());
            if (open != null) {
                Map<String, Object> attributes = new LinkedHashMap<>(open.getAttributes());
                attributes.putAll(request.getAttributes());
                stored = open.toBuilder()
                        .triggerCount(open.getTriggerCount() + 1)
                        .currentValue(request.getCurrentValue())
                        .lastTriggered(now)
                        .attributes(attributes)
                        .build();
                created = false;
            } else {
                stored = Alert.builder()
                        .id(idGenerator.get())
                        .key(request.getKey())
                        .origin(request.getOrigin())
                        .title(request.getTitle())
                        .description(request.getDescription())
                        .severity(request.getSeverity())
                        .status(AlertStatus.ACTIVE)
                        .createdAt(now)
                        .lastTriggered(now)
                        .metricName(request.getMetricName())
                        .currentValue(request.getCurrentValue())
                        .thresholdValue(request.getThreshold())
                        .childId(request.getChildId())
                        .attributes(request.getAttributes())
                        .build();
                openIdByKey.put(stored.getKey(), stored.getId());
                created = true;
            }
            alertsById.put(stored.getId(), stored);
        }

        if (created) {
            if (stored.getSeverity() == Severity.EMERGENCY) {
                LOG.error("EMERGENCY alert created: {} (key={}, child={})",
                        stored.getTitle(), stored.getKey(), stored.getChildId());
            } else {
                LOG.warn("Alert created: {} ({})", stored.getTitle(), stored.getSeverity().label());
            }
        } else {
            LOG.debug("Alert [{}] re-triggered: triggerCount={} value={}",
                    stored.getId(), stored.getTriggerCount(), stored.getCurrentValue());
        }

        if (stored.getSeverity().isAtLeast(notificationFloor)) {
            deliver(stored);
        }
        return stored;
    }

    // ---------------------------------------------------------------
    // Transitions
    // ---------------------------------------------------------------

    /**
     * Move an ACTIVE alert to ACKNOWLEDGED. Acknowledging an alert twice is a
     * no-op.
     *
     * @param id alert id
     * @return the alert after the call
     * @throws AlertNotFoundException if the id is unknown or already resolved
     * @throws IllegalStateException  if the alert was suppressed
     */
    public Alert acknowledge(String id) {
        synchronized (lock) {
            Alert alert = require(id);
            if (alert.getStatus() == AlertStatus.ACKNOWLEDGED) {
                return alert;
            }
            if (alert.getStatus() == AlertStatus.RESOLVED) {
                throw new AlertNotFoundException(id, "Alert already resolved: " + id);
            }
            if (alert.getStatus() == AlertStatus.SUPPRESSED) {
                throw new IllegalStateException("Cannot acknowledge suppressed alert: " + id);
            }
            Alert updated = alert.toBuilder()
                    .status(AlertStatus.ACKNOWLEDGED)
                    .acknowledgedAt(clock.instant())
                    .build();
            alertsById.put(id, updated);
            LOG.info("Alert acknowledged: {} ({})", updated.getTitle(), id);
            return updated;
        }
    }

    /**
     * Resolve an open alert. Resolving an already resolved alert is a no-op.
     *
     * @param id alert id
     * @return the alert after the call
     * @throws AlertNotFoundException if the id is unknown
     * @throws IllegalStateException  if the alert was suppressed
     */
    public Alert resolve(String id) {
        synchronized (lock) {
            Alert alert = require(id);
            if (alert.getStatus() == AlertStatus.RESOLVED) {
                return alert;
            }
            if (alert.getStatus() == AlertStatus.SUPPRESSED) {
                throw new IllegalStateException("Cannot resolve suppressed alert: " + id);
            }
            Alert updated = close(alert, AlertStatus.RESOLVED, clock.instant());
            LOG.info("Alert resolved: {} ({})", updated.getTitle(), id);
            return updated;
        }
    }

    /**
     * Silence an ACTIVE alert permanently.
     *
     * @param id alert id
     * @return the suppressed alert
     * @throws AlertNotFoundException if the id is unknown
     * @throws IllegalStateException  if the alert is not ACTIVE
     */
    public Alert suppress(String id) {
        synchronized (lock) {
            Alert alert = require(id);
            if (alert.getStatus() != AlertStatus.ACTIVE) {
                throw new IllegalStateException(
                        "Only ACTIVE alerts can be suppressed; alert " + id + " is " + alert.getStatus());
            }
            Alert updated = close(alert, AlertStatus.SUPPRESSED, null);
            LOG.info("Alert suppressed: {} ({})", updated.getTitle(), id);
            return updated;
        }
    }

    /**
     * Resolve every ACTIVE, non-EMERGENCY alert created more than
     * {@code cutoff} ago. Running it again without new alerts changes nothing.
     *
     * @param cutoff minimum alert age; must not be {@code null}
     * @return number of alerts resolved by this call
     */
    public int autoResolveStale(Duration cutoff) {
        Objects.requireNonNull(cutoff, "cutoff must not be null");
        Instant now = clock.instant();
        Instant staleBefore = now.minus(cutoff);
        int resolved = 0;

        synchronized (lock) {
            for (Alert alert : new ArrayList<>(alertsById.values())) {
                if (alert.getStatus() == AlertStatus.ACTIVE
                        && alert.getSeverity() != Severity.EMERGENCY
                        && alert.getCreatedAt().isBefore(staleBefore)) {
                    close(alert, AlertStatus.RESOLVED, now);
                    resolved++;
                    LOG.info("Auto-resolved stale alert: {}", alert.getTitle());
                }
            }
        }
        return resolved;
    }

    // ---------------------------------------------------------------
    // Reads
    // ---------------------------------------------------------------

    public Optional<Alert> find(String id) {
        synchronized (lock) {
            return Optional.ofNullable(alertsById.get(id));
        }
    }

    /**
     * @return the open alert for {@code key}, if any
     */
    public Optional<Alert> findOpen(String key) {
        synchronized (lock) {
            return Optional.ofNullable(openAlert(key));
        }
    }

    /**
     * @return ACTIVE alerts, newest first
     */
    public List<Alert> activeAlerts() {
        return activeAlerts(null);
    }

    /**
     * @param severity only return alerts of this severity; {@code null} for all
     * @return ACTIVE alerts, newest first
     */
    public List<Alert> activeAlerts(Severity severity) {
        List<Alert> result = new ArrayList<>();
        synchronized (lock) {
            for (Alert alert : alertsById.values()) {
                if (alert.getStatus() == AlertStatus.ACTIVE
                        && (severity == null || alert.getSeverity() == severity)) {
                    result.add(alert);
                }
            }
        }
        result.sort(NEWEST_FIRST);
        return List.copyOf(result);
    }

    /**
     * @return every alert ever raised, in creation order
     */
    public List<Alert> alerts() {
        synchronized (lock) {
            return List.copyOf(alertsById.values());
        }
    }

    public int activeCount() {
        synchronized (lock) {
            return (int) alertsById.values().stream()
                    .filter(a -> a.getStatus() == AlertStatus.ACTIVE)
                    .count();
        }
    }

    /**
     * @param childId child id
     * @return number of ACTIVE alerts raised for the child
     */
    public int activeCountForChild(String childId) {
        synchronized (lock) {
            return (int) alertsById.values().stream()
                    .filter(a -> a.getStatus() == AlertStatus.ACTIVE)
                    .filter(a -> Objects.equals(childId, a.getChildId()))
                    .count();
        }
    }

    /**
     * @param childId child id
     * @return every alert raised for the child, newest first
     */
    public List<Alert> alertsForChild(String childId) {
        List<Alert> result = new ArrayList<>();
        synchronized (lock) {
            for (Alert alert : alertsById.values()) {
                if (Objects.equals(childId, alert.getChildId())) {
                    result.add(alert);
                }
            }
        }
        result.sort(NEWEST_FIRST);
        return List.copyOf(result);
    }

    /**
     * @return number of sink invocations that threw
     */
    public long notificationFailures() {
        return notificationFailures.get();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Alert openAlert(String key) {
        String id = openIdByKey.get(key);
        if (id == null) {
            return null;
        }
        Alert alert = alertsById.get(id);
        return alert != null && alert.getStatus().isOpen() ? alert : null;
    }

    private Alert require(String id) {
        Objects.requireNonNull(id, "Alert id must not be null");
        Alert alert = alertsById.get(id);
        if (alert == null) {
            throw new AlertNotFoundException(id, "Alert not found: " + id);
        }
        return alert;
    }

    private Alert close(Alert alert, AlertStatus status, Instant resolvedAt) {
        Alert updated = alert.toBuilder()
                .status(status)
                .resolvedAt(resolvedAt)
                .build();
        alertsById.put(updated.getId(), updated);
        openIdByKey.remove(updated.getKey(), updated.getId());
        return updated;
    }

    private void deliver(Alert alert) {
        try {
            sink.notify(alert);
        } catch (Exception e) {
            notificationFailures.incrementAndGet();
            if (handlingFailure.get()) {
                LOG.error("Notification failed for alert [{}] {} while handling an earlier failure: {}",
                        alert.getId(), alert.getTitle(), e.getMessage());
                return;
            }
            LOG.error("Notification failed for alert [{}] {}: {}", alert.getId(), alert.getTitle(), e.getMessage(), e);
            handlingFailure.set(Boolean.TRUE);
            try {
                failureHandler.onFailure(alert, e);
            } catch (RuntimeException handlerError) {
                LOG.error("Notification failure handler threw for alert [{}]", alert.getId(), handlerError);
            } finally {
                handlingFailure.remove();
            }
        }
    }
}
