package com.safetysentinel.core.alerting;

import com.safetysentinel.core.model.Alert;

/**
 * Egress contract for alert notifications.
 *
 * <p>
 * Implementations deliver alerts to people or systems (email, SMS, pager,
 * log). They are called synchronously on the thread that raised the alert,
 * outside any engine lock, and may throw: failures are caught, logged and
 * recorded by the caller and never prevent the alert from being stored.
 * Delivery is at-most-once per call; there is no retry.
 * </p>
 */
@FunctionalInterface
public interface NotificationSink {

    /** Sink that drops every notification. */
    NotificationSink NONE = alert -> {
    };

    /**
     * Deliver a notification for the given alert.
     *
     * @param alert the alert as stored after the triggering change
     * @throws Exception if delivery failed
     */
    void notify(Alert alert) throws Exception;
}
