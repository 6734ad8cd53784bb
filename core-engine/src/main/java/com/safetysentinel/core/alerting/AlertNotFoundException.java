package com.safetysentinel.core.alerting;

import java.util.NoSuchElementException;

/**
 * Thrown when an alert transition names an id that does not exist or whose
 * alert can no longer be acted on.
 *
 * @since 1.0.0
 */
public class AlertNotFoundException extends NoSuchElementException {

    private static final long serialVersionUID = 1L;

    private final String alertId;

    public AlertNotFoundException(String alertId, String message) {
        super(message);
        this.alertId = alertId;
    }

    public String getAlertId() {
        return alertId;
    }
}
