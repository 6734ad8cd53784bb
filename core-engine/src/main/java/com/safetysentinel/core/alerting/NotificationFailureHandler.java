package com.safetysentinel.core.alerting;

import com.safetysentinel.core.model.Alert;

/**
 * Callback invoked when a {@link NotificationSink} throws.
 */
@FunctionalInterface
public interface NotificationFailureHandler {

    /** Handler that only relies on the manager's own logging. */
    NotificationFailureHandler NONE = (alert, cause) -> {
    };

    /**
     * @param alert the alert whose notification failed
     * @param cause the exception thrown by the sink
     */
    void onFailure(Alert alert, Exception cause);
}
