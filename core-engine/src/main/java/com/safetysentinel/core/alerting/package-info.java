/**
 * Alert registry, lifecycle transitions and notification egress.
 *
 * <p>
 * {@link com.safetysentinel.core.alerting.AlertLifecycleManager} is the only
 * component that creates or changes alerts; every other component raises
 * alerts through {@link com.safetysentinel.core.alerting.FireRequest}s.
 * </p>
 *
 * @since 1.0.0
 */
package com.safetysentinel.core.alerting;
