/**
 * Runnable monitoring service: the {@link com.safetysentinel.monitor.MonitoringEngine}
 * facade, its background {@link com.safetysentinel.monitor.HealthLoop} and a
 * logging notification sink.
 *
 * @since 1.0.0
 */
package com.safetysentinel.monitor;
