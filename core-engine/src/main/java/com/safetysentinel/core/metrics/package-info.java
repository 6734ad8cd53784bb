/**
 * Metric time series and request timing storage.
 */
package com.safetysentinel.core.metrics;
