package com.safetysentinel.core.model;

/**
 * Kind of a recorded {@link Metric}.
 */
public enum MetricKind {
    COUNTER,
    GAUGE,
    HISTOGRAM,
    TIMER
}
