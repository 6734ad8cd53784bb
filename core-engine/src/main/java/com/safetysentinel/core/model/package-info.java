/**
 * Domain model shared by every engine component.
 *
 * <p>
 * Everything in this package is immutable:
 * </p>
 * <ul>
 * <li>{@link com.safetysentinel.core.model.Metric}: a timestamped numeric
 * observation</li>
 * <li>{@link com.safetysentinel.core.model.Alert}: alert record; state
 * changes produce new instances</li>
 * <li>{@link com.safetysentinel.core.model.AlertRule}: registered threshold
 * rule</li>
 * <li>{@link com.safetysentinel.core.model.SafetyEvent} and
 * {@link com.safetysentinel.core.model.SecurityEvent}: append-only event
 * records</li>
 * <li>{@link com.safetysentinel.core.model.SafetySnapshot},
 * {@link com.safetysentinel.core.model.MetricsSummary} and friends: derived
 * read models</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.safetysentinel.core.model;
