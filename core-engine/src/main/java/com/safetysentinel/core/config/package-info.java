/**
 * Engine configuration and rule loading.
 *
 * <p>
 * {@link com.safetysentinel.core.config.MonitorConfig} carries every tunable
 * and is resolved from the environment;
 * {@link com.safetysentinel.core.config.RulesLoader} reads alert rules and
 * safety pattern thresholds from YAML into a
 * {@link com.safetysentinel.core.config.RulesConfig}. Both fail fast on
 * invalid input.
 * </p>
 *
 * @since 1.0.0
 */
package com.safetysentinel.core.config;
