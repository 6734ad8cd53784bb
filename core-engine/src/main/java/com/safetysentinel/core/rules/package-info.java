/**
 * Threshold alert rules.
 *
 * <p>
 * Rules are described by {@link com.safetysentinel.core.rules.RuleDefinition}
 * (programmatically or from YAML), validated into immutable
 * {@link com.safetysentinel.core.model.AlertRule}s and evaluated by
 * {@link com.safetysentinel.core.rules.AlertRuleEngine} on every metric
 * write.
 * </p>
 *
 * @since 1.0.0
 */
package com.safetysentinel.core.rules;
