package com.safetysentinel.core.rules;

import com.safetysentinel.core.alerting.AlertLifecycleManager;
import com.safetysentinel.core.alerting.FireRequest;
import com.safetysentinel.core.model.AlertOrigin;
import com.safetysentinel.core.model.AlertRule;
import com.safetysentinel.core.model.Metric;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Registry of threshold {@link AlertRule}s, evaluated synchronously on every
 * metric write.
 *
 * <p>
 * A rule that matches raises an alert keyed {@code rule:<ruleId>} through
 * the {@link AlertLifecycleManager}, so repeated violations of the same rule
 * re-trigger one alert instead of producing a new record per write.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Registration is guarded by a lock; {@link #evaluate(Metric)} works on an
 * immutable copy of the rules and never holds the lock while firing.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertRuleEngine {

    private static final Logger LOG = LoggerFactory.getLogger(AlertRuleEngine.class);

    /** Prefix of the alert keys raised by rules. */
    public static final String KEY_PREFIX = "rule:";

    private final AlertLifecycleManager alerts;

    private final Object lock = new Object();
    private final Map<String, AlertRule> rulesById = new LinkedHashMap<>();
    private volatile List<AlertRule> ruleView = List.of();

    public AlertRuleEngine(AlertLifecycleManager alerts) {
        this.alerts = Objects.requireNonNull(alerts, "AlertLifecycleManager must not be null");
    }

    // ---------------------------------------------------------------
    // Registration
    // ---------------------------------------------------------------

    /**
     * Validate and register a rule definition.
     *
     * @param definition rule definition; must not be {@code null}
     * @return the rule id
     * @throws RuleValidationException if the definition is invalid or a rule
     *                                 with the same id is already registered
     */
    public String register(RuleDefinition definition) {
        Objects.requireNonNull(definition, "RuleDefinition must not be null");
        return register(definition.toRule());
    }

    /**
     * Register an already-built rule.
     *
     * @param rule the rule; must not be {@code null}
     * @return the rule id
     * @throws RuleValidationException if the rule has a blank name or metric,
     *                                 or its id is already registered
     */
    public String register(AlertRule rule) {
        Objects.requireNonNull(rule, "AlertRule must not be null");
        if (rule.getId().isEmpty()) {
            throw new RuleValidationException("Rule name '" + rule.getName() + "' is blank");
        }
        if (rule.getMetricName().isBlank()) {
            throw new RuleValidationException("Rule '" + rule.getName() + "' requires a metric name");
        }
        synchronized (lock) {
            if (rulesById.containsKey(rule.getId())) {
                throw new RuleValidationException("Rule '" + rule.getId()
                        + "' is already registered; unregister it before replacing");
            }
            rulesById.put(rule.getId(), rule);
            ruleView = List.copyOf(rulesById.values());
        }
        LOG.info("Registered alert rule {}", rule);
        return rule.getId();
    }

    /**
     * Register every definition, failing on the first invalid one.
     *
     * @param definitions rule definitions
     * @return the registered ids in order
     */
    public List<String> registerAll(Collection<RuleDefinition> definitions) {
        Objects.requireNonNull(definitions, "Rule definitions must not be null");
        List<String> ids = definitions.stream().map(this::register).toList();
        LOG.info("Registered {} alert rule(s)", ids.size());
        return ids;
    }

    /**
     * @param ruleId id returned by {@code register}
     * @return {@code true} if a rule was removed
     */
    public boolean unregister(String ruleId) {
        synchronized (lock) {
            AlertRule removed = rulesById.remove(ruleId);
            if (removed == null) {
                return false;
            }
            ruleView = List.copyOf(rulesById.values());
            LOG.info("Unregistered alert rule '{}'", ruleId);
            return true;
        }
    }

    public Optional<AlertRule> find(String ruleId) {
        synchronized (lock) {
            return Optional.ofNullable(rulesById.get(ruleId));
        }
    }

    /**
     * @return immutable list of the registered rules, in registration order
     */
    public List<AlertRule> rules() {
        return ruleView;
    }

    // ---------------------------------------------------------------
    // Evaluation
    // ---------------------------------------------------------------

    /**
     * Apply every rule registered for the metric's name.
     *
     * @param metric the metric just written
     * @return number of rules that fired
     */
    public int evaluate(Metric metric) {
        Objects.requireNonNull(metric, "Metric must not be null");
        int fired = 0;

        for (AlertRule rule : ruleView) {
            if (!rule.getMetricName().equals(metric.getName())) {
                continue;
            }
            if (rule.isViolatedBy(metric.getValue())) {
                LOG.debug("Rule [{}] fired: {}={} {} {}", rule.getId(), metric.getName(),
                        metric.getValue(), rule.getComparator().symbol(), rule.getThreshold());
                alerts.fire(FireRequest.builder(KEY_PREFIX + rule.getId(), AlertOrigin.RULE)
                        .severity(rule.getSeverity())
                        .title(rule.getName())
                        .description(rule.getDescription())
                        .metric(metric.getName(), metric.getValue(), rule.getThreshold())
                        .build());
                fired++;
            }
        }
        return fired;
    }
}
