package com.safetysentinel.core.rules;

import com.safetysentinel.core.model.AlertRule;
import com.safetysentinel.core.model.Comparator;
import com.safetysentinel.core.model.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Mutable, YAML-bindable description of a threshold rule.
 *
 * <p>
 * Expected YAML shape:
 * </p>
 *
 * <pre>
 * - name: High Error Rate
 *   description: Error rate exceeds 5%
 *   severity: high
 *   metric: error_rate
 *   threshold: 0.05
 *   comparison: "&gt;"
 * </pre>
 *
 * <p>
 * Call {@link #validate()} (or {@link #toRule()}, which validates first) to
 * turn the definition into an immutable {@link AlertRule}.
 * </p>
 *
 * @since 1.0.0
 */
public class RuleDefinition {

    private String name;
    private String description;
    private String severity = "medium";
    private String metric;
    private double threshold;
    private String comparison = ">";

    public RuleDefinition() {
    }

    public RuleDefinition(String name, String description, String severity,
            String metric, double threshold, String comparison) {
        this.name = name;
        this.description = description;
        this.severity = severity;
        this.metric = metric;
        this.threshold = threshold;
        this.comparison = comparison;
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Check every field and report all problems at once.
     *
     * @throws RuleValidationException if any field is missing or illegal
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (name == null || name.isBlank()) {
            errors.add("Rule 'name' is required");
        } else if (AlertRule.idFor(name).isEmpty()) {
            errors.add("Rule name '" + name + "' must contain at least one letter or digit");
        }
        if (metric == null || metric.isBlank()) {
            errors.add("Rule '" + name + "' requires 'metric'");
        }
        if (Comparator.fromSymbol(comparison).isEmpty()) {
            errors.add("Rule '" + name + "' has unsupported comparison '" + comparison
                    + "'. Supported: >, <, ==");
        }
        if (severity == null) {
            errors.add("Rule '" + name + "' requires 'severity'");
        } else {
            try {
                Severity.fromLabel(severity);
            } catch (IllegalArgumentException e) {
                errors.add("Rule '" + name + "': " + e.getMessage());
            }
        }
        if (Double.isNaN(threshold)) {
            errors.add("Rule '" + name + "' threshold must be a number");
        }

        if (!errors.isEmpty()) {
            throw new RuleValidationException(errors);
        }
    }

    /**
     * @return the validated, immutable rule
     * @throws RuleValidationException if validation fails
     */
    public AlertRule toRule() {
        validate();
        return new AlertRule(
                name.trim(),
                description,
                Severity.fromLabel(severity),
                metric.trim(),
                threshold,
                Comparator.fromSymbol(comparison).orElseThrow());
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getSeverity() {
        return severity;
    }

    public void setSeverity(String severity) {
        this.severity = severity;
    }

    public String getMetric() {
        return metric;
    }

    public void setMetric(String metric) {
        this.metric = metric;
    }

    public double getThreshold() {
        return threshold;
    }

    public void setThreshold(double threshold) {
        this.threshold = threshold;
    }

    public String getComparison() {
        return comparison;
    }

    public void setComparison(String comparison) {
        this.comparison = comparison;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RuleDefinition that))
            return false;
        return Objects.equals(name, that.name) && Objects.equals(metric, that.metric);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, metric);
    }

    @Override
    public String toString() {
        return "RuleDefinition{" +
                "name='" + name + '\'' +
                ", metric='" + metric + '\'' +
                ", comparison='" + comparison + '\'' +
                ", threshold=" + threshold +
                ", severity='" + severity + '\'' +
                '}';
    }
}
