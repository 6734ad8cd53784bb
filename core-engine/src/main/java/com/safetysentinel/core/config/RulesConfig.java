package com.safetysentinel.core.config;

import com.safetysentinel.core.rules.RuleDefinition;
import com.safetysentinel.core.rules.RuleValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Top-level POJO for the rules YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * rules:
 *   - name: High Error Rate
 *     description: Error rate exceeds 5%
 *     severity: high
 *     metric: error_rate
 *     threshold: 0.05
 *     comparison: "&gt;"
 * patterns:
 *   - eventType: emotional_distress
 *     threshold: 3
 *     name: repeated_emotional_distress
 * </pre>
 *
 * @since 1.0.0
 */
public class RulesConfig {

    private List<RuleDefinition> rules = new ArrayList<>();
    private List<PatternDefinition> patterns = new ArrayList<>();

    /**
     * @return unmodifiable list of rule definitions
     */
    public List<RuleDefinition> getRules() {
        return Collections.unmodifiableList(rules);
    }

    /**
     * Set the rules list (used by SnakeYAML during deserialization).
     */
    public void setRules(List<RuleDefinition> rules) {
        this.rules = rules != null ? new ArrayList<>(rules) : new ArrayList<>();
    }

    /**
     * @return unmodifiable list of pattern definitions
     */
    public List<PatternDefinition> getPatterns() {
        return Collections.unmodifiableList(patterns);
    }

    public void setPatterns(List<PatternDefinition> patterns) {
        this.patterns = patterns != null ? new ArrayList<>(patterns) : new ArrayList<>();
    }

    /**
     * @return validated pattern thresholds, in file order
     * @throws IllegalArgumentException if a pattern is invalid
     */
    public List<PatternThreshold> patternThresholds() {
        return patterns.stream().map(PatternDefinition::toThreshold).toList();
    }

    /**
     * Validate every rule and pattern, collecting all errors.
     *
     * @throws RuleValidationException if anything is invalid or two rules
     *                                 share an id
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        Set<String> ids = new HashSet<>();

        for (int i = 0; i < rules.size(); i++) {
            RuleDefinition rule = rules.get(i);
            if (rule == null) {
                errors.add("Rule at index " + i + " is null");
                continue;
            }
            try {
                String id = rule.toRule().getId();
                if (!ids.add(id)) {
                    errors.add("Duplicate rule id '" + id + "'");
                }
            } catch (RuleValidationException e) {
                errors.addAll(e.getErrors());
            }
        }
        for (int i = 0; i < patterns.size(); i++) {
            PatternDefinition pattern = patterns.get(i);
            if (pattern == null) {
                errors.add("Pattern at index " + i + " is null");
                continue;
            }
            try {
                pattern.toThreshold();
            } catch (IllegalArgumentException e) {
                errors.add(e.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            throw new RuleValidationException(errors);
        }
    }

    @Override
    public String toString() {
        return "RulesConfig{rules=" + rules + ", patterns=" + patterns + '}';
    }
}
