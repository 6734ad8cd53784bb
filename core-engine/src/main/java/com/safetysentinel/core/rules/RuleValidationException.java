package com.safetysentinel.core.rules;

import java.util.List;

/**
 * Thrown when an alert rule definition is rejected at registration or load
 * time. Carries every problem found, not just the first.
 *
 * @since 1.0.0
 */
public class RuleValidationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final List<String> errors;

    public RuleValidationException(String message) {
        this(List.of(message));
    }

    public RuleValidationException(List<String> errors) {
        super("Invalid alert rule: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
