package com.perpetua.backend.exception;

import java.util.List;

/**
 * Advisor decision that does not match the decision schema. Raised before any trade is attempted.
 */
public class DecisionValidationException extends RuntimeException {
    private final List<String> violations;

    public DecisionValidationException(String message) {
        this(message, List.of(), null);
    }

    public DecisionValidationException(String message, Throwable cause) {
        this(message, List.of(), cause);
    }

    public DecisionValidationException(String message, List<String> violations) {
        this(message, violations, null);
    }

    private DecisionValidationException(String message, List<String> violations, Throwable cause) {
        super(violations.isEmpty() ? message : message + ": " + String.join("; ", violations), cause);
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
