package com.todotrail.core.error;

import com.todotrail.core.model.ScopeViolation;

import java.util.List;

/**
 * Thrown in block mode when a todo's content is finer-grained than its tier allows.
 */
public class ScopeViolationException extends ValidationException {

    private final List<ScopeViolation> violations;

    public ScopeViolationException(String message, List<ScopeViolation> violations) {
        super(message, violations.stream()
                .map(v -> new ValidationIssue(v.location(), v.description(), v.suggestion()))
                .toList());
        this.violations = List.copyOf(violations);
    }

    public List<ScopeViolation> getViolations() {
        return violations;
    }
}
