package com.todotrail.core.scope;

import com.todotrail.core.model.Scope;
import com.todotrail.core.model.ScopeViolation;

import java.util.List;

/**
 * Result of {@link ScopeEngine#validate}: the scope that was checked and everything wrong with it.
 */
public record ScopeValidation(Scope scope, List<ScopeViolation> violations) {

    public ScopeValidation {
        violations = violations == null ? List.of() : List.copyOf(violations);
    }

    public boolean isValid() {
        return violations.isEmpty();
    }
}
