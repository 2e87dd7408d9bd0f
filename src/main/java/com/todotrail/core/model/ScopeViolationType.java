package com.todotrail.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of scope problem found on a todo.
 */
public enum ScopeViolationType {
    FORBIDDEN_DETAIL("forbidden_detail"),
    ABSTRACTION_VIOLATION("abstraction_violation"),
    DETAIL_LEVEL_VIOLATION("detail_level_violation"),
    SCOPE_TIER_MISMATCH("scope_tier_mismatch");

    private final String value;

    ScopeViolationType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ScopeViolationType fromValue(String value) {
        for (ScopeViolationType candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown scope violation type: " + value);
    }
}
