package com.todotrail.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum RollbackConflictType {
    STATE_CONFLICT("state_conflict"),
    RELATIONSHIP_CONFLICT("relationship_conflict"),
    PLANNING_DOC_CONFLICT("planning_doc_conflict"),
    PROPAGATION_CONFLICT("propagation_conflict");

    private final String value;

    RollbackConflictType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static RollbackConflictType fromValue(String value) {
        for (RollbackConflictType candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown rollback conflict type: " + value);
    }
}
