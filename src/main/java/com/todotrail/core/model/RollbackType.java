package com.todotrail.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Full restores every field, selective only the named ones, partial every field without a blocking conflict.
 */
public enum RollbackType {
    FULL("full"),
    SELECTIVE("selective"),
    PARTIAL("partial");

    private final String value;

    RollbackType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static RollbackType fromValue(String value) {
        for (RollbackType candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown rollback type: " + value);
    }
}
