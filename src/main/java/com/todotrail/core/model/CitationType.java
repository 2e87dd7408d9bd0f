package com.todotrail.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Category of upstream change a citation points at.
 */
public enum CitationType {
    STATUS_CHANGE("status_change"),
    DESCRIPTION_CHANGE("description_change"),
    PARENT_CHANGE("parent_change"),
    PLANNING_DOC_CHANGE("planning_doc_change"),
    PROPAGATION_CHANGE("propagation_change"),
    CONFLICT_DETECTED("conflict_detected"),
    ROLLBACK_APPLIED("rollback_applied");

    private final String value;

    CitationType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static CitationType fromValue(String value) {
        for (CitationType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown citation type: " + value);
    }
}
