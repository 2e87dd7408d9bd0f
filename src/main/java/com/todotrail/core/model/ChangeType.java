package com.todotrail.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of mutations recorded in the change log.
 */
public enum ChangeType {
    TODO_CREATED("todo_created"),
    TODO_UPDATED("todo_updated"),
    TODO_DELETED("todo_deleted"),
    TODO_MOVED("todo_moved"),
    TODO_STATUS_CHANGED("todo_status_changed"),
    PROPAGATION_TRIGGERED("propagation_triggered"),
    PROPAGATION_COMPLETED("propagation_completed"),
    PROPAGATION_CONFLICT("propagation_conflict"),
    PROPAGATION_PRESERVED("propagation_preserved"),
    CHANGE_REQUEST_CREATED("change_request_created"),
    CHANGE_REQUEST_RESOLVED("change_request_resolved"),
    CHANGE_REQUEST_DISMISSED("change_request_dismissed"),
    PLANNING_DOC_UPDATED("planning_doc_updated"),
    PLANNING_DOC_SYNCED("planning_doc_synced"),
    BULK_UPDATE("bulk_update"),
    BULK_CREATE("bulk_create"),
    BULK_DELETE("bulk_delete"),
    ROLLBACK_APPLIED("rollback_applied");

    private final String value;

    ChangeType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public boolean isPropagation() {
        return value.startsWith("propagation_");
    }

    public boolean isPlanningDoc() {
        return this == PLANNING_DOC_UPDATED || this == PLANNING_DOC_SYNCED;
    }

    @JsonCreator
    public static ChangeType fromValue(String value) {
        for (ChangeType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown change type: " + value);
    }
}
