package com.todotrail.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Discriminator of {@link TriggerCondition}; each value has exactly one evaluator.
 */
public enum TriggerConditionType {
    HAS_UNREVIEWED_CITATIONS("has_unreviewed_citations"),
    HAS_HIGH_PRIORITY_CITATIONS("has_high_priority_citations"),
    HAS_CITATIONS_IN_CONTEXT("has_citations_in_context"),
    HAS_CONFLICTS("has_conflicts"),
    HAS_HIGH_SEVERITY_CONFLICTS("has_high_severity_conflicts"),
    HAS_CONFLICTS_AFFECTING_TODO("has_conflicts_affecting_todo"),
    HAS_RECENT_CHANGES("has_recent_changes"),
    HAS_PROPAGATION_CHANGES("has_propagation_changes"),
    HAS_PLANNING_DOC_CHANGES("has_planning_doc_changes"),
    TODO_STATUS_CHANGED("todo_status_changed"),
    PARENT_STATUS_CHANGED("parent_status_changed"),
    CHILD_STATUS_CHANGED("child_status_changed");

    private final String value;

    TriggerConditionType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static TriggerConditionType fromValue(String value) {
        for (TriggerConditionType candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown trigger condition type: " + value);
    }
}
