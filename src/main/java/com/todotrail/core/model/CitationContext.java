package com.todotrail.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Workflow junctions at which citations are relevant and triggers are evaluated.
 * Shared by the citation, trigger and change-log components; a new value has to be
 * handled by all three.
 */
public enum CitationContext {
    SESSION_START("session-start"),
    SESSION_CHECKPOINT("session-checkpoint"),
    SESSION_END("session-end"),
    PHASE_START("phase-start"),
    PHASE_CHECKPOINT("phase-checkpoint"),
    PHASE_END("phase-end"),
    TASK_START("task-start"),
    TASK_CHECKPOINT("task-checkpoint"),
    CONFLICT_DETECTION("conflict-detection"),
    PLANNING_DOC_UPDATE("planning-doc-update");

    private final String value;

    CitationContext(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Leading word of the junction name ("session" for session-start).
     */
    public String family() {
        int dash = value.indexOf('-');
        return dash < 0 ? value : value.substring(0, dash);
    }

    @JsonCreator
    public static CitationContext fromValue(String value) {
        for (CitationContext context : values()) {
            if (context.value.equalsIgnoreCase(value) || context.name().equalsIgnoreCase(value)) {
                return context;
            }
        }
        throw new IllegalArgumentException("Unknown citation context: " + value);
    }
}
