package com.todotrail.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How urgently a citation should be surfaced, ordered from least to most urgent.
 */
public enum CitationPriority {
    LOW("low", 1),
    MEDIUM("medium", 2),
    HIGH("high", 3),
    CRITICAL("critical", 4);

    private final String value;
    private final int score;

    CitationPriority(String value, int score) {
        this.value = value;
        this.score = score;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** Contribution of this priority to a citation's relevance score. */
    public int score() {
        return score;
    }

    public boolean atLeast(CitationPriority threshold) {
        return threshold == null || ordinal() >= threshold.ordinal();
    }

    /** Conflict severity with the same rank, used when citations stand in for conflicts. */
    public Severity asSeverity() {
        return Severity.values()[ordinal()];
    }

    @JsonCreator
    public static CitationPriority fromValue(String value) {
        for (CitationPriority priority : values()) {
            if (priority.value.equalsIgnoreCase(value)) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown citation priority: " + value);
    }
}
