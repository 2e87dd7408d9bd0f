package com.todotrail.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How abstract a todo's content must stay. Coarseness never increases going down the tree.
 */
public enum AbstractionLevel {
    HIGH("high", 3),
    MEDIUM_HIGH("medium-high", 2),
    MEDIUM("medium", 1),
    LOW("low", 0);

    private final String value;
    private final int coarseness;

    AbstractionLevel(String value, int coarseness) {
        this.value = value;
        this.coarseness = coarseness;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public int coarseness() {
        return coarseness;
    }

    public static AbstractionLevel expectedFor(TodoTier tier) {
        return switch (tier) {
            case FEATURE -> HIGH;
            case PHASE -> MEDIUM_HIGH;
            case SESSION -> MEDIUM;
            case TASK -> LOW;
        };
    }

    @JsonCreator
    public static AbstractionLevel fromValue(String value) {
        for (AbstractionLevel level : values()) {
            if (level.value.equalsIgnoreCase(value) || level.name().equalsIgnoreCase(value)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown abstraction level: " + value);
    }
}
