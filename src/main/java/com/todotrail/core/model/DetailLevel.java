package com.todotrail.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum DetailLevel {
    HIGH_LEVEL("high-level", 2),
    FOCUSED("focused", 1),
    GRANULAR("granular", 0);

    private final String value;
    private final int coarseness;

    DetailLevel(String value, int coarseness) {
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

    public static DetailLevel expectedFor(TodoTier tier) {
        return switch (tier) {
            case FEATURE -> HIGH_LEVEL;
            case PHASE, SESSION -> FOCUSED;
            case TASK -> GRANULAR;
        };
    }

    @JsonCreator
    public static DetailLevel fromValue(String value) {
        for (DetailLevel level : values()) {
            if (level.value.equalsIgnoreCase(value) || level.name().equalsIgnoreCase(value)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown detail level: " + value);
    }
}
