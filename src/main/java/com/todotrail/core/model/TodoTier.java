package com.todotrail.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The four levels of the planning hierarchy, coarsest first.
 */
public enum TodoTier {
    FEATURE("feature"),
    PHASE("phase"),
    SESSION("session"),
    TASK("task");

    private final String value;

    TodoTier(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** Zero for features, three for tasks. */
    public int depth() {
        return ordinal();
    }

    /**
     * Tier one level up, or {@code null} for {@link #FEATURE}.
     */
    public TodoTier parentTier() {
        return this == FEATURE ? null : values()[ordinal() - 1];
    }

    /**
     * Tier one level down, or {@code null} for {@link #TASK}.
     */
    public TodoTier childTier() {
        return this == TASK ? null : values()[ordinal() + 1];
    }

    public boolean isDirectParentOf(TodoTier child) {
        return child != null && child.ordinal() == ordinal() + 1;
    }

    @JsonCreator
    public static TodoTier fromValue(String value) {
        for (TodoTier tier : values()) {
            if (tier.value.equalsIgnoreCase(value) || tier.name().equalsIgnoreCase(value)) {
                return tier;
            }
        }
        throw new IllegalArgumentException("Unknown tier: " + value);
    }
}
