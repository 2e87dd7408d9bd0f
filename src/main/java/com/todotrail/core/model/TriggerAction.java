package com.todotrail.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What a fired trigger asks the caller to do.
 */
public enum TriggerAction {
    SHOW_CITATIONS("show_citations"),
    BLOCK_UNTIL_REVIEW("block_until_review");

    private final String value;

    TriggerAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static TriggerAction fromValue(String value) {
        for (TriggerAction candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown trigger action: " + value);
    }
}
