package com.todotrail.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ScopeCorrectionType {
    MOVE_DETAIL("move_detail"),
    SUMMARIZE_DETAIL("summarize_detail"),
    REMOVE_DETAIL("remove_detail"),
    ADJUST_SCOPE("adjust_scope");

    private final String value;

    ScopeCorrectionType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ScopeCorrectionType fromValue(String value) {
        for (ScopeCorrectionType candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown scope correction type: " + value);
    }
}
