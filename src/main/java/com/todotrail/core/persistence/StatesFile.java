package com.todotrail.core.persistence;

import com.todotrail.core.model.PreviousState;

import java.util.List;

/**
 * Contents of {@code previous-states.json}, oldest snapshot first.
 */
public record StatesFile(String feature, List<PreviousState> states, FileMetadata metadata) {

    public StatesFile {
        states = states == null ? List.of() : List.copyOf(states);
    }
}
