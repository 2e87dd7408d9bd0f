package com.todotrail.core.persistence;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.todotrail.core.model.Todo;

import java.util.List;

/**
 * Contents of a {@code feature-todos.json}, {@code phase-P-todos.json} or
 * {@code session-P.S-todos.json} file.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TodoFile(String feature, String phase, String session, List<Todo> todos, FileMetadata metadata) {

    public TodoFile {
        todos = todos == null ? List.of() : List.copyOf(todos);
    }
}
