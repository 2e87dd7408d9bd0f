package com.todotrail.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Optional context carried by a citation.
 *
 * @param reason         why the cited change was made
 * @param impact         coarse impact label (affects_todo_status, affects_multiple_todos, ...)
 * @param affectedTodos  todos touched by the cited change
 * @param requiresReview whether the change asks for an explicit review
 * @param reviewDeadline citation is deferred until this instant
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CitationMetadata(
    String reason,
    String impact,
    List<String> affectedTodos,
    Boolean requiresReview,
    Instant reviewDeadline
) implements Serializable {

    public static CitationMetadata empty() {
        return new CitationMetadata(null, null, null, null, null);
    }

    public CitationMetadata withReviewDeadline(Instant deadline) {
        return new CitationMetadata(reason, impact, affectedTodos, requiresReview, deadline);
    }
}
