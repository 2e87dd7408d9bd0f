package com.todotrail.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Immutable snapshot of a todo, used as a rollback target.
 *
 * @param id          state id ("state-...")
 * @param todoId      the snapshotted todo
 * @param timestamp   when the snapshot was stored
 * @param logSequence last change-log sequence of the feature when the snapshot was stored
 * @param state       the todo as it was
 * @param changeLogId the change that prompted the snapshot
 * @param reason      optional reason
 * @param tags        optional labels
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PreviousState(
    String id,
    String todoId,
    Instant timestamp,
    long logSequence,
    Todo state,
    String changeLogId,
    String reason,
    List<String> tags
) implements Serializable {

    public PreviousState {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
