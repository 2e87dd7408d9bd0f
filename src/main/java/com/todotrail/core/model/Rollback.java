package com.todotrail.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * A restoration attempt, kept in the feature's rollback history whether or not it applied.
 * A rollback with unresolved high or critical conflicts is never {@link RollbackStatus#COMPLETED}.
 *
 * @param id               rollback id
 * @param timestamp        when the rollback was attempted
 * @param author           who requested it
 * @param todoId           the restored todo
 * @param rolledBackTo     target state id
 * @param rolledBackFrom   state id of the snapshot taken of the pre-rollback todo
 * @param type             full, selective or partial
 * @param fields           fields restored (selective and partial rollbacks)
 * @param reason           why
 * @param conflicts        conflicts found by the analysis
 * @param status           outcome
 * @param discardedChanges change-log entries whose effect the rollback undid
 * @param changeLogId      the rollback_applied entry, once applied
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Rollback(
    String id,
    Instant timestamp,
    String author,
    String todoId,
    String rolledBackTo,
    String rolledBackFrom,
    RollbackType type,
    List<String> fields,
    String reason,
    List<RollbackConflict> conflicts,
    RollbackStatus status,
    List<String> discardedChanges,
    String changeLogId
) implements Serializable {

    public Rollback {
        fields = fields == null ? List.of() : List.copyOf(fields);
        conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
        discardedChanges = discardedChanges == null ? List.of() : List.copyOf(discardedChanges);
    }

    public Rollback withStatus(RollbackStatus newStatus) {
        return new Rollback(id, timestamp, author, todoId, rolledBackTo, rolledBackFrom, type, fields, reason,
                conflicts, newStatus, discardedChanges, changeLogId);
    }

    public boolean hasBlockingConflicts(Severity threshold) {
        return conflicts.stream().anyMatch(c -> c.blocks(threshold));
    }
}
