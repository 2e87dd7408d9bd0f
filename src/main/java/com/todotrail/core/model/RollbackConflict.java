package com.todotrail.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;

/**
 * A change that a rollback would discard, or a relationship the rollback would break.
 *
 * @param type        conflict category
 * @param field       affected todo field name
 * @param description human-readable explanation
 * @param severity    how serious discarding the change would be
 * @param changeLogId latest change-log entry that produced the divergence, if any
 * @param resolution  how the conflict was resolved; null while unresolved
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RollbackConflict(
    RollbackConflictType type,
    String field,
    String description,
    Severity severity,
    String changeLogId,
    String resolution
) implements Serializable {

    @JsonIgnore
    public boolean isResolved() {
        return resolution != null;
    }

    /** Unresolved and at or above the blocking threshold. */
    public boolean blocks(Severity threshold) {
        return !isResolved() && severity.atLeast(threshold);
    }

    public RollbackConflict resolve(String howResolved) {
        return new RollbackConflict(type, field, description, severity, changeLogId, howResolved);
    }
}
