package com.todotrail.core.error;

import com.todotrail.core.model.Rollback;

/**
 * Thrown by strict rollback variants when the rollback ended in conflict.
 */
public class RollbackConflictException extends TodoTrailException {

    private final Rollback rollback;

    public RollbackConflictException(String message, Rollback rollback) {
        super(message, rollback.conflicts().stream()
                .map(c -> new ValidationIssue(c.field(), c.description(), "Rerun with force to override"))
                .toList());
        this.rollback = rollback;
    }

    public Rollback getRollback() {
        return rollback;
    }
}
