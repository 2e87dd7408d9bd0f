package com.todotrail.core.error;

import java.util.List;

/**
 * Thrown when a todo's tier, id or parent violates the feature/phase/session/task hierarchy.
 */
public class InvalidHierarchyException extends TodoTrailException {
    public InvalidHierarchyException(String message) {
        super(message);
    }

    public InvalidHierarchyException(String message, List<ValidationIssue> issues) {
        super(message, issues);
    }
}
