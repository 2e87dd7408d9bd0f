package com.todotrail.core.error;

import java.util.List;

/**
 * Base of all TodoTrail failures. Carries structured issues for callers that present them.
 */
public class TodoTrailException extends RuntimeException {

    private final List<ValidationIssue> issues;

    public TodoTrailException(String message) {
        this(message, List.of());
    }

    public TodoTrailException(String message, Throwable cause) {
        super(message, cause);
        this.issues = List.of();
    }

    public TodoTrailException(String message, List<ValidationIssue> issues) {
        super(message);
        this.issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public List<ValidationIssue> getIssues() {
        return issues;
    }
}
