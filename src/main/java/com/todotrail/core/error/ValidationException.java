package com.todotrail.core.error;

import java.util.List;

public class ValidationException extends TodoTrailException {
    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, List<ValidationIssue> issues) {
        super(message, issues);
    }
}
