package com.todotrail.core.error;

/**
 * Thrown when an operation targets a todo, state, citation, trigger or rollback that does not exist.
 */
public class NotFoundException extends TodoTrailException {
    public NotFoundException(String message) {
        super(message);
    }
}
