package com.todotrail.core.error;

/**
 * Wraps I/O and serialization failures of the feature workspace files.
 */
public class TodoTrailStorageException extends TodoTrailException {
    public TodoTrailStorageException(String message) {
        super(message);
    }

    public TodoTrailStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
