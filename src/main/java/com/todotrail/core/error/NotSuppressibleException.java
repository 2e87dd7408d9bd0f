package com.todotrail.core.error;

public class NotSuppressibleException extends TodoTrailException {
    public NotSuppressibleException(String message) {
        super(message);
    }
}
