package com.todotrail.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing TodoTrail-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setFeature(String feature) {
        MDC.put("feature", feature);
    }

    public static void setTodo(String feature, String todoId) {
        MDC.put("feature", feature);
        if (todoId != null) {
            MDC.put("todoId", todoId);
        }
    }

    public static void setOperation(String feature, String todoId, String operation) {
        setTodo(feature, todoId);
        MDC.put("operation", operation);
    }

    public static void clear() {
        MDC.remove("feature");
        MDC.remove("todoId");
        MDC.remove("operation");
    }
}
