package com.todotrail.core.error;

import java.io.Serializable;

/**
 * One field-level problem reported with a {@link TodoTrailException}.
 */
public record ValidationIssue(String field, String reason, String suggestedFix) implements Serializable {
}
