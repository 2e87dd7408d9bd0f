package com.todotrail.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;

/**
 * A place where a todo's content is finer-grained than its tier allows.
 *
 * @param type        kind of violation
 * @param detailType  offending detail category, for forbidden details
 * @param location    {@code title@offset}, {@code description@offset} or {@code scope}
 * @param description human-readable explanation
 * @param suggestion  how to fix it
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScopeViolation(
    ScopeViolationType type,
    String detailType,
    String location,
    String description,
    String suggestion
) implements Serializable {
}
