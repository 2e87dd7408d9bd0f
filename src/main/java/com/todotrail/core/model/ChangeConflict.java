package com.todotrail.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;

/**
 * A conflict recorded alongside a change, e.g. by propagation.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChangeConflict(
    String type,
    String description,
    Severity severity,
    String resolution,
    Boolean requiresReview
) implements Serializable {

    @JsonIgnore
    public boolean isResolved() {
        return resolution != null && !resolution.isBlank();
    }

    /** Missing severities count as medium. */
    public Severity effectiveSeverity() {
        return severity != null ? severity : Severity.MEDIUM;
    }
}
