package com.todotrail.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScopeCorrection(
    ScopeCorrectionType type,
    String detail,
    String suggestedLocation,
    String suggestedSummary,
    String reason
) {
}
