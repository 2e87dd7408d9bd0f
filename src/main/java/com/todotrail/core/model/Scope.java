package com.todotrail.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.util.List;

/**
 * Abstraction policy attached to a todo.
 *
 * @param level            tier the scope was derived for
 * @param abstraction      how abstract the content must stay
 * @param detailLevel      how much detail the content may carry
 * @param allowedDetails   detail categories the todo may mention ("all" for no restriction)
 * @param forbiddenDetails detail categories that indicate scope creep
 * @param inheritedFrom    id of the parent todo the scope was narrowed from, if any
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Scope(
    TodoTier level,
    AbstractionLevel abstraction,
    DetailLevel detailLevel,
    List<String> allowedDetails,
    List<String> forbiddenDetails,
    String inheritedFrom
) implements Serializable {

    public static final String ALL_DETAILS = "all";

    public Scope {
        allowedDetails = allowedDetails == null ? List.of() : List.copyOf(allowedDetails);
        forbiddenDetails = forbiddenDetails == null ? List.of() : List.copyOf(forbiddenDetails);
    }

    public boolean allowsEverything() {
        return allowedDetails.contains(ALL_DETAILS);
    }

    public boolean forbids(String detailType) {
        return forbiddenDetails.contains(detailType);
    }
}
