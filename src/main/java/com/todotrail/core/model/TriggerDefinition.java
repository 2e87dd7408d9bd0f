package com.todotrail.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Declarative lookup trigger: fires at {@code junction} when every condition holds.
 */
public record TriggerDefinition(
    String id,
    String name,
    CitationContext junction,
    List<TriggerCondition> conditions,
    CitationPriority priority,
    boolean suppressible,
    TriggerAction action
) implements Serializable {

    public TriggerDefinition {
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    public boolean blocksUntilReview() {
        return action == TriggerAction.BLOCK_UNTIL_REVIEW;
    }
}
