package com.todotrail.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;

/**
 * Tagged condition of a trigger: {@code type} selects the evaluator, the other
 * components are that evaluator's optional parameters.
 *
 * @param type     discriminator
 * @param priority minimum citation priority
 * @param severity minimum conflict severity
 * @param hours    look-back window for change conditions
 * @param context  junction for {@link TriggerConditionType#HAS_CITATIONS_IN_CONTEXT}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TriggerCondition(
    TriggerConditionType type,
    CitationPriority priority,
    Severity severity,
    Integer hours,
    CitationContext context
) implements Serializable {

    public static TriggerCondition of(TriggerConditionType type) {
        return new TriggerCondition(type, null, null, null, null);
    }

    public static TriggerCondition unreviewedCitations(CitationPriority minPriority) {
        return new TriggerCondition(TriggerConditionType.HAS_UNREVIEWED_CITATIONS, minPriority, null, null, null);
    }

    public static TriggerCondition conflicts(Severity minSeverity) {
        return new TriggerCondition(TriggerConditionType.HAS_CONFLICTS, null, minSeverity, null, null);
    }

    public static TriggerCondition recentChanges(int hours) {
        return new TriggerCondition(TriggerConditionType.HAS_RECENT_CHANGES, null, null, hours, null);
    }

    public static TriggerCondition citationsIn(CitationContext context) {
        return new TriggerCondition(TriggerConditionType.HAS_CITATIONS_IN_CONTEXT, null, null, null, context);
    }

    public static TriggerCondition within(TriggerConditionType type, int hours) {
        return new TriggerCondition(type, null, null, hours, null);
    }
}
