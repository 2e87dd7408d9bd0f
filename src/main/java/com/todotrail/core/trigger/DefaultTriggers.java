package com.todotrail.core.trigger;

import com.todotrail.core.model.CitationContext;
import com.todotrail.core.model.CitationPriority;
import com.todotrail.core.model.Severity;
import com.todotrail.core.model.TriggerAction;
import com.todotrail.core.model.TriggerCondition;
import com.todotrail.core.model.TriggerDefinition;

import java.util.List;

/**
 * Triggers used for a feature that has no {@code trigger-config.json}.
 */
public final class DefaultTriggers {

    public static final String SESSION_START = "trigger-session-start";
    public static final String SESSION_CHECKPOINT = "trigger-session-checkpoint";
    public static final String CONFLICT_DETECTION = "trigger-conflict-detection";
    public static final String PHASE_START = "trigger-phase-start";

    private DefaultTriggers() {}

    public static List<TriggerDefinition> all(int recentWindowHours) {
        return List.of(
                new TriggerDefinition(SESSION_START, "session-start-lookup", CitationContext.SESSION_START,
                        List.of(TriggerCondition.unreviewedCitations(CitationPriority.HIGH),
                                TriggerCondition.conflicts(Severity.HIGH)),
                        CitationPriority.HIGH, true, TriggerAction.SHOW_CITATIONS),
                new TriggerDefinition(SESSION_CHECKPOINT, "session-checkpoint-lookup",
                        CitationContext.SESSION_CHECKPOINT,
                        List.of(TriggerCondition.recentChanges(recentWindowHours)),
                        CitationPriority.MEDIUM, true, TriggerAction.SHOW_CITATIONS),
                new TriggerDefinition(CONFLICT_DETECTION, "conflict-detection-lookup",
                        CitationContext.CONFLICT_DETECTION,
                        List.of(TriggerCondition.conflicts(Severity.HIGH)),
                        CitationPriority.CRITICAL, false, TriggerAction.BLOCK_UNTIL_REVIEW),
                new TriggerDefinition(PHASE_START, "phase-start-lookup", CitationContext.PHASE_START,
                        List.of(TriggerCondition.unreviewedCitations(CitationPriority.HIGH)),
                        CitationPriority.HIGH, true, TriggerAction.SHOW_CITATIONS));
    }
}
