package com.todotrail.core.citation;

import com.todotrail.core.model.Citation;
import com.todotrail.core.model.CitationContext;
import com.todotrail.core.model.CitationMetadata;
import com.todotrail.core.model.CitationPriority;
import com.todotrail.core.model.CitationType;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CitationPromptFormatterTest {

    private static final Instant NOW = Instant.parse("2026-03-02T09:00:00Z");

    private static Citation citation(String id, String changeId, CitationType type, CitationPriority priority,
                                     CitationMetadata metadata) {
        return new Citation(id, changeId, type, priority, List.of(CitationContext.SESSION_START), NOW,
                null, null, metadata, null);
    }

    @Test
    void groupsByTodoWithReasonAndImpact() {
        String prompt = CitationPromptFormatter.format(List.of(
                new TodoCitation("session-1.1", citation("c-1", "change-7", CitationType.CONFLICT_DETECTED,
                        CitationPriority.CRITICAL, new CitationMetadata("Parent and child disagree",
                                "Session plan is stale", null, true, null))),
                new TodoCitation("session-1.1", citation("c-2", "change-8", CitationType.DESCRIPTION_CHANGE,
                        CitationPriority.MEDIUM, null)),
                new TodoCitation("task-1.1.1", citation("c-3", "change-8", CitationType.DESCRIPTION_CHANGE,
                        CitationPriority.LOW, CitationMetadata.empty()))));

        assertTrue(prompt.startsWith("Change Review Required\n\n"));
        assertTrue(prompt.contains("You have 2 unreviewed citations for session-1.1:"));
        assertTrue(prompt.contains("You have 1 unreviewed citation for task-1.1.1:"));
        assertTrue(prompt.contains("[!!] CRITICAL: conflict_detected\n   Change: change-7\n"
                + "   Reason: Parent and child disagree\n   Impact: Session plan is stale\n"));
        assertTrue(prompt.contains("[ *] MEDIUM: description_change\n   Change: change-8\n   [Review]"));
        assertTrue(prompt.endsWith("[Review All] [Dismiss All] [Continue Without Review]"));
        assertTrue(prompt.indexOf("session-1.1") < prompt.indexOf("task-1.1.1"));
    }

    @Test
    void emptyListStillOffersActions() {
        assertEquals("Change Review Required\n\n[Review All] [Dismiss All] [Continue Without Review]",
                CitationPromptFormatter.format(List.of()));
    }
}
