package com.todotrail.core.trigger;

import com.todotrail.core.citation.CitationPromptFormatter;
import com.todotrail.core.citation.TodoCitation;
import com.todotrail.core.model.CitationPriority;
import com.todotrail.core.model.TriggerDefinition;

import java.util.List;

/**
 * A fired trigger with the citations that justify it.
 */
public record TriggerActivation(TriggerDefinition trigger, List<TodoCitation> citations) {

    public TriggerActivation {
        citations = citations == null ? List.of() : List.copyOf(citations);
    }

    public CitationPriority priority() {
        return trigger.priority();
    }

    /** True when the workflow must not continue until the citations are reviewed. */
    public boolean blocking() {
        return trigger.blocksUntilReview();
    }

    public String prompt() {
        return CitationPromptFormatter.format(citations);
    }
}
