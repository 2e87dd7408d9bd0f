package com.todotrail.core.citation;

import com.todotrail.core.model.Citation;
import com.todotrail.core.model.CitationPriority;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders citations as a plain-text review prompt.
 */
public final class CitationPromptFormatter {

    private CitationPromptFormatter() {}

    public static String format(List<TodoCitation> citations) {
        Map<String, List<Citation>> byTodo = new LinkedHashMap<>();
        for (TodoCitation item : citations) {
            byTodo.computeIfAbsent(item.todoId(), k -> new ArrayList<>()).add(item.citation());
        }

        StringBuilder prompt = new StringBuilder("Change Review Required\n\n");
        byTodo.forEach((todoId, todoCitations) -> {
            prompt.append("You have ").append(todoCitations.size()).append(" unreviewed citation")
                    .append(todoCitations.size() == 1 ? "" : "s").append(" for ").append(todoId).append(":\n\n");
            for (Citation citation : todoCitations) {
                prompt.append(marker(citation.priority())).append(' ')
                        .append(citation.priority().value().toUpperCase(Locale.ROOT)).append(": ")
                        .append(citation.type().value()).append('\n');
                prompt.append("   Change: ").append(citation.changeLogId()).append('\n');
                if (citation.metadata() != null && citation.metadata().reason() != null) {
                    prompt.append("   Reason: ").append(citation.metadata().reason()).append('\n');
                }
                if (citation.metadata() != null && citation.metadata().impact() != null) {
                    prompt.append("   Impact: ").append(citation.metadata().impact()).append('\n');
                }
                prompt.append("   [Review] [Dismiss] [Defer]\n\n");
            }
        });
        prompt.append("[Review All] [Dismiss All] [Continue Without Review]");
        return prompt.toString();
    }

    private static String marker(CitationPriority priority) {
        return switch (priority) {
            case CRITICAL -> "[!!]";
            case HIGH -> "[! ]";
            case MEDIUM -> "[ *]";
            case LOW -> "[  ]";
        };
    }
}
