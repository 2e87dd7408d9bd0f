package com.todotrail.core.trigger;

import java.util.Map;

/**
 * What a junction is about: usually the todo being started or checkpointed.
 *
 * @param todoId     focus todo; citation and status conditions never hold without one
 * @param attributes caller-supplied extras, carried through for display
 */
public record TriggerContext(String todoId, Map<String, Object> attributes) {

    public TriggerContext {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public static TriggerContext forTodo(String todoId) {
        return new TriggerContext(todoId, Map.of());
    }

    public static TriggerContext featureWide() {
        return new TriggerContext(null, Map.of());
    }

    public boolean hasTodo() {
        return todoId != null && !todoId.isBlank();
    }
}
