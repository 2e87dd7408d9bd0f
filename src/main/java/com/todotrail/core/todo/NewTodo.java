package com.todotrail.core.todo;

import com.todotrail.core.model.Scope;
import com.todotrail.core.model.TodoTier;

import java.util.List;
import java.util.Map;

/**
 * What a caller supplies to create a todo.
 *
 * @param scope explicit scope; null to derive it from the tier and parent
 */
public record NewTodo(
    String id,
    TodoTier tier,
    String parentId,
    String title,
    String description,
    String planningDocPath,
    String planningDocSection,
    List<String> tags,
    Map<String, Object> metadata,
    Scope scope
) {

    public static NewTodo of(String id, TodoTier tier, String parentId, String title, String description) {
        return new NewTodo(id, tier, parentId, title, description, null, null, null, null, null);
    }

    public NewTodo withPlanningDoc(String path, String section) {
        return new NewTodo(id, tier, parentId, title, description, path, section, tags, metadata, scope);
    }

    public NewTodo withTags(List<String> newTags) {
        return new NewTodo(id, tier, parentId, title, description, planningDocPath, planningDocSection, newTags,
                metadata, scope);
    }
}
