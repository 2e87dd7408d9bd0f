package com.todotrail.core.todo;

import com.todotrail.core.model.Todo;
import com.todotrail.core.model.TodoStatus;
import com.todotrail.core.model.TodoTier;
import com.todotrail.core.store.TodoStore;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Summarizes a todo's children at the parent's level of abstraction.
 */
@Service
public class DetailAggregator {

    private static final int MAX_NEXT_STEPS = 5;
    private static final int MAX_OBJECTIVE_LENGTH = 100;

    private final TodoStore todoStore;

    public DetailAggregator(TodoStore todoStore) {
        this.todoStore = todoStore;
    }

    public TodoSummary summarize(String feature, Todo parent) {
        List<Todo> children = todoStore.children(feature, parent.id());

        List<String> objectives = new ArrayList<>();
        Set<String> dependencies = new LinkedHashSet<>();
        List<String> nextSteps = new ArrayList<>();
        int completed = 0;
        int inProgress = 0;
        int pending = 0;

        for (Todo child : children) {
            if (child.tier() == TodoTier.PHASE || child.tier() == TodoTier.SESSION) {
                objectives.add(objectiveOf(child));
            }
            if (child.tier() == TodoTier.TASK && nextSteps.size() < MAX_NEXT_STEPS
                    && (child.status() == TodoStatus.PENDING || child.status() == TodoStatus.IN_PROGRESS)) {
                nextSteps.add(child.title());
            }
            dependencies.addAll(child.blockedBy());
            switch (child.status()) {
                case COMPLETED -> completed++;
                case IN_PROGRESS -> inProgress++;
                default -> pending++;
            }
        }

        TodoStatus status;
        if (!children.isEmpty() && completed == children.size()) {
            status = TodoStatus.COMPLETED;
        } else if (inProgress > 0 || completed > 0) {
            status = TodoStatus.IN_PROGRESS;
        } else {
            status = TodoStatus.PENDING;
        }
        return new TodoSummary(parent.title(), status, objectives,
                new TodoSummary.Progress(completed, inProgress, pending, children.size()),
                List.copyOf(dependencies), nextSteps);
    }

    private static String objectiveOf(Todo todo) {
        String description = todo.description();
        if (description == null || description.isBlank()) {
            return todo.title();
        }
        String first = description.split("[.!?]", 2)[0].trim();
        if (!first.isEmpty()) {
            return first;
        }
        return description.length() <= MAX_OBJECTIVE_LENGTH ? description : description.substring(0, MAX_OBJECTIVE_LENGTH);
    }
}
