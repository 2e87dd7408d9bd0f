package com.todotrail.core.store;

import com.todotrail.core.error.InvalidHierarchyException;
import com.todotrail.core.error.ValidationIssue;
import com.todotrail.core.model.Todo;
import com.todotrail.core.model.TodoIds;
import com.todotrail.core.model.TodoTier;
import com.todotrail.core.persistence.FeatureWorkspace;
import com.todotrail.core.persistence.FeatureWorkspaces;
import com.todotrail.core.persistence.FileMetadata;
import com.todotrail.core.persistence.JsonFileStore;
import com.todotrail.core.persistence.TodoFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Durable storage of todos, one set of files per feature.
 * <p>
 * Features live in {@code feature-todos.json}, phases in {@code phase-P-todos.json}, and
 * sessions together with their tasks in {@code session-P.S-todos.json}. The store only
 * persists; it never writes to the change log.
 */
@Service
public class TodoStore {

    private static final Logger log = LoggerFactory.getLogger(TodoStore.class);

    private final FeatureWorkspaces workspaces;
    private final JsonFileStore files;
    private final Clock clock;

    public TodoStore(FeatureWorkspaces workspaces, JsonFileStore files, Clock clock) {
        this.workspaces = workspaces;
        this.files = files;
        this.clock = clock;
    }

    public Optional<Todo> get(String feature, String todoId) {
        var tier = TodoIds.tierOf(todoId);
        if (tier.isEmpty()) {
            return Optional.empty();
        }
        FeatureWorkspace workspace = workspaces.get(feature);
        return files.read(fileFor(workspace, todoId, tier.get()), TodoFile.class)
                .flatMap(file -> file.todos().stream().filter(t -> todoId.equals(t.id())).findFirst());
    }

    /** Every todo of the feature, coarsest tier first. */
    public List<Todo> listAll(String feature) {
        FeatureWorkspace workspace = workspaces.get(feature);
        List<Todo> all = new ArrayList<>();
        for (Path path : workspace.todoFiles()) {
            files.read(path, TodoFile.class).ifPresent(file -> all.addAll(file.todos()));
        }
        all.sort(Comparator.comparingInt(t -> t.tier() == null ? Integer.MAX_VALUE : t.tier().depth()));
        return all;
    }

    public List<Todo> children(String feature, String parentId) {
        return listAll(feature).stream()
                .filter(t -> parentId.equals(t.parentId()))
                .toList();
    }

    /**
     * Validates the todo's place in the hierarchy, stamps {@code updatedAt} and persists it.
     *
     * @return the todo as stored
     * @throws InvalidHierarchyException if the id, tier or parent is inconsistent
     */
    public Todo save(String feature, Todo todo) {
        FeatureWorkspace workspace = workspaces.get(feature);
        return workspace.locked(() -> {
            validateHierarchy(feature, todo);
            Instant now = clock.instant();
            Todo stamped = todo.toBuilder()
                    .createdAt(todo.createdAt() != null ? todo.createdAt() : now)
                    .updatedAt(now)
                    .build();

            Path path = fileFor(workspace, stamped.id(), stamped.tier());
            TodoFile current = files.read(path, TodoFile.class)
                    .orElseGet(() -> emptyFile(feature, stamped));
            List<Todo> todos = new ArrayList<>(current.todos());
            int index = indexOf(todos, stamped.id());
            if (index >= 0) {
                todos.set(index, stamped);
            } else {
                todos.add(stamped);
            }
            files.write(path, new TodoFile(current.feature(), current.phase(), current.session(), todos,
                    FileMetadata.of(now, todos.size())));
            log.debug("Saved {} ({})", stamped.id(), stamped.status().value());
            return stamped;
        });
    }

    /**
     * Deletes a todo from its file. Used to undo a create whose change could not be logged.
     *
     * @return whether the todo was present
     */
    public boolean remove(String feature, String todoId) {
        var tier = TodoIds.tierOf(todoId);
        if (tier.isEmpty()) {
            return false;
        }
        FeatureWorkspace workspace = workspaces.get(feature);
        return workspace.locked(() -> {
            Path path = fileFor(workspace, todoId, tier.get());
            Optional<TodoFile> current = files.read(path, TodoFile.class);
            if (current.isEmpty()) {
                return false;
            }
            List<Todo> todos = new ArrayList<>(current.get().todos());
            int index = indexOf(todos, todoId);
            if (index < 0) {
                return false;
            }
            todos.remove(index);
            Instant now = clock.instant();
            files.write(path, new TodoFile(current.get().feature(), current.get().phase(), current.get().session(),
                    todos, FileMetadata.of(now, todos.size())));
            log.debug("Removed {}", todoId);
            return true;
        });
    }

    /**
     * Checks id format, tier and parent without persisting anything.
     *
     * @throws InvalidHierarchyException on the first inconsistency
     */
    public void validateHierarchy(String feature, Todo todo) {
        TodoTier tier = todo.tier();
        if (tier == null) {
            throw hierarchyError("tier", "Todo " + todo.id() + " has no tier", "Set the tier");
        }
        if (!TodoIds.isWellFormed(todo.id(), tier)) {
            throw hierarchyError("id", "Id " + todo.id() + " does not match the " + tier.value() + " format",
                    "Use " + exampleId(tier));
        }
        if (tier == TodoTier.FEATURE) {
            if (todo.parentId() != null) {
                throw hierarchyError("parentId", "Feature todo " + todo.id() + " cannot have a parent",
                        "Remove parentId");
            }
            return;
        }
        if (todo.parentId() == null) {
            throw hierarchyError("parentId", tier.value() + " todo " + todo.id() + " requires a "
                    + tier.parentTier().value() + " parent", "Set parentId to an existing " + tier.parentTier().value());
        }
        Todo parent = get(feature, todo.parentId()).orElseThrow(() -> hierarchyError("parentId",
                "Parent " + todo.parentId() + " of " + todo.id() + " does not exist",
                "Create " + todo.parentId() + " first"));
        if (parent.tier() == null || !parent.tier().isDirectParentOf(tier)) {
            throw hierarchyError("parentId", "Parent " + parent.id() + " is not a " + tier.parentTier().value(),
                    "A " + tier.value() + " must sit directly under a " + tier.parentTier().value());
        }
        if (!TodoIds.extendsParent(todo.id(), parent.id())) {
            throw hierarchyError("id", "Id " + todo.id() + " does not extend parent id " + parent.id(),
                    "Use an id starting with " + tier.value() + "-" + TodoIds.identifier(parent.id()) + ".");
        }
    }

    private static InvalidHierarchyException hierarchyError(String field, String reason, String fix) {
        return new InvalidHierarchyException(reason, List.of(new ValidationIssue(field, reason, fix)));
    }

    private static String exampleId(TodoTier tier) {
        return switch (tier) {
            case FEATURE -> "feature-my-feature";
            case PHASE -> "phase-1";
            case SESSION -> "session-1.1";
            case TASK -> "task-1.1.1";
        };
    }

    private static int indexOf(List<Todo> todos, String id) {
        for (int i = 0; i < todos.size(); i++) {
            if (id.equals(todos.get(i).id())) {
                return i;
            }
        }
        return -1;
    }

    private static TodoFile emptyFile(String feature, Todo todo) {
        return switch (todo.tier()) {
            case FEATURE -> new TodoFile(feature, null, null, List.of(), null);
            case PHASE -> new TodoFile(feature, TodoIds.phaseNumber(todo.id()).orElse(null), null, List.of(), null);
            case SESSION, TASK -> new TodoFile(feature, null, TodoIds.sessionNumber(todo.id()).orElse(null),
                    List.of(), null);
        };
    }

    private static Path fileFor(FeatureWorkspace workspace, String todoId, TodoTier tier) {
        return switch (tier) {
            case FEATURE -> workspace.featureTodosFile();
            case PHASE -> workspace.phaseTodosFile(TodoIds.identifier(todoId));
            case SESSION, TASK -> workspace.sessionTodosFile(TodoIds.sessionNumber(todoId).orElseThrow());
        };
    }
}
