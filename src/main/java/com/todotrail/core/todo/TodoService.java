package com.todotrail.core.todo;

import com.todotrail.core.changelog.ChangeLog;
import com.todotrail.core.citation.CitationEngine;
import com.todotrail.core.citation.CitationRules;
import com.todotrail.core.config.TodoTrailProperties;
import com.todotrail.core.error.NotFoundException;
import com.todotrail.core.error.ValidationException;
import com.todotrail.core.error.ValidationIssue;
import com.todotrail.core.logging.MdcContext;
import com.todotrail.core.metrics.TodoTrailMetrics;
import com.todotrail.core.model.ChangeLogEntry;
import com.todotrail.core.model.ChangeType;
import com.todotrail.core.model.CitationContext;
import com.todotrail.core.model.Todo;
import com.todotrail.core.model.TodoField;
import com.todotrail.core.model.TodoStatus;
import com.todotrail.core.model.TodoTier;
import com.todotrail.core.persistence.FeatureWorkspaces;
import com.todotrail.core.rollback.RollbackEngine;
import com.todotrail.core.scope.ScopeEngine;
import com.todotrail.core.store.TodoStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Locale;
import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Audited todo mutations: every create and update enforces scope, is logged with a
 * before/after diff, snapshots the prior state for rollback and cites the change on the
 * todo's direct children.
 */
@Service
public class TodoService {

    private static final Logger log = LoggerFactory.getLogger(TodoService.class);

    private static final Set<TodoField> STATUS_FIELDS = EnumSet.of(TodoField.STATUS, TodoField.COMPLETED_AT);
    private static final Set<TodoField> SCOPED_FIELDS = EnumSet.of(TodoField.TITLE, TodoField.DESCRIPTION,
            TodoField.SCOPE, TodoField.PARENT_ID);

    private final TodoStore todoStore;
    private final ChangeLog changeLog;
    private final ScopeEngine scopeEngine;
    private final CitationEngine citationEngine;
    private final RollbackEngine rollbackEngine;
    private final Clock clock;
    private final TodoTrailProperties properties;
    private final TodoTrailMetrics metrics;
    private final FeatureWorkspaces workspaces;

    public TodoService(TodoStore todoStore, ChangeLog changeLog, ScopeEngine scopeEngine,
                       CitationEngine citationEngine, RollbackEngine rollbackEngine,
                       FeatureWorkspaces workspaces, Clock clock,
                       TodoTrailProperties properties, TodoTrailMetrics metrics) {
        this.todoStore = todoStore;
        this.changeLog = changeLog;
        this.scopeEngine = scopeEngine;
        this.citationEngine = citationEngine;
        this.rollbackEngine = rollbackEngine;
        this.workspaces = workspaces;
        this.clock = clock;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * Creates a todo and logs {@code todo_created}.
     *
     * @throws ValidationException if the id is taken or, in block mode, the content is out of scope
     * @throws com.todotrail.core.error.InvalidHierarchyException if the id or parent is inconsistent
     */
    public Todo create(String feature, NewTodo request) {
        return workspaces.get(feature).locked(() -> {
            MdcContext.setOperation(feature, request.id(), "create");
            try {
                if (todoStore.get(feature, request.id()).isPresent()) {
                    throw new ValidationException("Todo already exists: " + request.id(),
                            List.of(new ValidationIssue("id", "already exists", "Update the existing todo instead")));
                }
                Todo parent = request.parentId() == null ? null
                        : todoStore.get(feature, request.parentId()).orElse(null);
                Instant now = clock.instant();
                Todo draft = Todo.builder()
                        .id(request.id())
                        .tier(request.tier())
                        .parentId(request.parentId())
                        .title(request.title())
                        .description(request.description())
                        .planningDocPath(request.planningDocPath())
                        .planningDocSection(request.planningDocSection())
                        .tags(request.tags())
                        .metadata(request.metadata())
                        .scope(request.scope())
                        .status(TodoStatus.PENDING)
                        .createdAt(now)
                        .build();
                todoStore.validateHierarchy(feature, draft);
                Todo scoped = enforceScope(draft, parent);

                Todo saved = todoStore.save(feature, scoped);
                try {
                    changeLog.append(feature, ChangeLogEntry.builder()
                            .changeType(ChangeType.TODO_CREATED)
                            .tier(scoped.tier())
                            .todoId(scoped.id())
                            .planningDocPath(scoped.planningDocPath())
                            .after(TodoField.snapshot(scoped))
                            .reason("Created " + scoped.tier().value() + " todo"));
                } catch (RuntimeException e) {
                    undo(e, () -> todoStore.remove(feature, saved.id()));
                    throw e;
                }
                log.info("Created {} todo {}", saved.tier().value(), saved.id());
                return saved;
            } finally {
                MdcContext.clear();
            }
        });
    }

    /**
     * Applies {@code change} to a todo's content. Identity fields cannot be changed.
     *
     * @return the saved todo, or the current one unchanged when the change touched nothing
     * @throws NotFoundException if the todo does not exist
     */
    public Todo update(String feature, String todoId, UnaryOperator<Todo.Builder> change, String reason) {
        return workspaces.get(feature).locked(() -> {
            MdcContext.setOperation(feature, todoId, "update");
            try {
                Todo current = todoStore.get(feature, todoId)
                        .orElseThrow(() -> new NotFoundException("Todo not found: " + todoId + " in " + feature));
                Todo proposed = change.apply(current.toBuilder())
                        .id(current.id())
                        .tier(current.tier())
                        .createdAt(current.createdAt())
                        .citations(current.citations())
                        .build();
                if (proposed.status() == TodoStatus.COMPLETED && current.status() != TodoStatus.COMPLETED
                        && proposed.completedAt() == null) {
                    proposed = proposed.toBuilder().completedAt(clock.instant()).build();
                }

                Set<TodoField> changed = TodoField.diff(current, proposed);
                if (changed.isEmpty()) {
                    return current;
                }
                todoStore.validateHierarchy(feature, proposed);
                if (changed.stream().anyMatch(SCOPED_FIELDS::contains)) {
                    Todo parent = proposed.parentId() == null ? null
                            : todoStore.get(feature, proposed.parentId()).orElse(null);
                    proposed = enforceScope(proposed, parent);
                    changed = TodoField.diff(current, proposed);
                }

                ChangeType type = changeTypeOf(changed);
                List<Todo> children = todoStore.children(feature, todoId);
                boolean propagate = properties.getCitations().isPropagate() && !children.isEmpty()
                        && CitationRules.citationTypeFor(type).isPresent();

                Todo saved = todoStore.save(feature, proposed);
                ChangeLogEntry entry;
                try {
                    entry = changeLog.append(feature, ChangeLogEntry.builder()
                            .changeType(type)
                            .tier(current.tier())
                            .todoId(todoId)
                            .planningDocPath(proposed.planningDocPath())
                            .before(TodoField.snapshot(current, changed))
                            .after(TodoField.snapshot(proposed, changed))
                            .reason(reason)
                            .propagationTriggered(propagate));
                    rollbackEngine.storeState(feature, current, entry.id(), reason);
                } catch (RuntimeException e) {
                    undo(e, () -> todoStore.save(feature, current));
                    throw e;
                }

                if (propagate) {
                    List<String> childIds = children.stream().map(Todo::id).toList();
                    citationEngine.createForChange(feature, entry.id(), childIds,
                            junctionsFor(children.get(0).tier()));
                }
                log.info("{} {} ({})", type.value(), todoId, changed);
                return saved;
            } finally {
                MdcContext.clear();
            }
        });
    }

    public Todo setStatus(String feature, String todoId, TodoStatus status, String reason) {
        return update(feature, todoId, b -> b.status(status), reason);
    }

    /** Moves a todo under another parent of the same tier. */
    public Todo move(String feature, String todoId, String newParentId, String reason) {
        return update(feature, todoId, b -> b.parentId(newParentId), reason);
    }

    /** Reverts a saved todo after its change could not be recorded; a failed revert is attached to the cause. */
    private static void undo(RuntimeException cause, Runnable revert) {
        try {
            revert.run();
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
        }
        log.warn("Reverted write after failing to record it: {}", cause.getMessage());
    }

    private Todo enforceScope(Todo todo, Todo parent) {
        Todo scoped = scopeEngine.enforceScope(todo, parent, properties.getScope().getMode());
        metrics.recordScopeViolations(todo.tier().value(), properties.getScope().getMode().name().toLowerCase(Locale.ROOT),
                scoped.scopeViolations().size());
        return scoped;
    }

    private static ChangeType changeTypeOf(Set<TodoField> changed) {
        if (changed.contains(TodoField.PARENT_ID)) {
            return ChangeType.TODO_MOVED;
        }
        if (changed.contains(TodoField.STATUS) && STATUS_FIELDS.containsAll(changed)) {
            return ChangeType.TODO_STATUS_CHANGED;
        }
        return ChangeType.TODO_UPDATED;
    }

    private static List<CitationContext> junctionsFor(TodoTier childTier) {
        return switch (childTier) {
            case FEATURE, PHASE -> List.of(CitationContext.PHASE_START, CitationContext.PHASE_CHECKPOINT);
            case SESSION -> List.of(CitationContext.SESSION_START, CitationContext.SESSION_CHECKPOINT);
            case TASK -> List.of(CitationContext.TASK_START, CitationContext.TASK_CHECKPOINT);
        };
    }
}
