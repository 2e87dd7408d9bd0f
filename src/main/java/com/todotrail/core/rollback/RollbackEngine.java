package com.todotrail.core.rollback;

import com.fasterxml.jackson.databind.JsonNode;
import com.todotrail.core.changelog.ChangeHistory;
import com.todotrail.core.changelog.ChangeLog;
import com.todotrail.core.config.TodoTrailProperties;
import com.todotrail.core.error.NotFoundException;
import com.todotrail.core.error.RollbackConflictException;
import com.todotrail.core.error.ValidationException;
import com.todotrail.core.error.ValidationIssue;
import com.todotrail.core.logging.MdcContext;
import com.todotrail.core.metrics.TodoTrailMetrics;
import com.todotrail.core.model.ChangeLogEntry;
import com.todotrail.core.model.ChangeType;
import com.todotrail.core.model.Ids;
import com.todotrail.core.model.PreviousState;
import com.todotrail.core.model.Rollback;
import com.todotrail.core.model.RollbackConflict;
import com.todotrail.core.model.RollbackConflictType;
import com.todotrail.core.model.RollbackStatus;
import com.todotrail.core.model.RollbackType;
import com.todotrail.core.model.Severity;
import com.todotrail.core.model.Todo;
import com.todotrail.core.model.TodoField;
import com.todotrail.core.persistence.FeatureWorkspace;
import com.todotrail.core.persistence.FeatureWorkspaces;
import com.todotrail.core.persistence.FileMetadata;
import com.todotrail.core.persistence.JsonFileStore;
import com.todotrail.core.persistence.RollbackHistoryFile;
import com.todotrail.core.persistence.StatesFile;
import com.todotrail.core.store.TodoStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Snapshots todos and restores them, refusing to silently discard changes made since the snapshot.
 * <p>
 * A rollback looks at the change-log entries for the todo appended after the snapshot (the
 * intervening changes). Every field such an entry changed whose current value differs from the
 * snapshot would be lost; each becomes a {@link RollbackConflict} with the severity configured
 * for the field. Unresolved conflicts at or above the blocking severity stop the rollback: it is
 * recorded with status {@link RollbackStatus#CONFLICT} and neither the store nor the change log
 * is touched.
 */
@Service
public class RollbackEngine {

    private static final Logger log = LoggerFactory.getLogger(RollbackEngine.class);

    private final TodoStore todoStore;
    private final ChangeLog changeLog;
    private final FeatureWorkspaces workspaces;
    private final JsonFileStore files;
    private final Clock clock;
    private final TodoTrailProperties properties;
    private final TodoTrailMetrics metrics;

    public RollbackEngine(TodoStore todoStore, ChangeLog changeLog, FeatureWorkspaces workspaces,
                          JsonFileStore files, Clock clock, TodoTrailProperties properties,
                          TodoTrailMetrics metrics) {
        this.todoStore = todoStore;
        this.changeLog = changeLog;
        this.workspaces = workspaces;
        this.files = files;
        this.clock = clock;
        this.properties = properties;
        this.metrics = metrics;
    }

    // -- States --

    /**
     * Stores a snapshot of {@code todo} as a rollback target.
     *
     * @param changeLogId the change that prompted the snapshot; it may already be in the log or be
     *                    about to be appended
     */
    public PreviousState storeState(String feature, Todo todo, String changeLogId, String reason) {
        FeatureWorkspace workspace = workspaces.get(feature);
        return workspace.locked(() -> {
            Instant now = clock.instant();
            PreviousState state = new PreviousState(Ids.generate("state", now), todo.id(), now,
                    changeLog.read(feature).lastSequence(), todo, changeLogId, reason, null);
            List<PreviousState> states = new ArrayList<>(loadStates(workspace).states());
            states.add(state);
            files.write(workspace.previousStatesFile(),
                    new StatesFile(feature, states, FileMetadata.of(now, states.size())));
            log.debug("Stored state {} of {} at sequence {}", state.id(), todo.id(), state.logSequence());
            return state;
        });
    }

    /** Snapshots of a todo, newest first. */
    public List<PreviousState> getStates(String feature, String todoId) {
        List<PreviousState> states = new ArrayList<>(loadStates(workspaces.get(feature)).states().stream()
                .filter(s -> todoId.equals(s.todoId()))
                .toList());
        // stable sort keeps file order for full ties, so reversing puts the latest stored first
        states.sort(Comparator.comparing(PreviousState::timestamp)
                .thenComparingLong(PreviousState::logSequence));
        Collections.reverse(states);
        return List.copyOf(states);
    }

    public Optional<PreviousState> getState(String feature, String stateId) {
        return loadStates(workspaces.get(feature)).states().stream()
                .filter(s -> s.id().equals(stateId))
                .findFirst();
    }

    // -- Rollbacks --

    public Rollback rollback(String feature, String todoId, String stateId, String reason) {
        return rollback(feature, todoId, stateId, reason, RollbackOptions.defaults());
    }

    /**
     * Restores every content field of the todo to the snapshot. Identity, creation time and
     * citations are kept.
     */
    public Rollback rollback(String feature, String todoId, String stateId, String reason, RollbackOptions options) {
        return execute(feature, todoId, stateId, RollbackType.FULL, EnumSet.allOf(TodoField.class), reason, options);
    }

    /**
     * Restores only the named fields; other fields keep their current values.
     */
    public Rollback rollbackFields(String feature, String todoId, String stateId, Collection<TodoField> fields,
                                   String reason, RollbackOptions options) {
        if (fields == null || fields.isEmpty()) {
            throw new ValidationException("Selective rollback needs at least one field",
                    List.of(new ValidationIssue("fields", "empty", "Name the fields to restore")));
        }
        return execute(feature, todoId, stateId, RollbackType.SELECTIVE, EnumSet.copyOf(fields), reason, options);
    }

    /**
     * Restores every field that has no blocking conflict and leaves the conflicting ones as they are.
     */
    public Rollback rollbackNonConflicting(String feature, String todoId, String stateId, String reason,
                                           RollbackOptions options) {
        return execute(feature, todoId, stateId, RollbackType.PARTIAL, EnumSet.allOf(TodoField.class), reason,
                options);
    }

    /**
     * Like {@link #rollback(String, String, String, String)} but fails instead of returning a
     * rollback in conflict.
     *
     * @throws RollbackConflictException if blocking conflicts stopped the rollback
     */
    public Rollback rollbackWithConflictCheck(String feature, String todoId, String stateId, String reason) {
        Rollback result = rollback(feature, todoId, stateId, reason);
        if (result.status() == RollbackStatus.CONFLICT) {
            throw new RollbackConflictException("Rollback of " + todoId + " to " + stateId + " has "
                    + result.conflicts().size() + " conflict(s)", result);
        }
        return result;
    }

    public List<Rollback> getRollbackHistory(String feature, String todoId) {
        return loadHistory(workspaces.get(feature)).rollbacks().stream()
                .filter(r -> todoId == null || todoId.equals(r.todoId()))
                .toList();
    }

    /**
     * Cancels a rollback that is pending or in conflict.
     *
     * @throws ValidationException if the rollback already completed
     */
    public Rollback cancelRollback(String feature, String rollbackId) {
        FeatureWorkspace workspace = workspaces.get(feature);
        return workspace.locked(() -> {
            List<Rollback> rollbacks = new ArrayList<>(loadHistory(workspace).rollbacks());
            for (int i = 0; i < rollbacks.size(); i++) {
                Rollback rollback = rollbacks.get(i);
                if (!rollback.id().equals(rollbackId)) {
                    continue;
                }
                if (rollback.status() == RollbackStatus.COMPLETED) {
                    throw new ValidationException("Rollback " + rollbackId + " already completed",
                            List.of(new ValidationIssue("status", "completed",
                                    "Roll back to the state stored before it instead")));
                }
                if (rollback.status() == RollbackStatus.CANCELLED) {
                    return rollback;
                }
                Rollback cancelled = rollback.withStatus(RollbackStatus.CANCELLED);
                rollbacks.set(i, cancelled);
                writeHistory(workspace, rollbacks);
                log.info("Cancelled rollback {}", rollbackId);
                return cancelled;
            }
            throw new NotFoundException("Rollback not found: " + rollbackId);
        });
    }

    private Rollback execute(String feature, String todoId, String stateId, RollbackType type,
                             Set<TodoField> requested, String reason, RollbackOptions options) {
        FeatureWorkspace workspace = workspaces.get(feature);
        return workspace.locked(() -> {
            MdcContext.setOperation(feature, todoId, "rollback");
            try {
                return doExecute(workspace, todoId, stateId, type, requested, reason, options);
            } finally {
                MdcContext.clear();
            }
        });
    }

    private Rollback doExecute(FeatureWorkspace workspace, String todoId, String stateId, RollbackType type,
                               Set<TodoField> requested, String reason, RollbackOptions options) {
        String feature = workspace.feature();
        Todo current = todoStore.get(feature, todoId)
                .orElseThrow(() -> new NotFoundException("Todo not found: " + todoId + " in " + feature));
        PreviousState state = getState(feature, stateId)
                .orElseThrow(() -> new NotFoundException("State not found: " + stateId));
        if (!todoId.equals(state.todoId())) {
            throw new ValidationException("State " + stateId + " belongs to " + state.todoId() + ", not " + todoId,
                    List.of(new ValidationIssue("stateId", "belongs to another todo", "Pick a state of " + todoId)));
        }

        Instant now = clock.instant();
        String rollbackId = Ids.generate("rollback", now);
        String author = options.author() != null ? options.author() : properties.getAuthor();
        Severity threshold = properties.getRollback().getBlockingSeverity();
        Todo snapshot = state.state();

        List<ChangeLogEntry> intervening = interveningChanges(changeLog.read(feature), state);
        List<RollbackConflict> conflicts = detectConflicts(feature, current, snapshot, intervening, requested);

        Set<TodoField> restore = EnumSet.copyOf(requested);
        if (type == RollbackType.PARTIAL) {
            List<RollbackConflict> resolved = new ArrayList<>();
            for (RollbackConflict conflict : conflicts) {
                if (conflict.blocks(threshold)) {
                    fieldOf(conflict).ifPresent(restore::remove);
                    resolved.add(conflict.resolve("kept current value, skipped by partial rollback"));
                } else {
                    resolved.add(conflict);
                }
            }
            conflicts = resolved;
        } else if (options.force()) {
            conflicts = conflicts.stream()
                    .map(c -> c.blocks(threshold) ? c.resolve("overridden by forced rollback") : c)
                    .toList();
        }

        List<String> fieldNames = type == RollbackType.FULL ? List.of()
                : restore.stream().map(TodoField::fieldName).toList();
        List<String> discarded = intervening.stream()
                .filter(e -> e.changedFields().stream().anyMatch(restore::contains))
                .map(ChangeLogEntry::id)
                .toList();
        Rollback rollback = new Rollback(rollbackId, now, author, todoId, stateId, null, type, fieldNames,
                reason, conflicts, RollbackStatus.PENDING, discarded, null);

        if (rollback.hasBlockingConflicts(threshold)) {
            Rollback blocked = rollback.withStatus(RollbackStatus.CONFLICT);
            appendHistory(workspace, blocked);
            metrics.recordRollback(type.value(), RollbackStatus.CONFLICT.value());
            log.warn("Rollback of {} to {} blocked by {} conflict(s)", todoId, stateId, conflicts.size());
            return blocked;
        }

        Todo.Builder builder = current.toBuilder();
        for (TodoField field : restore) {
            field.copy(snapshot, builder);
        }
        Todo restored = builder.build();
        todoStore.validateHierarchy(feature, restored);

        Set<TodoField> changed = TodoField.diff(current, restored);
        changed.retainAll(restore);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("rollbackId", rollbackId);
        metadata.put("stateId", stateId);
        metadata.put("rollbackType", type.value());
        todoStore.save(feature, restored);
        ChangeLogEntry entry;
        PreviousState from;
        try {
            entry = changeLog.append(feature, ChangeLogEntry.builder()
                    .author(author)
                    .changeType(ChangeType.ROLLBACK_APPLIED)
                    .tier(current.tier())
                    .todoId(todoId)
                    .planningDocPath(restored.planningDocPath())
                    .before(TodoField.snapshot(current, changed))
                    .after(TodoField.snapshot(restored, changed))
                    .reason(reason != null ? reason : "Rollback to state " + stateId)
                    .relatedChanges(discarded)
                    .metadata(metadata));
            from = storeState(feature, current, entry.id(), "Before rollback " + rollbackId);
        } catch (RuntimeException e) {
            try {
                todoStore.save(feature, current);
            } catch (RuntimeException revertFailure) {
                e.addSuppressed(revertFailure);
            }
            log.warn("Rollback of {} to {} reverted: {}", todoId, stateId, e.getMessage());
            throw e;
        }

        Rollback completed = new Rollback(rollbackId, now, author, todoId, stateId, from.id(), type, fieldNames,
                reason, conflicts, RollbackStatus.COMPLETED, discarded, entry.id());
        appendHistory(workspace, completed);
        metrics.recordRollback(type.value(), RollbackStatus.COMPLETED.value());
        log.info("Rolled back {} to {} ({}, {} field(s) changed)", todoId, stateId, type.value(), changed.size());
        return completed;
    }

    /**
     * Entries for the snapshot's todo logged after it. When the snapshot was taken before its
     * change was logged, that change is the one the snapshot guards and is not intervening: it
     * is the entry named by the state, or the first later entry when the named one is absent.
     */
    List<ChangeLogEntry> interveningChanges(ChangeHistory history, PreviousState state) {
        List<ChangeLogEntry> after = history.afterSequence(state.logSequence()).stream()
                .filter(e -> state.todoId().equals(e.todoId()))
                .filter(e -> !e.changedFields().isEmpty())
                .toList();
        if (after.isEmpty()) {
            return after;
        }
        Optional<ChangeLogEntry> named = state.changeLogId() == null ? Optional.empty()
                : history.find(state.changeLogId());
        if (named.isPresent() && named.get().sequence() <= state.logSequence()) {
            return after;
        }
        String guarded = named.map(ChangeLogEntry::id).orElse(after.get(0).id());
        return after.stream().filter(e -> !e.id().equals(guarded)).toList();
    }

    private List<RollbackConflict> detectConflicts(String feature, Todo current, Todo snapshot,
                                                   List<ChangeLogEntry> intervening, Set<TodoField> requested) {
        Map<TodoField, String> lastChangeByField = new LinkedHashMap<>();
        for (ChangeLogEntry entry : intervening) {
            for (TodoField field : entry.changedFields()) {
                if (requested.contains(field)) {
                    lastChangeByField.put(field, entry.id());
                }
            }
        }

        List<RollbackConflict> conflicts = new ArrayList<>();
        for (TodoField field : TodoField.values()) {
            String changeId = lastChangeByField.get(field);
            if (changeId == null || sameValue(field.get(current), field.get(snapshot))) {
                continue;
            }
            conflicts.add(new RollbackConflict(RollbackConflictType.STATE_CONFLICT, field.fieldName(),
                    "Rolling back discards " + field.fieldName() + " set by " + changeId + " after the snapshot",
                    properties.getRollback().severityOf(field), changeId, null));
        }

        if (requested.contains(TodoField.PARENT_ID) && snapshot.parentId() != null
                && todoStore.get(feature, snapshot.parentId()).isEmpty()) {
            conflicts.add(new RollbackConflict(RollbackConflictType.RELATIONSHIP_CONFLICT, TodoField.PARENT_ID.fieldName(),
                    "Parent todo " + snapshot.parentId() + " no longer exists", Severity.HIGH, null, null));
        }
        if (requested.contains(TodoField.PLANNING_DOC_PATH)
                && !lastChangeByField.containsKey(TodoField.PLANNING_DOC_PATH)
                && !Objects.equals(current.planningDocPath(), snapshot.planningDocPath())) {
            conflicts.add(new RollbackConflict(RollbackConflictType.PLANNING_DOC_CONFLICT,
                    TodoField.PLANNING_DOC_PATH.fieldName(), "Planning doc path changed since the snapshot",
                    Severity.MEDIUM, null, null));
        }
        return conflicts;
    }

    private boolean sameValue(Object a, Object b) {
        JsonNode left = files.mapper().valueToTree(a);
        JsonNode right = files.mapper().valueToTree(b);
        return Objects.equals(left, right);
    }

    private static Optional<TodoField> fieldOf(RollbackConflict conflict) {
        return conflict.field() == null ? Optional.empty() : TodoField.fromName(conflict.field());
    }

    private StatesFile loadStates(FeatureWorkspace workspace) {
        return files.read(workspace.previousStatesFile(), StatesFile.class)
                .orElseGet(() -> new StatesFile(workspace.feature(), List.of(), null));
    }

    private RollbackHistoryFile loadHistory(FeatureWorkspace workspace) {
        return files.read(workspace.rollbackHistoryFile(), RollbackHistoryFile.class)
                .orElseGet(() -> new RollbackHistoryFile(workspace.feature(), List.of(), null));
    }

    private void appendHistory(FeatureWorkspace workspace, Rollback rollback) {
        List<Rollback> rollbacks = new ArrayList<>(loadHistory(workspace).rollbacks());
        rollbacks.add(rollback);
        writeHistory(workspace, rollbacks);
    }

    private void writeHistory(FeatureWorkspace workspace, List<Rollback> rollbacks) {
        files.write(workspace.rollbackHistoryFile(),
                new RollbackHistoryFile(workspace.feature(), rollbacks, FileMetadata.of(clock.instant(), rollbacks.size())));
    }
}
