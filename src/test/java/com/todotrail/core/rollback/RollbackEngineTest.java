package com.todotrail.core.rollback;

import com.todotrail.core.TodoTrailFixture;
import com.todotrail.core.changelog.ChangeLog;
import com.todotrail.core.error.NotFoundException;
import com.todotrail.core.error.RollbackConflictException;
import com.todotrail.core.error.TodoTrailStorageException;
import com.todotrail.core.error.ValidationException;
import com.todotrail.core.model.ChangeLogEntry;
import com.todotrail.core.model.ChangeType;
import com.todotrail.core.model.CitationPriority;
import com.todotrail.core.model.CitationType;
import com.todotrail.core.model.PreviousState;
import com.todotrail.core.model.Rollback;
import com.todotrail.core.model.RollbackConflict;
import com.todotrail.core.model.RollbackConflictType;
import com.todotrail.core.model.RollbackStatus;
import com.todotrail.core.model.RollbackType;
import com.todotrail.core.model.Severity;
import com.todotrail.core.model.Todo;
import com.todotrail.core.model.TodoField;
import com.todotrail.core.model.TodoStatus;
import com.todotrail.core.store.TodoStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

class RollbackEngineTest {

    private static final String FEATURE = "shop";
    private static final String TASK = "task-1.1.1";

    @TempDir
    Path root;

    private TodoTrailFixture fx;
    private RollbackEngine engine;

    @BeforeEach
    void setUp() {
        fx = new TodoTrailFixture(root);
        engine = fx.rollbacks;
        fx.seed(FEATURE);
    }

    private Todo task() {
        return fx.todoStore.get(FEATURE, TASK).orElseThrow();
    }

    /** Starts the task and returns the state stored before the start. */
    private PreviousState start() {
        fx.clock.advance(Duration.ofMinutes(1));
        fx.todos.setStatus(FEATURE, TASK, TodoStatus.IN_PROGRESS, "started");
        return engine.getStates(FEATURE, TASK).get(0);
    }

    private void retitle(String title) {
        fx.clock.advance(Duration.ofMinutes(1));
        fx.todos.update(FEATURE, TASK, b -> b.title(title), "renamed");
    }

    private void block() {
        fx.clock.advance(Duration.ofMinutes(1));
        fx.todos.setStatus(FEATURE, TASK, TodoStatus.BLOCKED, "waiting on provider");
    }

    @Nested
    @DisplayName("Stored states")
    class StateTests {

        @Test
        @DisplayName("every update stores the prior state, newest first")
        void statesNewestFirst() {
            PreviousState started = start();
            retitle("Add card form v2");

            List<PreviousState> states = engine.getStates(FEATURE, TASK);
            assertEquals(2, states.size());
            assertEquals(started.id(), states.get(1).id());
            assertEquals(TodoStatus.PENDING, states.get(1).state().status());
            assertEquals(TodoStatus.IN_PROGRESS, states.get(0).state().status());
            assertEquals("Add card form", states.get(0).state().title());
        }

        @Test
        @DisplayName("states stored within the same millisecond are still newest first")
        void sameInstantNewestFirst() {
            fx.todos.setStatus(FEATURE, TASK, TodoStatus.IN_PROGRESS, "started");
            fx.todos.update(FEATURE, TASK, b -> b.title("T2"), "renamed");

            List<PreviousState> states = engine.getStates(FEATURE, TASK);
            assertEquals(2, states.size());
            assertEquals(states.get(0).timestamp(), states.get(1).timestamp());
            assertEquals(TodoStatus.IN_PROGRESS, states.get(0).state().status());
            assertEquals(TodoStatus.PENDING, states.get(1).state().status());
        }

        @Test
        @DisplayName("a state records the log position it was taken at")
        void logSequence() {
            PreviousState started = start();
            ChangeLogEntry change = fx.changeLog.find(FEATURE, started.changeLogId()).orElseThrow();
            assertEquals(change.sequence(), started.logSequence());
            assertEquals(started, engine.getState(FEATURE, started.id()).orElseThrow());
        }
    }

    @Nested
    @DisplayName("Failed writes")
    class FailedWriteTests {

        @Test
        @DisplayName("a failed store write leaves the log and the states untouched")
        void storeWriteFails() {
            retitle("Add card form v2");
            PreviousState beforeRename = engine.getStates(FEATURE, TASK).get(0);
            int logSize = fx.changeLog.read(FEATURE).size();

            TodoStore store = spy(fx.todoStore);
            doThrow(new TodoTrailStorageException("disk full")).when(store).save(any(), any());
            RollbackEngine failing = new RollbackEngine(store, fx.changeLog, fx.workspaces, fx.files, fx.clock,
                    fx.properties, fx.metrics);

            assertThrows(TodoTrailStorageException.class,
                    () -> failing.rollback(FEATURE, TASK, beforeRename.id(), "undo rename"));
            assertEquals(logSize, fx.changeLog.read(FEATURE).size());
            assertEquals(1, engine.getStates(FEATURE, TASK).size());
            assertEquals("Add card form v2", task().title());
        }

        @Test
        @DisplayName("a failed log append restores the todo")
        void logAppendFails() {
            retitle("Add card form v2");
            PreviousState beforeRename = engine.getStates(FEATURE, TASK).get(0);
            int logSize = fx.changeLog.read(FEATURE).size();

            ChangeLog changeLog = spy(fx.changeLog);
            doThrow(new TodoTrailStorageException("disk full")).when(changeLog).append(any(), any());
            RollbackEngine failing = new RollbackEngine(fx.todoStore, changeLog, fx.workspaces, fx.files,
                    fx.clock, fx.properties, fx.metrics);

            assertThrows(TodoTrailStorageException.class,
                    () -> failing.rollback(FEATURE, TASK, beforeRename.id(), "undo rename"));
            assertEquals("Add card form v2", task().title());
            assertEquals(logSize, fx.changeLog.read(FEATURE).size());
            assertEquals(1, engine.getStates(FEATURE, TASK).size());
        }
    }

    @Nested
    @DisplayName("Full rollback")
    class FullRollbackTests {

        @Test
        @DisplayName("undoing the last change restores the todo without conflicts")
        void undoLastChange() {
            start();
            retitle("Add card form v2");
            PreviousState beforeRename = engine.getStates(FEATURE, TASK).get(0);

            Rollback result = engine.rollback(FEATURE, TASK, beforeRename.id(), "rename was wrong");

            assertEquals(RollbackStatus.COMPLETED, result.status());
            assertTrue(result.conflicts().isEmpty());
            assertTrue(result.discardedChanges().isEmpty());
            assertEquals("Add card form", task().title());
            assertEquals(TodoStatus.IN_PROGRESS, task().status());
        }

        @Test
        @DisplayName("rolling back over a later change reports it and discards it")
        void roundTrip() {
            PreviousState pending = start();
            retitle("Add card form v2");
            String renameId = fx.changeLog.read(FEATURE).last().orElseThrow().id();

            Rollback result = engine.rollback(FEATURE, TASK, pending.id(), null);

            assertEquals(RollbackStatus.COMPLETED, result.status());
            assertEquals(RollbackType.FULL, result.type());
            assertEquals(List.of(renameId), result.discardedChanges());
            RollbackConflict conflict = result.conflicts().get(0);
            assertEquals(RollbackConflictType.STATE_CONFLICT, conflict.type());
            assertEquals("title", conflict.field());
            assertEquals(Severity.MEDIUM, conflict.severity());

            Todo restored = task();
            assertEquals(TodoStatus.PENDING, restored.status());
            assertEquals("Add card form", restored.title());
        }

        @Test
        @DisplayName("an applied rollback is logged and its starting point stored")
        void loggedAndStored() {
            PreviousState pending = start();
            Rollback result = engine.rollback(FEATURE, TASK, pending.id(), null,
                    RollbackOptions.defaults().by("riley"));

            ChangeLogEntry entry = fx.changeLog.find(FEATURE, result.changeLogId()).orElseThrow();
            assertEquals(ChangeType.ROLLBACK_APPLIED, entry.changeType());
            assertEquals("riley", entry.author());
            assertEquals(result.id(), entry.metadata().get("rollbackId"));
            assertEquals(pending.id(), entry.metadata().get("stateId"));
            assertEquals("pending", entry.after().get("status"));

            PreviousState from = engine.getState(FEATURE, result.rolledBackFrom()).orElseThrow();
            assertEquals(TodoStatus.IN_PROGRESS, from.state().status());
            assertEquals("riley", result.author());
            assertEquals(1.0, fx.registry.find("todotrail.rollbacks.total")
                    .tag("type", "full").tag("status", "completed").counter().count());
        }

        @Test
        @DisplayName("identity, creation time and citations survive a rollback")
        void keepsIdentity() {
            PreviousState pending = start();
            Todo before = task();
            fx.citations.create(FEATURE, TASK, "change-1", CitationType.STATUS_CHANGE, List.of(),
                    CitationPriority.LOW, null);

            engine.rollback(FEATURE, TASK, pending.id(), null);

            Todo after = task();
            assertEquals(before.createdAt(), after.createdAt());
            assertEquals(before.parentId(), after.parentId());
            assertEquals(1, after.citations().size());
        }
    }

    @Nested
    @DisplayName("Conflicts")
    class ConflictTests {

        @Test
        @DisplayName("a status set by another writer after the state blocks the rollback")
        void secondWriterBlocks() {
            PreviousState pending = start();
            block();

            Rollback result = engine.rollback(FEATURE, TASK, pending.id(), null);

            assertEquals(RollbackStatus.CONFLICT, result.status());
            assertEquals(TodoStatus.BLOCKED, task().status());
            assertEquals("status", result.conflicts().get(0).field());
            assertEquals(Severity.HIGH, result.conflicts().get(0).severity());
            assertNull(result.changeLogId());
            assertEquals(ChangeType.TODO_STATUS_CHANGED,
                    fx.changeLog.read(FEATURE).last().orElseThrow().changeType());
            assertEquals(RollbackStatus.CONFLICT, engine.getRollbackHistory(FEATURE, TASK).get(0).status());
        }

        @Test
        @DisplayName("the conflict check variant throws with the blocked rollback")
        void conflictCheckThrows() {
            PreviousState pending = start();
            block();

            var ex = assertThrows(RollbackConflictException.class,
                    () -> engine.rollbackWithConflictCheck(FEATURE, TASK, pending.id(), null));
            assertEquals(RollbackStatus.CONFLICT, ex.getRollback().status());
        }

        @Test
        @DisplayName("force overrides the conflict and records how it was resolved")
        void force() {
            PreviousState pending = start();
            block();

            Rollback result = engine.rollback(FEATURE, TASK, pending.id(), null, RollbackOptions.forced());

            assertEquals(RollbackStatus.COMPLETED, result.status());
            assertEquals(TodoStatus.PENDING, task().status());
            assertEquals("overridden by forced rollback", result.conflicts().get(0).resolution());
        }

        @Test
        @DisplayName("partial rollback restores everything except the conflicting fields")
        void partial() {
            PreviousState pending = start();
            block();
            fx.clock.advance(Duration.ofMinutes(1));
            fx.todos.update(FEATURE, TASK, b -> b.description("Reuse the provider widget"), null);

            Rollback result = engine.rollbackNonConflicting(FEATURE, TASK, pending.id(), null,
                    RollbackOptions.defaults());

            assertEquals(RollbackStatus.COMPLETED, result.status());
            assertEquals(RollbackType.PARTIAL, result.type());
            assertFalse(result.fields().contains("status"));
            assertTrue(result.fields().contains("description"));
            RollbackConflict skipped = result.conflicts().stream()
                    .filter(c -> "status".equals(c.field())).findFirst().orElseThrow();
            assertEquals("kept current value, skipped by partial rollback", skipped.resolution());
            Todo after = task();
            assertEquals(TodoStatus.BLOCKED, after.status());
            assertEquals("Add the form to src/checkout/CardForm.vue", after.description());
        }

        @Test
        @DisplayName("a snapshot whose parent is gone is a relationship conflict")
        void missingParent() {
            Todo orphan = task().toBuilder().parentId("session-1.2").build();
            PreviousState state = engine.storeState(FEATURE, orphan, null, "imported");

            Rollback result = engine.rollback(FEATURE, TASK, state.id(), null);

            assertEquals(RollbackStatus.CONFLICT, result.status());
            assertEquals(RollbackConflictType.RELATIONSHIP_CONFLICT, result.conflicts().get(0).type());
        }
    }

    @Nested
    @DisplayName("Selective rollback")
    class SelectiveTests {

        @Test
        @DisplayName("only the named fields are restored")
        void onlyNamedFields() {
            PreviousState pending = start();
            retitle("Add card form v2");

            Rollback result = engine.rollbackFields(FEATURE, TASK, pending.id(), List.of(TodoField.TITLE), null,
                    RollbackOptions.defaults());

            assertEquals(RollbackType.SELECTIVE, result.type());
            assertEquals(List.of("title"), result.fields());
            assertEquals("Add card form", task().title());
            assertEquals(TodoStatus.IN_PROGRESS, task().status());
        }

        @Test
        @DisplayName("a status conflict does not block a rollback of other fields")
        void unrelatedConflictIgnored() {
            PreviousState pending = start();
            block();
            retitle("Add card form v2");

            Rollback result = engine.rollbackFields(FEATURE, TASK, pending.id(), List.of(TodoField.TITLE), null,
                    RollbackOptions.defaults());

            assertEquals(RollbackStatus.COMPLETED, result.status());
            assertEquals(TodoStatus.BLOCKED, task().status());
        }

        @Test
        @DisplayName("an empty field list is rejected")
        void emptyFields() {
            PreviousState pending = start();
            assertThrows(ValidationException.class, () -> engine.rollbackFields(FEATURE, TASK, pending.id(),
                    List.of(), null, RollbackOptions.defaults()));
        }
    }

    @Nested
    @DisplayName("Validation and history")
    class HistoryTests {

        @Test
        @DisplayName("unknown todos and states are not found, foreign states are rejected")
        void invalidTargets() {
            PreviousState pending = start();
            assertThrows(NotFoundException.class, () -> engine.rollback(FEATURE, TASK, "state-404", null));
            assertThrows(NotFoundException.class, () -> engine.rollback(FEATURE, "task-1.1.9", pending.id(), null));
            assertThrows(ValidationException.class, () -> engine.rollback(FEATURE, "task-1.1.2", pending.id(), null));
        }

        @Test
        @DisplayName("a rollback in conflict can be cancelled, once")
        void cancelConflict() {
            PreviousState pending = start();
            block();
            Rollback blocked = engine.rollback(FEATURE, TASK, pending.id(), null);

            Rollback cancelled = engine.cancelRollback(FEATURE, blocked.id());
            Rollback again = engine.cancelRollback(FEATURE, blocked.id());

            assertEquals(RollbackStatus.CANCELLED, cancelled.status());
            assertEquals(cancelled, again);
            assertEquals(RollbackStatus.CANCELLED, engine.getRollbackHistory(FEATURE, null).get(0).status());
        }

        @Test
        @DisplayName("a completed rollback cannot be cancelled and unknown ids are not found")
        void cancelInvalid() {
            PreviousState pending = start();
            Rollback done = engine.rollback(FEATURE, TASK, pending.id(), null);

            assertThrows(ValidationException.class, () -> engine.cancelRollback(FEATURE, done.id()));
            assertThrows(NotFoundException.class, () -> engine.cancelRollback(FEATURE, "rollback-404"));
        }

        @Test
        @DisplayName("history can be filtered by todo")
        void historyByTodo() {
            PreviousState pending = start();
            engine.rollback(FEATURE, TASK, pending.id(), null);

            assertEquals(1, engine.getRollbackHistory(FEATURE, TASK).size());
            assertTrue(engine.getRollbackHistory(FEATURE, "task-1.1.2").isEmpty());
        }
    }
}
