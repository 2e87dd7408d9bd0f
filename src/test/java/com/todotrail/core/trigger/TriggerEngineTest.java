package com.todotrail.core.trigger;

import com.todotrail.core.TodoTrailFixture;
import com.todotrail.core.error.NotFoundException;
import com.todotrail.core.error.NotSuppressibleException;
import com.todotrail.core.error.ValidationException;
import com.todotrail.core.model.ChangeConflict;
import com.todotrail.core.model.ChangeLogEntry;
import com.todotrail.core.model.ChangeType;
import com.todotrail.core.model.Citation;
import com.todotrail.core.model.CitationContext;
import com.todotrail.core.model.CitationPriority;
import com.todotrail.core.model.CitationType;
import com.todotrail.core.model.Severity;
import com.todotrail.core.model.TodoStatus;
import com.todotrail.core.model.TriggerAction;
import com.todotrail.core.model.TriggerCondition;
import com.todotrail.core.model.TriggerConditionType;
import com.todotrail.core.model.TriggerDefinition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TriggerEngineTest {

    private static final String FEATURE = "shop";

    @TempDir
    Path root;

    private TodoTrailFixture fx;
    private TriggerEngine engine;

    @BeforeEach
    void setUp() {
        fx = new TodoTrailFixture(root);
        engine = fx.triggers;
        fx.seed(FEATURE);
        fx.clock.advance(Duration.ofDays(2));
    }

    private Citation citeOnPhase(CitationPriority priority, CitationType type, CitationContext... context) {
        return fx.citations.create(FEATURE, "phase-1", "change-1", type, List.of(context), priority, null);
    }

    private ChangeLogEntry logConflict(Severity severity) {
        return fx.changeLog.append(FEATURE, ChangeLogEntry.builder()
                .changeType(ChangeType.PROPAGATION_CONFLICT)
                .todoId("session-1.1")
                .conflicts(List.of(new ChangeConflict("status_mismatch", "parent blocked, child in progress",
                        severity, null, true))));
    }

    private List<String> detectedIds(CitationContext junction, TriggerContext context) {
        return engine.detect(FEATURE, junction, context).stream().map(TriggerDefinition::id).toList();
    }

    @Nested
    @DisplayName("Configuration")
    class ConfigurationTests {

        @Test
        @DisplayName("a feature without config uses the four default triggers")
        void defaults() {
            List<TriggerDefinition> triggers = engine.triggers(FEATURE);
            assertEquals(List.of(DefaultTriggers.SESSION_START, DefaultTriggers.SESSION_CHECKPOINT,
                    DefaultTriggers.CONFLICT_DETECTION, DefaultTriggers.PHASE_START),
                    triggers.stream().map(TriggerDefinition::id).toList());
            TriggerDefinition conflict = triggers.get(2);
            assertFalse(conflict.suppressible());
            assertTrue(conflict.blocksUntilReview());
        }

        @Test
        @DisplayName("configure replaces the triggers and drops suppressions of removed ones")
        void configure() {
            engine.suppress(FEATURE, DefaultTriggers.PHASE_START, 2);
            engine.suppress(FEATURE, DefaultTriggers.SESSION_START, 2);
            List<TriggerDefinition> kept = engine.triggers(FEATURE).stream()
                    .filter(t -> !t.id().equals(DefaultTriggers.SESSION_START))
                    .toList();

            engine.configure(FEATURE, kept);

            assertEquals(3, engine.triggers(FEATURE).size());
            citeOnPhase(CitationPriority.HIGH, CitationType.STATUS_CHANGE, CitationContext.PHASE_START);
            assertTrue(detectedIds(CitationContext.PHASE_START, TriggerContext.forTodo("phase-1")).isEmpty());
        }

        @Test
        @DisplayName("an empty configuration stays empty instead of falling back to the defaults")
        void emptyConfiguration() {
            engine.configure(FEATURE, List.of());

            assertTrue(engine.triggers(FEATURE).isEmpty());
            logConflict(Severity.HIGH);
            assertTrue(engine.detect(FEATURE, CitationContext.CONFLICT_DETECTION,
                    TriggerContext.featureWide()).isEmpty());
        }
    }

    @Nested
    @DisplayName("Citation conditions")
    class CitationConditionTests {

        @Test
        @DisplayName("phase start fires for an unreviewed high priority citation on the focus todo")
        void phaseStartFires() {
            citeOnPhase(CitationPriority.HIGH, CitationType.STATUS_CHANGE, CitationContext.PHASE_START);
            assertEquals(List.of(DefaultTriggers.PHASE_START),
                    detectedIds(CitationContext.PHASE_START, TriggerContext.forTodo("phase-1")));
            assertEquals(1.0, fx.registry.find("todotrail.triggers.fired")
                    .tag("trigger", DefaultTriggers.PHASE_START).counter().count());
        }

        @Test
        @DisplayName("medium priority citations are below the phase start threshold")
        void belowThreshold() {
            citeOnPhase(CitationPriority.MEDIUM, CitationType.DESCRIPTION_CHANGE, CitationContext.PHASE_START);
            assertTrue(detectedIds(CitationContext.PHASE_START, TriggerContext.forTodo("phase-1")).isEmpty());
        }

        @Test
        @DisplayName("citation conditions never hold without a focus todo")
        void needsFocus() {
            citeOnPhase(CitationPriority.HIGH, CitationType.STATUS_CHANGE, CitationContext.PHASE_START);
            assertTrue(detectedIds(CitationContext.PHASE_START, TriggerContext.featureWide()).isEmpty());
        }

        @Test
        @DisplayName("a dismissed citation never makes a trigger fire")
        void dismissedNeverDetected() {
            Citation citation = citeOnPhase(CitationPriority.CRITICAL, CitationType.STATUS_CHANGE,
                    CitationContext.PHASE_START);
            fx.citations.dismiss(FEATURE, "phase-1", citation.id());
            assertTrue(detectedIds(CitationContext.PHASE_START, TriggerContext.forTodo("phase-1")).isEmpty());
        }

        @Test
        @DisplayName("reviewed and deferred citations do not fire either")
        void reviewedAndDeferred() {
            Citation reviewed = citeOnPhase(CitationPriority.HIGH, CitationType.STATUS_CHANGE,
                    CitationContext.PHASE_START);
            Citation deferred = citeOnPhase(CitationPriority.HIGH, CitationType.STATUS_CHANGE,
                    CitationContext.PHASE_START);
            fx.citations.review(FEATURE, "phase-1", reviewed.id());
            fx.citations.defer(FEATURE, "phase-1", deferred.id(), fx.clock.instant().plus(Duration.ofHours(1)));

            assertTrue(detectedIds(CitationContext.PHASE_START, TriggerContext.forTodo("phase-1")).isEmpty());
            fx.clock.advance(Duration.ofHours(2));
            assertEquals(1, detectedIds(CitationContext.PHASE_START, TriggerContext.forTodo("phase-1")).size());
        }

        @Test
        @DisplayName("activation shows the focus todo's pending citations at the junction")
        void activate() {
            citeOnPhase(CitationPriority.HIGH, CitationType.STATUS_CHANGE, CitationContext.PHASE_START);
            citeOnPhase(CitationPriority.HIGH, CitationType.STATUS_CHANGE, CitationContext.SESSION_START);
            TriggerContext context = TriggerContext.forTodo("phase-1");
            TriggerDefinition trigger = engine.detect(FEATURE, CitationContext.PHASE_START, context).get(0);

            TriggerActivation activation = engine.activate(FEATURE, trigger, context);

            assertEquals(1, activation.citations().size());
            assertEquals(CitationPriority.HIGH, activation.priority());
            assertFalse(activation.blocking());
            assertTrue(activation.prompt().startsWith("Change Review Required"));
        }
    }

    @Nested
    @DisplayName("Conflict and change conditions")
    class ConflictConditionTests {

        @Test
        @DisplayName("an unresolved high conflict in the log fires the blocking conflict trigger")
        void conflictFires() {
            logConflict(Severity.HIGH);
            List<TriggerDefinition> fired = engine.detect(FEATURE, CitationContext.CONFLICT_DETECTION,
                    TriggerContext.featureWide());

            assertEquals(1, fired.size());
            assertTrue(engine.activate(FEATURE, fired.get(0), TriggerContext.featureWide()).blocking());
        }

        @Test
        @DisplayName("medium conflicts do not reach the high threshold")
        void mediumConflict() {
            logConflict(Severity.MEDIUM);
            assertTrue(detectedIds(CitationContext.CONFLICT_DETECTION, TriggerContext.featureWide()).isEmpty());
        }

        @Test
        @DisplayName("a conflict is acknowledged once a citation of its entry is reviewed")
        void acknowledgedConflict() {
            ChangeLogEntry entry = logConflict(Severity.HIGH);
            Citation citation = fx.citations.createFromChange(FEATURE, "session-1.1", entry.id(),
                    List.of(CitationContext.CONFLICT_DETECTION)).orElseThrow();
            assertEquals(CitationPriority.CRITICAL, citation.priority());

            fx.citations.review(FEATURE, "session-1.1", citation.id());

            assertTrue(detectedIds(CitationContext.CONFLICT_DETECTION, TriggerContext.featureWide()).isEmpty());
        }

        @Test
        @DisplayName("session start needs both a high citation and a high conflict")
        void sessionStartNeedsBoth() {
            fx.citations.create(FEATURE, "session-1.1", "change-1", CitationType.STATUS_CHANGE,
                    List.of(CitationContext.SESSION_START), CitationPriority.HIGH, null);
            TriggerContext context = TriggerContext.forTodo("session-1.1");
            assertTrue(detectedIds(CitationContext.SESSION_START, context).isEmpty());

            logConflict(Severity.CRITICAL);
            assertEquals(List.of(DefaultTriggers.SESSION_START), detectedIds(CitationContext.SESSION_START, context));
        }

        @Test
        @DisplayName("session checkpoint fires only while a change is inside the window")
        void recentChanges() {
            assertTrue(detectedIds(CitationContext.SESSION_CHECKPOINT, TriggerContext.featureWide()).isEmpty());

            fx.todos.setStatus(FEATURE, "task-1.1.1", TodoStatus.IN_PROGRESS, "picked up");
            assertEquals(List.of(DefaultTriggers.SESSION_CHECKPOINT),
                    detectedIds(CitationContext.SESSION_CHECKPOINT, TriggerContext.featureWide()));

            fx.clock.advance(Duration.ofHours(25));
            assertTrue(detectedIds(CitationContext.SESSION_CHECKPOINT, TriggerContext.featureWide()).isEmpty());
        }

        @Test
        @DisplayName("status conditions look at the focus todo, its parent and its children")
        void statusConditions() {
            engine.configure(FEATURE, List.of(
                    custom("own", TriggerConditionType.TODO_STATUS_CHANGED),
                    custom("parent", TriggerConditionType.PARENT_STATUS_CHANGED),
                    custom("child", TriggerConditionType.CHILD_STATUS_CHANGED)));

            fx.todos.setStatus(FEATURE, "task-1.1.1", TodoStatus.IN_PROGRESS, null);

            assertEquals(List.of("child"), detectedIds(CitationContext.TASK_CHECKPOINT,
                    TriggerContext.forTodo("session-1.1")));
            assertEquals(List.of("own"), detectedIds(CitationContext.TASK_CHECKPOINT,
                    TriggerContext.forTodo("task-1.1.1")));
            assertEquals(List.of(), detectedIds(CitationContext.TASK_CHECKPOINT,
                    TriggerContext.forTodo("phase-1")));
        }

        private TriggerDefinition custom(String id, TriggerConditionType type) {
            return new TriggerDefinition(id, id, CitationContext.TASK_CHECKPOINT,
                    List.of(TriggerCondition.within(type, 1)), CitationPriority.MEDIUM, true,
                    TriggerAction.SHOW_CITATIONS);
        }
    }

    @Nested
    @DisplayName("Suppression")
    class SuppressionTests {

        @Test
        @DisplayName("a suppressed trigger stays silent until the window ends")
        void suppress() {
            citeOnPhase(CitationPriority.HIGH, CitationType.STATUS_CHANGE, CitationContext.PHASE_START);
            Instant until = engine.suppress(FEATURE, DefaultTriggers.PHASE_START, 1);
            assertEquals(fx.clock.instant().plus(Duration.ofHours(1)), until);

            assertTrue(detectedIds(CitationContext.PHASE_START, TriggerContext.forTodo("phase-1")).isEmpty());
            fx.clock.advance(Duration.ofMinutes(61));
            assertEquals(1, detectedIds(CitationContext.PHASE_START, TriggerContext.forTodo("phase-1")).size());
        }

        @Test
        @DisplayName("suppressing again replaces the earlier window")
        void replaceWindow() {
            engine.suppress(FEATURE, DefaultTriggers.PHASE_START, 5);
            engine.suppress(FEATURE, DefaultTriggers.PHASE_START, 1);
            citeOnPhase(CitationPriority.HIGH, CitationType.STATUS_CHANGE, CitationContext.PHASE_START);
            fx.clock.advance(Duration.ofHours(2));
            assertEquals(1, detectedIds(CitationContext.PHASE_START, TriggerContext.forTodo("phase-1")).size());
        }

        @Test
        @DisplayName("the conflict trigger cannot be suppressed")
        void notSuppressible() {
            assertThrows(NotSuppressibleException.class,
                    () -> engine.suppress(FEATURE, DefaultTriggers.CONFLICT_DETECTION, 1));
        }

        @Test
        @DisplayName("unknown triggers and non-positive windows are rejected")
        void invalid() {
            assertThrows(NotFoundException.class, () -> engine.suppress(FEATURE, "trigger-lunch", 1));
            assertThrows(ValidationException.class, () -> engine.suppress(FEATURE, DefaultTriggers.PHASE_START, 0));
        }
    }
}
