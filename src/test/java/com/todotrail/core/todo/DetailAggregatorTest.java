package com.todotrail.core.todo;

import com.todotrail.core.TodoTrailFixture;
import com.todotrail.core.model.Todo;
import com.todotrail.core.model.TodoStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DetailAggregatorTest {

    private static final String FEATURE = "shop";

    @TempDir
    Path root;

    private TodoTrailFixture fx;

    @BeforeEach
    void setUp() {
        fx = new TodoTrailFixture(root);
        fx.seed(FEATURE);
    }

    private TodoSummary summarize(String todoId) {
        Todo todo = fx.todoStore.get(FEATURE, todoId).orElseThrow();
        return fx.aggregator.summarize(FEATURE, todo);
    }

    @Test
    void phaseObjectiveIsFirstSentence() {
        TodoSummary summary = summarize("feature-" + FEATURE);

        assertEquals("Checkout redesign", summary.title());
        assertEquals(List.of("Support cards and wallets"), summary.objectives());
        assertEquals(TodoStatus.PENDING, summary.status());
        assertTrue(summary.nextSteps().isEmpty());
    }

    @Test
    void openTasksAreNextSteps() {
        TodoSummary summary = summarize("session-1.1");

        assertEquals(List.of("Add card form", "Validate card numbers"), summary.nextSteps());
        assertTrue(summary.objectives().isEmpty());
        assertEquals(new TodoSummary.Progress(0, 0, 2, 2), summary.progress());
    }

    @Test
    void statusFollowsChildren() {
        fx.todos.setStatus(FEATURE, "task-1.1.1", TodoStatus.COMPLETED, null);

        TodoSummary partly = summarize("session-1.1");
        assertEquals(TodoStatus.IN_PROGRESS, partly.status());
        assertEquals(List.of("Validate card numbers"), partly.nextSteps());
        assertEquals(new TodoSummary.Progress(1, 0, 1, 2), partly.progress());

        fx.todos.setStatus(FEATURE, "task-1.1.2", TodoStatus.COMPLETED, null);
        assertEquals(TodoStatus.COMPLETED, summarize("session-1.1").status());
    }

    @Test
    void blockersAreKeyDependencies() {
        fx.todos.update(FEATURE, "task-1.1.2", b -> b.blockedBy(List.of("task-1.1.1")), null);
        fx.todos.setStatus(FEATURE, "task-1.1.1", TodoStatus.BLOCKED, null);

        TodoSummary summary = summarize("session-1.1");
        assertEquals(List.of("task-1.1.1"), summary.keyDependencies());
        assertEquals(List.of("Validate card numbers"), summary.nextSteps());
        assertEquals(2, summary.progress().pending());
    }

    @Test
    void leafHasEmptySummary() {
        TodoSummary summary = summarize("task-1.1.1");

        assertEquals(0, summary.progress().total());
        assertEquals(TodoStatus.PENDING, summary.status());
    }
}
