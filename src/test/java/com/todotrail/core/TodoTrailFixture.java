package com.todotrail.core;

import com.todotrail.core.changelog.ChangeLog;
import com.todotrail.core.citation.CitationEngine;
import com.todotrail.core.config.TodoTrailProperties;
import com.todotrail.core.metrics.TodoTrailMetrics;
import com.todotrail.core.model.TodoTier;
import com.todotrail.core.persistence.FeatureWorkspaces;
import com.todotrail.core.persistence.JsonFileStore;
import com.todotrail.core.rollback.RollbackEngine;
import com.todotrail.core.scope.ScopeEngine;
import com.todotrail.core.store.TodoStore;
import com.todotrail.core.todo.DetailAggregator;
import com.todotrail.core.todo.NewTodo;
import com.todotrail.core.todo.TodoService;
import com.todotrail.core.trigger.TriggerEngine;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Wires the TodoTrail components by hand over a temporary directory, the way Spring would.
 */
public class TodoTrailFixture {

    public static final Instant START = Instant.parse("2026-03-02T09:00:00Z");

    public final MutableClock clock = new MutableClock(START);
    public final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    public final TodoTrailProperties properties = new TodoTrailProperties();
    public final JsonFileStore files = new JsonFileStore(JsonFileStore.defaultMapper());
    public final FeatureWorkspaces workspaces;
    public final TodoTrailMetrics metrics = new TodoTrailMetrics(registry);
    public final TodoStore todoStore;
    public final ChangeLog changeLog;
    public final ScopeEngine scopeEngine = new ScopeEngine();
    public final CitationEngine citations;
    public final RollbackEngine rollbacks;
    public final TriggerEngine triggers;
    public final TodoService todos;
    public final DetailAggregator aggregator;

    public TodoTrailFixture(Path root) {
        workspaces = new FeatureWorkspaces(root);
        todoStore = new TodoStore(workspaces, files, clock);
        changeLog = new ChangeLog(workspaces, files, clock, properties, metrics);
        citations = new CitationEngine(todoStore, changeLog, workspaces, clock, metrics);
        rollbacks = new RollbackEngine(todoStore, changeLog, workspaces, files, clock, properties, metrics);
        triggers = new TriggerEngine(citations, changeLog, todoStore, workspaces, files, clock, properties, metrics);
        todos = new TodoService(todoStore, changeLog, scopeEngine, citations, rollbacks, workspaces, clock,
                properties, metrics);
        aggregator = new DetailAggregator(todoStore);
    }

    /**
     * Creates {@code feature-<feature>}, {@code phase-1}, {@code session-1.1} and
     * {@code task-1.1.1} and {@code task-1.1.2}.
     */
    public void seed(String feature) {
        todos.create(feature, NewTodo.of("feature-" + feature, TodoTier.FEATURE, null,
                "Checkout redesign", "Let shoppers pay in fewer screens"));
        todos.create(feature, NewTodo.of("phase-1", TodoTier.PHASE, "feature-" + feature,
                "Payment options", "Support cards and wallets. Keep the old flow as fallback."));
        todos.create(feature, NewTodo.of("session-1.1", TodoTier.SESSION, "phase-1",
                "Card payments", "Accept card payments through the existing provider"));
        todos.create(feature, NewTodo.of("task-1.1.1", TodoTier.TASK, "session-1.1",
                "Add card form", "Add the form to src/checkout/CardForm.vue"));
        todos.create(feature, NewTodo.of("task-1.1.2", TodoTier.TASK, "session-1.1",
                "Validate card numbers", "Luhn check before submit"));
    }
}
