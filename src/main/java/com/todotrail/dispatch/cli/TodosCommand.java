package com.todotrail.dispatch.cli;

import com.todotrail.core.error.NotFoundException;
import com.todotrail.core.model.Todo;
import com.todotrail.core.model.TodoStatus;
import com.todotrail.core.model.TodoTier;
import com.todotrail.core.store.TodoStore;
import com.todotrail.core.todo.DetailAggregator;
import com.todotrail.core.todo.NewTodo;
import com.todotrail.core.todo.TodoService;
import com.todotrail.core.todo.TodoSummary;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;

/**
 * CLI command to list, inspect and edit todos of a feature.
 */
@Command(name = "todos", mixinStandardHelpOptions = true,
        description = "List, show and edit the todos of a feature")
@Component
public class TodosCommand implements Runnable {

    private final TodoService todoService;
    private final TodoStore todoStore;
    private final DetailAggregator detailAggregator;

    public TodosCommand(TodoService todoService, TodoStore todoStore, DetailAggregator detailAggregator) {
        this.todoService = todoService;
        this.todoStore = todoStore;
        this.detailAggregator = detailAggregator;
    }

    @Override
    public void run() {
        new CommandLine(this).usage(System.out);
    }

    @Command(name = "list", description = "List the todos of a feature, parents first")
    void list(@Mixin FeatureOption feature,
              @Option(names = {"--tier", "-t"}, description = "Only list todos of this tier") TodoTier tier) {
        List<Todo> todos = todoStore.listAll(feature.name()).stream()
                .filter(t -> tier == null || t.tier() == tier)
                .toList();
        if (todos.isEmpty()) {
            ConsoleOutput.info("No todos for feature " + feature.name());
            return;
        }
        todos.forEach(ConsoleOutput::todo);
    }

    @Command(name = "show", description = "Show one todo and the roll-up of its children")
    void show(@Mixin FeatureOption feature,
              @Parameters(index = "0", description = "Todo id") String todoId) {
        Todo todo = todoStore.get(feature.name(), todoId)
                .orElseThrow(() -> new NotFoundException("Todo not found: " + todoId));

        ConsoleOutput.todo(todo);
        System.out.printf("  %-12s %s%n", "Tier:", todo.tier().value());
        System.out.printf("  %-12s %s%n", "Parent:", todo.parentId() != null ? todo.parentId() : "-");
        if (todo.planningDocPath() != null) {
            System.out.printf("  %-12s %s%s%n", "Doc:", todo.planningDocPath(),
                    todo.planningDocSection() != null ? " " + todo.planningDocSection() : "");
        }
        if (todo.description() != null) {
            System.out.printf("  %-12s %s%n", "Description:", todo.description());
        }
        System.out.printf("  %-12s %d (%d open)%n", "Citations:", todo.citations().size(),
                todo.citations().stream().filter(c -> !c.isReviewed() && !c.isDismissed()).count());
        todo.scopeViolations().forEach(ConsoleOutput::violation);

        if (todo.tier() != TodoTier.TASK) {
            TodoSummary summary = detailAggregator.summarize(feature.name(), todo);
            TodoSummary.Progress progress = summary.progress();
            System.out.println();
            System.out.printf("  Rolled up: %s, %d/%d completed, %d in progress, %d pending%n",
                    summary.status().value(), progress.completed(), progress.total(),
                    progress.inProgress(), progress.pending());
            summary.objectives().forEach(o -> System.out.println("    objective: " + o));
            summary.nextSteps().forEach(s -> System.out.println("    next: " + s));
            if (!summary.keyDependencies().isEmpty()) {
                System.out.println("    blocked by: " + String.join(", ", summary.keyDependencies()));
            }
        }
    }

    @Command(name = "add", description = "Create a todo")
    void add(@Mixin FeatureOption feature,
             @Option(names = "--id", required = true) String id,
             @Option(names = "--tier", required = true) TodoTier newTier,
             @Option(names = "--parent") String parentId,
             @Option(names = "--title", required = true) String title,
             @Option(names = "--description") String description,
             @Option(names = "--doc") String planningDocPath,
             @Option(names = "--section") String planningDocSection) {
        NewTodo request = NewTodo.of(id, newTier, parentId, title, description);
        if (planningDocPath != null) {
            request = request.withPlanningDoc(planningDocPath, planningDocSection);
        }
        Todo created = todoService.create(feature.name(), request);
        ConsoleOutput.success("Created " + created.id());
        created.scopeViolations().forEach(ConsoleOutput::violation);
    }

    @Command(name = "status", description = "Change the status of a todo")
    void status(@Mixin FeatureOption feature,
                @Parameters(index = "0", description = "Todo id") String todoId,
                @Parameters(index = "1", description = "New status") TodoStatus status,
                @Option(names = {"--reason", "-r"}) String reason) {
        Todo updated = todoService.setStatus(feature.name(), todoId, status, reason);
        ConsoleOutput.success(updated.id() + " is now " + updated.status().value());
    }

    @Command(name = "move", description = "Move a todo under another parent")
    void move(@Mixin FeatureOption feature,
              @Parameters(index = "0", description = "Todo id") String todoId,
              @Parameters(index = "1", description = "New parent id") String parentId,
              @Option(names = {"--reason", "-r"}) String reason) {
        Todo moved = todoService.move(feature.name(), todoId, parentId, reason);
        ConsoleOutput.success(moved.id() + " moved under " + moved.parentId());
    }
}
