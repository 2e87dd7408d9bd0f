package com.todotrail.dispatch.cli;

import com.todotrail.core.error.ValidationException;
import com.todotrail.core.error.ValidationIssue;
import com.todotrail.core.model.PreviousState;
import com.todotrail.core.model.Rollback;
import com.todotrail.core.model.RollbackStatus;
import com.todotrail.core.model.TodoField;
import com.todotrail.core.rollback.RollbackEngine;
import com.todotrail.core.rollback.RollbackOptions;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.List;

/**
 * CLI command to inspect stored states and roll todos back to them.
 */
@Command(name = "rollback", mixinStandardHelpOptions = true,
        description = "Roll todos back to stored states")
@Component
public class RollbackCommand implements Runnable {

    /** Exit code of {@code apply} when conflicts stopped the rollback. */
    static final int EXIT_CONFLICT = 4;

    private final RollbackEngine rollbackEngine;

    public RollbackCommand(RollbackEngine rollbackEngine) {
        this.rollbackEngine = rollbackEngine;
    }

    @Override
    public void run() {
        new CommandLine(this).usage(System.out);
    }

    @Command(name = "states", description = "Stored states of a todo, newest first")
    void states(@Mixin FeatureOption feature,
                @Parameters(index = "0", description = "Todo id") String todoId,
                @Option(names = {"--limit", "-n"}, defaultValue = "10") int limit) {
        List<PreviousState> states = rollbackEngine.getStates(feature.name(), todoId);
        if (states.isEmpty()) {
            ConsoleOutput.info("No stored states for " + todoId);
            return;
        }
        System.out.println();
        System.out.printf("  %-34s %-26s %-8s %-14s %s%n", "STATE", "STORED", "SEQ", "STATUS", "CHANGE");
        System.out.println("  " + "-".repeat(96));
        for (PreviousState state : states.subList(0, Math.min(limit, states.size()))) {
            System.out.printf("  %-34s %-26s %-8d %-14s %s%n",
                    state.id(),
                    state.timestamp(),
                    state.logSequence(),
                    state.state().status().value(),
                    state.changeLogId() != null ? state.changeLogId() : "-");
        }
        System.out.println();
    }

    @Command(name = "apply", description = "Roll a todo back to a stored state")
    int apply(@Mixin FeatureOption feature,
              @Parameters(index = "0", description = "Todo id") String todoId,
              @Parameters(index = "1", description = "State id") String stateId,
              @Option(names = "--fields", split = ",", description = "Restore only these fields") List<String> fields,
              @Option(names = "--partial", description = "Restore every field without a blocking conflict")
              boolean partial,
              @Option(names = "--force", description = "Override blocking conflicts") boolean force,
              @Option(names = "--author") String author,
              @Option(names = {"--reason", "-r"}) String reason) {
        RollbackOptions options = new RollbackOptions(force, author);
        Rollback result;
        if (fields != null && !fields.isEmpty()) {
            result = rollbackEngine.rollbackFields(feature.name(), todoId, stateId, toFields(fields), reason, options);
        } else if (partial) {
            result = rollbackEngine.rollbackNonConflicting(feature.name(), todoId, stateId, reason, options);
        } else {
            result = rollbackEngine.rollback(feature.name(), todoId, stateId, reason, options);
        }

        result.conflicts().forEach(ConsoleOutput::conflict);
        if (result.status() == RollbackStatus.CONFLICT) {
            ConsoleOutput.error("Rollback " + result.id() + " stopped by conflicts; use --force or --partial");
            return EXIT_CONFLICT;
        }
        ConsoleOutput.success(result.type().value() + " rollback " + result.id() + " of " + todoId
                + " to " + stateId + " completed");
        if (!result.discardedChanges().isEmpty()) {
            ConsoleOutput.info("Discarded changes: " + String.join(", ", result.discardedChanges()));
        }
        return 0;
    }

    @Command(name = "history", description = "Rollbacks recorded for the feature")
    void history(@Mixin FeatureOption feature,
                 @Option(names = "--todo") String todoId) {
        List<Rollback> rollbacks = rollbackEngine.getRollbackHistory(feature.name(), todoId);
        if (rollbacks.isEmpty()) {
            ConsoleOutput.info("No rollbacks recorded");
            return;
        }
        System.out.println();
        System.out.printf("  %-34s %-20s %-10s %-10s %s%n", "ROLLBACK", "TODO", "TYPE", "STATUS", "TO STATE");
        System.out.println("  " + "-".repeat(96));
        for (Rollback rollback : rollbacks) {
            System.out.printf("  %-34s %-20s %-10s %-10s %s%n",
                    rollback.id(),
                    rollback.todoId(),
                    rollback.type().value(),
                    rollback.status().value(),
                    rollback.rolledBackTo());
        }
        System.out.println();
    }

    @Command(name = "cancel", description = "Cancel a rollback that is pending or in conflict")
    void cancel(@Mixin FeatureOption feature,
                @Parameters(index = "0", description = "Rollback id") String rollbackId) {
        Rollback cancelled = rollbackEngine.cancelRollback(feature.name(), rollbackId);
        ConsoleOutput.success(cancelled.id() + " is " + cancelled.status().value());
    }

    private static List<TodoField> toFields(List<String> names) {
        List<TodoField> fields = new ArrayList<>();
        for (String name : names) {
            fields.add(TodoField.fromName(name.trim())
                    .orElseThrow(() -> new ValidationException("Unknown field: " + name,
                            List.of(new ValidationIssue("fields", name, "Use a todo field such as status or title")))));
        }
        return fields;
    }
}
