package com.todotrail.dispatch.cli;

import com.todotrail.core.model.CitationContext;
import com.todotrail.core.model.TriggerDefinition;
import com.todotrail.core.trigger.TriggerActivation;
import com.todotrail.core.trigger.TriggerContext;
import com.todotrail.core.trigger.TriggerEngine;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.time.Instant;
import java.util.List;

/**
 * CLI command to evaluate lookup triggers at a workflow junction.
 */
@Command(name = "triggers", mixinStandardHelpOptions = true,
        description = "List, check and suppress lookup triggers")
@Component
public class TriggersCommand implements Runnable {

    /** Exit code of {@code check} when a fired trigger blocks until review. */
    static final int EXIT_REVIEW_REQUIRED = 3;

    private final TriggerEngine triggerEngine;

    public TriggersCommand(TriggerEngine triggerEngine) {
        this.triggerEngine = triggerEngine;
    }

    @Override
    public void run() {
        new CommandLine(this).usage(System.out);
    }

    @Command(name = "list", description = "Configured triggers of the feature")
    void list(@Mixin FeatureOption feature) {
        List<TriggerDefinition> triggers = triggerEngine.triggers(feature.name());
        System.out.println();
        System.out.printf("  %-30s %-20s %-10s %-12s %s%n", "ID", "JUNCTION", "PRIORITY", "SUPPRESSIBLE", "ACTION");
        System.out.println("  " + "-".repeat(96));
        for (TriggerDefinition trigger : triggers) {
            System.out.printf("  %-30s %-20s %-10s %-12s %s%n",
                    trigger.id(),
                    trigger.junction().value(),
                    trigger.priority().value(),
                    trigger.suppressible() ? "yes" : "no",
                    trigger.action().value());
        }
        System.out.println();
    }

    @Command(name = "check", description = "Detect and activate the triggers of a junction")
    int check(@Mixin FeatureOption feature,
              @Parameters(index = "0", description = "Workflow junction, e.g. session-start") CitationContext junction,
              @Option(names = "--todo", description = "Todo in focus") String todoId) {
        TriggerContext context = todoId != null ? TriggerContext.forTodo(todoId) : TriggerContext.featureWide();
        List<TriggerDefinition> fired = triggerEngine.detect(feature.name(), junction, context);
        if (fired.isEmpty()) {
            ConsoleOutput.success("No triggers fired at " + junction.value());
            return 0;
        }
        boolean blocking = false;
        for (TriggerDefinition trigger : fired) {
            TriggerActivation activation = triggerEngine.activate(feature.name(), trigger, context);
            ConsoleOutput.warn(trigger.name() + " fired (" + activation.priority().value() + ")");
            if (!activation.citations().isEmpty()) {
                System.out.println(activation.prompt());
            }
            blocking |= activation.blocking();
        }
        if (blocking) {
            ConsoleOutput.error("Review required before continuing");
            return EXIT_REVIEW_REQUIRED;
        }
        return 0;
    }

    @Command(name = "suppress", description = "Silence a suppressible trigger for a number of hours")
    void suppress(@Mixin FeatureOption feature,
                  @Parameters(index = "0", description = "Trigger id") String triggerId,
                  @Option(names = "--hours", defaultValue = "1") int hours) {
        Instant until = triggerEngine.suppress(feature.name(), triggerId, hours);
        ConsoleOutput.success(triggerId + " suppressed until " + until);
    }
}
