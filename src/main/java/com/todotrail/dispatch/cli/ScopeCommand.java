package com.todotrail.dispatch.cli;

import com.todotrail.core.error.NotFoundException;
import com.todotrail.core.model.Scope;
import com.todotrail.core.model.ScopeCorrection;
import com.todotrail.core.model.Todo;
import com.todotrail.core.model.TodoTier;
import com.todotrail.core.scope.ScopeEngine;
import com.todotrail.core.scope.ScopeValidation;
import com.todotrail.core.store.TodoStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

import java.util.List;

/**
 * CLI command to check todos against their abstraction scope.
 */
@Command(name = "scope", mixinStandardHelpOptions = true,
        description = "Check todos for scope creep")
@Component
public class ScopeCommand implements Runnable {

    private final ScopeEngine scopeEngine;
    private final TodoStore todoStore;

    public ScopeCommand(ScopeEngine scopeEngine, TodoStore todoStore) {
        this.scopeEngine = scopeEngine;
        this.todoStore = todoStore;
    }

    @Override
    public void run() {
        new CommandLine(this).usage(System.out);
    }

    @Command(name = "check", description = "Validate a todo and suggest where misplaced detail belongs")
    int check(@Mixin FeatureOption feature,
              @Parameters(index = "0", description = "Todo id") String todoId) {
        Todo todo = todoStore.get(feature.name(), todoId)
                .orElseThrow(() -> new NotFoundException("Todo not found: " + todoId));
        Todo parent = todo.parentId() != null ? todoStore.get(feature.name(), todo.parentId()).orElse(null) : null;

        ScopeValidation validation = scopeEngine.validate(todo, parent);
        if (validation.isValid()) {
            ConsoleOutput.success(todoId + " stays within its " + todo.tier().value() + " scope");
            return 0;
        }
        validation.violations().forEach(ConsoleOutput::violation);
        List<ScopeCorrection> corrections = scopeEngine.suggestCorrections(validation.violations());
        for (ScopeCorrection correction : corrections) {
            System.out.printf("    %s %s -> %s%n", correction.type().value(), correction.detail(),
                    correction.suggestedLocation());
        }
        return 1;
    }

    @Command(name = "defaults", description = "Default scope of a tier")
    void defaults(@Parameters(index = "0", description = "feature, phase, session or task") TodoTier tier) {
        Scope scope = scopeEngine.defaultScope(tier);
        System.out.printf("  %-12s %s%n", "Abstraction:", scope.abstraction().value());
        System.out.printf("  %-12s %s%n", "Detail:", scope.detailLevel().value());
        System.out.printf("  %-12s %s%n", "Allowed:", String.join(", ", scope.allowedDetails()));
        System.out.printf("  %-12s %s%n", "Forbidden:", String.join(", ", scope.forbiddenDetails()));
    }
}
