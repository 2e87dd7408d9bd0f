package com.todotrail.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for TodoTrail.
 * Routes to subcommands: todos, log, citations, triggers, rollback, scope.
 */
@Command(
        name = "todotrail",
        mixinStandardHelpOptions = true,
        version = "TodoTrail 0.1.0",
        description = "Change log, citations, rollback and scope checks for planning todos",
        subcommands = {
                TodosCommand.class,
                LogCommand.class,
                CitationsCommand.class,
                TriggersCommand.class,
                RollbackCommand.class,
                ScopeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class TodoTrailCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
