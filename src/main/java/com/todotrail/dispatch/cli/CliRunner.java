package com.todotrail.dispatch.cli;

import com.todotrail.core.model.CitationContext;
import com.todotrail.core.model.CitationPriority;
import com.todotrail.core.model.TodoStatus;
import com.todotrail.core.model.TodoTier;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the appropriate command.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final TodoTrailCommand todoTrailCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(TodoTrailCommand todoTrailCommand, IFactory factory) {
        this.todoTrailCommand = todoTrailCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = commandLine(todoTrailCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Builds the command line with the converters for the hyphenated values used in the data
     * files ("session-start", "in_progress").
     */
    static CommandLine commandLine(TodoTrailCommand command, IFactory factory) {
        return new CommandLine(command, factory)
                .registerConverter(CitationContext.class, CitationContext::fromValue)
                .registerConverter(CitationPriority.class, CitationPriority::fromValue)
                .registerConverter(TodoStatus.class, TodoStatus::fromValue)
                .registerConverter(TodoTier.class, TodoTier::fromValue)
                .setExecutionExceptionHandler(new TodoTrailExceptionHandler());
    }
}
