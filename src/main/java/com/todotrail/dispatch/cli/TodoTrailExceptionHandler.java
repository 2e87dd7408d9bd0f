package com.todotrail.dispatch.cli;

import com.todotrail.core.error.TodoTrailException;
import com.todotrail.core.error.ValidationIssue;
import picocli.CommandLine;
import picocli.CommandLine.IExecutionExceptionHandler;
import picocli.CommandLine.ParseResult;

/**
 * Prints TodoTrail failures with their issues instead of a stack trace.
 */
class TodoTrailExceptionHandler implements IExecutionExceptionHandler {

    static final int EXIT_REJECTED = 1;

    @Override
    public int handleExecutionException(Exception ex, CommandLine commandLine, ParseResult parseResult) throws Exception {
        if (!(ex instanceof TodoTrailException failure)) {
            throw ex;
        }
        ConsoleOutput.error(failure.getMessage());
        for (ValidationIssue issue : failure.getIssues()) {
            ConsoleOutput.issue(issue);
        }
        return EXIT_REJECTED;
    }
}
