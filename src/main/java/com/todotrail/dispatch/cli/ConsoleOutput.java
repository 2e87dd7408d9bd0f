package com.todotrail.dispatch.cli;

import com.todotrail.core.error.ValidationIssue;
import com.todotrail.core.model.Citation;
import com.todotrail.core.model.RollbackConflict;
import com.todotrail.core.model.ScopeViolation;
import com.todotrail.core.model.Todo;
import com.todotrail.core.model.TodoStatus;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for TodoTrail CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) TODOTRAIL v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [TODOTRAIL]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void issue(ValidationIssue issue) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "    @|fg(red) -|@ " + issue.field() + ": " + issue.reason()
                        + (issue.suggestedFix() != null ? " @|faint (" + issue.suggestedFix() + ")|@" : "")));
    }

    public static void todo(Todo todo) {
        String indent = "  ".repeat(todo.tier() != null ? todo.tier().depth() : 0);
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                indent + statusMarker(todo.status()) + " @|bold " + todo.id() + "|@ " + todo.title()
                        + (todo.scopeViolations().isEmpty() ? ""
                        : " @|fg(yellow) [" + todo.scopeViolations().size() + " scope]|@")));
    }

    public static void citation(String todoId, Citation citation) {
        String color = switch (citation.priority()) {
            case CRITICAL -> "fg(red),bold";
            case HIGH -> "fg(red)";
            case MEDIUM -> "fg(yellow)";
            case LOW -> "faint";
        };
        String state = citation.isDismissed() ? "dismissed" : citation.isReviewed() ? "reviewed" : "open";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|" + color + " " + citation.priority().value().toUpperCase() + "|@ " + citation.id()
                        + " on " + todoId + " -> " + citation.changeLogId()
                        + " (" + citation.type().value() + ", " + state + ")"));
    }

    public static void violation(ScopeViolation violation) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(yellow) [SCOPE]|@ " + violation.type().value()
                        + (violation.detailType() != null ? " " + violation.detailType() : "")
                        + " at " + violation.location() + ": " + violation.description()));
    }

    public static void conflict(RollbackConflict conflict) {
        String color = conflict.isResolved() ? "faint" : "fg(red)";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|" + color + " [" + conflict.severity().value().toUpperCase() + "]|@ "
                        + conflict.field() + ": " + conflict.description()
                        + (conflict.isResolved() ? " (" + conflict.resolution() + ")" : "")));
    }

    private static String statusMarker(TodoStatus status) {
        return switch (status) {
            case COMPLETED -> "@|fg(green) [x]|@";
            case IN_PROGRESS -> "@|fg(cyan) [~]|@";
            case BLOCKED -> "@|fg(red) [!]|@";
            case CANCELLED -> "@|faint [-]|@";
            case PENDING -> "[ ]";
        };
    }
}
