package com.todotrail.dispatch.cli;

import com.todotrail.core.changelog.ChangeHistory;
import com.todotrail.core.changelog.ChangeLog;
import com.todotrail.core.model.ChangeLogEntry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.time.Instant;
import java.util.List;

/**
 * CLI command to show the change log of a feature.
 */
@Command(name = "log", mixinStandardHelpOptions = true, description = "Show the change log of a feature")
@Component
public class LogCommand implements Runnable {

    @Mixin
    FeatureOption feature;

    @Option(names = "--todo", description = "Only changes to this todo")
    String todoId;

    @Option(names = "--since", description = "Only changes after this instant (ISO-8601)")
    Instant since;

    @Option(names = {"--limit", "-n"}, description = "Number of entries to show", defaultValue = "20")
    int limit;

    private final ChangeLog changeLog;

    public LogCommand(ChangeLog changeLog) {
        this.changeLog = changeLog;
    }

    @Override
    public void run() {
        ChangeHistory history = changeLog.read(feature.name());
        List<ChangeLogEntry> entries = since != null ? history.since(since) : history.entries();
        if (todoId != null) {
            entries = entries.stream().filter(e -> todoId.equals(e.todoId())).toList();
        }
        if (entries.isEmpty()) {
            ConsoleOutput.info("No changes recorded for feature " + feature.name());
            return;
        }
        List<ChangeLogEntry> shown = entries.subList(Math.max(0, entries.size() - limit), entries.size());

        System.out.println();
        System.out.printf("  %-12s %-26s %-22s %-20s %s%n", "ID", "TIMESTAMP", "TYPE", "TODO", "AUTHOR");
        System.out.println("  " + "-".repeat(96));
        for (ChangeLogEntry entry : shown) {
            System.out.printf("  %-12s %-26s %-22s %-20s %s%n",
                    entry.id(),
                    entry.timestamp(),
                    entry.changeType().value(),
                    entry.todoId() != null ? truncate(entry.todoId(), 20) : "-",
                    entry.author());
            if (entry.reason() != null) {
                System.out.println("               " + entry.reason());
            }
            if (entry.hasUnresolvedConflicts()) {
                ConsoleOutput.warn(entry.id() + " carries unresolved conflicts");
            }
        }
        System.out.println();
        System.out.printf("  Showing %d of %d entries%n", shown.size(), entries.size());
    }

    private static String truncate(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
