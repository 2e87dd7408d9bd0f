package com.todotrail.dispatch.cli;

import com.todotrail.core.citation.CitationEngine;
import com.todotrail.core.citation.CitationQuery;
import com.todotrail.core.citation.TodoCitation;
import com.todotrail.core.model.Citation;
import com.todotrail.core.model.CitationContext;
import com.todotrail.core.model.CitationPriority;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * CLI command to look up and act on citations.
 */
@Command(name = "citations", mixinStandardHelpOptions = true,
        description = "Look up, review, dismiss and defer citations")
@Component
public class CitationsCommand implements Runnable {

    private final CitationEngine citationEngine;
    private final Clock clock;

    public CitationsCommand(CitationEngine citationEngine, Clock clock) {
        this.citationEngine = citationEngine;
        this.clock = clock;
    }

    @Override
    public void run() {
        new CommandLine(this).usage(System.out);
    }

    @Command(name = "lookup", description = "Citations of a todo, most relevant first")
    void lookup(@Mixin FeatureOption feature,
                @Parameters(index = "0", description = "Todo id") String todoId,
                @Option(names = {"--at", "-j"}, description = "Workflow junction, e.g. session-start")
                CitationContext junction) {
        List<Citation> citations = citationEngine.lookup(feature.name(), todoId, junction);
        if (citations.isEmpty()) {
            ConsoleOutput.info("No citations for " + todoId);
            return;
        }
        citations.forEach(c -> ConsoleOutput.citation(todoId, c));
    }

    @Command(name = "query", description = "Citations across the feature")
    void query(@Mixin FeatureOption feature,
               @Option(names = "--todo") String todoId,
               @Option(names = "--change") String changeLogId,
               @Option(names = "--min-priority") CitationPriority minPriority,
               @Option(names = "--context") CitationContext context,
               @Option(names = "--unreviewed", description = "Only citations not yet reviewed") boolean unreviewed,
               @Option(names = "--include-dismissed") boolean includeDismissed) {
        CitationQuery query = CitationQuery.all();
        if (todoId != null) {
            query = query.forTodo(todoId);
        }
        if (changeLogId != null) {
            query = query.forChange(changeLogId);
        }
        if (minPriority != null) {
            query = query.atLeast(minPriority);
        }
        if (context != null) {
            query = query.inContext(context);
        }
        if (unreviewed) {
            query = query.reviewed(false);
        }
        if (includeDismissed) {
            query = query.includingDismissed();
        }
        List<TodoCitation> found = citationEngine.query(feature.name(), query);
        if (found.isEmpty()) {
            ConsoleOutput.info("No matching citations");
            return;
        }
        found.forEach(tc -> ConsoleOutput.citation(tc.todoId(), tc.citation()));
        System.out.printf("%n  %d citation(s)%n", found.size());
    }

    @Command(name = "review", description = "Mark a citation reviewed")
    void review(@Mixin FeatureOption feature,
                @Parameters(index = "0", description = "Todo id") String todoId,
                @Parameters(index = "1", description = "Citation id") String citationId) {
        citationEngine.review(feature.name(), todoId, citationId);
        ConsoleOutput.success("Reviewed " + citationId);
    }

    @Command(name = "dismiss", description = "Dismiss a citation")
    void dismiss(@Mixin FeatureOption feature,
                 @Parameters(index = "0", description = "Todo id") String todoId,
                 @Parameters(index = "1", description = "Citation id") String citationId) {
        citationEngine.dismiss(feature.name(), todoId, citationId);
        ConsoleOutput.success("Dismissed " + citationId);
    }

    @Command(name = "defer", description = "Hide a citation from pending lookups for a while")
    void defer(@Mixin FeatureOption feature,
               @Parameters(index = "0", description = "Todo id") String todoId,
               @Parameters(index = "1", description = "Citation id") String citationId,
               @Option(names = "--hours", defaultValue = "24") int hours) {
        Instant until = clock.instant().plus(Duration.ofHours(hours));
        citationEngine.defer(feature.name(), todoId, citationId, until);
        ConsoleOutput.success("Deferred " + citationId + " until " + until);
    }
}
