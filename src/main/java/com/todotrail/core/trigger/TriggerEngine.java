package com.todotrail.core.trigger;

import com.todotrail.core.changelog.ChangeHistory;
import com.todotrail.core.changelog.ChangeLog;
import com.todotrail.core.citation.CitationEngine;
import com.todotrail.core.citation.CitationQuery;
import com.todotrail.core.citation.TodoCitation;
import com.todotrail.core.config.TodoTrailProperties;
import com.todotrail.core.error.NotFoundException;
import com.todotrail.core.error.NotSuppressibleException;
import com.todotrail.core.error.ValidationException;
import com.todotrail.core.error.ValidationIssue;
import com.todotrail.core.metrics.TodoTrailMetrics;
import com.todotrail.core.model.ChangeLogEntry;
import com.todotrail.core.model.ChangeType;
import com.todotrail.core.model.Citation;
import com.todotrail.core.model.CitationContext;
import com.todotrail.core.model.CitationPriority;
import com.todotrail.core.model.CitationType;
import com.todotrail.core.model.Severity;
import com.todotrail.core.model.Todo;
import com.todotrail.core.model.TodoField;
import com.todotrail.core.model.TriggerCondition;
import com.todotrail.core.model.TriggerDefinition;
import com.todotrail.core.persistence.FeatureWorkspace;
import com.todotrail.core.persistence.FeatureWorkspaces;
import com.todotrail.core.persistence.FileMetadata;
import com.todotrail.core.persistence.JsonFileStore;
import com.todotrail.core.persistence.TriggerConfigFile;
import com.todotrail.core.persistence.TriggerConfigFile.Suppression;
import com.todotrail.core.store.TodoStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Evaluates declarative lookup triggers at workflow junctions.
 * <p>
 * Definitions and suppression windows live in {@code trigger-config.json}; a feature without
 * that file uses {@link DefaultTriggers}. Conditions are evaluated against live citation,
 * change-log and todo state on every call.
 */
@Service
public class TriggerEngine {

    private static final Logger log = LoggerFactory.getLogger(TriggerEngine.class);

    private final CitationEngine citations;
    private final ChangeLog changeLog;
    private final TodoStore todoStore;
    private final FeatureWorkspaces workspaces;
    private final JsonFileStore files;
    private final Clock clock;
    private final TodoTrailProperties properties;
    private final TodoTrailMetrics metrics;

    public TriggerEngine(CitationEngine citations, ChangeLog changeLog, TodoStore todoStore,
                         FeatureWorkspaces workspaces, JsonFileStore files, Clock clock,
                         TodoTrailProperties properties, TodoTrailMetrics metrics) {
        this.citations = citations;
        this.changeLog = changeLog;
        this.todoStore = todoStore;
        this.workspaces = workspaces;
        this.files = files;
        this.clock = clock;
        this.properties = properties;
        this.metrics = metrics;
    }

    public List<TriggerDefinition> triggers(String feature) {
        return loadConfig(workspaces.get(feature)).triggers();
    }

    /**
     * Replaces the feature's trigger definitions. Suppressions of triggers that remain are kept.
     */
    public void configure(String feature, List<TriggerDefinition> triggers) {
        FeatureWorkspace workspace = workspaces.get(feature);
        workspace.locked(() -> {
            TriggerConfigFile current = loadConfig(workspace);
            Set<String> ids = triggers.stream().map(TriggerDefinition::id).collect(Collectors.toSet());
            List<Suppression> kept = current.suppressions().stream()
                    .filter(s -> ids.contains(s.triggerId()))
                    .toList();
            writeConfig(workspace, triggers, kept);
            log.info("Configured {} trigger(s) for {}", triggers.size(), feature);
        });
    }

    /**
     * Triggers of {@code junction} whose conditions all hold and that are not suppressed.
     */
    public List<TriggerDefinition> detect(String feature, CitationContext junction, TriggerContext context) {
        Instant now = clock.instant();
        TriggerConfigFile config = loadConfig(workspaces.get(feature));
        Evaluation evaluation = new Evaluation(feature, context, now);

        List<TriggerDefinition> fired = new ArrayList<>();
        for (TriggerDefinition trigger : config.triggers()) {
            if (trigger.junction() != junction) {
                continue;
            }
            if (!trigger.conditions().stream().allMatch(c -> evaluate(evaluation, c))) {
                continue;
            }
            if (isSuppressed(config, trigger, now)) {
                log.debug("Trigger {} suppressed", trigger.id());
                continue;
            }
            metrics.recordTriggerFired(trigger.id(), junction.value());
            fired.add(trigger);
        }
        return fired;
    }

    /**
     * The citations to show for a fired trigger: the focus todo's pending citations at the
     * trigger's junction.
     */
    public TriggerActivation activate(String feature, TriggerDefinition trigger, TriggerContext context) {
        if (!context.hasTodo()) {
            return new TriggerActivation(trigger, List.of());
        }
        List<TodoCitation> shown = citations.pending(feature, context.todoId(), trigger.junction()).stream()
                .map(c -> new TodoCitation(context.todoId(), c))
                .toList();
        log.info("Trigger {} activated for {} with {} citation(s)", trigger.id(), context.todoId(), shown.size());
        return new TriggerActivation(trigger, shown);
    }

    /**
     * Suppresses a trigger for {@code hours}, replacing any earlier window.
     *
     * @return end of the suppression window
     * @throws NotSuppressibleException if the trigger is not suppressible
     */
    public Instant suppress(String feature, String triggerId, int hours) {
        if (hours <= 0) {
            throw new ValidationException("Suppression hours must be positive",
                    List.of(new ValidationIssue("hours", "was " + hours, "Use a positive number of hours")));
        }
        FeatureWorkspace workspace = workspaces.get(feature);
        return workspace.locked(() -> {
            TriggerConfigFile config = loadConfig(workspace);
            TriggerDefinition trigger = config.triggers().stream()
                    .filter(t -> t.id().equals(triggerId))
                    .findFirst()
                    .orElseThrow(() -> new NotFoundException("Trigger not found: " + triggerId));
            if (!trigger.suppressible()) {
                throw new NotSuppressibleException("Trigger " + triggerId + " cannot be suppressed");
            }
            Instant now = clock.instant();
            Instant until = now.plus(Duration.ofHours(hours));
            List<Suppression> suppressions = new ArrayList<>();
            for (Suppression s : config.suppressions()) {
                if (!s.triggerId().equals(triggerId) && s.suppressedUntil().isAfter(now)) {
                    suppressions.add(s);
                }
            }
            suppressions.add(new Suppression(triggerId, until));
            writeConfig(workspace, config.triggers(), suppressions);
            log.info("Suppressed trigger {} until {}", triggerId, until);
            return until;
        });
    }

    private boolean evaluate(Evaluation e, TriggerCondition condition) {
        return switch (condition.type()) {
            case HAS_UNREVIEWED_CITATIONS -> e.pendingCitations(null).stream()
                    .anyMatch(c -> c.priority().atLeast(condition.priority()));
            case HAS_HIGH_PRIORITY_CITATIONS -> e.pendingCitations(null).stream()
                    .anyMatch(c -> c.priority().atLeast(orDefault(condition.priority(), CitationPriority.HIGH)));
            case HAS_CITATIONS_IN_CONTEXT -> condition.context() != null
                    && !e.pendingCitations(condition.context()).isEmpty();
            case HAS_CONFLICTS -> e.conflicts(false).anyMatch(s -> s.atLeast(condition.severity()));
            case HAS_HIGH_SEVERITY_CONFLICTS -> e.conflicts(false)
                    .anyMatch(s -> s.atLeast(orDefault(condition.severity(), Severity.HIGH)));
            case HAS_CONFLICTS_AFFECTING_TODO -> e.context.hasTodo()
                    && e.conflicts(true).anyMatch(s -> s.atLeast(condition.severity()));
            case HAS_RECENT_CHANGES -> !e.recent(condition).isEmpty();
            case HAS_PROPAGATION_CHANGES -> e.recent(condition).stream()
                    .anyMatch(entry -> entry.changeType().isPropagation());
            case HAS_PLANNING_DOC_CHANGES -> e.recent(condition).stream()
                    .anyMatch(entry -> entry.changeType().isPlanningDoc());
            case TODO_STATUS_CHANGED -> e.context.hasTodo()
                    && e.statusChanged(condition, id -> id.equals(e.context.todoId()));
            case PARENT_STATUS_CHANGED -> e.parentId() != null
                    && e.statusChanged(condition, id -> id.equals(e.parentId()));
            case CHILD_STATUS_CHANGED -> e.context.hasTodo()
                    && e.statusChanged(condition, e.childIds()::contains);
        };
    }

    private static <T> T orDefault(T value, T fallback) {
        return value != null ? value : fallback;
    }

    private static boolean isSuppressed(TriggerConfigFile config, TriggerDefinition trigger, Instant now) {
        return trigger.suppressible() && config.suppressions().stream()
                .anyMatch(s -> s.triggerId().equals(trigger.id()) && s.suppressedUntil().isAfter(now));
    }

    private TriggerConfigFile loadConfig(FeatureWorkspace workspace) {
        return files.read(workspace.triggerConfigFile(), TriggerConfigFile.class)
                .orElseGet(() -> new TriggerConfigFile(workspace.feature(),
                        DefaultTriggers.all(properties.getTriggers().getDefaultWindowHours()), List.of(), null));
    }

    private void writeConfig(FeatureWorkspace workspace, List<TriggerDefinition> triggers,
                             List<Suppression> suppressions) {
        files.write(workspace.triggerConfigFile(), new TriggerConfigFile(workspace.feature(), triggers,
                suppressions, FileMetadata.of(clock.instant(), triggers.size())));
    }

    /**
     * State shared by the conditions of one {@link #detect} call. Each piece is loaded on first use.
     */
    private final class Evaluation {
        private final String feature;
        private final TriggerContext context;
        private final Instant now;
        private ChangeHistory history;
        private List<TodoCitation> allCitations;
        private Todo focus;
        private boolean focusLoaded;

        Evaluation(String feature, TriggerContext context, Instant now) {
            this.feature = feature;
            this.context = context;
            this.now = now;
        }

        List<Citation> pendingCitations(CitationContext junction) {
            return context.hasTodo() ? citations.pending(feature, context.todoId(), junction) : List.of();
        }

        /**
         * Severities of open conflicts: unresolved conflicts recorded in the change log whose
         * entry nobody has reviewed or dismissed a citation of yet, plus pending conflict
         * citations on the focus todo.
         */
        Stream<Severity> conflicts(boolean affectingFocusOnly) {
            Set<String> acknowledged = new HashSet<>();
            Set<String> citedByFocus = new HashSet<>();
            for (TodoCitation tc : allCitations()) {
                if (tc.citation().isReviewed() || tc.citation().isDismissed()) {
                    acknowledged.add(tc.citation().changeLogId());
                } else if (tc.todoId().equals(context.todoId())) {
                    citedByFocus.add(tc.citation().changeLogId());
                }
            }
            Predicate<ChangeLogEntry> relevant = affectingFocusOnly
                    ? entry -> context.todoId().equals(entry.todoId()) || citedByFocus.contains(entry.id())
                    : entry -> true;

            Stream<Severity> logged = history().stream()
                    .filter(relevant)
                    .filter(entry -> !acknowledged.contains(entry.id()))
                    .flatMap(entry -> entry.conflicts().stream())
                    .filter(conflict -> !conflict.isResolved())
                    .map(conflict -> conflict.effectiveSeverity());
            Stream<Severity> cited = pendingCitations(null).stream()
                    .filter(c -> c.type() == CitationType.CONFLICT_DETECTED)
                    .map(c -> c.priority().asSeverity());
            return Stream.concat(logged, cited);
        }

        List<ChangeLogEntry> recent(TriggerCondition condition) {
            int hours = condition.hours() != null ? condition.hours()
                    : properties.getTriggers().getDefaultWindowHours();
            return history().since(now.minus(Duration.ofHours(hours)));
        }

        boolean statusChanged(TriggerCondition condition, Predicate<String> todoFilter) {
            return recent(condition).stream()
                    .filter(entry -> entry.todoId() != null && todoFilter.test(entry.todoId()))
                    .anyMatch(entry -> entry.changeType() == ChangeType.TODO_STATUS_CHANGED
                            || entry.touches(TodoField.STATUS));
        }

        String parentId() {
            Todo todo = focus();
            return todo == null ? null : todo.parentId();
        }

        Set<String> childIds() {
            return todoStore.children(feature, context.todoId()).stream()
                    .map(Todo::id)
                    .collect(Collectors.toSet());
        }

        private Todo focus() {
            if (!focusLoaded) {
                focus = context.hasTodo() ? todoStore.get(feature, context.todoId()).orElse(null) : null;
                focusLoaded = true;
            }
            return focus;
        }

        private ChangeHistory history() {
            if (history == null) {
                history = changeLog.read(feature);
            }
            return history;
        }

        private List<TodoCitation> allCitations() {
            if (allCitations == null) {
                allCitations = citations.query(feature, CitationQuery.all().includingDismissed());
            }
            return allCitations;
        }
    }
}
