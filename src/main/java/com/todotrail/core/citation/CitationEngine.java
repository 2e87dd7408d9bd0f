package com.todotrail.core.citation;

import com.todotrail.core.changelog.ChangeLog;
import com.todotrail.core.error.NotFoundException;
import com.todotrail.core.logging.MdcContext;
import com.todotrail.core.metrics.TodoTrailMetrics;
import com.todotrail.core.model.ChangeLogEntry;
import com.todotrail.core.model.Citation;
import com.todotrail.core.model.CitationContext;
import com.todotrail.core.model.CitationMetadata;
import com.todotrail.core.model.CitationPriority;
import com.todotrail.core.model.CitationType;
import com.todotrail.core.model.Ids;
import com.todotrail.core.model.Todo;
import com.todotrail.core.persistence.FeatureWorkspaces;
import com.todotrail.core.store.TodoStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Links todos to the change-log entries they should be aware of.
 * <p>
 * Citations are stored on the todo that carries them. Reviewing, dismissing and deferring
 * update the citation in place; none of them is recorded in the change log.
 */
@Service
public class CitationEngine {

    private static final Logger log = LoggerFactory.getLogger(CitationEngine.class);

    private final TodoStore todoStore;
    private final ChangeLog changeLog;
    private final FeatureWorkspaces workspaces;
    private final Clock clock;
    private final TodoTrailMetrics metrics;

    public CitationEngine(TodoStore todoStore, ChangeLog changeLog, FeatureWorkspaces workspaces,
                          Clock clock, TodoTrailMetrics metrics) {
        this.todoStore = todoStore;
        this.changeLog = changeLog;
        this.workspaces = workspaces;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Attaches a new citation to a todo.
     *
     * @throws NotFoundException if the todo does not exist
     */
    public Citation create(String feature, String todoId, String changeLogId, CitationType type,
                           List<CitationContext> context, CitationPriority priority, CitationMetadata metadata) {
        return workspaces.get(feature).locked(() -> {
            Todo todo = requireTodo(feature, todoId);
            Instant now = clock.instant();
            Citation citation = new Citation(Ids.generate("citation", now), changeLogId, type, priority, context,
                    now, null, null, metadata, null);
            todoStore.save(feature, todo.withCitation(citation));
            metrics.recordCitationCreated(type.value(), priority.value());
            log.debug("Cited {} on {} ({}, {})", changeLogId, todoId, type.value(), priority.value());
            return citation;
        });
    }

    /**
     * Cites a change-log entry on a todo, deriving type, priority and metadata from the entry.
     *
     * @return empty when the entry does not exist or its change type is not citation-worthy
     */
    public Optional<Citation> createFromChange(String feature, String todoId, String changeLogId,
                                               List<CitationContext> context) {
        Optional<ChangeLogEntry> entry = changeLog.find(feature, changeLogId);
        if (entry.isEmpty()) {
            log.debug("No change {} in {}, nothing to cite", changeLogId, feature);
            return Optional.empty();
        }
        return CitationRules.citationTypeFor(entry.get().changeType())
                .map(type -> create(feature, todoId, changeLogId, type, context,
                        CitationRules.priorityFor(entry.get(), context), CitationRules.metadataFor(entry.get())));
    }

    /**
     * Cites one change on several todos and links the created citations to each other.
     */
    public List<Citation> createForChange(String feature, String changeLogId, List<String> todoIds,
                                          List<CitationContext> context) {
        return workspaces.get(feature).locked(() -> {
            Optional<ChangeLogEntry> entry = changeLog.find(feature, changeLogId);
            if (entry.isEmpty() || CitationRules.citationTypeFor(entry.get().changeType()).isEmpty()) {
                return List.<Citation>of();
            }
            CitationType type = CitationRules.citationTypeFor(entry.get().changeType()).get();
            CitationPriority priority = CitationRules.priorityFor(entry.get(), context);
            CitationMetadata base = CitationRules.metadataFor(entry.get());
            CitationMetadata metadata = new CitationMetadata(base.reason(), base.impact(), todoIds,
                    base.requiresReview(), null);

            List<Citation> created = new ArrayList<>();
            List<String> createdOn = new ArrayList<>();
            for (String todoId : todoIds) {
                if (todoStore.get(feature, todoId).isEmpty()) {
                    log.warn("Skipping citation of {} on missing todo {}", changeLogId, todoId);
                    continue;
                }
                created.add(create(feature, todoId, changeLogId, type, context, priority, metadata));
                createdOn.add(todoId);
            }
            if (created.size() < 2) {
                return created;
            }

            List<String> ids = created.stream().map(Citation::id).toList();
            List<Citation> linked = new ArrayList<>();
            for (int i = 0; i < created.size(); i++) {
                String ownId = created.get(i).id();
                List<String> related = ids.stream().filter(id -> !id.equals(ownId)).toList();
                linked.add(updateCitation(feature, createdOn.get(i), ownId, c -> c.withRelatedCitations(related)));
            }
            return linked;
        });
    }

    /**
     * Non-dismissed citations of a todo, most relevant first.
     *
     * @param junction restricts the result to citations relevant there; null for all
     */
    public List<Citation> lookup(String feature, String todoId, CitationContext junction) {
        Instant now = clock.instant();
        return todoStore.get(feature, todoId)
                .map(todo -> todo.citations().stream()
                        .filter(c -> !c.isDismissed())
                        .filter(c -> c.appliesTo(junction))
                        .sorted(byRelevance(junction, now))
                        .toList())
                .orElse(List.of());
    }

    /**
     * Citations still asking for attention: unreviewed, not dismissed and not deferred.
     */
    public List<Citation> pending(String feature, String todoId, CitationContext junction) {
        Instant now = clock.instant();
        return lookup(feature, todoId, junction).stream()
                .filter(c -> !c.isReviewed())
                .filter(c -> !c.isDeferredAt(now))
                .toList();
    }

    /**
     * Marks a citation reviewed. Reviewing twice, or reviewing a dismissed citation, changes nothing.
     */
    public Citation review(String feature, String todoId, String citationId) {
        return workspaces.get(feature).locked(() -> {
            Citation current = requireCitation(requireTodo(feature, todoId), citationId);
            if (current.isReviewed() || current.isDismissed()) {
                return current;
            }
            metrics.recordCitationReviewed();
            return updateCitation(feature, todoId, citationId, c -> c.withReviewedAt(clock.instant()));
        });
    }

    /**
     * Dismisses a citation for good; it is never returned by lookups or triggers again.
     */
    public Citation dismiss(String feature, String todoId, String citationId) {
        return workspaces.get(feature).locked(() -> {
            Citation current = requireCitation(requireTodo(feature, todoId), citationId);
            if (current.isDismissed()) {
                return current;
            }
            metrics.recordCitationDismissed();
            log.debug("Dismissed citation {} on {}", citationId, todoId);
            return updateCitation(feature, todoId, citationId, c -> c.withDismissedAt(clock.instant()));
        });
    }

    /**
     * Hides a citation from pending lists and triggers until {@code until}.
     */
    public Citation defer(String feature, String todoId, String citationId, Instant until) {
        return workspaces.get(feature).locked(() -> {
            Citation current = requireCitation(requireTodo(feature, todoId), citationId);
            if (current.isDismissed()) {
                return current;
            }
            CitationMetadata metadata = current.metadata() != null ? current.metadata() : CitationMetadata.empty();
            return updateCitation(feature, todoId, citationId,
                    c -> c.withMetadata(metadata.withReviewDeadline(until)));
        });
    }

    /**
     * Reporting query across all todos of a feature.
     */
    public List<TodoCitation> query(String feature, CitationQuery query) {
        List<Todo> todos = query.todoId() != null
                ? todoStore.get(feature, query.todoId()).map(List::of).orElse(List.of())
                : todoStore.listAll(feature);
        List<TodoCitation> results = new ArrayList<>();
        for (Todo todo : todos) {
            for (Citation citation : todo.citations()) {
                if (query.matches(todo.id(), citation)) {
                    results.add(new TodoCitation(todo.id(), citation));
                }
            }
        }
        return results;
    }

    private Citation updateCitation(String feature, String todoId, String citationId, UnaryOperator<Citation> change) {
        MdcContext.setOperation(feature, todoId, "citation");
        try {
            Todo todo = requireTodo(feature, todoId);
            List<Citation> citations = new ArrayList<>(todo.citations());
            Citation updated = null;
            for (int i = 0; i < citations.size(); i++) {
                if (citations.get(i).id().equals(citationId)) {
                    updated = change.apply(citations.get(i));
                    citations.set(i, updated);
                }
            }
            if (updated == null) {
                throw new NotFoundException("Citation not found: " + citationId + " on " + todoId);
            }
            todoStore.save(feature, todo.withCitations(citations));
            return updated;
        } finally {
            MdcContext.clear();
        }
    }

    private Todo requireTodo(String feature, String todoId) {
        return todoStore.get(feature, todoId)
                .orElseThrow(() -> new NotFoundException("Todo not found: " + todoId + " in " + feature));
    }

    private static Citation requireCitation(Todo todo, String citationId) {
        return todo.citations().stream()
                .filter(c -> c.id().equals(citationId))
                .findFirst()
                .orElseThrow(() -> new NotFoundException("Citation not found: " + citationId + " on " + todo.id()));
    }

    private static Comparator<Citation> byRelevance(CitationContext junction, Instant now) {
        return Comparator.comparingInt((Citation c) -> CitationRules.score(c, junction, now)).reversed()
                .thenComparing(Citation::createdAt, Comparator.nullsLast(Comparator.reverseOrder()));
    }
}
