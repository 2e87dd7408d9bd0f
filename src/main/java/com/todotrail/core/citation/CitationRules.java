package com.todotrail.core.citation;

import com.todotrail.core.model.ChangeLogEntry;
import com.todotrail.core.model.ChangeType;
import com.todotrail.core.model.Citation;
import com.todotrail.core.model.CitationContext;
import com.todotrail.core.model.CitationMetadata;
import com.todotrail.core.model.CitationPriority;
import com.todotrail.core.model.CitationType;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Rules that turn change-log entries into citations and rank citations for display.
 * <p>
 * The change type table is exhaustive: types absent from it (creations, deletions,
 * change requests, bulk operations, preserved propagations) never produce a citation.
 */
public final class CitationRules {

    private static final Map<ChangeType, CitationType> CITATION_TYPES = new EnumMap<>(ChangeType.class);

    static {
        CITATION_TYPES.put(ChangeType.TODO_STATUS_CHANGED, CitationType.STATUS_CHANGE);
        CITATION_TYPES.put(ChangeType.TODO_UPDATED, CitationType.DESCRIPTION_CHANGE);
        CITATION_TYPES.put(ChangeType.TODO_MOVED, CitationType.PARENT_CHANGE);
        CITATION_TYPES.put(ChangeType.PLANNING_DOC_UPDATED, CitationType.PLANNING_DOC_CHANGE);
        CITATION_TYPES.put(ChangeType.PLANNING_DOC_SYNCED, CitationType.PLANNING_DOC_CHANGE);
        CITATION_TYPES.put(ChangeType.PROPAGATION_TRIGGERED, CitationType.PROPAGATION_CHANGE);
        CITATION_TYPES.put(ChangeType.PROPAGATION_COMPLETED, CitationType.PROPAGATION_CHANGE);
        CITATION_TYPES.put(ChangeType.PROPAGATION_CONFLICT, CitationType.CONFLICT_DETECTED);
        CITATION_TYPES.put(ChangeType.ROLLBACK_APPLIED, CitationType.ROLLBACK_APPLIED);
    }

    private CitationRules() {}

    public static Optional<CitationType> citationTypeFor(ChangeType changeType) {
        return Optional.ofNullable(CITATION_TYPES.get(changeType));
    }

    public static CitationPriority priorityFor(ChangeLogEntry entry, Collection<CitationContext> context) {
        if (context.contains(CitationContext.CONFLICT_DETECTION)
                || entry.changeType() == ChangeType.PROPAGATION_CONFLICT
                || !entry.conflicts().isEmpty()) {
            return CitationPriority.CRITICAL;
        }
        if (entry.changeType() == ChangeType.TODO_STATUS_CHANGED || entry.changeType().isPropagation()) {
            return CitationPriority.HIGH;
        }
        return CitationPriority.MEDIUM;
    }

    public static String impactOf(ChangeLogEntry entry) {
        if (entry.changeType() == ChangeType.TODO_STATUS_CHANGED) {
            return "affects_todo_status";
        }
        if (entry.changeType().isPropagation()) {
            return "affects_multiple_todos";
        }
        if (!entry.conflicts().isEmpty()) {
            return "has_conflicts";
        }
        return "affects_todo";
    }

    public static CitationMetadata metadataFor(ChangeLogEntry entry) {
        boolean requiresReview = entry.conflicts().stream()
                .anyMatch(c -> Boolean.TRUE.equals(c.requiresReview()));
        List<String> affected = entry.todoId() == null ? List.of() : List.of(entry.todoId());
        return new CitationMetadata(entry.reason(), impactOf(entry), affected, requiresReview, null);
    }

    /**
     * Relevance of a citation at a junction: priority, plus 2 while unreviewed, plus 2 when
     * younger than a day or 1 when younger than a week, plus 2 for an exact junction match
     * or 1 for a match in the same family (session, phase, task).
     */
    public static int score(Citation citation, CitationContext junction, Instant now) {
        int score = citation.priority().score();
        if (!citation.isReviewed()) {
            score += 2;
        }
        if (citation.createdAt() != null) {
            Duration age = Duration.between(citation.createdAt(), now);
            if (age.compareTo(Duration.ofHours(24)) < 0) {
                score += 2;
            } else if (age.compareTo(Duration.ofDays(7)) < 0) {
                score += 1;
            }
        }
        if (junction != null) {
            if (citation.context().contains(junction)) {
                score += 2;
            } else if (citation.context().stream().anyMatch(c -> c.family().equals(junction.family()))) {
                score += 1;
            }
        }
        return score;
    }
}
