package com.todotrail.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * A directed edge from a todo to a change-log entry the todo should be aware of.
 * <p>
 * A citation is either open, reviewed ({@code reviewedAt} set) or dismissed
 * ({@code dismissedAt} set). Dismissal is terminal.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Citation(
    String id,
    String changeLogId,
    CitationType type,
    CitationPriority priority,
    List<CitationContext> context,
    Instant createdAt,
    Instant reviewedAt,
    Instant dismissedAt,
    CitationMetadata metadata,
    List<String> relatedCitations
) implements Serializable {

    public Citation {
        context = context == null ? List.of() : List.copyOf(context);
        relatedCitations = relatedCitations == null ? List.of() : List.copyOf(relatedCitations);
    }

    @JsonIgnore
    public boolean isReviewed() {
        return reviewedAt != null;
    }

    @JsonIgnore
    public boolean isDismissed() {
        return dismissedAt != null;
    }

    public boolean appliesTo(CitationContext junction) {
        return junction == null || context.contains(junction);
    }

    /** True while the review deadline lies after {@code now}. */
    public boolean isDeferredAt(Instant now) {
        return metadata != null && metadata.reviewDeadline() != null
                && metadata.reviewDeadline().isAfter(now);
    }

    public Citation withReviewedAt(Instant instant) {
        return new Citation(id, changeLogId, type, priority, context, createdAt, instant, dismissedAt,
                metadata, relatedCitations);
    }

    public Citation withDismissedAt(Instant instant) {
        return new Citation(id, changeLogId, type, priority, context, createdAt, reviewedAt, instant,
                metadata, relatedCitations);
    }

    public Citation withMetadata(CitationMetadata newMetadata) {
        return new Citation(id, changeLogId, type, priority, context, createdAt, reviewedAt, dismissedAt,
                newMetadata, relatedCitations);
    }

    public Citation withRelatedCitations(List<String> related) {
        return new Citation(id, changeLogId, type, priority, context, createdAt, reviewedAt, dismissedAt,
                metadata, related);
    }
}
