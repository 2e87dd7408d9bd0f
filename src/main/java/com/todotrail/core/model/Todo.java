package com.todotrail.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A tracked unit of work at one tier of the planning hierarchy.
 * <p>
 * Parent references are plain ids resolved through the store on demand.
 *
 * @param id                 storage id, {@code {tier}-{identifier}} (e.g. "task-2.1.3")
 * @param title              short title
 * @param description        free-text description, scanned for scope creep
 * @param status             lifecycle status
 * @param tier               hierarchy level
 * @param parentId           id of the owning todo one tier up; null only for features
 * @param planningDocPath    planning document this todo was extracted from
 * @param planningDocSection section of that document
 * @param createdAt          creation instant
 * @param updatedAt          last save instant
 * @param completedAt        when the todo reached {@link TodoStatus#COMPLETED}
 * @param blockedBy          ids this todo waits on
 * @param blocks             ids waiting on this todo
 * @param tags               free-form labels
 * @param metadata           free-form attributes owned by callers
 * @param citations          upstream changes this todo should be aware of
 * @param scope              abstraction policy
 * @param scopeViolations    violations accepted in warn mode, kept for later review
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Todo(
    String id,
    String title,
    String description,
    TodoStatus status,
    TodoTier tier,
    String parentId,
    String planningDocPath,
    String planningDocSection,
    Instant createdAt,
    Instant updatedAt,
    Instant completedAt,
    List<String> blockedBy,
    List<String> blocks,
    List<String> tags,
    Map<String, Object> metadata,
    List<Citation> citations,
    Scope scope,
    List<ScopeViolation> scopeViolations
) implements Serializable {

    public Todo {
        blockedBy = blockedBy == null ? List.of() : List.copyOf(blockedBy);
        blocks = blocks == null ? List.of() : List.copyOf(blocks);
        tags = tags == null ? List.of() : List.copyOf(tags);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        citations = citations == null ? List.of() : List.copyOf(citations);
        scopeViolations = scopeViolations == null ? List.of() : List.copyOf(scopeViolations);
    }

    public Todo withCitations(List<Citation> newCitations) {
        return toBuilder().citations(newCitations).build();
    }

    public Todo withCitation(Citation citation) {
        var updated = new ArrayList<>(citations);
        updated.add(citation);
        return withCitations(updated);
    }

    public Todo withUpdatedAt(Instant instant) {
        return toBuilder().updatedAt(instant).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id).title(title).description(description).status(status).tier(tier)
                .parentId(parentId).planningDocPath(planningDocPath).planningDocSection(planningDocSection)
                .createdAt(createdAt).updatedAt(updatedAt).completedAt(completedAt)
                .blockedBy(blockedBy).blocks(blocks).tags(tags).metadata(metadata)
                .citations(citations).scope(scope).scopeViolations(scopeViolations);
    }

    public static final class Builder {
        private String id;
        private String title;
        private String description;
        private TodoStatus status = TodoStatus.PENDING;
        private TodoTier tier;
        private String parentId;
        private String planningDocPath;
        private String planningDocSection;
        private Instant createdAt;
        private Instant updatedAt;
        private Instant completedAt;
        private List<String> blockedBy;
        private List<String> blocks;
        private List<String> tags;
        private Map<String, Object> metadata;
        private List<Citation> citations;
        private Scope scope;
        private List<ScopeViolation> scopeViolations;

        private Builder() {
        }

        public Builder id(String id) { this.id = id; return this; }
        public Builder title(String title) { this.title = title; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder status(TodoStatus status) { this.status = status; return this; }
        public Builder tier(TodoTier tier) { this.tier = tier; return this; }
        public Builder parentId(String parentId) { this.parentId = parentId; return this; }
        public Builder planningDocPath(String path) { this.planningDocPath = path; return this; }
        public Builder planningDocSection(String section) { this.planningDocSection = section; return this; }
        public Builder createdAt(Instant createdAt) { this.createdAt = createdAt; return this; }
        public Builder updatedAt(Instant updatedAt) { this.updatedAt = updatedAt; return this; }
        public Builder completedAt(Instant completedAt) { this.completedAt = completedAt; return this; }
        public Builder blockedBy(List<String> blockedBy) { this.blockedBy = blockedBy; return this; }
        public Builder blocks(List<String> blocks) { this.blocks = blocks; return this; }
        public Builder tags(List<String> tags) { this.tags = tags; return this; }
        public Builder metadata(Map<String, Object> metadata) { this.metadata = metadata; return this; }
        public Builder citations(List<Citation> citations) { this.citations = citations; return this; }
        public Builder scope(Scope scope) { this.scope = scope; return this; }
        public Builder scopeViolations(List<ScopeViolation> violations) { this.scopeViolations = violations; return this; }

        public Todo build() {
            return new Todo(id, title, description, status, tier, parentId, planningDocPath, planningDocSection,
                    createdAt, updatedAt, completedAt, blockedBy, blocks, tags, metadata, citations, scope,
                    scopeViolations);
        }
    }
}
