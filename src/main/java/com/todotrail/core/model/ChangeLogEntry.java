package com.todotrail.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable record of one mutation.
 *
 * @param id                   assigned on append ("change-17")
 * @param sequence             per-feature position, assigned on append, strictly increasing
 * @param timestamp            assigned on append, strictly increasing per feature
 * @param author               who made the change
 * @param changeType           kind of mutation
 * @param tier                 tier of the affected todo
 * @param todoId               affected todo, if the change concerns one
 * @param planningDocPath      affected planning document, if any
 * @param before               partial snapshot of the changed fields before the change
 * @param after                partial snapshot of the changed fields after the change
 * @param reason               why the change was made
 * @param propagationTriggered whether the change was propagated to other todos
 * @param relatedChanges       ids of entries logically tied to this one
 * @param conflicts            conflicts recorded with the change
 * @param metadata             free-form attributes
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChangeLogEntry(
    String id,
    long sequence,
    Instant timestamp,
    String author,
    ChangeType changeType,
    TodoTier tier,
    String todoId,
    String planningDocPath,
    Map<String, Object> before,
    Map<String, Object> after,
    String reason,
    boolean propagationTriggered,
    List<String> relatedChanges,
    List<ChangeConflict> conflicts,
    Map<String, Object> metadata
) implements Serializable {

    public ChangeLogEntry {
        before = before == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(before));
        after = after == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(after));
        relatedChanges = relatedChanges == null ? List.of() : List.copyOf(relatedChanges);
        conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /** Todo content fields named in either partial snapshot. */
    @JsonIgnore
    public Set<TodoField> changedFields() {
        Set<TodoField> fields = EnumSet.noneOf(TodoField.class);
        if (before != null) {
            before.keySet().forEach(k -> TodoField.fromName(k).ifPresent(fields::add));
        }
        if (after != null) {
            after.keySet().forEach(k -> TodoField.fromName(k).ifPresent(fields::add));
        }
        return fields;
    }

    public boolean touches(TodoField field) {
        return (after != null && after.containsKey(field.fieldName()))
                || (before != null && before.containsKey(field.fieldName()));
    }

    @JsonIgnore
    public boolean hasUnresolvedConflicts() {
        return conflicts.stream().anyMatch(c -> !c.isResolved());
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder().id(id).sequence(sequence).timestamp(timestamp).author(author)
                .changeType(changeType).tier(tier).todoId(todoId).planningDocPath(planningDocPath)
                .before(before).after(after).reason(reason).propagationTriggered(propagationTriggered)
                .relatedChanges(relatedChanges).conflicts(conflicts).metadata(metadata);
    }

    /**
     * Drafts an entry; id, sequence and timestamp are filled in by the change log on append.
     */
    public static final class Builder {
        private String id;
        private long sequence;
        private Instant timestamp;
        private String author;
        private ChangeType changeType;
        private TodoTier tier;
        private String todoId;
        private String planningDocPath;
        private Map<String, Object> before;
        private Map<String, Object> after;
        private String reason;
        private boolean propagationTriggered;
        private List<String> relatedChanges;
        private List<ChangeConflict> conflicts;
        private Map<String, Object> metadata;

        private Builder() {
        }

        public Builder id(String id) { this.id = id; return this; }
        public Builder sequence(long sequence) { this.sequence = sequence; return this; }
        public Builder timestamp(Instant timestamp) { this.timestamp = timestamp; return this; }
        public Builder author(String author) { this.author = author; return this; }
        public Builder changeType(ChangeType changeType) { this.changeType = changeType; return this; }
        public Builder tier(TodoTier tier) { this.tier = tier; return this; }
        public Builder todoId(String todoId) { this.todoId = todoId; return this; }
        public Builder planningDocPath(String path) { this.planningDocPath = path; return this; }
        public Builder before(Map<String, Object> before) { this.before = before; return this; }
        public Builder after(Map<String, Object> after) { this.after = after; return this; }
        public Builder reason(String reason) { this.reason = reason; return this; }
        public Builder propagationTriggered(boolean triggered) { this.propagationTriggered = triggered; return this; }
        public Builder relatedChanges(List<String> related) { this.relatedChanges = related; return this; }
        public Builder conflicts(List<ChangeConflict> conflicts) { this.conflicts = conflicts; return this; }
        public Builder metadata(Map<String, Object> metadata) { this.metadata = metadata; return this; }

        public ChangeType changeType() { return changeType; }
        public String author() { return author; }

        public ChangeLogEntry build() {
            return new ChangeLogEntry(id, sequence, timestamp, author, changeType, tier, todoId, planningDocPath,
                    before, after, reason, propagationTriggered, relatedChanges, conflicts, metadata);
        }
    }
}
