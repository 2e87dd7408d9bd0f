package com.todotrail.core.changelog;

import com.todotrail.core.model.ChangeLogEntry;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Immutable view of a feature's change log, oldest entry first.
 */
public final class ChangeHistory {

    private static final ChangeHistory EMPTY = new ChangeHistory(List.of());

    private final List<ChangeLogEntry> entries;

    public ChangeHistory(List<ChangeLogEntry> entries) {
        this.entries = List.copyOf(entries);
    }

    public static ChangeHistory empty() {
        return EMPTY;
    }

    public List<ChangeLogEntry> entries() {
        return entries;
    }

    public Stream<ChangeLogEntry> stream() {
        return entries.stream();
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public Optional<ChangeLogEntry> last() {
        return entries.isEmpty() ? Optional.empty() : Optional.of(entries.get(entries.size() - 1));
    }

    /** Sequence of the newest entry, or 0 for an empty log. */
    public long lastSequence() {
        return last().map(ChangeLogEntry::sequence).orElse(0L);
    }

    public Optional<ChangeLogEntry> find(String id) {
        return entries.stream().filter(e -> e.id().equals(id)).findFirst();
    }

    /** Entries strictly after {@code instant}. */
    public List<ChangeLogEntry> since(Instant instant) {
        return entries.stream().filter(e -> e.timestamp().isAfter(instant)).toList();
    }

    public List<ChangeLogEntry> afterSequence(long sequence) {
        return entries.stream().filter(e -> e.sequence() > sequence).toList();
    }

    public List<ChangeLogEntry> forTodo(String todoId) {
        return entries.stream().filter(e -> todoId.equals(e.todoId())).toList();
    }
}
