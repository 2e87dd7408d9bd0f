package com.todotrail.core.changelog;

import com.todotrail.core.config.TodoTrailProperties;
import com.todotrail.core.metrics.TodoTrailMetrics;
import com.todotrail.core.model.ChangeLogEntry;
import com.todotrail.core.persistence.ChangeLogFile;
import com.todotrail.core.persistence.FeatureWorkspace;
import com.todotrail.core.persistence.FeatureWorkspaces;
import com.todotrail.core.persistence.FileMetadata;
import com.todotrail.core.persistence.JsonFileStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Append-only, per-feature log of mutations stored in {@code change-log.json}.
 * <p>
 * Timestamps strictly increase per feature: an entry appended in the same millisecond
 * as its predecessor, or while the clock runs backwards, is stamped one millisecond
 * after the previous entry.
 */
@Service
public class ChangeLog {

    private static final Logger log = LoggerFactory.getLogger(ChangeLog.class);

    private final FeatureWorkspaces workspaces;
    private final JsonFileStore files;
    private final Clock clock;
    private final TodoTrailProperties properties;
    private final TodoTrailMetrics metrics;

    public ChangeLog(FeatureWorkspaces workspaces, JsonFileStore files, Clock clock,
                     TodoTrailProperties properties, TodoTrailMetrics metrics) {
        this.workspaces = workspaces;
        this.files = files;
        this.clock = clock;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * Appends a drafted entry, assigning its id, sequence and timestamp.
     *
     * @param draft the entry; {@code changeType} is required, {@code author} defaults to the configured author
     * @return the entry as stored
     */
    public ChangeLogEntry append(String feature, ChangeLogEntry.Builder draft) {
        Objects.requireNonNull(draft.changeType(), "changeType");
        FeatureWorkspace workspace = workspaces.get(feature);
        return workspace.locked(() -> {
            ChangeLogFile current = load(workspace);
            List<ChangeLogEntry> entries = new ArrayList<>(current.entries());
            ChangeLogEntry last = entries.isEmpty() ? null : entries.get(entries.size() - 1);

            long sequence = last == null ? 1 : last.sequence() + 1;
            Instant now = clock.instant();
            if (last != null && !now.isAfter(last.timestamp())) {
                now = last.timestamp().plusMillis(1);
            }
            ChangeLogEntry entry = draft
                    .id("change-" + sequence)
                    .sequence(sequence)
                    .timestamp(now)
                    .author(draft.author() != null ? draft.author() : properties.getAuthor())
                    .build();
            entries.add(entry);
            files.write(workspace.changeLogFile(),
                    new ChangeLogFile(feature, entries, FileMetadata.of(now, entries.size())));

            metrics.recordChangeAppended(entry.changeType().value());
            log.debug("Appended {} {} for {}", entry.id(), entry.changeType().value(), entry.todoId());
            return entry;
        });
    }

    public ChangeHistory read(String feature) {
        List<ChangeLogEntry> entries = load(workspaces.get(feature)).entries();
        return entries.isEmpty() ? ChangeHistory.empty() : new ChangeHistory(entries);
    }

    /** Entries with a timestamp strictly after {@code instant}. */
    public List<ChangeLogEntry> readSince(String feature, Instant instant) {
        return read(feature).since(instant);
    }

    public Optional<ChangeLogEntry> find(String feature, String entryId) {
        return read(feature).find(entryId);
    }

    private ChangeLogFile load(FeatureWorkspace workspace) {
        return files.read(workspace.changeLogFile(), ChangeLogFile.class)
                .orElseGet(() -> new ChangeLogFile(workspace.feature(), List.of(), null));
    }
}
