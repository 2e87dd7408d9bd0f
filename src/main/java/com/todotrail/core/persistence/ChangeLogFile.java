package com.todotrail.core.persistence;

import com.todotrail.core.model.ChangeLogEntry;

import java.util.List;

public record ChangeLogFile(String feature, List<ChangeLogEntry> entries, FileMetadata metadata) {

    public ChangeLogFile {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }
}
