package com.todotrail.core.persistence;

import com.todotrail.core.model.Rollback;

import java.util.List;

public record RollbackHistoryFile(String feature, List<Rollback> rollbacks, FileMetadata metadata) {

    public RollbackHistoryFile {
        rollbacks = rollbacks == null ? List.of() : List.copyOf(rollbacks);
    }
}
