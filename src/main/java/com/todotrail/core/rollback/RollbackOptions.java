package com.todotrail.core.rollback;

/**
 * @param force  override blocking conflicts, recording them as resolved
 * @param author recorded on the rollback and its change-log entry; null for the configured author
 */
public record RollbackOptions(boolean force, String author) {

    public static RollbackOptions defaults() {
        return new RollbackOptions(false, null);
    }

    public static RollbackOptions forced() {
        return new RollbackOptions(true, null);
    }

    public RollbackOptions by(String newAuthor) {
        return new RollbackOptions(force, newAuthor);
    }
}
