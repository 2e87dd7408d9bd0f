package com.todotrail.core.persistence;

import com.todotrail.core.error.TodoTrailStorageException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * The on-disk state of one feature plus the mutex guarding it.
 * <p>
 * Every read-modify-write on a feature's files runs inside {@link #locked}. The lock is
 * reentrant so compound operations may call into other components that lock again.
 */
public class FeatureWorkspace {

    private static final Pattern FEATURE_NAME = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9._-]*$");

    private final String feature;
    private final Path dir;
    private final ReentrantLock lock = new ReentrantLock();

    public FeatureWorkspace(Path root, String feature) {
        if (feature == null || !FEATURE_NAME.matcher(feature).matches()) {
            throw new IllegalArgumentException("Invalid feature name: " + feature);
        }
        this.feature = feature;
        this.dir = root.resolve(feature).resolve("todos");
    }

    public String feature() {
        return feature;
    }

    public Path dir() {
        return dir;
    }

    public Path featureTodosFile() {
        return dir.resolve("feature-todos.json");
    }

    public Path phaseTodosFile(String phase) {
        return dir.resolve("phase-" + phase + "-todos.json");
    }

    public Path sessionTodosFile(String session) {
        return dir.resolve("session-" + session + "-todos.json");
    }

    public Path changeLogFile() {
        return dir.resolve("change-log.json");
    }

    public Path rollbackHistoryFile() {
        return dir.resolve("rollback-history.json");
    }

    public Path previousStatesFile() {
        return dir.resolve("previous-states.json");
    }

    public Path triggerConfigFile() {
        return dir.resolve("trigger-config.json");
    }

    /** All {@code *-todos.json} files currently on disk, sorted by name. */
    public List<Path> todoFiles() {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> p.getFileName().toString().endsWith("-todos.json"))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new TodoTrailStorageException("Failed to list " + dir + ": " + e.getMessage(), e);
        }
    }

    public <T> T locked(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void locked(Runnable action) {
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }
}
