package com.todotrail.core.persistence;

import com.todotrail.core.error.TodoTrailStorageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class JsonFileStoreTest {

    @TempDir
    Path dir;

    private JsonFileStore store;

    @BeforeEach
    void setUp() {
        store = new JsonFileStore(JsonFileStore.defaultMapper());
    }

    @Test
    @DisplayName("read of a missing file is empty")
    void readMissing() {
        assertTrue(store.read(dir.resolve("nope.json"), FileMetadata.class).isEmpty());
    }

    @Test
    @DisplayName("write creates parent directories and read returns the document")
    void writeThenRead() {
        Path file = dir.resolve("a/b/meta.json");
        FileMetadata metadata = FileMetadata.of(Instant.parse("2026-03-01T10:00:00Z"), 3);

        store.write(file, metadata);

        assertEquals(metadata, store.read(file, FileMetadata.class).orElseThrow());
    }

    @Test
    @DisplayName("timestamps are written as ISO-8601 strings")
    void isoTimestamps() throws Exception {
        Path file = dir.resolve("meta.json");
        store.write(file, FileMetadata.of(Instant.parse("2026-03-01T10:00:00Z"), 1));
        assertTrue(Files.readString(file).contains("2026-03-01T10:00:00Z"));
    }

    @Test
    @DisplayName("no temp files are left behind after a write")
    void noTempFiles() throws Exception {
        store.write(dir.resolve("meta.json"), FileMetadata.of(Instant.now(), 1));
        store.write(dir.resolve("meta.json"), FileMetadata.of(Instant.now(), 2));
        try (Stream<Path> files = Files.list(dir)) {
            assertEquals(1, files.count());
        }
    }

    @Test
    @DisplayName("a corrupt file raises a storage exception naming the file")
    void corruptFile() throws Exception {
        Path file = dir.resolve("broken.json");
        Files.writeString(file, "{ not json");
        var ex = assertThrows(TodoTrailStorageException.class, () -> store.read(file, FileMetadata.class));
        assertTrue(ex.getMessage().contains("broken.json"));
    }
}
