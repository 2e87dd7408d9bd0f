package com.todotrail.core.persistence;

import java.time.Instant;

/**
 * Header block written into every workspace file.
 */
public record FileMetadata(String version, Instant lastUpdated, Integer totalEntries) {

    public static final String CURRENT_VERSION = "1.0";

    public static FileMetadata of(Instant now, int totalEntries) {
        return new FileMetadata(CURRENT_VERSION, now, totalEntries);
    }
}
