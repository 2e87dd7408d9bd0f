package com.todotrail.core.persistence;

import com.todotrail.core.model.TriggerDefinition;

import java.time.Instant;
import java.util.List;

/**
 * Contents of {@code trigger-config.json}: trigger definitions plus active suppression windows.
 */
public record TriggerConfigFile(String feature, List<TriggerDefinition> triggers, List<Suppression> suppressions,
                                FileMetadata metadata) {

    public TriggerConfigFile {
        triggers = triggers == null ? List.of() : List.copyOf(triggers);
        suppressions = suppressions == null ? List.of() : List.copyOf(suppressions);
    }

    public record Suppression(String triggerId, Instant suppressedUntil) {
    }
}
