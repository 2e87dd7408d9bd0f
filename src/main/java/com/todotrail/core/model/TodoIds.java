package com.todotrail.core.model;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parsing and validation of todo ids ({@code feature-{slug}}, {@code phase-P},
 * {@code session-P.S}, {@code task-P.S.T}).
 */
public final class TodoIds {

    private static final Pattern FEATURE = Pattern.compile("^feature-[A-Za-z0-9][A-Za-z0-9._-]*$");
    private static final Pattern PHASE = Pattern.compile("^phase-\\d+$");
    private static final Pattern SESSION = Pattern.compile("^session-\\d+\\.\\d+$");
    private static final Pattern TASK = Pattern.compile("^task-\\d+\\.\\d+\\.\\d+$");

    private TodoIds() {}

    public static boolean isWellFormed(String id, TodoTier tier) {
        if (id == null || tier == null) {
            return false;
        }
        return switch (tier) {
            case FEATURE -> FEATURE.matcher(id).matches();
            case PHASE -> PHASE.matcher(id).matches();
            case SESSION -> SESSION.matcher(id).matches();
            case TASK -> TASK.matcher(id).matches();
        };
    }

    /** The part after the tier prefix: "2.1" for "session-2.1". */
    public static String identifier(String id) {
        int dash = id.indexOf('-');
        return dash < 0 ? id : id.substring(dash + 1);
    }

    public static Optional<TodoTier> tierOf(String id) {
        if (id == null) {
            return Optional.empty();
        }
        for (TodoTier tier : TodoTier.values()) {
            if (isWellFormed(id, tier)) {
                return Optional.of(tier);
            }
        }
        return Optional.empty();
    }

    /**
     * Whether a child's structured identifier extends its parent's ("2.1" under "2").
     * Phases may sit under any feature.
     */
    public static boolean extendsParent(String childId, String parentId) {
        if (parentId.startsWith("feature-")) {
            return true;
        }
        return identifier(childId).startsWith(identifier(parentId) + ".");
    }

    public static String phaseId(int phase) {
        return "phase-" + phase;
    }

    public static String sessionId(int phase, int session) {
        return "session-" + phase + "." + session;
    }

    public static String taskId(int phase, int session, int task) {
        return "task-" + phase + "." + session + "." + task;
    }

    /** Phase number a phase, session or task id belongs to. */
    public static Optional<String> phaseNumber(String id) {
        var tier = tierOf(id);
        if (tier.isEmpty() || tier.get() == TodoTier.FEATURE) {
            return Optional.empty();
        }
        String identifier = identifier(id);
        int dot = identifier.indexOf('.');
        return Optional.of(dot < 0 ? identifier : identifier.substring(0, dot));
    }

    /** "P.S" session number a session or task id belongs to. */
    public static Optional<String> sessionNumber(String id) {
        var tier = tierOf(id);
        if (tier.isEmpty() || tier.get().depth() < TodoTier.SESSION.depth()) {
            return Optional.empty();
        }
        String[] parts = identifier(id).split("\\.");
        return Optional.of(parts[0] + "." + parts[1]);
    }
}
