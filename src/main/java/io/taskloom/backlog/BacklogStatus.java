package io.taskloom.backlog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum BacklogStatus {
    PLANNED,
    IN_PROGRESS,
    BLOCKED,
    COMPLETE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Accepts the wire names plus the spellings hand-edited backlogs tend to use
     * ("in progress", "done", "completed"). Unknown values read as blocked so they are never
     * dispatched.
     */
    @JsonCreator
    public static BacklogStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return PLANNED;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
        return switch (normalized) {
            case "planned", "todo", "pending" -> PLANNED;
            case "in_progress", "running", "started" -> IN_PROGRESS;
            case "complete", "completed", "done" -> COMPLETE;
            default -> BLOCKED;
        };
    }
}
