package io.taskloom.model;

import java.util.Locale;

public enum Role {
    ARCHITECT,
    CODE_DEVELOPER,
    PROJECT_MANAGER,
    CODE_REVIEWER,
    ASSISTANT,
    ORCHESTRATOR;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Role fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("role must not be blank");
        }
        String normalized = raw.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (Role value : values()) {
            if (value.name().equals(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown role: " + raw);
    }
}
