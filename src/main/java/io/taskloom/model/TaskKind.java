package io.taskloom.model;

import java.util.Locale;

/**
 * Unit of work a worker can be spawned for. Every kind is performed by exactly one role.
 */
public enum TaskKind {
    CREATE_SPEC(Role.ARCHITECT, 5),
    IMPLEMENT(Role.CODE_DEVELOPER, 3),
    REFACTORING_ANALYSIS(Role.ARCHITECT, 8),
    AUTO_PLANNING(Role.PROJECT_MANAGER, 8),
    REVIEW(Role.CODE_REVIEWER, 5);

    private final Role role;
    private final int defaultPriority;

    TaskKind(Role role, int defaultPriority) {
        this.role = role;
        this.defaultPriority = defaultPriority;
    }

    public Role role() {
        return role;
    }

    /** Queue priority of tasks the controller creates for this kind. */
    public int defaultPriority() {
        return defaultPriority;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TaskKind fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("task kind must not be blank");
        }
        String normalized = raw.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (TaskKind value : values()) {
            if (value.name().equals(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown task kind: " + raw);
    }
}
