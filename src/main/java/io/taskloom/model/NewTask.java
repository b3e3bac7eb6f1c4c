package io.taskloom.model;

import java.util.Map;

/**
 * Enqueue request. A null {@code taskId} asks the queue to generate one.
 */
public record NewTask(
        String taskId,
        String sender,
        String recipient,
        String kind,
        int priority,
        Map<String, Object> payload
) {
    public NewTask {
        if (sender == null || sender.isBlank()) {
            throw new IllegalArgumentException("sender must not be blank");
        }
        if (recipient == null || recipient.isBlank()) {
            throw new IllegalArgumentException("recipient must not be blank");
        }
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("kind must not be blank");
        }
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }

    public static NewTask of(Role sender, TaskKind kind, int priority, Map<String, Object> payload) {
        return new NewTask(null, sender.wireName(), kind.role().wireName(), kind.wireName(), priority, payload);
    }
}
