package io.taskloom.model;

import java.util.Map;

public record Task(
        String taskId,
        String sender,
        String recipient,
        String kind,
        int priority,
        Map<String, Object> payload,
        TaskStatus status,
        String startedBy,
        long createdAtMs,
        Long startedAtMs,
        Long completedAtMs,
        Long durationMs,
        String error
) {
}
