package io.taskloom.model;

import java.util.Map;

public record ProcessRecord(
        long id,
        long pid,
        Role role,
        String taskId,
        TaskKind taskKind,
        Integer priorityNumber,
        long spawnedAtMs,
        Long startedAtMs,
        Long completedAtMs,
        ProcessStatus status,
        String command,
        String isolatedContextPath,
        Integer exitCode,
        Map<String, Object> metadata
) {
    public long ageMs(long nowMs) {
        return Math.max(0L, nowMs - spawnedAtMs);
    }
}
