package io.taskloom.process;

import io.taskloom.model.Role;
import io.taskloom.model.TaskKind;

import java.nio.file.Path;
import java.util.Map;

/**
 * What to launch. {@code workDir} defaults to the supervisor's workspace; a worker running in
 * an isolated context gets that context as its working directory.
 */
public record SpawnRequest(
        Role role,
        TaskKind taskKind,
        String taskId,
        Integer itemNumber,
        Path workDir,
        Map<String, Object> metadata
) {
    public SpawnRequest {
        if (role == null || taskKind == null) {
            throw new IllegalArgumentException("role and taskKind are required");
        }
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId is required");
        }
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static SpawnRequest of(TaskKind kind, String taskId, Integer itemNumber) {
        return new SpawnRequest(kind.role(), kind, taskId, itemNumber, null, Map.of());
    }

    public SpawnRequest inContext(Path context) {
        return new SpawnRequest(role, taskKind, taskId, itemNumber, context, metadata);
    }
}
