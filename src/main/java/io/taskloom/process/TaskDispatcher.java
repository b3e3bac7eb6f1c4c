package io.taskloom.process;

import io.taskloom.model.NewTask;
import io.taskloom.model.Role;
import io.taskloom.model.TaskKind;
import io.taskloom.storage.WorkQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Records a task in the queue, then spawns the worker for it. If the spawn fails the task is
 * marked failed right away, so nothing is left queued for a worker that never started.
 */
public final class TaskDispatcher {
    private static final Logger log = LoggerFactory.getLogger(TaskDispatcher.class);

    private final WorkQueue queue;
    private final ProcessSupervisor supervisor;

    public TaskDispatcher(WorkQueue queue, ProcessSupervisor supervisor) {
        this.queue = queue;
        this.supervisor = supervisor;
    }

    public SpawnResult dispatch(TaskKind kind, Integer itemNumber, Path workDir, Map<String, Object> payload) {
        Map<String, Object> body = new LinkedHashMap<>();
        if (payload != null) {
            body.putAll(payload);
        }
        if (itemNumber != null) {
            body.put("item", itemNumber);
        }
        String taskId;
        try {
            taskId = queue.enqueue(NewTask.of(Role.ORCHESTRATOR, kind, kind.defaultPriority(), body));
        } catch (RuntimeException e) {
            log.warn("Failed to enqueue {} task for item {}: {}", kind.wireName(), itemNumber, e.getMessage());
            return SpawnResult.failure(null, "enqueue failed: " + e.getMessage());
        }
        SpawnResult result = supervisor.spawn(new SpawnRequest(kind.role(), kind, taskId, itemNumber, workDir, body));
        if (!result.success()) {
            try {
                queue.markFailed(taskId, result.error());
            } catch (RuntimeException e) {
                log.warn("Failed to mark task {} failed after spawn error: {}", taskId, e.getMessage());
            }
        }
        return result;
    }

    public ProcessSupervisor supervisor() {
        return supervisor;
    }
}
