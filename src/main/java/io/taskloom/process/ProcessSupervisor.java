package io.taskloom.process;

import io.taskloom.model.ProcessRecord;
import io.taskloom.model.ProcessStatus;
import io.taskloom.observability.AuditLogger;
import io.taskloom.storage.ProcessStore;
import io.taskloom.storage.WorkQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Launches worker processes and keeps their records and linked tasks in step with what the
 * operating system reports. Public operations never throw; failures come back as data.
 */
public final class ProcessSupervisor {
    private static final Logger log = LoggerFactory.getLogger(ProcessSupervisor.class);
    public static final int KILLED_EXIT_CODE = -9;
    private static final Duration KILL_GRACE = Duration.ofSeconds(5);
    private static final List<ProcessStatus> LIVE_STATUSES = List.of(ProcessStatus.SPAWNED, ProcessStatus.RUNNING);

    private final ProcessHost host;
    private final ProcessStore store;
    private final WorkQueue queue;
    private final SpawnTable spawnTable;
    private final Path defaultWorkDir;
    private final IsolatedContextReleaser contextReleaser;
    private final AuditLogger auditLogger;
    private final Clock clock;
    private final Map<Long, WorkerHandle> handles = new ConcurrentHashMap<>();

    public ProcessSupervisor(
            ProcessHost host,
            ProcessStore store,
            WorkQueue queue,
            SpawnTable spawnTable,
            Path defaultWorkDir,
            IsolatedContextReleaser contextReleaser,
            AuditLogger auditLogger,
            Clock clock
    ) {
        this.host = host;
        this.store = store;
        this.queue = queue;
        this.spawnTable = spawnTable;
        this.defaultWorkDir = defaultWorkDir;
        this.contextReleaser = contextReleaser == null ? IsolatedContextReleaser.NONE : contextReleaser;
        this.auditLogger = auditLogger;
        this.clock = clock;
    }

    public SpawnResult spawn(SpawnRequest request) {
        if (request.role() != request.taskKind().role()) {
            return SpawnResult.failure(request.taskId(),
                    request.role().wireName() + " does not perform " + request.taskKind().wireName());
        }
        SpawnStrategy strategy = spawnTable.strategyFor(request.taskKind());
        List<String> command = strategy.command(request);
        Map<String, String> environment = strategy.environment(request);
        Path workDir = request.workDir() == null ? defaultWorkDir : request.workDir();
        WorkerHandle handle;
        try {
            handle = host.launch(command, workDir, environment);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to launch {} worker for task {}: {}", request.role().wireName(), request.taskId(), e.getMessage());
            audit("process.spawn", request.taskId(), "failed", Map.of(
                    "role", request.role().wireName(),
                    "kind", request.taskKind().wireName(),
                    "error", String.valueOf(e.getMessage())
            ));
            return SpawnResult.failure(request.taskId(), "launch failed: " + e.getMessage());
        }
        long recordId;
        try {
            recordId = store.insert(new ProcessStore.NewProcess(
                    handle.pid(),
                    request.role(),
                    request.taskId(),
                    request.taskKind(),
                    request.itemNumber(),
                    clock.millis(),
                    String.join(" ", command),
                    request.workDir() == null ? null : request.workDir().toString(),
                    request.metadata()
            ));
        } catch (RuntimeException e) {
            // an untracked worker could never be supervised or killed
            handle.terminate();
            log.error("Failed to record worker pid={} for task {}; terminated it", handle.pid(), request.taskId(), e);
            return SpawnResult.failure(request.taskId(), "record failed: " + e.getMessage());
        }
        handles.put(recordId, handle);
        log.info("Spawned {} worker pid={} task={} kind={} item={}",
                request.role().wireName(), handle.pid(), request.taskId(), request.taskKind().wireName(), request.itemNumber());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("pid", handle.pid());
        details.put("role", request.role().wireName());
        details.put("kind", request.taskKind().wireName());
        details.put("item", request.itemNumber());
        audit("process.spawn", request.taskId(), "ok", details);
        return SpawnResult.success(handle.pid(), recordId, request.taskId());
    }

    /**
     * Probes the latest record for {@code pid}. A live spawned worker is promoted to running;
     * a vanished one is finalized as completed, or failed when a non-zero exit code was seen.
     */
    public Optional<ProcessStatus> checkStatus(long pid) {
        try {
            return store.latestByPid(pid).map(this::reconcile);
        } catch (RuntimeException e) {
            log.warn("Status check failed for pid={}: {}", pid, e.getMessage());
            return Optional.empty();
        }
    }

    public List<ProcessRecord> listActive(boolean includeCompleted) {
        try {
            for (ProcessRecord record : store.listByStatus(LIVE_STATUSES)) {
                reconcile(record);
            }
            return includeCompleted ? store.listRecent(200) : store.listByStatus(LIVE_STATUSES);
        } catch (RuntimeException e) {
            log.warn("Failed to list active processes: {}", e.getMessage());
            return List.of();
        }
    }

    /**
     * Running records older than {@code timeout}. Advisory only; nothing is killed.
     */
    public List<ProcessRecord> detectHung(Duration timeout) {
        long nowMs = clock.millis();
        List<ProcessRecord> out = new ArrayList<>();
        try {
            for (ProcessRecord record : store.listByStatus(List.of(ProcessStatus.RUNNING))) {
                if (record.ageMs(nowMs) > timeout.toMillis()) {
                    out.add(record);
                }
            }
        } catch (RuntimeException e) {
            log.warn("Hang detection failed: {}", e.getMessage());
        }
        return out;
    }

    public KillResult kill(long pid) {
        try {
            Optional<ProcessRecord> found = store.latestByPid(pid);
            if (found.isEmpty()) {
                return KillResult.failed(pid, "no process record for pid " + pid);
            }
            ProcessRecord record = found.get();
            if (record.status().terminal()) {
                return KillResult.failed(pid, "process already " + record.status().name().toLowerCase());
            }
            Optional<WorkerHandle> handle = resolveHandle(record);
            if (handle.isPresent()) {
                handle.get().terminate();
                try {
                    handle.get().waitFor(KILL_GRACE);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            if (store.markTerminal(record.id(), ProcessStatus.KILLED, KILLED_EXIT_CODE, clock.millis())) {
                queue.markFailed(record.taskId(), "killed by supervisor");
            }
            handles.remove(record.id());
            log.warn("Killed worker pid={} task={}", pid, record.taskId());
            audit("process.kill", record.taskId(), "ok", Map.of("pid", pid));
            return KillResult.killed(pid);
        } catch (RuntimeException e) {
            log.warn("Kill failed for pid={}: {}", pid, e.getMessage());
            return KillResult.failed(pid, e.getMessage());
        }
    }

    /**
     * Finalizes an exited worker and optionally releases its isolated context. A worker that is
     * still alive is left alone and false is returned.
     */
    public boolean cleanup(long pid, boolean releaseIsolatedContext) {
        try {
            Optional<ProcessRecord> found = store.latestByPid(pid);
            if (found.isEmpty()) {
                return false;
            }
            ProcessStatus status = reconcile(found.get());
            if (!status.terminal()) {
                log.info("Not cleaning up pid={}: still {}", pid, status.name().toLowerCase());
                return false;
            }
            ProcessRecord record = found.get();
            handles.remove(record.id());
            if (releaseIsolatedContext && record.isolatedContextPath() != null) {
                try {
                    contextReleaser.release(Path.of(record.isolatedContextPath()));
                    store.clearIsolatedContext(record.id());
                } catch (IOException | RuntimeException e) {
                    log.warn("Failed to release isolated context {} of pid={}: {}",
                            record.isolatedContextPath(), pid, e.getMessage());
                }
            }
            return true;
        } catch (RuntimeException e) {
            log.warn("Cleanup failed for pid={}: {}", pid, e.getMessage());
            return false;
        }
    }

    /**
     * Waits up to {@code timeout} for the worker to exit, then reconciles its record.
     */
    public Optional<ProcessStatus> awaitExit(long pid, Duration timeout) {
        Optional<ProcessRecord> found;
        try {
            found = store.latestByPid(pid);
        } catch (RuntimeException e) {
            log.warn("Await failed for pid={}: {}", pid, e.getMessage());
            return Optional.empty();
        }
        if (found.isEmpty()) {
            return Optional.empty();
        }
        if (!found.get().status().terminal()) {
            Optional<WorkerHandle> handle = resolveHandle(found.get());
            if (handle.isPresent()) {
                try {
                    handle.get().waitFor(timeout);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return Optional.empty();
                }
            }
        }
        return checkStatus(pid);
    }

    private ProcessStatus reconcile(ProcessRecord record) {
        if (record.status().terminal()) {
            return record.status();
        }
        Optional<WorkerHandle> handle = resolveHandle(record);
        long nowMs = clock.millis();
        if (handle.isPresent() && handle.get().isAlive()) {
            if (record.status() == ProcessStatus.SPAWNED && store.markRunning(record.id(), nowMs)) {
                queue.markStarted(record.taskId(), record.role().wireName());
            }
            return ProcessStatus.RUNNING;
        }
        OptionalInt exitCode = handle.map(WorkerHandle::exitCode).orElse(OptionalInt.empty());
        ProcessStatus terminal = exitCode.isPresent() && exitCode.getAsInt() != 0
                ? ProcessStatus.FAILED
                : ProcessStatus.COMPLETED;
        Integer code = exitCode.isPresent() ? exitCode.getAsInt() : null;
        if (store.markTerminal(record.id(), terminal, code, nowMs)) {
            if (terminal == ProcessStatus.COMPLETED) {
                queue.markCompleted(record.taskId(), record.ageMs(nowMs));
            } else {
                queue.markFailed(record.taskId(), "worker exited with code " + code);
            }
            log.info("Worker pid={} task={} finished: {}", record.pid(), record.taskId(), terminal.name().toLowerCase());
        }
        handles.remove(record.id());
        return store.byId(record.id()).map(ProcessRecord::status).orElse(terminal);
    }

    private Optional<WorkerHandle> resolveHandle(ProcessRecord record) {
        WorkerHandle held = handles.get(record.id());
        if (held != null) {
            return Optional.of(held);
        }
        return host.lookup(record.pid(), record.spawnedAtMs());
    }

    private void audit(String action, String taskId, String result, Map<String, Object> details) {
        if (auditLogger == null) {
            return;
        }
        try {
            auditLogger.log(AuditLogger.AuditEvent.of(action, "supervisor", "process", result, taskId, details));
        } catch (RuntimeException e) {
            log.warn("Failed to write audit event {}: {}", action, e.getMessage());
        }
    }
}
