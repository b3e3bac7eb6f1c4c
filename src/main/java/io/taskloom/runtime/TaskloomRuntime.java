package io.taskloom.runtime;

import io.taskloom.backlog.JsonBacklogSource;
import io.taskloom.config.TaskloomConfig;
import io.taskloom.config.WorkLoopSettings;
import io.taskloom.coordination.BatchOutcome;
import io.taskloom.coordination.ConflictChecker;
import io.taskloom.coordination.GitWorktreeContextManager;
import io.taskloom.coordination.ParallelCoordinator;
import io.taskloom.coordination.ReloadingFootprintOracle;
import io.taskloom.loop.ControllerSnapshot;
import io.taskloom.loop.SnapshotStore;
import io.taskloom.loop.WorkLoopController;
import io.taskloom.model.NewTask;
import io.taskloom.model.ProcessRecord;
import io.taskloom.model.Role;
import io.taskloom.model.Task;
import io.taskloom.model.TaskKind;
import io.taskloom.model.TaskStatus;
import io.taskloom.observability.AuditLogger;
import io.taskloom.ownership.OverlapViolation;
import io.taskloom.ownership.OwnershipGuard;
import io.taskloom.ownership.OwnershipRules;
import io.taskloom.process.KillResult;
import io.taskloom.process.OsProcessHost;
import io.taskloom.process.ProcessSupervisor;
import io.taskloom.process.SpawnTable;
import io.taskloom.process.TaskDispatcher;
import io.taskloom.storage.Database;
import io.taskloom.storage.MergeFlagStore;
import io.taskloom.storage.NotificationStore;
import io.taskloom.storage.ProcessStore;
import io.taskloom.storage.WorkQueue;
import io.taskloom.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Composition root: builds every component from the filesystem layout and the settings file,
 * and exposes the read and maintenance operations the CLI needs.
 */
public final class TaskloomRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TaskloomRuntime.class);

    private final TaskloomConfig config;
    private final WorkLoopSettings settings;
    private final Clock clock;
    private final Database database;
    private final WorkQueue queue;
    private final ProcessStore processStore;
    private final MergeFlagStore mergeFlags;
    private final NotificationStore notifications;
    private final AuditLogger auditLogger;
    private final OwnershipGuard ownershipGuard;
    private final Path repoRoot;
    private final GitWorktreeContextManager contexts;
    private final ProcessSupervisor supervisor;
    private final TaskDispatcher dispatcher;
    private final SnapshotStore snapshots;
    private ParallelCoordinator coordinator;

    public TaskloomRuntime(TaskloomConfig config) {
        this(config, WorkLoopSettings.load(config.settingsFile()), Clock.systemUTC());
    }

    public TaskloomRuntime(TaskloomConfig config, WorkLoopSettings settings, Clock clock) {
        this.config = config;
        this.settings = settings;
        this.clock = clock;
        this.database = new Database(config);
        this.queue = new WorkQueue(database, clock);
        this.processStore = new ProcessStore(database);
        this.mergeFlags = new MergeFlagStore(database, clock);
        this.notifications = new NotificationStore(database, clock);
        this.auditLogger = new AuditLogger(config.auditFile(), clock);
        this.ownershipGuard = OwnershipGuard.withDefaults();
        this.repoRoot = settings.repoRootPath(Path.of("").toAbsolutePath());
        this.contexts = new GitWorktreeContextManager(repoRoot, config.worktreeRoot(), settings.trunkBranch());
        this.supervisor = new ProcessSupervisor(
                new OsProcessHost(config.workerLogDir()),
                processStore,
                queue,
                SpawnTable.fromSettings(settings),
                repoRoot,
                contexts,
                auditLogger,
                clock
        );
        this.dispatcher = new TaskDispatcher(queue, supervisor);
        this.snapshots = new SnapshotStore(config.snapshotFile());
    }

    public void init() {
        database.init();
        try {
            Files.createDirectories(config.workerLogDir());
            Files.createDirectories(config.worktreeRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    public TaskloomConfig config() {
        return config;
    }

    public WorkLoopSettings settings() {
        return settings;
    }

    public WorkQueue queue() {
        return queue;
    }

    public AuditLogger auditLogger() {
        return auditLogger;
    }

    public synchronized WorkLoopController newController() {
        return new WorkLoopController(
                new JsonBacklogSource(settings.backlogPath(repoRoot)),
                queue,
                dispatcher,
                coordinator(),
                mergeFlags,
                notifications,
                snapshots,
                auditLogger,
                settings,
                clock
        );
    }

    private synchronized ParallelCoordinator coordinator() {
        if (coordinator == null) {
            coordinator = new ParallelCoordinator(
                    new ConflictChecker(new ReloadingFootprintOracle(settings.footprintPath(repoRoot))),
                    dispatcher,
                    contexts,
                    ownershipGuard,
                    mergeFlags,
                    notifications,
                    auditLogger,
                    ParallelCoordinator.Settings.from(settings)
            );
        }
        return coordinator;
    }

    // controller pid file

    public void writeControllerPid(long pid) {
        try {
            Files.createDirectories(config.stateDir());
            Files.writeString(config.pidFile(), Long.toString(pid), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write pid file " + config.pidFile(), e);
        }
    }

    public void clearControllerPid() {
        try {
            Files.deleteIfExists(config.pidFile());
        } catch (IOException e) {
            log.warn("Failed to remove pid file {}: {}", config.pidFile(), e.getMessage());
        }
    }

    public OptionalLong controllerPid() {
        if (!Files.exists(config.pidFile())) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(Files.readString(config.pidFile(), StandardCharsets.UTF_8).trim()));
        } catch (IOException | NumberFormatException e) {
            log.warn("Unreadable pid file {}: {}", config.pidFile(), e.getMessage());
            return OptionalLong.empty();
        }
    }

    public boolean controllerRunning() {
        OptionalLong pid = controllerPid();
        return pid.isPresent() && ProcessHandle.of(pid.getAsLong()).map(ProcessHandle::isAlive).orElse(false);
    }

    /**
     * Asks a running controller to stop by leaving a stop request next to its pid file. The
     * controller notices it within a second, writes the final snapshot and exits with status 0;
     * its workers keep running.
     */
    public StopOutcome stopController() {
        OptionalLong pid = controllerPid();
        if (pid.isEmpty()) {
            return new StopOutcome(false, null, "no controller pid file at " + config.pidFile());
        }
        Optional<ProcessHandle> handle = ProcessHandle.of(pid.getAsLong()).filter(ProcessHandle::isAlive);
        if (handle.isEmpty()) {
            clearControllerPid();
            return new StopOutcome(false, pid.getAsLong(), "controller is not running; removed stale pid file");
        }
        try {
            Files.createDirectories(config.stateDir());
            Files.writeString(config.stopRequestFile(), Instant.now(clock).toString(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write stop request " + config.stopRequestFile(), e);
        }
        auditLogger.log(AuditLogger.AuditEvent.of("controller.stop", "cli", "work-loop",
                "ok", null, Map.of("pid", pid.getAsLong())));
        return new StopOutcome(true, pid.getAsLong(), "stop requested");
    }

    public boolean stopRequested() {
        return Files.exists(config.stopRequestFile());
    }

    public void clearStopRequest() {
        try {
            Files.deleteIfExists(config.stopRequestFile());
        } catch (IOException e) {
            log.warn("Failed to remove stop request {}: {}", config.stopRequestFile(), e.getMessage());
        }
    }

    // views

    public StatusOutcome status() {
        boolean dbOk;
        try (Connection ignored = database.openConnection()) {
            dbOk = true;
        } catch (Exception e) {
            dbOk = false;
        }
        ControllerSnapshot snapshot = loadSnapshotQuietly();
        List<ProcessRecord> live = supervisor.listActive(false);
        return new StatusOutcome(
                controllerRunning(),
                controllerPid().isPresent() ? controllerPid().getAsLong() : null,
                dbOk,
                snapshot.lastUpdateMs() == 0L ? null : Instant.ofEpochMilli(snapshot.lastUpdateMs()).toString(),
                snapshot.activeTasks().keySet().stream().sorted().toList(),
                snapshot.lastPeriodicRuns(),
                live.size(),
                mergeFlags.flaggedItems().size(),
                queue.taskMetrics(),
                Instant.now(clock).toString()
        );
    }

    public DashboardOutcome dashboard() {
        return new DashboardOutcome(
                queue.taskMetrics(),
                queue.queueDepth(),
                queue.agentPerformance(),
                queue.slowestTasks(5),
                supervisor.listActive(false),
                mergeFlags.list(),
                notifications.recent(10),
                settings.toView()
        );
    }

    public OwnershipOutcome validateOwnership() {
        List<OverlapViolation> violations = OwnershipGuard.validateNoOverlaps(OwnershipRules.defaults());
        return new OwnershipOutcome(
                violations.isEmpty(),
                violations.stream().map(OverlapViolation::describe).toList(),
                ownershipGuard.auditListing()
        );
    }

    public List<Task> tasks(String status, int limit) {
        TaskStatus filter = status == null || status.isBlank() ? null : TaskStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        return queue.listTasks(filter, limit);
    }

    public Optional<Task> task(String taskId) {
        return queue.getTask(taskId);
    }

    public String enqueue(String kindRaw, Integer priority, String payloadJson) {
        TaskKind kind = TaskKind.fromString(kindRaw);
        int effectivePriority = priority == null ? kind.defaultPriority() : priority;
        String taskId = queue.enqueue(NewTask.of(Role.ORCHESTRATOR, kind, effectivePriority, Jsons.toMap(payloadJson)));
        auditLogger.log(AuditLogger.AuditEvent.of("task.enqueue", "cli", "queue", "ok", taskId,
                Map.of("kind", kind.wireName(), "priority", effectivePriority)));
        return taskId;
    }

    public List<ProcessRecord> processes(boolean includeCompleted) {
        return supervisor.listActive(includeCompleted);
    }

    public List<ProcessRecord> hung(Duration timeout) {
        return supervisor.detectHung(timeout);
    }

    public KillResult kill(long pid) {
        return supervisor.kill(pid);
    }

    public boolean cleanup(long pid, boolean releaseContext) {
        return supervisor.cleanup(pid, releaseContext);
    }

    public PurgeOutcome purge(int retentionDays) {
        int removed = queue.cleanupOld(retentionDays);
        auditLogger.log(AuditLogger.AuditEvent.of("queue.purge", "cli", "queue", "ok", null,
                Map.of("retention_days", retentionDays, "removed", removed)));
        return new PurgeOutcome(retentionDays, removed);
    }

    public BatchOutcome runBatch(List<Integer> items, int maxParallel, boolean autoMerge) {
        return coordinator().executeBatch(items, maxParallel, autoMerge);
    }

    public List<MergeFlagStore.MergeFlag> flags() {
        return mergeFlags.list();
    }

    public boolean unflag(int item) {
        boolean cleared = mergeFlags.clear(item);
        auditLogger.log(AuditLogger.AuditEvent.of("merge.unflag", "cli", "item/" + item,
                cleared ? "ok" : "not_found", null, Map.of("item", item)));
        return cleared;
    }

    public List<NotificationStore.Notification> notifications(int limit) {
        return notifications.recent(limit);
    }

    public List<Database.SchemaMigrationRow> schemaMigrations() {
        return database.listSchemaMigrations();
    }

    private ControllerSnapshot loadSnapshotQuietly() {
        try {
            return snapshots.load().orElse(ControllerSnapshot.empty());
        } catch (RuntimeException e) {
            log.warn("Failed to read controller snapshot: {}", e.getMessage());
            return ControllerSnapshot.empty();
        }
    }

    @Override
    public synchronized void close() {
        if (coordinator != null) {
            coordinator.close();
        }
    }

    public record StopOutcome(boolean stopRequested, Long pid, String message) {
    }

    public record StatusOutcome(
            boolean controllerRunning,
            Long controllerPid,
            boolean dbOk,
            String lastSnapshotAt,
            List<String> trackedTasks,
            Map<String, Long> lastPeriodicRuns,
            int liveProcesses,
            int flaggedItems,
            WorkQueue.TaskMetrics tasks,
            String timestamp
    ) {
    }

    public record DashboardOutcome(
            WorkQueue.TaskMetrics tasks,
            Map<String, WorkQueue.QueueDepth> queueDepth,
            List<WorkQueue.AgentPerformance> agents,
            List<Task> slowestTasks,
            List<ProcessRecord> liveProcesses,
            List<MergeFlagStore.MergeFlag> mergeFlags,
            List<NotificationStore.Notification> recentNotifications,
            Map<String, Object> settings
    ) {
    }

    public record OwnershipOutcome(boolean valid, List<String> violations, List<String> rules) {
    }

    public record PurgeOutcome(int retentionDays, int removedTasks) {
    }
}
