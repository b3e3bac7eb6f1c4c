package io.taskloom.loop;

import io.taskloom.backlog.BacklogItem;
import io.taskloom.backlog.BacklogSource;
import io.taskloom.config.WorkLoopSettings;
import io.taskloom.coordination.BatchDispatch;
import io.taskloom.coordination.BatchOutcome;
import io.taskloom.coordination.DispatchedWorker;
import io.taskloom.coordination.IndependenceVerdict;
import io.taskloom.coordination.MergeOutcome;
import io.taskloom.coordination.ParallelCoordinator;
import io.taskloom.model.ProcessRecord;
import io.taskloom.model.ProcessStatus;
import io.taskloom.model.TaskKind;
import io.taskloom.notify.NotificationSink;
import io.taskloom.notify.Severity;
import io.taskloom.observability.AuditLogger;
import io.taskloom.process.ProcessSupervisor;
import io.taskloom.process.SpawnResult;
import io.taskloom.process.TaskDispatcher;
import io.taskloom.storage.MergeFlagStore;
import io.taskloom.storage.WorkQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * The long-running control loop. A cycle keeps specification work ahead of implementation and
 * hands implementation items to the parallel coordinator; it ends by writing a snapshot. A
 * failing cycle is logged and the loop carries on with the next one.
 *
 * <p>Only one thread calls {@link #runCycle()}; batch completions arrive from coordinator threads
 * through a concurrent queue and are applied at the start of the next cycle.
 */
public final class WorkLoopController {
    private static final Logger log = LoggerFactory.getLogger(WorkLoopController.class);

    static final String SPEC_PREFIX = "spec_";
    static final String IMPL_PREFIX = "impl_";

    private final BacklogSource backlog;
    private final WorkQueue queue;
    private final TaskDispatcher dispatcher;
    private final ParallelCoordinator coordinator;
    private final MergeFlagStore mergeFlags;
    private final NotificationSink notifications;
    private final SnapshotStore snapshots;
    private final AuditLogger auditLogger;
    private final WorkLoopSettings settings;
    private final Clock clock;

    private final Map<String, ActiveTask> activeTasks = new LinkedHashMap<>();
    private final Map<String, Long> lastPeriodicRuns = new TreeMap<>();
    private final Set<String> timeoutAlerted = new HashSet<>();
    private final Set<String> recoveredKeys = new HashSet<>();
    private final Map<String, BatchDispatch> inflightBatches = new ConcurrentHashMap<>();
    private final ConcurrentLinkedQueue<BatchCompletion> finishedBatches = new ConcurrentLinkedQueue<>();
    private final CountDownLatch shutdownSignal = new CountDownLatch(1);

    private List<BacklogItem> cachedItems;
    private String lastBacklogVersion;
    private boolean recovered;
    private long cycles;
    private volatile boolean shutdownRequested;
    private volatile LoopState state = LoopState.STARTING;

    public WorkLoopController(
            BacklogSource backlog,
            WorkQueue queue,
            TaskDispatcher dispatcher,
            ParallelCoordinator coordinator,
            MergeFlagStore mergeFlags,
            NotificationSink notifications,
            SnapshotStore snapshots,
            AuditLogger auditLogger,
            WorkLoopSettings settings,
            Clock clock
    ) {
        this.backlog = backlog;
        this.queue = queue;
        this.dispatcher = dispatcher;
        this.coordinator = coordinator;
        this.mergeFlags = mergeFlags;
        this.notifications = notifications;
        this.snapshots = snapshots;
        this.auditLogger = auditLogger;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Restores tracked tasks and periodic run times from the last snapshot. Safe to call more
     * than once; only the first call reads the snapshot.
     */
    public synchronized void recover() {
        if (recovered) {
            return;
        }
        recovered = true;
        Optional<ControllerSnapshot> loaded = snapshots.load();
        if (loaded.isEmpty()) {
            log.info("No controller snapshot at {}; starting with an empty state", snapshots.file());
            return;
        }
        ControllerSnapshot snapshot = loaded.get();
        activeTasks.putAll(snapshot.activeTasks());
        lastPeriodicRuns.putAll(snapshot.lastPeriodicRuns());
        lastBacklogVersion = snapshot.lastBacklogVersion();
        recoveredKeys.addAll(snapshot.activeTasks().keySet());
        log.info("Recovered {} tracked task(s) from snapshot written at {}",
                activeTasks.size(), snapshot.lastUpdateMs());
    }

    /**
     * Runs cycles until {@link #requestShutdown()} is called or the thread is interrupted, then
     * writes a final snapshot.
     */
    public void run() {
        recover();
        log.info("Work loop started: poll={}ms specBacklogTarget={} maxParallel={}",
                settings.pollIntervalMs(), settings.specBacklogTarget(), settings.maxParallel());
        audit("loop.start", "ok", Map.of("tracked", activeTasks.size()));
        try {
            while (!shutdownRequested) {
                long startMs = clock.millis();
                runCycle();
                if (shutdownRequested) {
                    break;
                }
                state = LoopState.SLEEPING;
                long elapsedMs = Math.max(0L, clock.millis() - startMs);
                long sleepMs = Math.max(0L, settings.pollIntervalMs() - elapsedMs);
                if (shutdownSignal.await(sleepMs, TimeUnit.MILLISECONDS)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Work loop interrupted");
        } finally {
            shutdown();
        }
    }

    public void requestShutdown() {
        shutdownRequested = true;
        shutdownSignal.countDown();
    }

    public synchronized CycleReport runCycle() {
        recover();
        cycles++;
        CycleReport report = new CycleReport(cycles);
        try {
            state = LoopState.POLLING;
            drainBatches(report);
            List<BacklogItem> items = pollBacklog();
            Set<Integer> flagged = mergeFlags.flaggedItems();

            state = LoopState.COORDINATING;
            dispatchSpecs(items, flagged, report);
            runPeriodicJobs(report);
            dispatchImplementation(items, flagged, report);

            state = LoopState.MONITORING;
            monitor(report);
        } catch (RuntimeException e) {
            report.error(e.getClass().getSimpleName() + ": " + e.getMessage());
            log.error("Work loop cycle {} failed in state {}", cycles, state, e);
            audit("loop.cycle", "error", Map.of(
                    "cycle", cycles,
                    "state", state.name(),
                    "error", String.valueOf(e.getMessage())
            ));
        }
        state = LoopState.PERSISTING;
        persist();
        log.debug("Cycle {} done: specs={} impl={} periodic={} finished={} tracked={}",
                cycles, report.specsDispatched(), report.implementationsDispatched(),
                report.periodicRuns(), report.finished(), activeTasks.size());
        return report;
    }

    public LoopState state() {
        return state;
    }

    public synchronized long cycles() {
        return cycles;
    }

    public synchronized Map<String, ActiveTask> activeTasks() {
        return Map.copyOf(activeTasks);
    }

    public synchronized Map<String, Long> lastPeriodicRuns() {
        return Map.copyOf(lastPeriodicRuns);
    }

    private List<BacklogItem> pollBacklog() {
        String version = backlog.version();
        if (cachedItems != null && version.equals(lastBacklogVersion)) {
            return cachedItems;
        }
        cachedItems = backlog.getAllItems();
        lastBacklogVersion = version;
        log.info("Backlog changed (version {}): {} item(s)", version, cachedItems.size());
        return cachedItems;
    }

    private void dispatchSpecs(List<BacklogItem> items, Set<Integer> flagged, CycleReport report) {
        long inFlight = activeTasks.keySet().stream().filter(k -> k.startsWith(SPEC_PREFIX)).count();
        for (BacklogItem item : sortedByNumber(items)) {
            if (inFlight >= settings.specBacklogTarget()) {
                break;
            }
            String key = SPEC_PREFIX + item.number();
            if (!item.needsSpec() || activeTasks.containsKey(key) || flagged.contains(item.number())) {
                continue;
            }
            SpawnResult result = dispatcher.dispatch(TaskKind.CREATE_SPEC, item.number(), null, titlePayload(item));
            if (!result.success()) {
                log.warn("Spec dispatch for item {} failed: {}", item.number(), result.error());
                continue;
            }
            activeTasks.put(key, ActiveTask.single(result.taskId(), result.pid(), clock.millis(),
                    TaskKind.CREATE_SPEC, item.number()));
            report.specsDispatched().add(item.number());
            inFlight++;
        }
    }

    private void runPeriodicJobs(CycleReport report) {
        long nowMs = clock.millis();
        for (PeriodicJob job : PeriodicJob.values()) {
            long interval = job.intervalMs(settings);
            if (interval <= 0L) {
                continue;
            }
            Long last = lastPeriodicRuns.get(job.key());
            if (last != null && nowMs - last < interval) {
                continue;
            }
            if (job.kind() == null) {
                int removed = queue.cleanupOld(settings.queueRetentionDays());
                log.info("Queue cleanup removed {} finished task(s) older than {} day(s)",
                        removed, settings.queueRetentionDays());
                lastPeriodicRuns.put(job.key(), nowMs);
                report.periodicRuns().add(job.key());
                continue;
            }
            if (activeTasks.containsKey(job.key())) {
                continue;
            }
            SpawnResult result = dispatcher.dispatch(job.kind(), null, null, Map.of());
            if (!result.success()) {
                log.warn("Periodic job {} failed to start: {}", job.key(), result.error());
                continue;
            }
            activeTasks.put(job.key(), ActiveTask.single(result.taskId(), result.pid(), nowMs, job.kind(), null));
            lastPeriodicRuns.put(job.key(), nowMs);
            report.periodicRuns().add(job.key());
        }
    }

    private void dispatchImplementation(List<BacklogItem> items, Set<Integer> flagged, CycleReport report) {
        boolean implInFlight = !inflightBatches.isEmpty()
                || activeTasks.keySet().stream().anyMatch(k -> k.startsWith(IMPL_PREFIX));
        if (implInFlight) {
            return;
        }
        List<BacklogItem> candidates = sortedByNumber(items).stream()
                .filter(BacklogItem::implementable)
                .filter(i -> !flagged.contains(i.number()))
                .toList();
        if (candidates.isEmpty()) {
            return;
        }
        if (candidates.size() >= 2) {
            List<Integer> numbers = candidates.stream()
                    .limit(Math.max(1, settings.maxParallel()))
                    .map(BacklogItem::number)
                    .toList();
            IndependenceVerdict verdict = coordinator.checker().checkIndependence(numbers);
            if (verdict.valid()) {
                startBatch(numbers, report);
                return;
            }
            log.info("Items {} are not independent ({}); implementing {} alone",
                    numbers, verdict.reason(), candidates.get(0).number());
        }
        BacklogItem first = candidates.get(0);
        SpawnResult result = dispatcher.dispatch(TaskKind.IMPLEMENT, first.number(), null, titlePayload(first));
        if (!result.success()) {
            log.warn("Implementation dispatch for item {} failed: {}", first.number(), result.error());
            return;
        }
        activeTasks.put(IMPL_PREFIX + first.number(), ActiveTask.single(result.taskId(), result.pid(),
                clock.millis(), TaskKind.IMPLEMENT, first.number()));
        report.implementationsDispatched().add(first.number());
    }

    private void startBatch(List<Integer> numbers, CycleReport report) {
        BatchDispatch dispatch = coordinator.dispatchBatch(numbers, settings.maxParallel(), settings.autoMerge());
        long nowMs = clock.millis();
        for (DispatchedWorker worker : dispatch.workers()) {
            String context = worker.context() == null ? null : worker.context().toString();
            activeTasks.put(IMPL_PREFIX + worker.itemNumber(), new ActiveTask(worker.taskId(), worker.pid(), nowMs,
                    TaskKind.IMPLEMENT, worker.itemNumber(), dispatch.batchId(), context));
            report.implementationsDispatched().add(worker.itemNumber());
        }
        report.batchId(dispatch.batchId());
        inflightBatches.put(dispatch.batchId(), dispatch);
        dispatch.completion().whenComplete((outcome, error) ->
                finishedBatches.add(new BatchCompletion(dispatch.batchId(), outcome, error)));
        audit("loop.batch", "dispatched", Map.of(
                "batch_id", dispatch.batchId(),
                "mode", dispatch.mode().name(),
                "items", report.implementationsDispatched(),
                "deferred", dispatch.deferred()
        ));
    }

    private void drainBatches(CycleReport report) {
        BatchCompletion done;
        while ((done = finishedBatches.poll()) != null) {
            inflightBatches.remove(done.batchId());
            String batchId = done.batchId();
            activeTasks.entrySet().removeIf(e -> batchId.equals(e.getValue().batchId()) && !stillRunning(e));
            timeoutAlerted.removeIf(k -> !activeTasks.containsKey(k));
            report.batchesDrained().add(batchId);
            if (done.error() != null) {
                log.error("Batch {} ended with an error", batchId, done.error());
                notifications.send(Severity.WARNING, "Batch " + batchId + " failed",
                        "Reconciliation stopped with " + done.error().getClass().getSimpleName() + ": "
                                + done.error().getMessage());
                continue;
            }
            BatchOutcome outcome = done.outcome();
            long merged = outcome.mergeResults().stream().filter(MergeOutcome::merged).count();
            long flagged = outcome.mergeResults().stream().filter(MergeOutcome::flagged).count();
            log.info("Batch {} finished as {} in {}ms: merged={} flagged={} items={}",
                    batchId, outcome.finalState(), outcome.duration().toMillis(), merged, flagged, outcome.executed());
        }
    }

    private boolean stillRunning(Map.Entry<String, ActiveTask> entry) {
        Optional<ProcessStatus> status = dispatcher.supervisor().checkStatus(entry.getValue().pid());
        if (status.isEmpty() || status.get().terminal()) {
            return false;
        }
        log.warn("Batch {} ended while {} (pid={}) is still running; it stays tracked",
                entry.getValue().batchId(), entry.getKey(), entry.getValue().pid());
        return true;
    }

    private void monitor(CycleReport report) {
        long nowMs = clock.millis();
        ProcessSupervisor supervisor = dispatcher.supervisor();
        boolean firstPassAfterRecovery = !recoveredKeys.isEmpty();
        for (Map.Entry<String, ActiveTask> entry : new ArrayList<>(activeTasks.entrySet())) {
            String key = entry.getKey();
            ActiveTask task = entry.getValue();
            Optional<ProcessStatus> status = supervisor.checkStatus(task.pid());
            boolean exited = status.isEmpty() || status.get().terminal();
            boolean recoveredEntry = recoveredKeys.contains(key);
            if (!exited) {
                checkTimeout(key, task, nowMs, report);
                continue;
            }
            if (task.inBatch() && inflightBatches.containsKey(task.batchId())) {
                continue;
            }
            activeTasks.remove(key);
            timeoutAlerted.remove(key);
            if (recoveredEntry) {
                report.orphaned().add(key);
                log.warn("Task {} ({}) was tracked before restart and its worker pid={} is gone",
                        key, task.taskId(), task.pid());
            } else {
                report.finished().add(key);
                log.info("Task {} ({}) finished: {}", key, task.taskId(),
                        status.map(Enum::name).orElse("UNKNOWN"));
            }
            supervisor.cleanup(task.pid(), false);
            if (task.contextPath() != null) {
                // batch entry with no batch left waiting to merge it
                notifications.send(Severity.WARNING, "Unreconciled batch item " + task.itemNumber(),
                        "Item " + task.itemNumber() + " finished without a running batch to merge it. "
                                + "Its isolated context is kept at " + task.contextPath()
                                + " and needs to be reconciled by hand.");
            }
        }
        if (firstPassAfterRecovery) {
            recoveredKeys.clear();
        }

        List<ProcessRecord> hung = supervisor.detectHung(Duration.ofMillis(settings.hungProcessTimeoutMs()));
        for (ProcessRecord record : hung) {
            log.warn("Worker pid={} role={} task={} has been running for {}ms",
                    record.pid(), record.role().wireName(), record.taskId(), record.ageMs(nowMs));
        }
        report.hungProcesses(hung.size());
    }

    private void checkTimeout(String key, ActiveTask task, long nowMs, CycleReport report) {
        long runningMs = nowMs - task.startedAtMs();
        if (runningMs <= settings.taskTimeoutMs() || !timeoutAlerted.add(key)) {
            return;
        }
        report.timeoutAlerts().add(key);
        log.warn("Task {} ({}) exceeded its timeout: running {}ms", key, task.taskId(), runningMs);
        notifications.send(Severity.HIGH, "Task timeout: " + key,
                "Task " + task.taskId() + " (" + task.kind().wireName() + ", pid " + task.pid() + ") has been running for "
                        + Duration.ofMillis(runningMs).toMinutes() + " minute(s). It was not stopped.");
    }

    private void persist() {
        try {
            snapshots.save(new ControllerSnapshot(
                    ControllerSnapshot.CURRENT_SCHEMA_VERSION,
                    clock.millis(),
                    activeTasks,
                    lastBacklogVersion,
                    lastPeriodicRuns
            ));
        } catch (RuntimeException e) {
            log.error("Failed to persist controller snapshot", e);
        }
    }

    private synchronized void shutdown() {
        state = LoopState.SHUTTING_DOWN;
        persist();
        int running = activeTasks.size();
        log.info("Work loop stopping after {} cycle(s); {} task(s) still tracked", cycles, running);
        notifications.send(Severity.INFO, "Work loop stopped",
                "Controller stopped after " + cycles + " cycle(s) with " + running + " task(s) still running.");
        audit("loop.stop", "ok", Map.of("cycles", cycles, "tracked", running));
        state = LoopState.STOPPED;
    }

    private void audit(String action, String result, Map<String, Object> details) {
        if (auditLogger == null) {
            return;
        }
        try {
            auditLogger.log(AuditLogger.AuditEvent.of(action, "controller", "work-loop", result, null, details));
        } catch (RuntimeException e) {
            log.warn("Failed to write audit event {}: {}", action, e.getMessage());
        }
    }

    private static List<BacklogItem> sortedByNumber(List<BacklogItem> items) {
        List<BacklogItem> sorted = new ArrayList<>(items);
        sorted.sort(Comparator.comparingInt(BacklogItem::number));
        return sorted;
    }

    private static Map<String, Object> titlePayload(BacklogItem item) {
        return item.title() == null ? Map.of() : Map.of("title", item.title());
    }

    private record BatchCompletion(String batchId, BatchOutcome outcome, Throwable error) {
    }
}
