package io.taskloom.coordination;

import io.taskloom.config.WorkLoopSettings;
import io.taskloom.model.ProcessStatus;
import io.taskloom.model.Role;
import io.taskloom.model.TaskKind;
import io.taskloom.notify.NotificationSink;
import io.taskloom.notify.Severity;
import io.taskloom.observability.AuditLogger;
import io.taskloom.ownership.OwnershipGuard;
import io.taskloom.ownership.OwnershipViolationException;
import io.taskloom.process.ProcessSupervisor;
import io.taskloom.process.SpawnResult;
import io.taskloom.process.TaskDispatcher;
import io.taskloom.storage.MergeFlagStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs implementation items concurrently when they are pairwise independent, each in its own
 * isolated context, and one at a time in the trunk otherwise. Reconciliation back into the
 * trunk is serialized by a single coordinator-wide lock.
 */
public final class ParallelCoordinator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ParallelCoordinator.class);
    private static final Duration AWAIT_SLICE = Duration.ofSeconds(1);

    private final ConflictChecker checker;
    private final TaskDispatcher dispatcher;
    private final IsolatedContextManager contexts;
    private final OwnershipGuard ownershipGuard;
    private final MergeFlagStore mergeFlags;
    private final NotificationSink notifications;
    private final AuditLogger auditLogger;
    private final Settings settings;
    private final ReentrantLock mergeLock = new ReentrantLock();
    private final AtomicLong batchCounter = new AtomicLong();
    private final ExecutorService waiters;

    public ParallelCoordinator(
            ConflictChecker checker,
            TaskDispatcher dispatcher,
            IsolatedContextManager contexts,
            OwnershipGuard ownershipGuard,
            MergeFlagStore mergeFlags,
            NotificationSink notifications,
            AuditLogger auditLogger,
            Settings settings
    ) {
        this.checker = checker;
        this.dispatcher = dispatcher;
        this.contexts = contexts;
        this.ownershipGuard = ownershipGuard;
        this.mergeFlags = mergeFlags;
        this.notifications = notifications;
        this.auditLogger = auditLogger;
        this.settings = settings;
        AtomicLong threadCounter = new AtomicLong();
        this.waiters = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "taskloom-batch-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public ConflictChecker checker() {
        return checker;
    }

    /**
     * Blocking form: runs every item, in waves of at most {@code maxParallel} when the verdict
     * is valid and one by one in the trunk otherwise, and reconciles each wave before the next.
     */
    public BatchOutcome executeBatch(List<Integer> items, int maxParallel, boolean autoMerge) {
        long startNs = System.nanoTime();
        ExecutionBatch batch = newBatch(items);
        IndependenceVerdict verdict = check(batch);
        BatchMode mode = verdict.valid() ? BatchMode.PARALLEL : BatchMode.SEQUENTIAL;
        List<Integer> executed = new ArrayList<>();
        if (mode == BatchMode.PARALLEL) {
            for (List<Integer> wave : partition(batch.items(), Math.max(1, maxParallel))) {
                batch.transition(BatchState.PARALLEL_DISPATCH);
                List<DispatchedWorker> workers = startParallelWave(batch, wave);
                reconcileWave(batch, workers, autoMerge);
                workers.forEach(w -> executed.add(w.itemNumber()));
            }
        } else {
            for (Integer item : batch.items()) {
                batch.transition(BatchState.SEQUENTIAL_DISPATCH);
                List<DispatchedWorker> workers = startInTrunk(batch, item);
                reconcileWave(batch, workers, autoMerge);
                workers.forEach(w -> executed.add(w.itemNumber()));
            }
        }
        return finish(batch, mode, executed, startNs);
    }

    /**
     * Non-blocking form used by the work loop: starts one wave and returns at once. The
     * returned future completes on a background thread after the wave is reconciled.
     */
    public BatchDispatch dispatchBatch(List<Integer> items, int maxParallel, boolean autoMerge) {
        long startNs = System.nanoTime();
        ExecutionBatch batch = newBatch(items);
        IndependenceVerdict verdict = check(batch);
        BatchMode mode;
        List<Integer> wave;
        List<DispatchedWorker> workers;
        if (verdict.valid()) {
            mode = BatchMode.PARALLEL;
            wave = batch.items().subList(0, Math.min(batch.items().size(), Math.max(1, maxParallel)));
            batch.transition(BatchState.PARALLEL_DISPATCH);
            workers = startParallelWave(batch, wave);
        } else {
            mode = BatchMode.SEQUENTIAL;
            wave = batch.items().isEmpty() ? List.of() : batch.items().subList(0, 1);
            batch.transition(BatchState.SEQUENTIAL_DISPATCH);
            workers = wave.isEmpty() ? List.of() : startInTrunk(batch, wave.get(0));
        }
        List<Integer> deferred = batch.items().stream().filter(i -> !wave.contains(i)).toList();
        List<Integer> executed = workers.stream().map(DispatchedWorker::itemNumber).toList();
        CompletableFuture<BatchOutcome> completion;
        if (workers.isEmpty()) {
            completion = CompletableFuture.completedFuture(finish(batch, mode, executed, startNs));
        } else {
            completion = CompletableFuture.supplyAsync(() -> {
                reconcileWave(batch, workers, autoMerge);
                return finish(batch, mode, executed, startNs);
            }, waiters);
        }
        log.info("Batch {} dispatched {} in {} mode, deferred {}", batch.batchId(), executed, mode, deferred);
        return new BatchDispatch(batch.batchId(), mode, workers, deferred, completion);
    }

    private ExecutionBatch newBatch(List<Integer> items) {
        List<Integer> distinct = items.stream().distinct().toList();
        return new ExecutionBatch("batch-" + System.currentTimeMillis() + "-" + batchCounter.incrementAndGet(), distinct);
    }

    private IndependenceVerdict check(ExecutionBatch batch) {
        IndependenceVerdict verdict = checker.checkIndependence(batch.items());
        if (!verdict.valid()) {
            log.info("Batch {} falls back to sequential: {} {}", batch.batchId(), verdict.reason(), verdict.conflictingPairs());
        }
        return verdict;
    }

    private List<DispatchedWorker> startParallelWave(ExecutionBatch batch, List<Integer> wave) {
        List<DispatchedWorker> workers = new ArrayList<>();
        for (Integer item : wave) {
            Path context;
            try {
                context = contexts.acquire(item);
            } catch (IOException | RuntimeException e) {
                log.warn("Failed to acquire isolated context for item {}: {}", item, e.getMessage());
                batch.outcome(MergeOutcome.skipped(item, "context acquire failed: " + e.getMessage()));
                continue;
            }
            SpawnResult result = dispatcher.dispatch(TaskKind.IMPLEMENT, item, context, Map.of("batch_id", batch.batchId()));
            if (!result.success()) {
                releaseQuietly(context);
                batch.outcome(MergeOutcome.skipped(item, "spawn failed: " + result.error()));
                continue;
            }
            workers.add(new DispatchedWorker(item, result.taskId(), result.pid(), context));
        }
        return workers;
    }

    private List<DispatchedWorker> startInTrunk(ExecutionBatch batch, int item) {
        SpawnResult result = dispatcher.dispatch(TaskKind.IMPLEMENT, item, null, Map.of("batch_id", batch.batchId()));
        if (!result.success()) {
            batch.outcome(MergeOutcome.skipped(item, "spawn failed: " + result.error()));
            return List.of();
        }
        return List.of(new DispatchedWorker(item, result.taskId(), result.pid(), null));
    }

    private void reconcileWave(ExecutionBatch batch, List<DispatchedWorker> workers, boolean autoMerge) {
        Map<DispatchedWorker, ProcessStatus> exits = awaitWorkers(workers);
        batch.transition(BatchState.RECONCILING);
        ProcessSupervisor supervisor = dispatcher.supervisor();
        List<DispatchedWorker> ordered = new ArrayList<>(workers);
        ordered.sort(Comparator.comparingInt(DispatchedWorker::itemNumber));
        for (DispatchedWorker worker : ordered) {
            ProcessStatus status = exits.get(worker);
            MergeOutcome outcome;
            if (worker.context() == null) {
                outcome = status == ProcessStatus.COMPLETED
                        ? MergeOutcome.merged(worker.itemNumber(), 0)
                        : MergeOutcome.skipped(worker.itemNumber(), "worker " + describe(status));
            } else if (status != ProcessStatus.COMPLETED) {
                outcome = MergeOutcome.skipped(worker.itemNumber(), "worker " + describe(status));
            } else if (!autoMerge) {
                outcome = MergeOutcome.skipped(worker.itemNumber(), "auto-merge disabled; context kept at " + worker.context());
            } else {
                outcome = reconcileWithRetries(batch, worker);
            }
            batch.outcome(outcome);
            boolean exited = status != null && status.terminal();
            boolean keepContext = worker.context() != null && status == ProcessStatus.COMPLETED && !autoMerge;
            if (exited) {
                supervisor.cleanup(worker.pid(), !keepContext);
            }
        }
    }

    /**
     * Waits until every worker has exited, however long that takes; overdue workers are only
     * reported by the work loop. Interruption stops the wait and leaves the worker as running.
     */
    private Map<DispatchedWorker, ProcessStatus> awaitWorkers(List<DispatchedWorker> workers) {
        ProcessSupervisor supervisor = dispatcher.supervisor();
        Map<DispatchedWorker, ProcessStatus> out = new LinkedHashMap<>();
        for (DispatchedWorker worker : workers) {
            ProcessStatus status = ProcessStatus.RUNNING;
            while (!Thread.currentThread().isInterrupted()) {
                Optional<ProcessStatus> observed = supervisor.awaitExit(worker.pid(), AWAIT_SLICE);
                if (observed.isEmpty()) {
                    status = Thread.currentThread().isInterrupted() ? ProcessStatus.RUNNING : null;
                    break;
                }
                status = observed.get();
                if (status.terminal()) {
                    break;
                }
            }
            out.put(worker, status);
        }
        return out;
    }

    /**
     * Holds the merge lock for all attempts of one item, so no other reconciliation can run
     * in between. Exhausted retries flag the item and raise a high-severity notification.
     */
    private MergeOutcome reconcileWithRetries(ExecutionBatch batch, DispatchedWorker worker) {
        int item = worker.itemNumber();
        String lastError = null;
        int attempts = 0;
        mergeLock.lock();
        try {
            for (int attempt = 1; attempt <= settings.mergeMaxAttempts(); attempt++) {
                attempts = attempt;
                try {
                    for (String path : contexts.changedPaths(worker.context())) {
                        ownershipGuard.assertCanWrite(Role.CODE_DEVELOPER, path);
                    }
                    IsolatedContextManager.MergeAttempt result = contexts.merge(worker.context(), item);
                    if (result.merged()) {
                        log.info("Batch {} merged item {} on attempt {}", batch.batchId(), item, attempt);
                        audit("batch.merge", worker.taskId(), "ok", Map.of("item", item, "attempts", attempt, "batch_id", batch.batchId()));
                        return MergeOutcome.merged(item, attempt);
                    }
                    lastError = result.error();
                } catch (OwnershipViolationException e) {
                    lastError = e.getMessage();
                    log.error("Batch {} item {} writes outside its ownership: {}", batch.batchId(), item, e.getMessage());
                    break;
                } catch (IOException | RuntimeException e) {
                    lastError = e.getMessage();
                }
                log.warn("Merge attempt {}/{} for item {} failed: {}", attempt, settings.mergeMaxAttempts(), item, lastError);
                if (attempt < settings.mergeMaxAttempts() && !sleepBackoff()) {
                    break;
                }
            }
            return flag(batch, worker, attempts, lastError);
        } finally {
            mergeLock.unlock();
        }
    }

    private MergeOutcome flag(ExecutionBatch batch, DispatchedWorker worker, int attempts, String error) {
        int item = worker.itemNumber();
        try {
            mergeFlags.flag(item, attempts, error);
        } catch (RuntimeException e) {
            log.error("Failed to persist merge flag for item {}", item, e);
        }
        notifications.send(Severity.HIGH,
                "Merge failed for item " + item,
                "Reconciliation of item " + item + " failed after " + attempts + " attempt(s): " + error
                        + ". The item is excluded from automatic dispatch until the flag is cleared.");
        audit("batch.merge", worker.taskId(), "flagged", Map.of(
                "item", item,
                "attempts", attempts,
                "batch_id", batch.batchId(),
                "error", String.valueOf(error)
        ));
        return MergeOutcome.flagged(item, attempts, error);
    }

    private boolean sleepBackoff() {
        try {
            Thread.sleep(settings.mergeRetryBackoffMs());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private BatchOutcome finish(ExecutionBatch batch, BatchMode mode, List<Integer> executed, long startNs) {
        if (batch.state() == BatchState.CHECKING) {
            batch.transition(mode == BatchMode.PARALLEL ? BatchState.PARALLEL_DISPATCH : BatchState.SEQUENTIAL_DISPATCH);
        }
        if (batch.state() != BatchState.RECONCILING) {
            batch.transition(BatchState.RECONCILING);
        }
        batch.transition(batch.anyFlagged() ? BatchState.FLAGGED : BatchState.MERGED);
        return new BatchOutcome(
                batch.batchId(),
                mode,
                executed,
                batch.outcomes(),
                Duration.ofNanos(System.nanoTime() - startNs),
                batch.state()
        );
    }

    private void releaseQuietly(Path context) {
        try {
            contexts.release(context);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to release isolated context {}: {}", context, e.getMessage());
        }
    }

    private void audit(String action, String taskId, String result, Map<String, Object> details) {
        if (auditLogger == null) {
            return;
        }
        try {
            auditLogger.log(AuditLogger.AuditEvent.of(action, "coordinator", "batch", result, taskId, details));
        } catch (RuntimeException e) {
            log.warn("Failed to write audit event {}: {}", action, e.getMessage());
        }
    }

    private static String describe(ProcessStatus status) {
        return status == null ? "unknown" : status.name().toLowerCase(Locale.ROOT);
    }

    private static List<List<Integer>> partition(List<Integer> items, int size) {
        List<List<Integer>> out = new ArrayList<>();
        for (int i = 0; i < items.size(); i += size) {
            out.add(items.subList(i, Math.min(items.size(), i + size)));
        }
        return out;
    }

    @Override
    public void close() {
        waiters.shutdown();
        try {
            if (!waiters.awaitTermination(5, TimeUnit.SECONDS)) {
                waiters.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            waiters.shutdownNow();
        }
    }

    public record Settings(int mergeMaxAttempts, long mergeRetryBackoffMs) {
        public static Settings from(WorkLoopSettings settings) {
            return new Settings(settings.mergeMaxAttempts(), settings.mergeRetryBackoffMs());
        }
    }
}
