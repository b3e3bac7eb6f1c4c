package io.taskloom.process;

import io.taskloom.MutableClock;
import io.taskloom.config.TaskloomConfig;
import io.taskloom.config.WorkLoopSettings;
import io.taskloom.model.NewTask;
import io.taskloom.model.ProcessRecord;
import io.taskloom.model.ProcessStatus;
import io.taskloom.model.Role;
import io.taskloom.model.Task;
import io.taskloom.model.TaskKind;
import io.taskloom.model.TaskStatus;
import io.taskloom.observability.AuditLogger;
import io.taskloom.storage.Database;
import io.taskloom.storage.ProcessStore;
import io.taskloom.storage.WorkQueue;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class ProcessSupervisorTest {

    @Test
    void spawnLaunchesRoleCommandAndRecordsProcess() throws Exception {
        Path root = Files.createTempDirectory("taskloom-test-supervisor-spawn-");
        try {
            Fixture f = new Fixture(root);
            String taskId = f.enqueue(TaskKind.IMPLEMENT);

            SpawnResult result = f.supervisor.spawn(SpawnRequest.of(TaskKind.IMPLEMENT, taskId, 12));

            Assertions.assertTrue(result.success(), result.error());
            FakeProcessHost.Launch launch = f.host.launches().get(0);
            Assertions.assertEquals(List.of(
                    "taskloom-worker", "code_developer",
                    "--task-kind", "implement",
                    "--task-id", taskId,
                    "--item", "12"
            ), launch.command());
            Assertions.assertEquals(root, launch.workDir());
            Assertions.assertEquals(taskId, launch.environment().get(TemplateSpawnStrategy.ENV_TASK_ID));
            Assertions.assertEquals("code_developer", launch.environment().get(TemplateSpawnStrategy.ENV_ROLE));

            ProcessRecord record = f.store.latestByPid(result.pid()).orElseThrow();
            Assertions.assertEquals(ProcessStatus.SPAWNED, record.status());
            Assertions.assertEquals(Role.CODE_DEVELOPER, record.role());
            Assertions.assertEquals(12, record.priorityNumber());
            Assertions.assertEquals(result.recordId(), record.id());

            Assertions.assertEquals(ProcessStatus.RUNNING, f.supervisor.checkStatus(result.pid()).orElseThrow());
            Task task = f.queue.getTask(taskId).orElseThrow();
            Assertions.assertEquals(TaskStatus.RUNNING, task.status());
            Assertions.assertEquals("code_developer", task.startedBy());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void roleThatDoesNotPerformKindIsRejected() throws Exception {
        Path root = Files.createTempDirectory("taskloom-test-supervisor-role-");
        try {
            Fixture f = new Fixture(root);
            String taskId = f.enqueue(TaskKind.IMPLEMENT);

            SpawnResult result = f.supervisor.spawn(
                    new SpawnRequest(Role.ARCHITECT, TaskKind.IMPLEMENT, taskId, 3, null, Map.of()));

            Assertions.assertFalse(result.success());
            Assertions.assertTrue(f.host.launches().isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void launchFailureIsReportedAsData() throws Exception {
        Path root = Files.createTempDirectory("taskloom-test-supervisor-launch-fail-");
        try {
            Fixture f = new Fixture(root);
            f.host.failLaunches("no such executable");
            String taskId = f.enqueue(TaskKind.CREATE_SPEC);

            SpawnResult result = f.supervisor.spawn(SpawnRequest.of(TaskKind.CREATE_SPEC, taskId, 4));

            Assertions.assertFalse(result.success());
            Assertions.assertTrue(result.error().contains("no such executable"), result.error());
            Assertions.assertTrue(f.supervisor.listActive(true).isEmpty());
            Assertions.assertTrue(f.audit.recent(10).stream()
                    .anyMatch(e -> "process.spawn".equals(e.get("action")) && "failed".equals(e.get("result"))));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void cleanExitCompletesRecordAndTask() throws Exception {
        Path root = Files.createTempDirectory("taskloom-test-supervisor-exit-");
        try {
            Fixture f = new Fixture(root);
            String taskId = f.enqueue(TaskKind.IMPLEMENT);
            SpawnResult result = f.supervisor.spawn(SpawnRequest.of(TaskKind.IMPLEMENT, taskId, 1));
            f.supervisor.checkStatus(result.pid());

            f.clock.advance(Duration.ofSeconds(90));
            f.host.exit(result.pid(), 0);

            Assertions.assertEquals(ProcessStatus.COMPLETED, f.supervisor.checkStatus(result.pid()).orElseThrow());
            ProcessRecord record = f.store.latestByPid(result.pid()).orElseThrow();
            Assertions.assertEquals(0, record.exitCode());
            Assertions.assertNotNull(record.completedAtMs());
            Task task = f.queue.getTask(taskId).orElseThrow();
            Assertions.assertEquals(TaskStatus.COMPLETED, task.status());
            Assertions.assertEquals(90_000L, task.durationMs());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void nonZeroExitFailsRecordAndTask() throws Exception {
        Path root = Files.createTempDirectory("taskloom-test-supervisor-fail-");
        try {
            Fixture f = new Fixture(root);
            String taskId = f.enqueue(TaskKind.REVIEW);
            SpawnResult result = f.supervisor.spawn(SpawnRequest.of(TaskKind.REVIEW, taskId, null));
            f.host.exit(result.pid(), 3);

            Assertions.assertEquals(ProcessStatus.FAILED, f.supervisor.checkStatus(result.pid()).orElseThrow());
            Task task = f.queue.getTask(taskId).orElseThrow();
            Assertions.assertEquals(TaskStatus.FAILED, task.status());
            Assertions.assertTrue(task.error().contains("3"), task.error());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void hungDetectionReportsOnlyLongRunningLiveWorkers() throws Exception {
        Path root = Files.createTempDirectory("taskloom-test-supervisor-hung-");
        try {
            Fixture f = new Fixture(root);
            SpawnResult stuck = f.supervisor.spawn(SpawnRequest.of(TaskKind.IMPLEMENT, f.enqueue(TaskKind.IMPLEMENT), 1));
            SpawnResult finished = f.supervisor.spawn(SpawnRequest.of(TaskKind.CREATE_SPEC, f.enqueue(TaskKind.CREATE_SPEC), 2));
            f.supervisor.checkStatus(stuck.pid());
            f.supervisor.checkStatus(finished.pid());

            f.clock.advance(Duration.ofHours(2));
            f.host.exit(finished.pid(), 0);
            f.supervisor.checkStatus(finished.pid());

            List<ProcessRecord> hung = f.supervisor.detectHung(Duration.ofMinutes(30));
            Assertions.assertEquals(1, hung.size());
            Assertions.assertEquals(stuck.pid(), hung.get(0).pid());
            Assertions.assertTrue(f.supervisor.detectHung(Duration.ofHours(3)).isEmpty());
            Assertions.assertEquals(ProcessStatus.RUNNING, f.supervisor.checkStatus(stuck.pid()).orElseThrow(),
                    "hang detection is advisory");
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void killTerminatesWorkerAndFailsTask() throws Exception {
        Path root = Files.createTempDirectory("taskloom-test-supervisor-kill-");
        try {
            Fixture f = new Fixture(root);
            String taskId = f.enqueue(TaskKind.AUTO_PLANNING);
            SpawnResult result = f.supervisor.spawn(SpawnRequest.of(TaskKind.AUTO_PLANNING, taskId, null));

            KillResult killed = f.supervisor.kill(result.pid());

            Assertions.assertTrue(killed.killed(), killed.error());
            Assertions.assertTrue(f.host.handle(result.pid()).terminated());
            ProcessRecord record = f.store.latestByPid(result.pid()).orElseThrow();
            Assertions.assertEquals(ProcessStatus.KILLED, record.status());
            Assertions.assertEquals(ProcessSupervisor.KILLED_EXIT_CODE, record.exitCode());
            Task task = f.queue.getTask(taskId).orElseThrow();
            Assertions.assertEquals(TaskStatus.FAILED, task.status());
            Assertions.assertEquals("killed by supervisor", task.error());

            KillResult again = f.supervisor.kill(result.pid());
            Assertions.assertFalse(again.killed());
            Assertions.assertFalse(f.supervisor.kill(999_999L).killed());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void cleanupReleasesIsolatedContextOnlyAfterExit() throws Exception {
        Path root = Files.createTempDirectory("taskloom-test-supervisor-cleanup-");
        try {
            List<Path> released = new ArrayList<>();
            Fixture f = new Fixture(root, released::add);
            Path context = root.resolve("worktrees").resolve("item-7");
            String taskId = f.enqueue(TaskKind.IMPLEMENT);
            SpawnResult result = f.supervisor.spawn(SpawnRequest.of(TaskKind.IMPLEMENT, taskId, 7).inContext(context));
            Assertions.assertEquals(context, f.host.launches().get(0).workDir());

            Assertions.assertFalse(f.supervisor.cleanup(result.pid(), true), "live worker is left alone");
            Assertions.assertTrue(released.isEmpty());

            f.host.exit(result.pid(), 0);
            Assertions.assertTrue(f.supervisor.cleanup(result.pid(), true));
            Assertions.assertEquals(List.of(context), released);
            Assertions.assertNull(f.store.latestByPid(result.pid()).orElseThrow().isolatedContextPath());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void newSupervisorReattachesToWorkersOfPreviousRun() throws Exception {
        Path root = Files.createTempDirectory("taskloom-test-supervisor-restart-");
        try {
            Fixture f = new Fixture(root);
            String taskId = f.enqueue(TaskKind.IMPLEMENT);
            SpawnResult result = f.supervisor.spawn(SpawnRequest.of(TaskKind.IMPLEMENT, taskId, 5));

            ProcessSupervisor restarted = f.newSupervisor(IsolatedContextReleaser.NONE);
            Assertions.assertEquals(ProcessStatus.RUNNING, restarted.checkStatus(result.pid()).orElseThrow());
            Assertions.assertEquals(1, restarted.listActive(false).size());

            f.host.exit(result.pid(), 0);
            Assertions.assertEquals(ProcessStatus.COMPLETED, restarted.checkStatus(result.pid()).orElseThrow());
            Assertions.assertTrue(restarted.listActive(false).isEmpty());
            Assertions.assertEquals(1, restarted.listActive(true).size());
            Assertions.assertTrue(restarted.checkStatus(123L).isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    private static final class Fixture {
        final MutableClock clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        final Path root;
        final FakeProcessHost host = new FakeProcessHost(clock);
        final WorkQueue queue;
        final ProcessStore store;
        final AuditLogger audit;
        final ProcessSupervisor supervisor;

        Fixture(Path root) {
            this(root, IsolatedContextReleaser.NONE);
        }

        Fixture(Path root, IsolatedContextReleaser releaser) {
            this.root = root;
            TaskloomConfig config = TaskloomConfig.fromRoot(root.toString());
            Database db = new Database(config);
            db.init();
            this.queue = new WorkQueue(db, clock);
            this.store = new ProcessStore(db);
            this.audit = new AuditLogger(config.auditFile(), clock);
            this.supervisor = newSupervisor(releaser);
        }

        ProcessSupervisor newSupervisor(IsolatedContextReleaser releaser) {
            return new ProcessSupervisor(
                    host,
                    store,
                    queue,
                    SpawnTable.fromSettings(WorkLoopSettings.defaults()),
                    root,
                    releaser,
                    audit,
                    clock
            );
        }

        String enqueue(TaskKind kind) {
            return queue.enqueue(NewTask.of(Role.ORCHESTRATOR, kind, kind.defaultPriority(), Map.of()));
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
