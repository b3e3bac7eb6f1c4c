package io.taskloom.runtime;

import io.taskloom.config.TaskloomConfig;
import io.taskloom.model.Task;
import io.taskloom.model.TaskKind;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class TaskloomRuntimeTest {

    @Test
    void enqueuedTasksAreListedAndCounted() throws Exception {
        Path root = Files.createTempDirectory("taskloom-test-runtime-queue-");
        try (TaskloomRuntime runtime = new TaskloomRuntime(TaskloomConfig.fromRoot(root.toString()))) {
            runtime.init();

            String implement = runtime.enqueue("implement", null, "{\"item\": 4}");
            String review = runtime.enqueue("review", 1, null);

            Task stored = runtime.task(implement).orElseThrow();
            Assertions.assertEquals("implement", stored.kind());
            Assertions.assertEquals(TaskKind.IMPLEMENT.defaultPriority(), stored.priority());
            Assertions.assertEquals(4, stored.payload().get("item"));
            Assertions.assertEquals(1, runtime.task(review).orElseThrow().priority());

            List<Task> queued = runtime.tasks("queued", 10);
            Assertions.assertEquals(2, queued.size());
            Assertions.assertTrue(runtime.tasks("completed", 10).isEmpty());

            TaskloomRuntime.StatusOutcome status = runtime.status();
            Assertions.assertTrue(status.dbOk());
            Assertions.assertFalse(status.controllerRunning());
            Assertions.assertEquals(2, status.tasks().queued());
            Assertions.assertNull(status.lastSnapshotAt());
            Assertions.assertTrue(runtime.auditLogger().recent(10).stream()
                    .anyMatch(e -> "task.enqueue".equals(e.get("action"))));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unknownTaskKindIsRejected() throws Exception {
        Path root = Files.createTempDirectory("taskloom-test-runtime-kind-");
        try (TaskloomRuntime runtime = new TaskloomRuntime(TaskloomConfig.fromRoot(root.toString()))) {
            runtime.init();

            Assertions.assertThrows(IllegalArgumentException.class, () -> runtime.enqueue("deploy", null, null));
            Assertions.assertEquals(0, runtime.status().tasks().total());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void defaultOwnershipTableIsValid() throws Exception {
        Path root = Files.createTempDirectory("taskloom-test-runtime-ownership-");
        try (TaskloomRuntime runtime = new TaskloomRuntime(TaskloomConfig.fromRoot(root.toString()))) {
            runtime.init();

            TaskloomRuntime.OwnershipOutcome out = runtime.validateOwnership();

            Assertions.assertTrue(out.valid());
            Assertions.assertTrue(out.violations().isEmpty());
            Assertions.assertTrue(out.rules().stream().anyMatch(line -> line.startsWith("docs/specs")));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void pidFileTracksControllerAndStaleFileIsCleared() throws Exception {
        Path root = Files.createTempDirectory("taskloom-test-runtime-pid-");
        try (TaskloomRuntime runtime = new TaskloomRuntime(TaskloomConfig.fromRoot(root.toString()))) {
            runtime.init();
            Assertions.assertFalse(runtime.stopController().stopRequested());

            long self = ProcessHandle.current().pid();
            runtime.writeControllerPid(self);
            Assertions.assertEquals(self, runtime.controllerPid().getAsLong());
            Assertions.assertTrue(runtime.controllerRunning());
            Assertions.assertFalse(runtime.stopRequested());
            Assertions.assertTrue(runtime.stopController().stopRequested());
            Assertions.assertTrue(runtime.stopRequested());
            Assertions.assertTrue(ProcessHandle.current().isAlive());
            runtime.clearStopRequest();
            Assertions.assertFalse(runtime.stopRequested());
            runtime.clearControllerPid();
            Assertions.assertTrue(runtime.controllerPid().isEmpty());

            runtime.writeControllerPid(999_999_999L);
            Assertions.assertFalse(runtime.controllerRunning());
            TaskloomRuntime.StopOutcome stale = runtime.stopController();
            Assertions.assertFalse(stale.stopRequested());
            Assertions.assertFalse(Files.exists(runtime.config().pidFile()));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void mergeFlagsCanBeListedAndCleared() throws Exception {
        Path root = Files.createTempDirectory("taskloom-test-runtime-flags-");
        try (TaskloomRuntime runtime = new TaskloomRuntime(TaskloomConfig.fromRoot(root.toString()))) {
            runtime.init();
            Assertions.assertTrue(runtime.flags().isEmpty());
            Assertions.assertFalse(runtime.unflag(3));
            Assertions.assertFalse(runtime.schemaMigrations().isEmpty());
            Assertions.assertEquals(0, runtime.purge(30).removedTasks());
        } finally {
            deleteRecursively(root);
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
