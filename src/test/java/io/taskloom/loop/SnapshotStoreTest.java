package io.taskloom.loop;

import io.taskloom.config.ConfigurationException;
import io.taskloom.model.TaskKind;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

final class SnapshotStoreTest {

    @Test
    void savedSnapshotLoadsBackUnchanged() throws Exception {
        Path root = Files.createTempDirectory("taskloom-test-snapshot-");
        try {
            SnapshotStore store = new SnapshotStore(root.resolve("state").resolve("controller.json"));
            ControllerSnapshot snapshot = new ControllerSnapshot(
                    ControllerSnapshot.CURRENT_SCHEMA_VERSION,
                    1_772_359_200_000L,
                    Map.of(
                            "spec_4", ActiveTask.single("task-a", 40001L, 1_772_359_100_000L, TaskKind.CREATE_SPEC, 4),
                            "impl_7", new ActiveTask("task-b", 40002L, 1_772_359_150_000L, TaskKind.IMPLEMENT, 7,
                                    "batch-1-1", "/tmp/worktrees/item-7"),
                            "auto_planning", ActiveTask.single("task-c", 40003L, 1_772_359_190_000L, TaskKind.AUTO_PLANNING, null)
                    ),
                    "1772359000000:512",
                    Map.of("auto_planning", 1_772_359_190_000L, "queue_cleanup", 1_772_300_000_000L)
            );

            store.save(snapshot);
            Optional<ControllerSnapshot> loaded = store.load();

            Assertions.assertEquals(Optional.of(snapshot), loaded);
            try (Stream<Path> files = Files.list(store.file().getParent())) {
                Assertions.assertEquals(List.of(store.file()), files.toList(), "no temp file is left behind");
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void missingSnapshotIsEmpty() throws Exception {
        Path root = Files.createTempDirectory("taskloom-test-snapshot-missing-");
        try {
            Assertions.assertTrue(new SnapshotStore(root.resolve("controller.json")).load().isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void newerSchemaIsRefused() throws Exception {
        Path root = Files.createTempDirectory("taskloom-test-snapshot-newer-");
        try {
            Path file = root.resolve("controller.json");
            Files.writeString(file, "{\"schema_version\": 99, \"last_update\": 1, \"active_tasks\": {}}", StandardCharsets.UTF_8);

            Assertions.assertThrows(ConfigurationException.class, () -> new SnapshotStore(file).load());
            Assertions.assertTrue(Files.exists(file), "a newer snapshot is left in place");
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unreadableSnapshotIsQuarantined() throws Exception {
        Path root = Files.createTempDirectory("taskloom-test-snapshot-corrupt-");
        try {
            Path file = root.resolve("controller.json");
            Files.writeString(file, "{\"schema_version\": 1, \"active_tasks\": {", StandardCharsets.UTF_8);

            Optional<ControllerSnapshot> loaded = new SnapshotStore(file).load();

            Assertions.assertTrue(loaded.isEmpty());
            Assertions.assertFalse(Files.exists(file));
            try (Stream<Path> files = Files.list(root)) {
                Assertions.assertTrue(files.anyMatch(p -> p.getFileName().toString().startsWith("controller.json.corrupt-")));
            }
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
