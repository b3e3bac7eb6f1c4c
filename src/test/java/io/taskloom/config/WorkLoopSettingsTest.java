package io.taskloom.config;

import io.taskloom.model.Role;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class WorkLoopSettingsTest {

    @Test
    void missingFileYieldsDefaults() throws Exception {
        Path root = Files.createTempDirectory("taskloom-test-settings-defaults-");
        try {
            WorkLoopSettings settings = WorkLoopSettings.load(root.resolve("taskloom-settings.json"));

            Assertions.assertEquals(WorkLoopSettings.defaults(), settings);
            Assertions.assertEquals(30_000L, settings.pollIntervalMs());
            Assertions.assertEquals(3, settings.specBacklogTarget());
            Assertions.assertEquals(WorkLoopSettings.WEEK_MS, settings.refactoringAnalysisIntervalMs());
            Assertions.assertEquals(List.of("taskloom-worker", "architect"), settings.workerCommand(Role.ARCHITECT));
            Assertions.assertTrue(settings.workerCommand(Role.ORCHESTRATOR).isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void partialFileOverridesOnlyWhatItNames() throws Exception {
        Path root = Files.createTempDirectory("taskloom-test-settings-partial-");
        try {
            Path file = root.resolve("taskloom-settings.json");
            Files.writeString(file, """
                    {
                      "pollIntervalMs": 5000,
                      "maxParallel": 0,
                      "autoMerge": false,
                      "repoRoot": "../workspace",
                      "workers": {"code-developer": ["./bin/dev-agent", "--fast"]}
                    }
                    """, StandardCharsets.UTF_8);

            WorkLoopSettings settings = WorkLoopSettings.load(file);

            Assertions.assertEquals(5_000L, settings.pollIntervalMs());
            Assertions.assertEquals(1, settings.maxParallel(), "clamped to at least one");
            Assertions.assertFalse(settings.autoMerge());
            Assertions.assertEquals(3, settings.specBacklogTarget());
            Assertions.assertEquals(List.of("./bin/dev-agent", "--fast"), settings.workerCommand(Role.CODE_DEVELOPER));
            Assertions.assertEquals(List.of("taskloom-worker", "architect"), settings.workerCommand(Role.ARCHITECT));
            Path base = Path.of("/srv/taskloom/repo");
            Assertions.assertEquals(Path.of("/srv/taskloom/workspace"), settings.repoRootPath(base));
            Assertions.assertEquals(Path.of("/srv/taskloom/repo/backlog.json"), settings.backlogPath(base));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void invalidEntriesAreReportedTogether() throws Exception {
        Path root = Files.createTempDirectory("taskloom-test-settings-invalid-");
        try {
            Path file = root.resolve("taskloom-settings.json");
            Files.writeString(file, """
                    {
                      "trunkBranch": "  ",
                      "workers": {"janitor": ["x"], "architect": []}
                    }
                    """, StandardCharsets.UTF_8);

            ConfigurationException error = Assertions.assertThrows(ConfigurationException.class,
                    () -> WorkLoopSettings.load(file));

            Assertions.assertEquals(3, error.problems().size(), error.problems().toString());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unknownKeyIsAConfigurationError() throws Exception {
        Path root = Files.createTempDirectory("taskloom-test-settings-unknown-");
        try {
            Path file = root.resolve("taskloom-settings.json");
            Files.writeString(file, "{\"pollIntervalSeconds\": 5}", StandardCharsets.UTF_8);

            Assertions.assertThrows(ConfigurationException.class, () -> WorkLoopSettings.load(file));
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
