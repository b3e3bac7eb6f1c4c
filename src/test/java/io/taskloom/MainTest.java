package io.taskloom;

import com.fasterxml.jackson.databind.JsonNode;
import io.taskloom.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

final class MainTest {

    @Test
    void enqueuedTaskIsVisibleThroughTheCli() throws Exception {
        Path root = Files.createTempDirectory("taskloom-test-cli-");
        try {
            Assertions.assertEquals(0, run("--root", root.toString(), "init").exitCode);
            Assertions.assertTrue(Files.exists(root.resolve("taskloom.db")));

            Result enqueued = run("--root", root.toString(), "enqueue", "--kind", "create-spec", "--payload", "{\"item\": 8}");
            Assertions.assertEquals(0, enqueued.exitCode);
            String taskId = Jsons.mapper().readTree(enqueued.out).get("task_id").asText();

            Result listed = run("--root", root.toString(), "tasks", "--status", "queued");
            Assertions.assertEquals(0, listed.exitCode);
            JsonNode tasks = Jsons.mapper().readTree(listed.out);
            Assertions.assertEquals(1, tasks.size());
            Assertions.assertEquals(taskId, tasks.get(0).get("taskId").asText());
            Assertions.assertEquals(5, tasks.get(0).get("priority").asInt());

            Assertions.assertEquals(1, run("--root", root.toString(), "task", "missing-id").exitCode);
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void ownershipValidationSucceedsForBuiltInTable() throws Exception {
        Path root = Files.createTempDirectory("taskloom-test-cli-ownership-");
        try {
            Result result = run("--root", root.toString(), "validate-ownership");

            Assertions.assertEquals(0, result.exitCode);
            Assertions.assertTrue(Jsons.mapper().readTree(result.out).get("valid").asBoolean());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void invalidSettingsExitWithConfigurationError() throws Exception {
        Path root = Files.createTempDirectory("taskloom-test-cli-config-");
        try {
            Files.writeString(root.resolve("taskloom-settings.json"), "{\"trunkBranch\": \"\"}", StandardCharsets.UTF_8);

            Result result = run("--root", root.toString(), "status");

            Assertions.assertEquals(Main.CONFIGURATION_ERROR, result.exitCode);
            Assertions.assertTrue(result.err.contains("trunkBranch"), result.err);
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void stopCommandEndsARunningControllerWithExitCodeZero() throws Exception {
        Path root = Files.createTempDirectory("taskloom-test-cli-stop-");
        try {
            Files.writeString(root.resolve("taskloom-settings.json"), Jsons.toJson(Map.of(
                    "pollIntervalMs", 100,
                    "refactoringAnalysisIntervalMs", 0,
                    "autoPlanningIntervalMs", 0,
                    "repoRoot", root.toString()
            )), StandardCharsets.UTF_8);
            AtomicInteger startExit = new AtomicInteger(-1);
            Thread controller = new Thread(
                    () -> startExit.set(Main.newCommandLine().execute("--root", root.toString(), "start")),
                    "taskloom-test-controller");
            controller.start();
            Path pidFile = root.resolve("state").resolve("controller.pid");
            for (int i = 0; i < 200 && !Files.exists(pidFile); i++) {
                Thread.sleep(25L);
            }
            Assertions.assertTrue(Files.exists(pidFile), "controller never wrote its pid file");

            Result stop = run("--root", root.toString(), "stop");
            Assertions.assertEquals(0, stop.exitCode, stop.out);
            Assertions.assertTrue(Jsons.mapper().readTree(stop.out).get("stopRequested").asBoolean());

            controller.join(15_000L);
            Assertions.assertFalse(controller.isAlive());
            Assertions.assertEquals(0, startExit.get());
            Assertions.assertFalse(Files.exists(pidFile));
            Assertions.assertFalse(Files.exists(root.resolve("state").resolve("controller.stop")));
            Assertions.assertTrue(Files.exists(root.resolve("state").resolve("work-loop-state.json")));
        } finally {
            deleteRecursively(root);
        }
    }

    private static Result run(String... args) {
        CommandLine cmd = Main.newCommandLine();
        StringWriter err = new StringWriter();
        cmd.setErr(new PrintWriter(err, true));
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        PrintStream original = System.out;
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        int exitCode;
        try {
            exitCode = cmd.execute(args);
        } finally {
            System.setOut(original);
        }
        return new Result(exitCode, out.toString(StandardCharsets.UTF_8), err.toString());
    }

    private record Result(int exitCode, String out, String err) {
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
