package io.taskloom.config;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Filesystem layout of one taskloom installation. Everything the controller owns lives
 * under {@link #rootDir()}; the workspace it orchestrates is configured separately in
 * {@link WorkLoopSettings#repoRoot()}.
 */
public final class TaskloomConfig {
    public static final String DEFAULT_ROOT = "data";

    private final Path rootDir;

    public TaskloomConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static TaskloomConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new TaskloomConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("taskloom.db");
    }

    public Path settingsFile() {
        return rootDir.resolve("taskloom-settings.json");
    }

    public Path stateDir() {
        return rootDir.resolve("state");
    }

    public Path snapshotFile() {
        return stateDir().resolve("work-loop-state.json");
    }

    public Path pidFile() {
        return stateDir().resolve("controller.pid");
    }

    public Path stopRequestFile() {
        return stateDir().resolve("controller.stop");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }

    public Path workerLogDir() {
        return rootDir.resolve("logs");
    }

    public Path worktreeRoot() {
        return rootDir.resolve("worktrees");
    }
}
