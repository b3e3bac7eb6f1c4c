package io.taskloom.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import io.taskloom.model.Role;
import io.taskloom.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tunables of the work loop. Loaded from {@code taskloom-settings.json}; every field of the
 * file is optional and falls back to {@link #defaults()}.
 */
public record WorkLoopSettings(
        long pollIntervalMs,
        int specBacklogTarget,
        int maxParallel,
        long taskTimeoutMs,
        long hungProcessTimeoutMs,
        long refactoringAnalysisIntervalMs,
        long autoPlanningIntervalMs,
        long queueCleanupIntervalMs,
        int queueRetentionDays,
        int mergeMaxAttempts,
        long mergeRetryBackoffMs,
        boolean autoMerge,
        String backlogFile,
        String footprintFile,
        String repoRoot,
        String trunkBranch,
        Map<Role, List<String>> workers
) {
    public static final long DEFAULT_POLL_INTERVAL_MS = 30_000L;
    public static final int DEFAULT_SPEC_BACKLOG_TARGET = 3;
    public static final int DEFAULT_MAX_PARALLEL = 3;
    public static final long DEFAULT_TASK_TIMEOUT_MS = 2L * 60L * 60L * 1000L;
    public static final long WEEK_MS = 7L * 24L * 60L * 60L * 1000L;
    public static final long DAY_MS = 24L * 60L * 60L * 1000L;

    public WorkLoopSettings {
        workers = workers == null ? Map.of() : Map.copyOf(workers);
    }

    public static WorkLoopSettings defaults() {
        Map<Role, List<String>> workers = new EnumMap<>(Role.class);
        for (Role role : Role.values()) {
            if (role != Role.ORCHESTRATOR) {
                workers.put(role, List.of("taskloom-worker", role.wireName()));
            }
        }
        return new WorkLoopSettings(
                DEFAULT_POLL_INTERVAL_MS,
                DEFAULT_SPEC_BACKLOG_TARGET,
                DEFAULT_MAX_PARALLEL,
                DEFAULT_TASK_TIMEOUT_MS,
                DEFAULT_TASK_TIMEOUT_MS,
                WEEK_MS,
                WEEK_MS,
                DAY_MS,
                30,
                3,
                2_000L,
                true,
                "backlog.json",
                "footprints.json",
                ".",
                "main",
                workers
        );
    }

    /**
     * Reads the settings file. A missing file yields the defaults; an unreadable or
     * inconsistent file is a {@link ConfigurationException}.
     */
    public static WorkLoopSettings load(Path file) {
        WorkLoopSettings defaults = defaults();
        if (file == null || !Files.exists(file)) {
            return defaults;
        }
        SettingsFile raw;
        try {
            raw = Jsons.mapper()
                    .readerFor(SettingsFile.class)
                    .with(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                    .readValue(file.toFile());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read settings file " + file, e);
        }
        return fromFile(raw, defaults);
    }

    static WorkLoopSettings fromFile(SettingsFile file, WorkLoopSettings defaults) {
        if (file == null) {
            return defaults;
        }
        List<String> problems = new ArrayList<>();
        long poll = sanitizeLong(file.pollIntervalMs(), defaults.pollIntervalMs(), 100L);
        int specTarget = sanitizeInt(file.specBacklogTarget(), defaults.specBacklogTarget(), 0);
        int maxParallel = sanitizeInt(file.maxParallel(), defaults.maxParallel(), 1);
        long taskTimeout = sanitizeLong(file.taskTimeoutMs(), defaults.taskTimeoutMs(), 1_000L);
        long hungTimeout = sanitizeLong(file.hungProcessTimeoutMs(), defaults.hungProcessTimeoutMs(), 1_000L);
        long refactoring = sanitizeLong(file.refactoringAnalysisIntervalMs(), defaults.refactoringAnalysisIntervalMs(), 0L);
        long planning = sanitizeLong(file.autoPlanningIntervalMs(), defaults.autoPlanningIntervalMs(), 0L);
        long cleanup = sanitizeLong(file.queueCleanupIntervalMs(), defaults.queueCleanupIntervalMs(), 0L);
        int retentionDays = sanitizeInt(file.queueRetentionDays(), defaults.queueRetentionDays(), 1);
        int mergeAttempts = sanitizeInt(file.mergeMaxAttempts(), defaults.mergeMaxAttempts(), 1);
        long mergeBackoff = sanitizeLong(file.mergeRetryBackoffMs(), defaults.mergeRetryBackoffMs(), 0L);
        boolean autoMerge = file.autoMerge() == null ? defaults.autoMerge() : file.autoMerge();
        String backlog = sanitizePath(file.backlogFile(), defaults.backlogFile());
        String footprints = sanitizePath(file.footprintFile(), defaults.footprintFile());
        String repoRoot = sanitizePath(file.repoRoot(), defaults.repoRoot());
        String trunk = file.trunkBranch() == null ? defaults.trunkBranch() : file.trunkBranch().trim();
        if (trunk.isEmpty()) {
            problems.add("trunkBranch must not be blank");
        }

        Map<Role, List<String>> workers = new EnumMap<>(Role.class);
        workers.putAll(defaults.workers());
        if (file.workers() != null) {
            for (Map.Entry<String, List<String>> entry : file.workers().entrySet()) {
                Role role;
                try {
                    role = Role.fromString(entry.getKey());
                } catch (IllegalArgumentException e) {
                    problems.add("workers: " + e.getMessage());
                    continue;
                }
                List<String> command = entry.getValue() == null ? List.of() : entry.getValue().stream()
                        .filter(part -> part != null && !part.isBlank())
                        .toList();
                if (command.isEmpty()) {
                    problems.add("workers." + role.wireName() + " must name an executable");
                    continue;
                }
                workers.put(role, command);
            }
        }
        if (!problems.isEmpty()) {
            throw new ConfigurationException("Invalid work loop settings", problems);
        }
        return new WorkLoopSettings(
                poll,
                specTarget,
                maxParallel,
                taskTimeout,
                hungTimeout,
                refactoring,
                planning,
                cleanup,
                retentionDays,
                mergeAttempts,
                mergeBackoff,
                autoMerge,
                backlog,
                footprints,
                repoRoot,
                trunk,
                workers
        );
    }

    public Path repoRootPath(Path base) {
        return resolve(base, repoRoot);
    }

    public Path backlogPath(Path base) {
        return resolve(base, backlogFile);
    }

    public Path footprintPath(Path base) {
        return resolve(base, footprintFile);
    }

    public List<String> workerCommand(Role role) {
        return workers.getOrDefault(role, List.of());
    }

    /**
     * Flattened view for the CLI and the audit log.
     */
    public Map<String, Object> toView() {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("poll_interval_ms", pollIntervalMs);
        view.put("spec_backlog_target", specBacklogTarget);
        view.put("max_parallel", maxParallel);
        view.put("task_timeout_ms", taskTimeoutMs);
        view.put("hung_process_timeout_ms", hungProcessTimeoutMs);
        view.put("refactoring_analysis_interval_ms", refactoringAnalysisIntervalMs);
        view.put("auto_planning_interval_ms", autoPlanningIntervalMs);
        view.put("queue_cleanup_interval_ms", queueCleanupIntervalMs);
        view.put("queue_retention_days", queueRetentionDays);
        view.put("merge_max_attempts", mergeMaxAttempts);
        view.put("merge_retry_backoff_ms", mergeRetryBackoffMs);
        view.put("auto_merge", autoMerge);
        view.put("backlog_file", backlogFile);
        view.put("footprint_file", footprintFile);
        view.put("repo_root", repoRoot);
        view.put("trunk_branch", trunkBranch);
        Map<String, Object> workerView = new LinkedHashMap<>();
        for (Role role : Role.values()) {
            List<String> command = workers.get(role);
            if (command != null) {
                workerView.put(role.wireName(), command);
            }
        }
        view.put("workers", workerView);
        return view;
    }

    private static Path resolve(Path base, String raw) {
        Path path = Path.of(raw);
        if (path.isAbsolute() || base == null) {
            return path.normalize();
        }
        return base.resolve(path).toAbsolutePath().normalize();
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static String sanitizePath(String raw, String fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        return raw.trim();
    }

    record SettingsFile(
            Long pollIntervalMs,
            Integer specBacklogTarget,
            Integer maxParallel,
            Long taskTimeoutMs,
            Long hungProcessTimeoutMs,
            Long refactoringAnalysisIntervalMs,
            Long autoPlanningIntervalMs,
            Long queueCleanupIntervalMs,
            Integer queueRetentionDays,
            Integer mergeMaxAttempts,
            Long mergeRetryBackoffMs,
            Boolean autoMerge,
            String backlogFile,
            String footprintFile,
            String repoRoot,
            String trunkBranch,
            Map<String, List<String>> workers
    ) {
    }
}
