package io.taskloom.loop;

import io.taskloom.config.WorkLoopSettings;
import io.taskloom.model.TaskKind;

import java.util.Locale;

/**
 * Maintenance run on a timer. Jobs with a task kind are dispatched to a worker; queue cleanup
 * runs inside the controller.
 */
public enum PeriodicJob {
    REFACTORING_ANALYSIS(TaskKind.REFACTORING_ANALYSIS),
    AUTO_PLANNING(TaskKind.AUTO_PLANNING),
    QUEUE_CLEANUP(null);

    private final TaskKind kind;

    PeriodicJob(TaskKind kind) {
        this.kind = kind;
    }

    public TaskKind kind() {
        return kind;
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Zero or less disables the job. */
    public long intervalMs(WorkLoopSettings settings) {
        return switch (this) {
            case REFACTORING_ANALYSIS -> settings.refactoringAnalysisIntervalMs();
            case AUTO_PLANNING -> settings.autoPlanningIntervalMs();
            case QUEUE_CLEANUP -> settings.queueCleanupIntervalMs();
        };
    }
}
