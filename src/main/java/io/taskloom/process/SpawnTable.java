package io.taskloom.process;

import io.taskloom.config.ConfigurationException;
import io.taskloom.config.WorkLoopSettings;
import io.taskloom.model.TaskKind;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Closed mapping from task kind to spawn strategy. Every kind must be present; the role that
 * performs a kind is fixed by {@link TaskKind#role()}.
 */
public final class SpawnTable {
    private final Map<TaskKind, SpawnStrategy> strategies;

    public SpawnTable(Map<TaskKind, SpawnStrategy> strategies) {
        List<String> missing = new ArrayList<>();
        for (TaskKind kind : TaskKind.values()) {
            if (strategies == null || strategies.get(kind) == null) {
                missing.add(kind.wireName() + " (" + kind.role().wireName() + ")");
            }
        }
        if (!missing.isEmpty()) {
            throw new ConfigurationException("No spawn strategy for task kinds", missing);
        }
        this.strategies = new EnumMap<>(strategies);
    }

    public static SpawnTable fromSettings(WorkLoopSettings settings) {
        Map<TaskKind, SpawnStrategy> strategies = new EnumMap<>(TaskKind.class);
        List<String> problems = new ArrayList<>();
        for (TaskKind kind : TaskKind.values()) {
            List<String> command = settings.workerCommand(kind.role());
            if (command.isEmpty()) {
                problems.add("no worker command for role " + kind.role().wireName());
                continue;
            }
            strategies.put(kind, new TemplateSpawnStrategy(command));
        }
        if (!problems.isEmpty()) {
            throw new ConfigurationException("Incomplete worker configuration", problems);
        }
        return new SpawnTable(strategies);
    }

    public SpawnStrategy strategyFor(TaskKind kind) {
        return strategies.get(kind);
    }
}
