package io.taskloom.process;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base command from settings, followed by {@code --task-kind}, {@code --task-id} and, when
 * known, {@code --item} and {@code --workdir}.
 */
public final class TemplateSpawnStrategy implements SpawnStrategy {
    public static final String ENV_TASK_ID = "TASKLOOM_TASK_ID";
    public static final String ENV_ROLE = "TASKLOOM_ROLE";

    private final List<String> baseCommand;

    public TemplateSpawnStrategy(List<String> baseCommand) {
        if (baseCommand == null || baseCommand.isEmpty()) {
            throw new IllegalArgumentException("worker command cannot be empty");
        }
        this.baseCommand = List.copyOf(baseCommand);
    }

    @Override
    public List<String> command(SpawnRequest request) {
        List<String> out = new ArrayList<>(baseCommand);
        out.add("--task-kind");
        out.add(request.taskKind().wireName());
        out.add("--task-id");
        out.add(request.taskId());
        if (request.itemNumber() != null) {
            out.add("--item");
            out.add(String.valueOf(request.itemNumber()));
        }
        if (request.workDir() != null) {
            out.add("--workdir");
            out.add(request.workDir().toString());
        }
        return out;
    }

    @Override
    public Map<String, String> environment(SpawnRequest request) {
        Map<String, String> env = new LinkedHashMap<>();
        env.put(ENV_TASK_ID, request.taskId());
        env.put(ENV_ROLE, request.role().wireName());
        return env;
    }

    List<String> baseCommand() {
        return baseCommand;
    }
}
