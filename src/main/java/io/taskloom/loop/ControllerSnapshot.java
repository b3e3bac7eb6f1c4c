package io.taskloom.loop;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Everything the controller needs to resume after a restart. Written as a whole every cycle.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ControllerSnapshot(
        @JsonProperty("schema_version") int schemaVersion,
        @JsonProperty("last_update") long lastUpdateMs,
        @JsonProperty("active_tasks") Map<String, ActiveTask> activeTasks,
        @JsonProperty("last_backlog_version") String lastBacklogVersion,
        @JsonProperty("last_periodic_runs") Map<String, Long> lastPeriodicRuns
) {
    public static final int CURRENT_SCHEMA_VERSION = 1;

    public ControllerSnapshot {
        activeTasks = activeTasks == null ? Map.of() : new LinkedHashMap<>(activeTasks);
        lastPeriodicRuns = lastPeriodicRuns == null ? Map.of() : new TreeMap<>(lastPeriodicRuns);
    }

    public static ControllerSnapshot empty() {
        return new ControllerSnapshot(CURRENT_SCHEMA_VERSION, 0L, Map.of(), null, Map.of());
    }
}
