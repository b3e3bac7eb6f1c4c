package io.taskloom.loop;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.taskloom.model.TaskKind;

/**
 * A dispatched task the controller is tracking. {@code batchId} and {@code contextPath} are set
 * only for items started as part of a parallel batch.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ActiveTask(
        @JsonProperty("task_id") String taskId,
        @JsonProperty("pid") long pid,
        @JsonProperty("started_at") long startedAtMs,
        @JsonProperty("kind") TaskKind kind,
        @JsonProperty("item") Integer itemNumber,
        @JsonProperty("batch_id") String batchId,
        @JsonProperty("context_path") String contextPath
) {
    public static ActiveTask single(String taskId, long pid, long startedAtMs, TaskKind kind, Integer itemNumber) {
        return new ActiveTask(taskId, pid, startedAtMs, kind, itemNumber, null, null);
    }

    public boolean inBatch() {
        return batchId != null;
    }
}
