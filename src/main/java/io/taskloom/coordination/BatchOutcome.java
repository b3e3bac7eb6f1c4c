package io.taskloom.coordination;

import java.time.Duration;
import java.util.List;

public record BatchOutcome(
        String batchId,
        BatchMode mode,
        List<Integer> executed,
        List<MergeOutcome> mergeResults,
        Duration duration,
        BatchState finalState
) {
    public BatchOutcome {
        executed = List.copyOf(executed);
        mergeResults = List.copyOf(mergeResults);
    }
}
