package io.taskloom.coordination;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * One dispatched wave. {@code completion} finishes once every worker has exited and been
 * reconciled; {@code deferred} items were not started in this wave and stay in the backlog.
 */
public record BatchDispatch(
        String batchId,
        BatchMode mode,
        List<DispatchedWorker> workers,
        List<Integer> deferred,
        CompletableFuture<BatchOutcome> completion
) {
    public BatchDispatch {
        workers = List.copyOf(workers);
        deferred = List.copyOf(deferred);
    }
}
