package io.taskloom.coordination;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Transient bookkeeping for one batch, with its state transitions enforced:
 * checking, then parallel or sequential dispatch, then reconciling, then merged or flagged.
 * A multi-wave batch goes back from reconciling to dispatch for the next wave.
 */
public final class ExecutionBatch {
    private static final Map<BatchState, Set<BatchState>> TRANSITIONS = Map.of(
            BatchState.CHECKING, EnumSet.of(BatchState.PARALLEL_DISPATCH, BatchState.SEQUENTIAL_DISPATCH),
            BatchState.PARALLEL_DISPATCH, EnumSet.of(BatchState.RECONCILING),
            BatchState.SEQUENTIAL_DISPATCH, EnumSet.of(BatchState.RECONCILING),
            BatchState.RECONCILING, EnumSet.of(
                    BatchState.PARALLEL_DISPATCH, BatchState.SEQUENTIAL_DISPATCH, BatchState.MERGED, BatchState.FLAGGED),
            BatchState.MERGED, EnumSet.noneOf(BatchState.class),
            BatchState.FLAGGED, EnumSet.noneOf(BatchState.class)
    );

    private final String batchId;
    private final List<Integer> items;
    private final Map<Integer, MergeOutcome> outcomes = new LinkedHashMap<>();
    private BatchState state = BatchState.CHECKING;

    public ExecutionBatch(String batchId, List<Integer> items) {
        this.batchId = batchId;
        this.items = List.copyOf(items);
    }

    public synchronized void transition(BatchState next) {
        if (!TRANSITIONS.get(state).contains(next)) {
            throw new IllegalStateException("Batch " + batchId + " cannot go from " + state + " to " + next);
        }
        state = next;
    }

    public synchronized BatchState state() {
        return state;
    }

    public String batchId() {
        return batchId;
    }

    public List<Integer> items() {
        return items;
    }

    public synchronized void outcome(MergeOutcome outcome) {
        outcomes.put(outcome.itemNumber(), outcome);
    }

    public synchronized List<MergeOutcome> outcomes() {
        return List.copyOf(outcomes.values());
    }

    public synchronized boolean anyFlagged() {
        return outcomes.values().stream().anyMatch(MergeOutcome::flagged);
    }
}
