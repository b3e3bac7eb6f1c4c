package io.taskloom.coordination;

public enum BatchState {
    CHECKING,
    PARALLEL_DISPATCH,
    SEQUENTIAL_DISPATCH,
    RECONCILING,
    MERGED,
    FLAGGED;

    public boolean terminal() {
        return this == MERGED || this == FLAGGED;
    }
}
