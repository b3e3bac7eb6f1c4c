package io.taskloom.model;

/**
 * Lifecycle of a supervised worker process: spawned, then running, then one terminal state.
 * A worker that exits before its first probe may go from spawned straight to a terminal state.
 */
public enum ProcessStatus {
    SPAWNED,
    RUNNING,
    COMPLETED,
    FAILED,
    KILLED;

    public boolean terminal() {
        return this == COMPLETED || this == FAILED || this == KILLED;
    }

    public boolean canTransitionTo(ProcessStatus next) {
        if (next == null || terminal()) {
            return false;
        }
        return switch (this) {
            case SPAWNED -> next != SPAWNED;
            case RUNNING -> next.terminal();
            default -> false;
        };
    }
}
