package io.taskloom.coordination;

/**
 * How one item of a batch ended. {@code flagged} items exhausted their merge retries and are
 * excluded from automatic dispatch.
 */
public record MergeOutcome(int itemNumber, boolean merged, int attempts, boolean flagged, String error) {
    public static MergeOutcome merged(int itemNumber, int attempts) {
        return new MergeOutcome(itemNumber, true, attempts, false, null);
    }

    public static MergeOutcome flagged(int itemNumber, int attempts, String error) {
        return new MergeOutcome(itemNumber, false, attempts, true, error);
    }

    public static MergeOutcome skipped(int itemNumber, String reason) {
        return new MergeOutcome(itemNumber, false, 0, false, reason);
    }
}
