package io.taskloom.coordination;

import java.util.List;

/**
 * Result of a pairwise independence check. {@code independentGroups} partitions the candidates
 * greedily in their given order; the first group is always present, even for an invalid verdict.
 */
public record IndependenceVerdict(
        boolean valid,
        List<List<Integer>> independentGroups,
        List<ConflictPair> conflictingPairs,
        String reason
) {
    public IndependenceVerdict {
        independentGroups = independentGroups.stream().map(List::copyOf).toList();
        conflictingPairs = List.copyOf(conflictingPairs);
    }

    public List<Integer> firstGroup() {
        return independentGroups.isEmpty() ? List.of() : independentGroups.get(0);
    }
}
