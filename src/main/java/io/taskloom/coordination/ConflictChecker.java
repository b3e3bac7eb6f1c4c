package io.taskloom.coordination;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public final class ConflictChecker {
    private static final Logger log = LoggerFactory.getLogger(ConflictChecker.class);

    private final DisjointnessOracle oracle;

    public ConflictChecker(DisjointnessOracle oracle) {
        this.oracle = oracle;
    }

    /**
     * Asks the oracle about every pair. The verdict is valid only if all pairs are independent;
     * an oracle failure marks that pair as conflicting and never escapes.
     */
    public IndependenceVerdict checkIndependence(List<Integer> items) {
        List<Integer> candidates = new ArrayList<>(new LinkedHashSet<>(items));
        if (candidates.size() < 2) {
            return new IndependenceVerdict(true, candidates.isEmpty() ? List.of() : List.of(candidates),
                    List.of(), "fewer than two candidates");
        }
        List<ConflictPair> conflicts = new ArrayList<>();
        Set<Long> dependent = new HashSet<>();
        for (int i = 0; i < candidates.size(); i++) {
            for (int j = i + 1; j < candidates.size(); j++) {
                int a = candidates.get(i);
                int b = candidates.get(j);
                String reason = null;
                try {
                    if (!oracle.areIndependent(a, b)) {
                        reason = "overlapping footprint";
                    }
                } catch (Exception e) {
                    log.warn("Disjointness oracle failed for items {} and {}: {}", a, b, e.getMessage());
                    reason = "oracle error: " + e.getMessage();
                }
                if (reason != null) {
                    conflicts.add(new ConflictPair(a, b, reason));
                    dependent.add(pairKey(a, b));
                }
            }
        }
        List<List<Integer>> groups = greedyGroups(candidates, dependent);
        boolean valid = conflicts.isEmpty();
        String reason = valid
                ? "all " + candidates.size() + " candidates are pairwise independent"
                : conflicts.size() + " conflicting pair(s)";
        return new IndependenceVerdict(valid, groups, conflicts, reason);
    }

    /**
     * Takes the first remaining item, then every later item independent of all already chosen,
     * and repeats on what is left.
     */
    private static List<List<Integer>> greedyGroups(List<Integer> candidates, Set<Long> dependent) {
        List<List<Integer>> groups = new ArrayList<>();
        List<Integer> remaining = new ArrayList<>(candidates);
        while (!remaining.isEmpty()) {
            List<Integer> group = new ArrayList<>();
            List<Integer> rest = new ArrayList<>();
            for (Integer item : remaining) {
                boolean fits = true;
                for (Integer chosen : group) {
                    if (dependent.contains(pairKey(item, chosen))) {
                        fits = false;
                        break;
                    }
                }
                if (fits) {
                    group.add(item);
                } else {
                    rest.add(item);
                }
            }
            groups.add(group);
            remaining = rest;
        }
        return groups;
    }

    private static long pairKey(int a, int b) {
        int lo = Math.min(a, b);
        int hi = Math.max(a, b);
        return ((long) lo << 32) | (hi & 0xffffffffL);
    }
}
