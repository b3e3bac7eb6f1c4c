package io.taskloom.coordination;

/**
 * Decides whether two backlog items can be worked on at the same time without touching the
 * same files. Treated as a black box; any exception it throws counts as "not independent".
 */
@FunctionalInterface
public interface DisjointnessOracle {
    boolean areIndependent(int itemA, int itemB) throws Exception;
}
