package com.arithmeticsearch;

import java.util.List;

/**
 * Depth-first enumeration of every way to collapse a pool of expression nodes to one.
 *
 * <p>Pools live in a per-size arena: {@code arena[s]} holds the pool of size {@code s}.
 * A step at size {@code s} writes its child pool into {@code arena[s - 1]} and the
 * recursion below only touches smaller slots, so a branch never sees a sibling's pool.
 * The child pool is the untouched nodes in their original order followed by the new node.
 */
final class PoolSearch {

    private final Expression[][] arena;
    private final SolutionAccumulator sink;
    private final SearchStats stats;
    private final int size;

    PoolSearch(List<Expression> leaves, SolutionAccumulator sink) {
        this.size = leaves.size();
        this.sink = sink;
        this.stats = sink.stats();
        this.arena = new Expression[size + 1][];
        for (int s = 1; s <= size; s++) arena[s] = new Expression[s];
        leaves.toArray(arena[size]);
    }

    /** Explores every pair of the initial pool in ascending (i, j) order. */
    void run() {
        expand(size);
    }

    /** Explores only the branches below the initial pair (i, j). */
    void runPair(int i, int j) {
        if (sink.isFull()) return;
        stats.pools++;
        expandPair(size, i, j);
    }

    private void expand(int s) {
        if (sink.isFull()) return;
        Expression[] pool = arena[s];
        if (s == 1) {
            sink.offer(pool[0]);
            return;
        }
        stats.pools++;
        for (int i = 0; i < s; i++) {
            for (int j = i + 1; j < s; j++) {
                if (!expandPair(s, i, j)) return;
            }
        }
    }

    /** @return false once the cap is reached */
    private boolean expandPair(int s, int i, int j) {
        Expression[] pool = arena[s];
        Expression[] child = arena[s - 1];
        int k = 0;
        for (int m = 0; m < s; m++) {
            if (m != i && m != j) child[k++] = pool[m];
        }
        for (Expression candidate : Combiner.combine(pool[i], pool[j], stats)) {
            if (sink.isFull()) return false;
            child[k] = candidate;
            expand(s - 1);
        }
        return !sink.isFull();
    }
}
