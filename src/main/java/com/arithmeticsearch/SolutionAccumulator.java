package com.arithmeticsearch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Collects solutions for one search: the target, the cap, the texts already reported
 * and the counters. Shared by every recursive step of that search and nothing else.
 */
final class SolutionAccumulator {
    private final Fraction target;
    private final int maxSolutions;
    private final Set<String> seen = new HashSet<>();
    private final List<Solution> solutions = new ArrayList<>();
    private final SearchStats stats = new SearchStats();

    SolutionAccumulator(Fraction target, int maxSolutions) {
        this.target = target;
        this.maxSolutions = maxSolutions;
    }

    /** True once the cap is reached; every pending branch stops at this point. */
    boolean isFull() {
        return solutions.size() >= maxSolutions;
    }

    /** Checks a single-node pool against the target and records it if its text is new. */
    void offer(Expression terminal) {
        stats.terminals++;
        if (!terminal.value().equals(target)) return;
        stats.matches++;
        String text = terminal.render();
        if (!seen.add(text)) {
            stats.duplicates++;
            return;
        }
        solutions.add(new Solution(text, terminal.value()));
        if (isFull()) stats.capReached = true;
    }

    /**
     * Appends solutions found elsewhere, skipping texts already held, until the cap.
     * Used to merge partitions in pair order.
     */
    void mergeFrom(SolutionAccumulator other) {
        stats.merge(other.stats);
        for (Solution s : other.solutions) {
            if (isFull()) break;
            if (seen.add(s.expression())) solutions.add(s);
            else stats.duplicates++;
        }
        if (isFull()) stats.capReached = true;
    }

    List<Solution> solutions() {
        stats.solutions = solutions.size();
        return Collections.unmodifiableList(solutions);
    }

    SearchStats stats() {
        stats.solutions = solutions.size();
        return stats;
    }
}
