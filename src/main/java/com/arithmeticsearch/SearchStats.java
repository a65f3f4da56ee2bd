package com.arithmeticsearch;

/** Counters for one search invocation. */
public final class SearchStats {
    public long pools;          // non-terminal pools expanded
    public long terminals;      // single-node pools checked against the target
    public long matches;        // terminals equal to the target, duplicates included
    public long duplicates;     // matches dropped because their text was already reported
    public long pruned;         // candidates dropped on a zero divisor
    public int solutions;
    public boolean capReached;

    /** Adds another partition's counters into this one. */
    void merge(SearchStats o) {
        pools += o.pools;
        terminals += o.terminals;
        matches += o.matches;
        duplicates += o.duplicates;
        pruned += o.pruned;
    }

    @Override
    public String toString() {
        return "*Totals: solutions=" + solutions +
                " pools=" + pools +
                " terminals=" + terminals +
                " duplicates=" + duplicates +
                " pruned=" + pruned +
                (capReached ? " (stopped at cap)" : "");
    }
}
