package com.arithmeticsearch;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds every structurally distinct way to combine a hand of numbers with + - * / into a
 * target value.
 *
 * <p>Each number is used exactly once. Results are exact (rational arithmetic, no
 * tolerance) and reported in discovery order: initial pairs ascending, then the
 * combiner's fixed operator order. Expressions that flatten to the same canonical text
 * are reported once.
 *
 * <p>A solver instance holds no search state between calls apart from
 * {@link #getLastStats()}; separate instances can run concurrently.
 */
public class ArithmeticSolver {

    private static final Logger logger = LoggerFactory.getLogger(ArithmeticSolver.class);

    private final int threads;
    private SearchStats lastStats = null;

    public ArithmeticSolver() {
        this(1);
    }

    /** @param threads worker threads for partitioning the top-level pairs; 1 searches inline */
    public ArithmeticSolver(int threads) {
        this.threads = Math.max(1, threads);
    }

    public SearchStats getLastStats() { return lastStats; }

    // ---- double entry points ----

    public List<Solution> findSolutions(double[] numbers, double target) {
        return findSolutions(numbers, target, SolverConfig.UNBOUNDED);
    }

    /**
     * @throws IllegalArgumentException if {@code numbers} is empty or holds a non-finite
     *         value, if {@code target} is not finite, or if {@code maxSolutions <= 0}
     */
    public List<Solution> findSolutions(double[] numbers, double target, int maxSolutions) {
        if (numbers == null || numbers.length == 0)
            throw new IllegalArgumentException("The numbers array must contain at least one entry.");
        if (!Double.isFinite(target))
            throw new IllegalArgumentException("Target must be a finite number: " + target);
        List<Expression> leaves = new ArrayList<>(numbers.length);
        for (double x : numbers) {
            if (!Double.isFinite(x)) throw new IllegalArgumentException("Numbers must be finite: " + x);
            leaves.add(Expression.number(x));
        }
        return search(leaves, Fraction.of(target), maxSolutions);
    }

    public Optional<Solution> findFirstSolution(double[] numbers, double target) {
        return first(findSolutions(numbers, target, 1));
    }

    // ---- exact entry points ----

    public List<Solution> findSolutions(List<Fraction> numbers, Fraction target) {
        return findSolutions(numbers, target, SolverConfig.UNBOUNDED);
    }

    /** @throws IllegalArgumentException if {@code numbers} is empty or {@code maxSolutions <= 0} */
    public List<Solution> findSolutions(List<Fraction> numbers, Fraction target, int maxSolutions) {
        if (numbers == null || numbers.isEmpty())
            throw new IllegalArgumentException("The numbers list must contain at least one entry.");
        Objects.requireNonNull(target, "target");
        List<Expression> leaves = new ArrayList<>(numbers.size());
        for (Fraction f : numbers) leaves.add(Expression.number(Objects.requireNonNull(f, "number")));
        return search(leaves, target, maxSolutions);
    }

    public Optional<Solution> findFirstSolution(List<Fraction> numbers, Fraction target) {
        return first(findSolutions(numbers, target, 1));
    }

    /** Searches the configured hand; each number prints with its configured literal. */
    public List<Solution> solve(SolverConfig config) {
        List<Expression> leaves = new ArrayList<>(config.numbers.size());
        for (int i = 0; i < config.numbers.size(); i++) {
            leaves.add(Expression.number(config.numbers.get(i), config.literals.get(i)));
        }
        return search(leaves, config.target, config.maxSolutions);
    }

    private static Optional<Solution> first(List<Solution> solutions) {
        return solutions.isEmpty() ? Optional.empty() : Optional.of(solutions.get(0));
    }

    // ---- search ----

    private List<Solution> search(List<Expression> leaves, Fraction target, int maxSolutions) {
        if (maxSolutions <= 0)
            throw new IllegalArgumentException("maxSolutions must be greater than zero: " + maxSolutions);

        logger.debug("Searching {} for {} (cap={}, threads={})", leaves, target,
                maxSolutions == SolverConfig.UNBOUNDED ? "none" : maxSolutions, threads);
        long t0 = System.nanoTime();

        SolutionAccumulator result;
        if (threads > 1 && leaves.size() > 2) {
            result = searchParallel(leaves, target, maxSolutions);
        } else {
            result = new SolutionAccumulator(target, maxSolutions);
            new PoolSearch(leaves, result).run();
        }

        List<Solution> solutions = result.solutions();
        lastStats = result.stats();
        logger.debug("{} in {} ms", lastStats, (System.nanoTime() - t0) / 1_000_000);
        return solutions;
    }

    /**
     * Runs each top-level pair (i, j) as its own capped search, then merges the partitions
     * in ascending pair order. A partition capped at {@code maxSolutions} always holds
     * enough new texts to fill whatever the earlier partitions left open, so the merged
     * list equals the sequential one.
     */
    private SolutionAccumulator searchParallel(List<Expression> leaves, Fraction target, int maxSolutions) {
        int n = leaves.size();
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        List<Future<SolutionAccumulator>> parts = new ArrayList<>();
        try {
            for (int i = 0; i < n; i++) {
                for (int j = i + 1; j < n; j++) {
                    final int a = i, b = j;
                    parts.add(pool.submit(() -> {
                        SolutionAccumulator acc = new SolutionAccumulator(target, maxSolutions);
                        new PoolSearch(leaves, acc).runPair(a, b);
                        return acc;
                    }));
                }
            }
            logger.debug("Scheduled {} pair partitions on {} threads", parts.size(), threads);

            SolutionAccumulator merged = new SolutionAccumulator(target, maxSolutions);
            for (Future<SolutionAccumulator> f : parts) {
                merged.mergeFrom(f.get());
            }
            return merged;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Search interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            if (cause instanceof Error) throw (Error) cause;
            throw new IllegalStateException("Search partition failed", cause);
        } finally {
            pool.shutdownNow();
        }
    }
}
