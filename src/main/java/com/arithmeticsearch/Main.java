package com.arithmeticsearch;

import java.io.PrintStream;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    private static void usage(PrintStream err) {
        err.println(
                "Usage: arith-search [options] n1 n2 ... nk\n" +
                        "Combine every number exactly once with + - * / to reach the target.\n" +
                        "Options:\n" +
                        "  -target X     value to reach (integer, decimal or a/b)\n" +
                        "  -mode 24|163  game preset: 4 numbers to 24, or 6 numbers to 163\n" +
                        "  -max N        stop after N distinct solutions\n" +
                        "  -first        same as -max 1\n" +
                        "  -threads N    search top-level pairs on N threads\n" +
                        "  -verify       re-evaluate each printed expression\n"
        );
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /** @return 0 on success (solvable or not), 1 if verification failed, 2 on argument errors */
    static int run(String[] args, PrintStream out, PrintStream err) {
        SolverConfig config;
        try {
            config = OptionsParser.parse(args);
        } catch (IllegalArgumentException e) {
            logger.warn("Rejected arguments: {}", e.getMessage());
            usage(err);
            err.println("Argument error: " + e.getMessage());
            return 2;
        }

        long t0 = System.nanoTime();
        ArithmeticSolver solver = new ArithmeticSolver(config.threads);
        List<Solution> solutions = solver.solve(config);

        int status = 0;
        for (Solution s : solutions) {
            out.println(s);
            if (config.verify) {
                Fraction check = ExpressionEvaluator.evaluate(s.expression());
                if (!check.equals(config.target)) {
                    err.println("*verify failed: " + s.expression() + " evaluates to " + check);
                    status = 1;
                }
            }
        }
        if (solutions.isEmpty()) out.println("*no solution");

        long t1 = System.nanoTime();
        out.println(solver.getLastStats());
        out.printf("*Time=%.3fs%n", (t1 - t0) / 1_000_000_000.0);
        return status;
    }
}
