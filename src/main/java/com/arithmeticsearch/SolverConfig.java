package com.arithmeticsearch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class SolverConfig {
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    public final List<Fraction> numbers;    // hand, in input order
    public final List<String> literals;     // how each number prints, same order
    public final Fraction target;
    public final int maxSolutions;          // cap (UNBOUNDED = no cap)
    public final int threads;               // top-level pair partitions run in parallel
    public final GameMode mode;             // preset, or null
    public final boolean verify;            // re-evaluate printed expressions

    private SolverConfig(Builder b) {
        this.numbers = Collections.unmodifiableList(new ArrayList<>(b.numbers));
        this.literals = Collections.unmodifiableList(new ArrayList<>(b.literals));
        this.mode = b.mode;
        this.target = b.target != null ? b.target : (b.mode != null ? b.mode.target() : null);
        this.maxSolutions = b.maxSolutions;
        this.threads = b.threads;
        this.verify = b.verify;
    }

    public static final class Builder {
        private final List<Fraction> numbers = new ArrayList<>();
        private final List<String> literals = new ArrayList<>();
        private Fraction target;
        private int maxSolutions = UNBOUNDED;
        private int threads = 1;
        private GameMode mode;
        private boolean verify;

        public Builder addNumber(Fraction f){ return addNumber(f, Expression.literalOf(f)); }
        public Builder addNumber(Fraction f, String literal){ this.numbers.add(f); this.literals.add(literal); return this; }
        public Builder target(Fraction t){ this.target=t; return this; }
        public Builder maxSolutions(int v){ this.maxSolutions=v; return this; }
        public Builder threads(int v){ this.threads=Math.max(1,v); return this; }
        public Builder mode(GameMode m){ this.mode=m; return this; }
        public Builder verify(boolean v){ this.verify=v; return this; }

        /** @throws IllegalArgumentException on a missing target, a bad cap or a hand that does not fit the mode */
        public SolverConfig build(){
            if (target == null && mode == null) throw new IllegalArgumentException("Missing target (use -target or -mode)");
            if (maxSolutions <= 0) throw new IllegalArgumentException("maxSolutions must be greater than zero: " + maxSolutions);
            if (numbers.isEmpty()) throw new IllegalArgumentException("At least one number is required");
            if (mode != null && numbers.size() != mode.handSize())
                throw new IllegalArgumentException("Mode " + mode.label() + " takes " + mode.handSize()
                        + " numbers, got " + numbers.size());
            return new SolverConfig(this);
        }
    }
}
