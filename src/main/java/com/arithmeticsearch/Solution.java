package com.arithmeticsearch;

import java.util.Objects;

/** One way to reach the target: canonical expression text and its exact value. */
public final class Solution {
    private final String expression;
    private final Fraction value;

    public Solution(String expression, Fraction value) {
        this.expression = Objects.requireNonNull(expression, "expression");
        this.value = Objects.requireNonNull(value, "value");
    }

    public String expression() { return expression; }
    public Fraction value()    { return value; }
    public double doubleValue() { return value.doubleValue(); }

    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Solution)) return false;
        Solution o = (Solution) obj;
        return expression.equals(o.expression) && value.equals(o.value);
    }

    @Override public int hashCode() { return expression.hashCode() * 31 + value.hashCode(); }

    @Override public String toString() { return expression + " = " + value; }
}
