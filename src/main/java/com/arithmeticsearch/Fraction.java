package com.arithmeticsearch;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.Objects;

/** Immutable arbitrary-precision rational with normalized sign and gcd reduction. */
public final class Fraction implements Comparable<Fraction> {
    public static final Fraction ZERO = new Fraction(BigInteger.ZERO, BigInteger.ONE);
    public static final Fraction ONE  = new Fraction(BigInteger.ONE,  BigInteger.ONE);

    private final BigInteger n;        // numerator
    private final BigInteger d;        // denominator > 0

    /** Creates and reduces; denominator must be nonzero. */
    public Fraction(BigInteger num, BigInteger den) {
        Objects.requireNonNull(num, "numerator");
        Objects.requireNonNull(den, "denominator");
        if (den.signum() == 0) throw new ArithmeticException("Zero denominator");
        if (num.signum() == 0) { this.n = BigInteger.ZERO; this.d = BigInteger.ONE; return; }
        if (den.signum() < 0) { num = num.negate(); den = den.negate(); }
        BigInteger g = num.gcd(den);
        this.n = num.divide(g);
        this.d = den.divide(g);
    }

    /** Factories */
    public static Fraction of(long k) { return new Fraction(BigInteger.valueOf(k), BigInteger.ONE); }
    public static Fraction of(long num, long den) { return new Fraction(BigInteger.valueOf(num), BigInteger.valueOf(den)); }

    /**
     * Exact value of the shortest decimal form of {@code x}, so {@code 0.1} becomes 1/10
     * rather than the binary approximation.
     */
    public static Fraction of(double x) {
        if (!Double.isFinite(x)) throw new IllegalArgumentException("Not a finite number: " + x);
        return of(BigDecimal.valueOf(x));
    }

    public static Fraction of(BigDecimal x) {
        BigDecimal t = x.stripTrailingZeros();
        if (t.scale() <= 0) return new Fraction(t.toBigIntegerExact(), BigInteger.ONE);
        return new Fraction(t.unscaledValue(), BigInteger.TEN.pow(t.scale()));
    }

    /** Parse "a/b" or "a" (whitespace ok). */
    public static Fraction parse(String s) {
        String t = s.trim();
        int slash = t.indexOf('/');
        if (slash < 0) return new Fraction(new BigInteger(t), BigInteger.ONE);
        BigInteger a = new BigInteger(t.substring(0, slash).trim());
        BigInteger b = new BigInteger(t.substring(slash + 1).trim());
        return new Fraction(a, b);
    }

    public BigInteger numerator()   { return n; }
    public BigInteger denominator() { return d; }

    // ---- arithmetic ----

    public Fraction add(Fraction o) {
        return new Fraction(n.multiply(o.d).add(o.n.multiply(d)), d.multiply(o.d));
    }

    public Fraction subtract(Fraction o) {
        return new Fraction(n.multiply(o.d).subtract(o.n.multiply(d)), d.multiply(o.d));
    }

    public Fraction multiply(Fraction o) {
        // (n/d)*(x/y) with cross-cancel
        BigInteger g1 = n.gcd(o.d);
        BigInteger g2 = d.gcd(o.n);
        BigInteger a = n.divide(g1);
        BigInteger b = o.n.divide(g2);
        BigInteger c = d.divide(g2);
        BigInteger e = o.d.divide(g1);
        return new Fraction(a.multiply(b), c.multiply(e));
    }

    public Fraction divide(Fraction o) {
        Fraction q = divideOrNull(o);
        if (q == null) throw new ArithmeticException("Divide by zero fraction");
        return q;
    }

    /** Quotient, or {@code null} when the divisor is zero. */
    public Fraction divideOrNull(Fraction o) {
        if (o.n.signum() == 0) return null;
        return new Fraction(n.multiply(o.d), d.multiply(o.n));
    }

    public Fraction negate() { return n.signum() == 0 ? ZERO : new Fraction(n.negate(), d); }
    public boolean isInteger() { return d.equals(BigInteger.ONE); }

    public double doubleValue() {
        if (isInteger()) return n.doubleValue();
        return new BigDecimal(n).divide(new BigDecimal(d), MathContext.DECIMAL64).doubleValue();
    }

    // ---- Comparable ----
    @Override public int compareTo(Fraction o) {
        // a/b ? c/d  <=>  ad ? cb
        return n.multiply(o.d).compareTo(o.n.multiply(d));
    }

    // ---- Object ----
    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Fraction)) return false;
        Fraction o = (Fraction) obj;
        return n.equals(o.n) && d.equals(o.d);
    }

    @Override public int hashCode() { return n.hashCode() * 31 + d.hashCode(); }

    /** Integers print as integers, rationals as a/b. */
    @Override public String toString() {
        return isInteger() ? n.toString() : n + "/" + d;
    }
}
