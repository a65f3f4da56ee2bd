package com.arithmeticsearch;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.math.BigInteger;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for the {@link Fraction} class: reduction, arithmetic, exact equality and
 * the ordering used for canonical sorting.
 */
public class FractionTest {

    @Test
    public void testArithmetic() {
        Fraction a = Fraction.of(1, 2);
        Fraction b = Fraction.of(3, 4);
        // 1/2 + 3/4 = 5/4
        assertEquals(Fraction.of(5, 4), a.add(b));
        // 1/2 - 3/4 = -1/4
        assertEquals(Fraction.of(-1, 4), a.subtract(b));
        // 1/2 * 3/4 = 3/8
        assertEquals(Fraction.of(3, 8), a.multiply(b));
        // (1/2) / (3/4) = 2/3
        assertEquals(Fraction.of(2, 3), a.divide(b));
    }

    @Test
    public void testNormalizationAndSign() {
        // denominator always positive; gcd reduced
        assertEquals(Fraction.of(-2, 3), Fraction.of(4, -6));
        assertEquals(BigInteger.valueOf(3), Fraction.of(4, -6).denominator());
        assertEquals(Fraction.ONE, Fraction.of(10, 10));
        // zero normalizes to 0/1
        assertEquals(Fraction.ZERO, Fraction.of(0, -7));
        assertEquals(BigInteger.ONE, Fraction.of(0, -7).denominator());
        assertEquals(BigInteger.ONE, Fraction.of(3, 4).subtract(Fraction.of(6, 8)).denominator());
    }

    @Test
    public void testZeroDenominatorThrows() {
        assertThrows(ArithmeticException.class, () -> Fraction.of(1, 0));
    }

    @Test
    public void testDivideByZero() {
        Fraction a = Fraction.of(1, 2);
        assertThrows(ArithmeticException.class, () -> a.divide(Fraction.ZERO));
        assertNull(a.divideOrNull(Fraction.ZERO));
        assertEquals(Fraction.ZERO, Fraction.ZERO.divideOrNull(a));
    }

    @Test
    public void testExactEqualityNotApproximate() {
        // 1/3 + 1/3 + 1/3 is exactly 1; 0.1 + 0.2 is exactly 3/10
        Fraction third = Fraction.of(1, 3);
        assertEquals(Fraction.ONE, third.add(third).add(third));
        assertEquals(Fraction.of(3, 10), Fraction.of(0.1).add(Fraction.of(0.2)));
        assertNotEquals(Fraction.of(1_000_000_001, 1_000_000_000), Fraction.ONE);
    }

    @Test
    public void testFromDecimal() {
        assertEquals(Fraction.of(1, 2), Fraction.of(0.5));
        assertEquals(Fraction.of(5), Fraction.of(5.0));
        assertEquals(Fraction.of(-1, 8), Fraction.of(-0.125));
        assertEquals(Fraction.of(100), Fraction.of(new BigDecimal("1E+2")));
        assertThrows(IllegalArgumentException.class, () -> Fraction.of(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> Fraction.of(Double.POSITIVE_INFINITY));
    }

    @Test
    public void testComparisonTransitivityAndTotalOrder() {
        Fraction a = Fraction.parse("1/3");
        Fraction b = Fraction.parse("2/5");
        Fraction c = Fraction.parse("3/7");
        assertTrue(a.compareTo(b) < 0);
        assertTrue(b.compareTo(c) < 0);
        assertTrue(a.compareTo(c) < 0);
        assertEquals(0, a.compareTo(Fraction.parse("2/6")));
        assertTrue(Fraction.of(-1).compareTo(Fraction.ZERO) < 0);
    }

    @Test
    public void testParseAndToString() {
        assertEquals(Fraction.of(3, 4), Fraction.parse(" 3/4 "));
        assertEquals(Fraction.of(-2), Fraction.parse("-2"));
        assertEquals("7/3", Fraction.of(7, 3).toString());
        assertEquals("5", Fraction.of(10, 2).toString());
        assertEquals("-1/4", Fraction.of(1, -4).toString());
    }

    @Test
    public void testNegateAndDouble() {
        Fraction f = Fraction.of(-3, 7);
        assertEquals(Fraction.of(3, 7), f.negate());
        assertSame(Fraction.ZERO, Fraction.ZERO.negate());
        assertEquals(0.75, Fraction.of(3, 4).doubleValue(), 0.0);
        assertEquals(163.0, Fraction.of(163).doubleValue(), 0.0);
    }

    @Test
    public void testHashEqualsContract() {
        Fraction a = Fraction.of(10, 20);
        Fraction b = Fraction.of(1, 2);
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }
}
