package com.arithmeticsearch;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class ExpressionEvaluatorTest {

    @Test
    public void precedenceAndAssociativity() {
        assertEquals(Fraction.of(163), ExpressionEvaluator.evaluate("(5+8)*13-(4+2)*1"));
        assertEquals(Fraction.of(7), ExpressionEvaluator.evaluate("1+2*3"));
        assertEquals(Fraction.of(1), ExpressionEvaluator.evaluate("8/4/2"));
        assertEquals(Fraction.of(5), ExpressionEvaluator.evaluate("10-2-3"));
        assertEquals(Fraction.of(24), ExpressionEvaluator.evaluate("8/(3-8/3)"));
    }

    @Test
    public void unaryMinusDecimalsAndFractionLiterals() {
        assertEquals(Fraction.of(8), ExpressionEvaluator.evaluate("5--3"));
        assertEquals(Fraction.of(-6), ExpressionEvaluator.evaluate("-3*2"));
        assertEquals(Fraction.of(2), ExpressionEvaluator.evaluate("0.5*4"));
        assertEquals(Fraction.of(6), ExpressionEvaluator.evaluate("3/(1/2)"));
        assertEquals(Fraction.of(7), ExpressionEvaluator.evaluate(" 3 + 4 "));
    }

    @Test
    public void rendersOfSearchNodesEvaluateToTheirValue() {
        Expression e = Expression.join(Expression.Kind.PRODUCT,
                Expression.number(-2),
                Expression.join(Expression.Kind.SUM, Expression.number(0.5), Expression.number(7), true),
                true);
        assertEquals(e.value(), ExpressionEvaluator.evaluate(e.render()));
    }

    @Test
    public void malformedTextIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> ExpressionEvaluator.evaluate(""));
        assertThrows(IllegalArgumentException.class, () -> ExpressionEvaluator.evaluate("1+"));
        assertThrows(IllegalArgumentException.class, () -> ExpressionEvaluator.evaluate("(1+2"));
        assertThrows(IllegalArgumentException.class, () -> ExpressionEvaluator.evaluate("1+2)"));
        assertThrows(IllegalArgumentException.class, () -> ExpressionEvaluator.evaluate("2^3"));
        assertThrows(IllegalArgumentException.class, () -> ExpressionEvaluator.evaluate("1..2"));
    }

    @Test
    public void divisionByZeroIsArithmetic() {
        assertThrows(ArithmeticException.class, () -> ExpressionEvaluator.evaluate("1/(2-2)"));
    }
}
