package com.arithmeticsearch;

import java.math.BigDecimal;

/**
 * Evaluates expression text such as {@code 13*(5+8)-(1*(2+4))} with exact rational
 * arithmetic. Grammar, usual precedence, left associative:
 *
 * <pre>
 *   expr   := term (('+' | '-') term)*
 *   term   := factor (('*' | '/') factor)*
 *   factor := '-' factor | number | '(' expr ')'
 * </pre>
 *
 * Whitespace is ignored.
 */
public final class ExpressionEvaluator {

    private final String src;
    private int pos;

    private ExpressionEvaluator(String src) {
        this.src = src;
    }

    /**
     * @throws IllegalArgumentException on malformed text
     * @throws ArithmeticException on division by zero
     */
    public static Fraction evaluate(String text) {
        ExpressionEvaluator p = new ExpressionEvaluator(text);
        Fraction v = p.expr();
        p.skipSpaces();
        if (p.pos != p.src.length()) throw p.error("Unexpected '" + p.src.charAt(p.pos) + "'");
        return v;
    }

    private Fraction expr() {
        Fraction v = term();
        while (true) {
            char c = peek();
            if (c == '+') { pos++; v = v.add(term()); }
            else if (c == '-') { pos++; v = v.subtract(term()); }
            else return v;
        }
    }

    private Fraction term() {
        Fraction v = factor();
        while (true) {
            char c = peek();
            if (c == '*') { pos++; v = v.multiply(factor()); }
            else if (c == '/') { pos++; v = v.divide(factor()); }
            else return v;
        }
    }

    private Fraction factor() {
        char c = peek();
        if (c == '-') {
            pos++;
            return factor().negate();
        }
        if (c == '(') {
            pos++;
            Fraction v = expr();
            if (peek() != ')') throw error("Expected ')'");
            pos++;
            return v;
        }
        return number();
    }

    private Fraction number() {
        int start = pos;
        while (pos < src.length() && (Character.isDigit(src.charAt(pos)) || src.charAt(pos) == '.')) pos++;
        if (start == pos) throw error(pos < src.length() ? "Unexpected '" + src.charAt(pos) + "'" : "Unexpected end of input");
        try {
            return Fraction.of(new BigDecimal(src.substring(start, pos)));
        } catch (NumberFormatException e) {
            throw error("Bad number '" + src.substring(start, pos) + "'");
        }
    }

    // next non-space char, or 0 at end
    private char peek() {
        skipSpaces();
        return pos < src.length() ? src.charAt(pos) : 0;
    }

    private void skipSpaces() {
        while (pos < src.length() && Character.isWhitespace(src.charAt(pos))) pos++;
    }

    private IllegalArgumentException error(String msg) {
        return new IllegalArgumentException(msg + " at position " + pos + " in \"" + src + "\"");
    }
}
