package com.arithmeticsearch;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Immutable expression node: a number literal, a flattened sum or a flattened product.
 *
 * <p>The node set is closed. Sums and products keep two member lists, positive members
 * and negative members (subtrahends for a sum, divisors for a product). Joining two nodes
 * of the group's kind absorbs their members instead of nesting them, so every
 * combination of commutative operations has exactly one flat shape and one canonical text.
 */
public final class Expression {

    public enum Kind {
        NUMBER, SUM, PRODUCT;

        char positiveSign() { return this == SUM ? '+' : '*'; }
        char negativeSign() { return this == SUM ? '-' : '/'; }
    }

    /** Canonical member order: exact value first, rendered text breaks ties. */
    static final Comparator<Expression> CANONICAL_ORDER =
            Comparator.comparing(Expression::value).thenComparing(Expression::render);

    private final Kind kind;
    private final Fraction value;
    private final String literal;              // NUMBER only
    private final List<Expression> positives;  // SUM / PRODUCT only
    private final List<Expression> negatives;  // SUM / PRODUCT only
    private String text;                       // cached canonical rendering

    private Expression(Kind kind, Fraction value, String literal,
                       List<Expression> positives, List<Expression> negatives) {
        this.kind = kind;
        this.value = value;
        this.literal = literal;
        this.positives = positives;
        this.negatives = negatives;
    }

    /** Leaf for one input number; the literal is its plain decimal form. */
    public static Expression number(Fraction value, String literal) {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(literal, "literal");
        return new Expression(Kind.NUMBER, value, literal,
                Collections.emptyList(), Collections.emptyList());
    }

    public static Expression number(double x) {
        BigDecimal dec = BigDecimal.valueOf(x).stripTrailingZeros();
        return number(Fraction.of(x), dec.toPlainString());
    }

    /** Leaf for an exact value, printed by {@link #literalOf(Fraction)}. */
    public static Expression number(Fraction value) {
        return number(value, literalOf(value));
    }

    /** Integers print plainly, other values as a parenthesised {@code (a/b)}. */
    public static String literalOf(Fraction value) {
        return value.isInteger() ? value.toString() : "(" + value + ")";
    }

    /**
     * Joins {@code first} and {@code second} into a group of {@code groupKind}. With
     * {@code invertSecond} the second operand is subtracted (SUM) or divides (PRODUCT).
     * Operands already of {@code groupKind} contribute their members directly, with the
     * second operand's lists swapped when it is inverted.
     *
     * @return the flattened group, or {@code null} when a PRODUCT would divide by zero
     */
    public static Expression join(Kind groupKind, Expression first, Expression second, boolean invertSecond) {
        if (groupKind == Kind.NUMBER) throw new IllegalArgumentException("Cannot join into a number");
        List<Expression> pos = new ArrayList<>();
        List<Expression> neg = new ArrayList<>();
        absorb(groupKind, first, false, pos, neg);
        absorb(groupKind, second, invertSecond, pos, neg);

        // exact arithmetic: combining the operands' values equals folding over the merged members
        Fraction v;
        if (groupKind == Kind.SUM) {
            v = invertSecond ? first.value.subtract(second.value) : first.value.add(second.value);
        } else {
            v = invertSecond ? first.value.divideOrNull(second.value) : first.value.multiply(second.value);
            if (v == null) return null;
        }
        return new Expression(groupKind, v, null,
                Collections.unmodifiableList(pos), Collections.unmodifiableList(neg));
    }

    private static void absorb(Kind groupKind, Expression e, boolean inverted,
                               List<Expression> pos, List<Expression> neg) {
        if (e.kind == groupKind) {
            pos.addAll(inverted ? e.negatives : e.positives);
            neg.addAll(inverted ? e.positives : e.negatives);
        } else if (inverted) {
            neg.add(e);
        } else {
            pos.add(e);
        }
    }

    public Kind kind() { return kind; }

    /** Exact value, fixed at construction. */
    public Fraction value() { return value; }

    public List<Expression> positives() { return positives; }
    public List<Expression> negatives() { return negatives; }

    /**
     * Recomputes the value from the member tree instead of returning the cached one.
     *
     * @throws ArithmeticException if a divisor evaluates to zero
     */
    public Fraction evaluate() {
        switch (kind) {
            case NUMBER:
                return value;
            case SUM: {
                Fraction r = Fraction.ZERO;
                for (Expression e : positives) r = r.add(e.evaluate());
                for (Expression e : negatives) r = r.subtract(e.evaluate());
                return r;
            }
            case PRODUCT: {
                Fraction r = Fraction.ONE;
                for (Expression e : positives) r = r.multiply(e.evaluate());
                for (Expression e : negatives) r = r.divide(e.evaluate());
                return r;
            }
            default:
                throw new IllegalStateException("Unknown kind: " + kind);
        }
    }

    /**
     * Canonical text: members sorted by {@link #CANONICAL_ORDER}, positives before
     * negatives, leading positive sign dropped. Two nodes built in different orders from
     * the same commutative combination render identically.
     */
    public String render() {
        String t = text;
        if (t == null) {
            t = kind == Kind.NUMBER ? literal : renderGroup();
            text = t;
        }
        return t;
    }

    private String renderGroup() {
        List<Expression> pos = new ArrayList<>(positives);
        List<Expression> neg = new ArrayList<>(negatives);
        pos.sort(CANONICAL_ORDER);
        neg.sort(CANONICAL_ORDER);

        StringBuilder sb = new StringBuilder();
        for (Expression e : pos) appendMember(sb, kind.positiveSign(), e);
        for (Expression e : neg) appendMember(sb, kind.negativeSign(), e);
        if (sb.length() > 0 && sb.charAt(0) == kind.positiveSign()) sb.deleteCharAt(0);
        return sb.toString();
    }

    private void appendMember(StringBuilder sb, char sign, Expression member) {
        sb.append(sign);
        if (needsParentheses(member)) {
            sb.append('(').append(member.render()).append(')');
        } else {
            sb.append(member.render());
        }
    }

    // a sum inside a product binds looser than its operator; a product inside a sum does not
    private boolean needsParentheses(Expression member) {
        switch (member.kind) {
            case NUMBER:
                return false;
            case SUM:
                return kind == Kind.PRODUCT;
            case PRODUCT:
                return false;
            default:
                throw new IllegalStateException("Unknown kind: " + member.kind);
        }
    }

    @Override
    public String toString() {
        return render();
    }
}
