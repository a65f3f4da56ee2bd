package com.arithmeticsearch;

import java.util.ArrayList;
import java.util.List;

import com.arithmeticsearch.Expression.Kind;

/** Every single-operator result of two expression nodes. */
final class Combiner {

    private Combiner() {}

    /**
     * Candidates in fixed order: a+b, a*b, a-b, b-a, a/b, b/a. Products and quotients that
     * divide by zero are left out, so the list holds four to six nodes.
     *
     * @param stats receives one prune per dropped candidate; may be {@code null}
     */
    static List<Expression> combine(Expression a, Expression b, SearchStats stats) {
        List<Expression> out = new ArrayList<>(6);
        out.add(Expression.join(Kind.SUM, a, b, false));
        addIfDefined(out, Expression.join(Kind.PRODUCT, a, b, false), stats);
        out.add(Expression.join(Kind.SUM, a, b, true));
        out.add(Expression.join(Kind.SUM, b, a, true));
        addIfDefined(out, Expression.join(Kind.PRODUCT, a, b, true), stats);
        addIfDefined(out, Expression.join(Kind.PRODUCT, b, a, true), stats);
        return out;
    }

    static List<Expression> combine(Expression a, Expression b) {
        return combine(a, b, null);
    }

    private static void addIfDefined(List<Expression> out, Expression e, SearchStats stats) {
        if (e != null) out.add(e);
        else if (stats != null) stats.pruned++;
    }
}
