package com.arithmeticsearch;

import java.math.BigDecimal;

public final class OptionsParser {

    private OptionsParser() {}

    /** @throws IllegalArgumentException on an unknown option, a missing value or a bad number */
    public static SolverConfig parse(String[] args){
        SolverConfig.Builder b = new SolverConfig.Builder();

        for (int i=0; i<args.length; i++) {
            String a = args[i];
            switch (a) {
                case "-target": b.target(parseNumber(value(args, ++i, a))); break;
                case "-mode": b.mode(GameMode.fromLabel(value(args, ++i, a))); break;
                case "-max": b.maxSolutions(parseInt(value(args, ++i, a), a)); break;
                case "-first": b.maxSolutions(1); break;
                case "-threads": b.threads(parseInt(value(args, ++i, a), a)); break;
                case "-verify": b.verify(true); break;
                default:
                    // "-3" is a number, "-x" an option
                    if (a.startsWith("-") && !isNumber(a)) throw new IllegalArgumentException("Unknown option: " + a);
                    b.addNumber(parseNumber(a), literal(a));
            }
        }
        return b.build();
    }

    /** Accepts "5", "-3", "0.25" and "1/4". */
    static Fraction parseNumber(String s){
        String t = s.trim();
        try {
            if (t.indexOf('/') >= 0) return Fraction.parse(t);
            return Fraction.of(new BigDecimal(t));
        } catch (NumberFormatException | ArithmeticException e) {
            throw new IllegalArgumentException("Not a number: " + s, e);
        }
    }

    /** Decimals print as typed, without trailing zeros; a/b prints as (a/b). */
    static String literal(String s){
        String t = s.trim();
        if (t.indexOf('/') >= 0) return Expression.literalOf(Fraction.parse(t));
        return new BigDecimal(t).stripTrailingZeros().toPlainString();
    }

    private static boolean isNumber(String s){
        try {
            parseNumber(s);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static String value(String[] args, int i, String option){
        if (i >= args.length) throw new IllegalArgumentException("Missing value for " + option);
        return args[i];
    }

    private static int parseInt(String s, String option){
        try {
            return Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Bad value for " + option + ": " + s, e);
        }
    }
}
