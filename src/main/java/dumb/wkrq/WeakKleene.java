package dumb.wkrq;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;
import java.util.function.Function;

import static dumb.wkrq.Sign.E;
import static dumb.wkrq.Sign.F;
import static dumb.wkrq.Sign.T;

/**
 * Weak Kleene truth functions over the definite signs, and Ferguson's restricted quantifiers over
 * sets of (restriction, matrix) value pairs.
 */
public enum WeakKleene {
    ;

    /** Pairs under which a restricted quantifier stays meaningful: anything but an e, except behind a false restriction. */
    private static final Set<Pair> MEANINGFUL = Set.of(new Pair(T, T), new Pair(T, F), new Pair(F, T), new Pair(F, F), new Pair(F, E));

    public static Sign not(Sign a) {
        return definite(a).negate();
    }

    public static Sign and(Sign a, Sign b) {
        if (definite(a) == E || definite(b) == E) return E;
        return a == T && b == T ? T : F;
    }

    public static Sign or(Sign a, Sign b) {
        if (definite(a) == E || definite(b) == E) return E;
        return a == T || b == T ? T : F;
    }

    public static Sign implies(Sign a, Sign b) {
        return or(not(a), b);
    }

    public static Sign forall(Collection<Pair> pairs) {
        if (!MEANINGFUL.containsAll(pairs)) return E;
        return pairs.contains(new Pair(T, F)) ? F : T;
    }

    public static Sign exists(Collection<Pair> pairs) {
        if (!MEANINGFUL.containsAll(pairs)) return E;
        return pairs.contains(new Pair(T, T)) ? T : F;
    }

    /**
     * Evaluates {@code f} with atomic formulas looked up in {@code atoms}; quantifiers range over
     * {@code domain}. An atom the valuation does not know is an error.
     */
    public static Sign eval(Formula f, Function<Formula, Sign> atoms, Collection<Term.Const> domain) {
        if (f.isAtomic()) {
            var s = atoms.apply(f);
            if (s == null) throw new IllegalArgumentException("No value for " + f);
            return definite(s);
        }
        if (f instanceof Formula.Compound c) {
            return switch (c.op()) {
                case NOT -> not(eval(c.operand(), atoms, domain));
                case AND -> and(eval(c.left(), atoms, domain), eval(c.right(), atoms, domain));
                case OR -> or(eval(c.left(), atoms, domain), eval(c.right(), atoms, domain));
                case IMPLIES -> implies(eval(c.left(), atoms, domain), eval(c.right(), atoms, domain));
            };
        }
        var q = (Formula.Quantified) f;
        Set<Pair> pairs = new HashSet<>();
        for (var c : domain)
            pairs.add(new Pair(eval(q.restrictionAt(c), atoms, domain), eval(q.matrixAt(c), atoms, domain)));
        return q.universal() ? forall(pairs) : exists(pairs);
    }

    private static Sign definite(Sign s) {
        if (!s.definite()) throw new IllegalArgumentException("Not a truth value: " + s);
        return s;
    }

    public record Pair(Sign restriction, Sign matrix) {
    }
}
