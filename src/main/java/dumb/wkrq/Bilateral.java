package dumb.wkrq;

import java.util.List;

import static dumb.wkrq.Sign.F;
import static dumb.wkrq.Sign.T;

/**
 * Bilateral normal form for ACrQ. {@link #star} pushes negation inward until it rests on atoms,
 * where {@code ~R(t)} becomes {@code R*(t)} and {@code ~R*(t)} becomes {@code R(t)}. Formulas with the
 * same starred form are the same proposition to an ACrQ branch.
 */
public enum Bilateral {
    ;

    public static Formula star(Formula f) {
        if (f.isAtomic()) return f;
        if (f instanceof Formula.Quantified q)
            return new Formula.Quantified(q.kind(), q.var(), star(q.restriction()), star(q.matrix()));
        var c = (Formula.Compound) f;
        if (c.op() == Formula.Connective.NOT) return starNegated(c.operand());
        return new Formula.Compound(c.op(), c.operands().stream().map(Bilateral::star).toList());
    }

    /** The starred form of {@code ~p}. */
    private static Formula starNegated(Formula p) {
        if (p instanceof Formula.Bilateral b) return star(b.dual());
        if (p instanceof Formula.Atom a) return new Formula.Bilateral(a.name(), List.of(), true);
        if (p instanceof Formula.Predicate r) return new Formula.Bilateral(r.name(), r.terms(), true);
        if (p instanceof Formula.Quantified q)
            return new Formula.Quantified(dual(q.kind()), q.var(), star(q.restriction()), starNegated(q.matrix()));
        var c = (Formula.Compound) p;
        return switch (c.op()) {
            case NOT -> star(c.operand());
            case AND -> Formula.or(starNegated(c.left()), starNegated(c.right()));
            case OR -> Formula.and(starNegated(c.left()), starNegated(c.right()));
            case IMPLIES -> Formula.and(star(c.left()), starNegated(c.right()));
        };
    }

    static Formula.Quantifier dual(Formula.Quantifier q) {
        return q == Formula.Quantifier.FORALL ? Formula.Quantifier.EXISTS : Formula.Quantifier.FORALL;
    }

    /** The positive side of an atomic formula, as an {@link Formula.Atom} or {@link Formula.Predicate}. */
    static Formula base(Formula atomic) {
        if (atomic instanceof Formula.Bilateral b) return b.base();
        if (!atomic.isAtomic()) throw new IllegalArgumentException("Not atomic: " + atomic);
        return atomic;
    }

    /** The negative side R* of an atomic formula. */
    static Formula.Bilateral negative(Formula atomic) {
        var base = base(atomic);
        if (base instanceof Formula.Predicate p) return new Formula.Bilateral(p.name(), p.terms(), true);
        return new Formula.Bilateral(((Formula.Atom) base).name(), List.of(), true);
    }

    /**
     * The values a branch gives R and R*. Both true is a glut, both false a gap; in every other
     * combination the predicate behaves classically.
     */
    public record Valuation(Sign positive, Sign negative) {
        public boolean glut() {
            return positive == T && negative == T;
        }

        public boolean gap() {
            return positive == F && negative == F;
        }

        @Override
        public String toString() {
            return "(" + positive + ", " + negative + ")";
        }
    }
}
