package dumb.wkrq;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

import static dumb.wkrq.SignedFormula.e;
import static dumb.wkrq.SignedFormula.f;
import static dumb.wkrq.SignedFormula.m;
import static dumb.wkrq.SignedFormula.t;
import static java.util.Objects.requireNonNull;

/**
 * Ferguson's wKrQ tableau rules over the six signs. Propositional rules are one-shot; quantifier
 * rules split into witnesses, fired once, and per-constant obligations that stay live as the branch
 * acquires constants.
 */
public class WkrqRules implements Rules {

    protected final Instantiator instantiator;

    public WkrqRules(Instantiator instantiator) {
        this.instantiator = requireNonNull(instantiator);
    }

    @Override
    public Formula canonical(Formula f) {
        return f;
    }

    @Override
    @Nullable
    public Expansion expand(SignedFormula sf, Branch branch) {
        var sign = sf.sign();
        if (sign == Sign.V) throw new MalformedRuleApplication("No rule for sign v: " + sf);
        if (branch.consumed(sf)) return null;
        if (sign.meta() && satisfied(sign, sf.formula(), branch)) return null;

        var f = sf.formula();
        if (f.isAtomic()) return atom(sign, f, branch);
        if (f instanceof Formula.Quantified q) return quantified(sf, q, branch);
        var c = (Formula.Compound) f;
        return switch (c.op()) {
            case NOT -> negation(sign, c.operand(), branch);
            case AND -> conjunction(sign, c.left(), c.right());
            case OR -> disjunction(sign, c, c.left(), c.right());
            case IMPLIES -> implication(sign, c, c.left(), c.right());
        };
    }

    /** A meta sign is discharged once the branch commits to one of the values it admits. */
    protected boolean satisfied(Sign meta, Formula f, Branch branch) {
        for (var s : branch.signs(f))
            if (s.definite() && meta.admits(s)) return true;
        return false;
    }

    @Nullable
    protected Expansion atom(Sign sign, Formula f, Branch branch) {
        return switch (sign) {
            case M -> Expansion.beta("m-atom", List.of(t(f)), List.of(f(f)));
            case N -> Expansion.beta("n-atom", List.of(f(f)), List.of(e(f)));
            default -> null;
        };
    }

    @Nullable
    protected Expansion negation(Sign sign, Formula p, Branch branch) {
        return switch (sign) {
            case T -> Expansion.alpha("t-not", f(p));
            case F -> Expansion.alpha("f-not", t(p));
            case E -> Expansion.alpha("e-not", e(p));
            case M -> Expansion.beta("m-not", List.of(f(p)), List.of(t(p)));
            case N -> Expansion.beta("n-not", List.of(t(p)), List.of(e(p)));
            case V -> throw new MalformedRuleApplication("No rule for sign v");
        };
    }

    protected Expansion conjunction(Sign sign, Formula p, Formula q) {
        return switch (sign) {
            case T -> Expansion.alpha("t-and", t(p), t(q));
            case F -> Expansion.beta("f-and", List.of(f(p), m(q)), List.of(m(p), f(q)));
            case E -> Expansion.beta("e-and", List.of(e(p)), List.of(e(q)));
            case M -> Expansion.beta("m-and", List.of(t(p), t(q)), List.of(f(p), m(q)), List.of(m(p), f(q)));
            case N -> Expansion.beta("n-and", List.of(f(p), m(q)), List.of(m(p), f(q)), List.of(e(p)), List.of(e(q)));
            case V -> throw new MalformedRuleApplication("No rule for sign v");
        };
    }

    protected Expansion disjunction(Sign sign, Formula whole, Formula p, Formula q) {
        return switch (sign) {
            case T -> Expansion.beta("t-or", List.of(t(p), m(q)), List.of(m(p), t(q)), List.of(e(p), e(q), e(whole)));
            case F -> Expansion.alpha("f-or", f(p), f(q));
            case E -> Expansion.beta("e-or", List.of(e(p)), List.of(e(q)));
            case M -> Expansion.beta("m-or", List.of(f(p), f(q)), List.of(t(p), m(q)), List.of(m(p), t(q)));
            case N -> Expansion.beta("n-or", List.of(f(p), f(q)), List.of(e(p)), List.of(e(q)));
            case V -> throw new MalformedRuleApplication("No rule for sign v");
        };
    }

    protected Expansion implication(Sign sign, Formula whole, Formula p, Formula q) {
        return switch (sign) {
            case T -> Expansion.beta("t-implies", List.of(f(p), m(q)), List.of(m(p), t(q)), List.of(e(p), e(q), e(whole)));
            case F -> Expansion.alpha("f-implies", t(p), f(q));
            case E -> Expansion.beta("e-implies", List.of(e(p)), List.of(e(q)));
            case M -> Expansion.beta("m-implies", List.of(t(p), f(q)), List.of(f(p), m(q)), List.of(m(p), t(q)));
            case N -> Expansion.beta("n-implies", List.of(t(p), f(q)), List.of(e(p)), List.of(e(q)));
            case V -> throw new MalformedRuleApplication("No rule for sign v");
        };
    }

    @Nullable
    protected Expansion quantified(SignedFormula sf, Formula.Quantified q, Branch branch) {
        var name = sf.sign().symbol + "-" + (q.universal() ? "forall" : "exists");
        return switch (sf.sign()) {
            case M -> Expansion.beta(name, List.of(t(q)), List.of(f(q)));
            case N -> Expansion.beta(name, List.of(f(q)), List.of(e(q)));
            case E -> branch.witnessed(sf) ? null : error(name, q, instantiator.freshWitness(branch));
            case T -> q.universal() ? instance(name, sf, q, branch) : existentialWitness(name, sf, q, branch);
            case F -> q.universal() ? counterexample(name, sf, q, branch) : instance(name, sf, q, branch);
            case V -> throw new MalformedRuleApplication("No rule for sign v");
        };
    }

    /** {@code t:∀} and {@code f:∃} at the next unused constant. */
    @Nullable
    private Expansion instance(String name, SignedFormula sf, Formula.Quantified q, Branch branch) {
        var a = instantiator.nextInstance(sf, branch);
        if (a == null) return null;
        var matrix = q.universal() ? t(q.matrixAt(a)) : f(q.matrixAt(a));
        return new Expansion(name + "-instance",
                List.of(List.of(f(q.restrictionAt(a))), List.of(t(q.restrictionAt(a)), matrix)),
                Bookkeeping.INSTANTIATE, a, null);
    }

    /**
     * {@code f:∀}: a fresh counterexample, then the side condition that the quantifier stays
     * meaningful at every other constant.
     */
    @Nullable
    private Expansion counterexample(String name, SignedFormula sf, Formula.Quantified q, Branch branch) {
        if (!branch.witnessed(sf)) {
            var c = instantiator.freshWitness(branch);
            return new Expansion(name + "-witness",
                    List.of(List.of(t(q.restrictionAt(c)), f(q.matrixAt(c)))),
                    Bookkeeping.WITNESS, c, null);
        }
        return meaningful(name, sf, q, branch);
    }

    /**
     * {@code t:∃}: every constant already satisfying the restriction may serve as the witness, and a
     * fresh witness is always kept as the last alternative.
     */
    @Nullable
    private Expansion existentialWitness(String name, SignedFormula sf, Formula.Quantified q, Branch branch) {
        if (branch.witnessed(sf)) return meaningful(name, sf, q, branch);
        var c = instantiator.freshWitness(branch);
        List<List<SignedFormula>> branches = new ArrayList<>();
        for (var a : instantiator.witnessCandidates(q, branch))
            branches.add(List.of(t(q.matrixAt(a))));
        branches.add(List.of(t(q.restrictionAt(c)), t(q.matrixAt(c))));
        return new Expansion(name + "-witness", branches, Bookkeeping.WITNESS, c, null);
    }

    /** No constant may make the restriction true and the matrix undefined. */
    @Nullable
    private Expansion meaningful(String name, SignedFormula sf, Formula.Quantified q, Branch branch) {
        var a = instantiator.nextInstance(sf, branch);
        if (a == null) return null;
        return new Expansion(name + "-meaningful",
                List.of(List.of(f(q.restrictionAt(a))), List.of(t(q.restrictionAt(a)), m(q.matrixAt(a)))),
                Bookkeeping.INSTANTIATE, a, null);
    }

    private static Expansion error(String name, Formula.Quantified q, Term.Const c) {
        return new Expansion(name + "-witness",
                List.of(List.of(e(q.restrictionAt(c))), List.of(t(q.restrictionAt(c)), e(q.matrixAt(c)))),
                Bookkeeping.WITNESS, c, null);
    }
}
