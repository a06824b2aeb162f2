package dumb.wkrq;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * ACrQ: wKrQ without general negation elimination. Negation is driven inward by DeMorgan rules and
 * stops at atoms, where {@code ~R} becomes the independent predicate {@code R*}. Branches index formulas
 * by {@link Bilateral#star}, so {@code t:R(a)} and {@code t:R*(a)} coexist as a glut instead of closing.
 * An optional {@link EvidenceProvider} is consulted for each ground atom.
 */
public class AcrqRules extends WkrqRules {
    private static final Logger logger = LoggerFactory.getLogger(AcrqRules.class);

    @Nullable
    private final EvidenceProvider evidence;
    private final Map<Formula, Answer> answers = new HashMap<>();

    public AcrqRules(Instantiator instantiator, @Nullable EvidenceProvider evidence) {
        super(instantiator);
        this.evidence = evidence;
    }

    @Override
    public Formula canonical(Formula f) {
        return Bilateral.star(f);
    }

    @Override
    @Nullable
    protected Expansion atom(Sign sign, Formula f, Branch branch) {
        if (evidence != null && f.isGround() && !branch.consulted(Bilateral.base(f)))
            return consult(Bilateral.base(f));
        return super.atom(sign, f, branch);
    }

    @Override
    protected Expansion negation(Sign sign, Formula p, Branch branch) {
        var s = sign.symbol;
        if (p instanceof Formula.Bilateral b)
            return Expansion.alpha(s + "-not-bilateral", new SignedFormula(sign, b.base()));
        if (p.isAtomic())
            return Expansion.alpha(s + "-not-atom", new SignedFormula(sign, Bilateral.negative(p)));
        if (p instanceof Formula.Quantified q)
            return Expansion.alpha(s + "-not-" + (q.universal() ? "forall" : "exists"),
                    new SignedFormula(sign, q.with(Bilateral.dual(q.kind()), Formula.not(q.matrix()))));
        var c = (Formula.Compound) p;
        return switch (c.op()) {
            case NOT -> Expansion.alpha(s + "-not-not", new SignedFormula(sign, c.operand()));
            case AND -> Expansion.alpha(s + "-not-and",
                    new SignedFormula(sign, Formula.or(Formula.not(c.left()), Formula.not(c.right()))));
            case OR -> Expansion.alpha(s + "-not-or",
                    new SignedFormula(sign, Formula.and(Formula.not(c.left()), Formula.not(c.right()))));
            case IMPLIES -> Expansion.alpha(s + "-not-implies",
                    new SignedFormula(sign, Formula.and(c.left(), Formula.not(c.right()))));
        };
    }

    private Expansion consult(Formula base) {
        var answer = answers.computeIfAbsent(base, this::ask);
        var conclusions = List.of(
                new SignedFormula(answer.evidence.positive().sign, base),
                new SignedFormula(answer.evidence.negative().sign, Bilateral.negative(base)));
        return new Expansion("evidence", List.of(conclusions), Bookkeeping.EVIDENCE, null, answer.note);
    }

    private Answer ask(Formula base) {
        var name = base instanceof Formula.Predicate p ? p.name() : ((Formula.Atom) base).name();
        List<Term.Const> terms = base instanceof Formula.Predicate p
                ? p.terms().stream().map(Term.Const.class::cast).toList()
                : List.of();
        try {
            var e = evidence.evaluate(name, terms);
            if (e == null) {
                logger.warn("Evidence provider returned nothing for {}", base);
                return new Answer(EvidenceProvider.BilateralEvidence.UNKNOWN, "no evidence for " + base);
            }
            logger.debug("Evidence for {}: {}", base, e);
            return new Answer(e, "evidence " + e + " for " + base);
        } catch (RuntimeException ex) {
            logger.warn("Evidence provider failed for {}: {}", base, ex.getMessage());
            return new Answer(EvidenceProvider.BilateralEvidence.UNKNOWN, "provider failure for " + base + ": " + ex.getMessage());
        }
    }

    private record Answer(EvidenceProvider.BilateralEvidence evidence, String note) {
    }
}
