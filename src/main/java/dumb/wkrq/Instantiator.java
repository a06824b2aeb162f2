package dumb.wkrq;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Chooses the constants quantifier rules instantiate with. Fresh names come from two monotonic
 * sequences owned by one tableau: {@code a_N} for arbitrary instances of universal obligations on an
 * empty domain, {@code c_N} for witnesses. Peeking is side-effect free; {@link #commit} advances the
 * sequence once the controller has applied the expansion that used the name.
 */
public class Instantiator {
    static final String ARBITRARY = "a_";
    static final String WITNESS = "c_";

    private int arbitrary = 1;
    private int witness = 1;

    /**
     * The next constant {@code obligation} has not yet been applied to on {@code branch}: an existing
     * constant in order of appearance, or an arbitrary fresh one when the branch has no constants.
     */
    @Nullable
    public Term.Const nextInstance(SignedFormula obligation, Branch branch) {
        var constants = branch.constants();
        if (constants.isEmpty()) return fresh(ARBITRARY, arbitrary, branch);
        for (var c : constants)
            if (!branch.instantiated(obligation, c)) return c;
        return null;
    }

    public Term.Const freshWitness(Branch branch) {
        return fresh(WITNESS, witness, branch);
    }

    /**
     * Constants {@code a} for which the branch already asserts {@code t:} of the restriction of
     * {@code q} instantiated at {@code a}. Matching is done on canonical forms.
     */
    public List<Term.Const> witnessCandidates(Formula.Quantified q, Branch branch) {
        var pattern = branch.canonical(q.restriction());
        Set<Term.Const> found = new LinkedHashSet<>();
        for (var sf : branch.formulas()) {
            if (sf.sign() != Sign.T) continue;
            var c = Unifier.bindingOf(q.var(), pattern, branch.canonical(sf.formula()));
            if (c != null && branch.has(Sign.T, q.restrictionAt(c))) found.add(c);
        }
        return new ArrayList<>(found);
    }

    /** Advances the sequence {@code c} was drawn from past it. Existing constants are ignored. */
    public void commit(@Nullable Term.Const c) {
        if (c == null) return;
        var n = sequenceNumber(c.name(), ARBITRARY);
        if (n > 0) {
            arbitrary = Math.max(arbitrary, n + 1);
            return;
        }
        n = sequenceNumber(c.name(), WITNESS);
        if (n > 0) witness = Math.max(witness, n + 1);
    }

    private static Term.Const fresh(String prefix, int from, Branch branch) {
        var n = from;
        Term.Const c;
        do {
            c = new Term.Const(prefix + n++);
        } while (branch.constants().contains(c));
        return c;
    }

    private static int sequenceNumber(String name, String prefix) {
        if (!name.startsWith(prefix)) return -1;
        try {
            return Integer.parseInt(name.substring(prefix.length()));
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
