package dumb.wkrq;

import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * One-way matching of formulas containing variables against ground formulas. Bindings are immutable
 * maps; {@code null} means no match.
 */
public enum Unifier {
    ;

    @Nullable
    public static Map<Term.Var, Term> match(Formula pattern, Formula ground, Map<Term.Var, Term> bindings) {
        if (bindings == null) return null;
        if (pattern instanceof Formula.Atom a)
            return a.equals(ground) ? bindings : null;
        if (pattern instanceof Formula.Predicate p)
            return ground instanceof Formula.Predicate g && p.name().equals(g.name())
                    ? matchTerms(p.terms(), g.terms(), bindings) : null;
        if (pattern instanceof Formula.Bilateral b)
            return ground instanceof Formula.Bilateral g && b.name().equals(g.name()) && b.negative() == g.negative()
                    ? matchTerms(b.terms(), g.terms(), bindings) : null;
        if (pattern instanceof Formula.Compound c) {
            if (!(ground instanceof Formula.Compound g) || c.op() != g.op()) return null;
            var current = bindings;
            for (var i = 0; i < c.operands().size() && current != null; i++)
                current = match(c.operands().get(i), g.operands().get(i), current);
            return current;
        }
        var q = (Formula.Quantified) pattern;
        if (!(ground instanceof Formula.Quantified g) || q.kind() != g.kind() || !q.var().equals(g.var())) return null;
        return match(q.matrix(), g.matrix(), match(q.restriction(), g.restriction(), bindings));
    }

    /** Matches {@code pattern} against {@code ground} and returns what {@code var} was bound to, if anything. */
    @Nullable
    public static Term.Const bindingOf(Term.Var var, Formula pattern, Formula ground) {
        var b = match(pattern, ground, Map.of());
        return b != null && b.get(var) instanceof Term.Const c ? c : null;
    }

    @Nullable
    private static Map<Term.Var, Term> matchTerms(List<Term> pattern, List<Term> ground, Map<Term.Var, Term> bindings) {
        if (pattern.size() != ground.size()) return null;
        var current = bindings;
        for (var i = 0; i < pattern.size() && current != null; i++)
            current = matchTerm(pattern.get(i), ground.get(i), current);
        return current;
    }

    @Nullable
    private static Map<Term.Var, Term> matchTerm(Term pattern, Term ground, Map<Term.Var, Term> bindings) {
        if (pattern instanceof Term.Var v) {
            var bound = bindings.get(v);
            if (bound != null) return bound.equals(ground) ? bindings : null;
            Map<Term.Var, Term> next = new HashMap<>(bindings);
            next.put(v, ground);
            return Collections.unmodifiableMap(next);
        }
        return pattern.equals(ground) ? bindings : null;
    }
}
