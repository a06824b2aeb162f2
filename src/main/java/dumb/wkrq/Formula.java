package dumb.wkrq;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

sealed public interface Formula permits Formula.Atom, Formula.Predicate, Formula.Bilateral, Formula.Compound, Formula.Quantified {

    static Atom atom(String name) {
        return new Atom(name);
    }

    static Predicate pred(String name, List<Term> terms) {
        return new Predicate(name, terms);
    }

    static Predicate pred(String name, String... terms) {
        return new Predicate(name, Arrays.stream(terms).map(Term::of).toList());
    }

    static Compound not(Formula f) {
        return new Compound(Connective.NOT, List.of(f));
    }

    static Compound and(Formula a, Formula b) {
        return new Compound(Connective.AND, List.of(a, b));
    }

    static Compound or(Formula a, Formula b) {
        return new Compound(Connective.OR, List.of(a, b));
    }

    static Compound implies(Formula a, Formula b) {
        return new Compound(Connective.IMPLIES, List.of(a, b));
    }

    static Quantified forall(String var, Formula restriction, Formula matrix) {
        return new Quantified(Quantifier.FORALL, new Term.Var(var), restriction, matrix);
    }

    static Quantified exists(String var, Formula restriction, Formula matrix) {
        return new Quantified(Quantifier.EXISTS, new Term.Var(var), restriction, matrix);
    }

    /**
     * Rejects formulas that cannot be handed to a tableau: free variables at top level, or a
     * quantifier whose restriction or matrix does not mention the variable it binds.
     */
    static void validate(Formula f) {
        var free = f.freeVars();
        if (!free.isEmpty())
            throw new InvalidFormulaException("Free variables " + free + " in " + f);
        validateQuantifiers(f);
    }

    private static void validateQuantifiers(Formula f) {
        if (f instanceof Compound c) {
            c.operands().forEach(Formula::validateQuantifiers);
        } else if (f instanceof Quantified q) {
            if (!q.restriction().freeVars().contains(q.var()))
                throw new InvalidFormulaException("Restriction does not reference bound variable " + q.var() + ": " + q);
            if (!q.matrix().freeVars().contains(q.var()))
                throw new InvalidFormulaException("Matrix does not reference bound variable " + q.var() + ": " + q);
            validateQuantifiers(q.restriction());
            validateQuantifiers(q.matrix());
        }
    }

    Set<Term.Var> freeVars();

    Set<Term.Const> constants();

    Formula substitute(Term.Var var, Term value);

    int complexity();

    default boolean isAtomic() {
        return false;
    }

    default boolean isGround() {
        return freeVars().isEmpty();
    }

    enum Connective {
        NOT("~"), AND("&"), OR("|"), IMPLIES("->");

        public final String symbol;

        Connective(String symbol) {
            this.symbol = symbol;
        }
    }

    enum Quantifier {
        FORALL("∀"), EXISTS("∃");

        public final String symbol;

        Quantifier(String symbol) {
            this.symbol = symbol;
        }
    }

    record Atom(String name) implements Formula {
        public Atom {
            requireNonNull(name);
        }

        @Override
        public Set<Term.Var> freeVars() {
            return Set.of();
        }

        @Override
        public Set<Term.Const> constants() {
            return Set.of();
        }

        @Override
        public Formula substitute(Term.Var var, Term value) {
            return this;
        }

        @Override
        public int complexity() {
            return 1;
        }

        @Override
        public boolean isAtomic() {
            return true;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    record Predicate(String name, List<Term> terms) implements Formula {
        public Predicate {
            requireNonNull(name);
            terms = List.copyOf(terms);
            if (name.endsWith("*"))
                throw new InvalidFormulaException("Predicate name must not carry the dual marker, use Bilateral: " + name);
        }

        @Override
        public Set<Term.Var> freeVars() {
            return vars(terms);
        }

        @Override
        public Set<Term.Const> constants() {
            return consts(terms);
        }

        @Override
        public Formula substitute(Term.Var var, Term value) {
            return terms.contains(var) ? new Predicate(name, replace(terms, var, value)) : this;
        }

        @Override
        public int complexity() {
            return 1;
        }

        @Override
        public boolean isAtomic() {
            return true;
        }

        @Override
        public String toString() {
            return name + args(terms);
        }
    }

    /**
     * The dual R* of a predicate: independent negative evidence for R. The positive side is always
     * spelled as an {@link Atom} or {@link Predicate}, so {@code negative} must be true.
     */
    record Bilateral(String name, List<Term> terms, boolean negative) implements Formula {
        public Bilateral {
            requireNonNull(name);
            terms = List.copyOf(terms);
            if (!negative)
                throw new InvalidFormulaException("Positive side of " + name + " is a plain atom or predicate, not a Bilateral");
        }

        /** The positive side R, which is the dual of R*. */
        public Formula dual() {
            return base();
        }

        /** The positive side R(t) as an ordinary atom or predicate, whichever polarity this is. */
        public Formula base() {
            return terms.isEmpty() ? new Atom(name) : new Predicate(name, terms);
        }

        @Override
        public Set<Term.Var> freeVars() {
            return vars(terms);
        }

        @Override
        public Set<Term.Const> constants() {
            return consts(terms);
        }

        @Override
        public Formula substitute(Term.Var var, Term value) {
            return terms.contains(var) ? new Bilateral(name, replace(terms, var, value), negative) : this;
        }

        @Override
        public int complexity() {
            return 1;
        }

        @Override
        public boolean isAtomic() {
            return true;
        }

        @Override
        public String toString() {
            return name + (negative ? "*" : "") + (terms.isEmpty() ? "" : args(terms));
        }
    }

    final class Compound implements Formula {
        private final Connective op;
        private final List<Formula> operands;
        private volatile int hashCodeCache;
        private volatile boolean hashCodeCalculated;
        private volatile int complexityCache = -1;
        private volatile Set<Term.Var> freeVarsCache;
        private volatile String stringCache;

        public Compound(Connective op, List<Formula> operands) {
            this.op = requireNonNull(op);
            this.operands = List.copyOf(operands);
            var arity = op == Connective.NOT ? 1 : 2;
            if (this.operands.size() != arity)
                throw new InvalidFormulaException(op + " expects " + arity + " operands, got " + this.operands.size());
        }

        public Connective op() {
            return op;
        }

        public List<Formula> operands() {
            return operands;
        }

        public Formula operand() {
            return operands.get(0);
        }

        public Formula left() {
            return operands.get(0);
        }

        public Formula right() {
            return operands.get(1);
        }

        @Override
        public Set<Term.Var> freeVars() {
            if (freeVarsCache == null)
                freeVarsCache = operands.stream().flatMap(o -> o.freeVars().stream()).collect(Collectors.toUnmodifiableSet());
            return freeVarsCache;
        }

        @Override
        public Set<Term.Const> constants() {
            return operands.stream().flatMap(o -> o.constants().stream()).collect(Collectors.toUnmodifiableSet());
        }

        @Override
        public Formula substitute(Term.Var var, Term value) {
            if (!freeVars().contains(var)) return this;
            return new Compound(op, operands.stream().map(o -> o.substitute(var, value)).toList());
        }

        @Override
        public int complexity() {
            if (complexityCache == -1) complexityCache = 1 + operands.stream().mapToInt(Formula::complexity).sum();
            return complexityCache;
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof Compound that && op == that.op && hashCode() == that.hashCode() && operands.equals(that.operands));
        }

        @Override
        public int hashCode() {
            if (!hashCodeCalculated) {
                hashCodeCache = 31 * op.hashCode() + operands.hashCode();
                hashCodeCalculated = true;
            }
            return hashCodeCache;
        }

        @Override
        public String toString() {
            if (stringCache == null)
                stringCache = op == Connective.NOT
                        ? "~" + operand()
                        : "(" + left() + " " + op.symbol + " " + right() + ")";
            return stringCache;
        }
    }

    final class Quantified implements Formula {
        private final Quantifier kind;
        private final Term.Var var;
        private final Formula restriction;
        private final Formula matrix;
        private volatile int hashCodeCache;
        private volatile boolean hashCodeCalculated;
        private volatile Set<Term.Var> freeVarsCache;

        public Quantified(Quantifier kind, Term.Var var, Formula restriction, Formula matrix) {
            this.kind = requireNonNull(kind);
            this.var = requireNonNull(var);
            this.restriction = requireNonNull(restriction);
            this.matrix = requireNonNull(matrix);
        }

        public Quantifier kind() {
            return kind;
        }

        public Term.Var var() {
            return var;
        }

        public Formula restriction() {
            return restriction;
        }

        public Formula matrix() {
            return matrix;
        }

        public boolean universal() {
            return kind == Quantifier.FORALL;
        }

        /** The restriction with the bound variable replaced by {@code c}. */
        public Formula restrictionAt(Term.Const c) {
            return restriction.substitute(var, c);
        }

        /** The matrix with the bound variable replaced by {@code c}. */
        public Formula matrixAt(Term.Const c) {
            return matrix.substitute(var, c);
        }

        public Quantified with(Quantifier kind, Formula matrix) {
            return new Quantified(kind, var, restriction, matrix);
        }

        @Override
        public Set<Term.Var> freeVars() {
            if (freeVarsCache == null) {
                Set<Term.Var> free = new HashSet<>(restriction.freeVars());
                free.addAll(matrix.freeVars());
                free.remove(var);
                freeVarsCache = Collections.unmodifiableSet(free);
            }
            return freeVarsCache;
        }

        @Override
        public Set<Term.Const> constants() {
            Set<Term.Const> c = new HashSet<>(restriction.constants());
            c.addAll(matrix.constants());
            return Collections.unmodifiableSet(c);
        }

        @Override
        public Formula substitute(Term.Var v, Term value) {
            if (v.equals(var) || !freeVars().contains(v)) return this;
            return new Quantified(kind, var, restriction.substitute(v, value), matrix.substitute(v, value));
        }

        @Override
        public int complexity() {
            return 1 + restriction.complexity() + matrix.complexity();
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof Quantified that && kind == that.kind && hashCode() == that.hashCode()
                    && var.equals(that.var) && restriction.equals(that.restriction) && matrix.equals(that.matrix));
        }

        @Override
        public int hashCode() {
            if (!hashCodeCalculated) {
                var h = kind.hashCode();
                h = 31 * h + var.hashCode();
                h = 31 * h + restriction.hashCode();
                hashCodeCache = 31 * h + matrix.hashCode();
                hashCodeCalculated = true;
            }
            return hashCodeCache;
        }

        @Override
        public String toString() {
            return "[" + kind.symbol + var + " " + restriction + "]" + matrix;
        }
    }

    class InvalidFormulaException extends IllegalArgumentException {
        public InvalidFormulaException(String message) {
            super(message);
        }
    }

    private static Set<Term.Var> vars(List<Term> terms) {
        Set<Term.Var> s = new LinkedHashSet<>();
        for (var t : terms) if (t instanceof Term.Var v) s.add(v);
        return Collections.unmodifiableSet(s);
    }

    private static Set<Term.Const> consts(List<Term> terms) {
        Set<Term.Const> s = new LinkedHashSet<>();
        for (var t : terms) if (t instanceof Term.Const c) s.add(c);
        return Collections.unmodifiableSet(s);
    }

    private static List<Term> replace(List<Term> terms, Term.Var var, Term value) {
        var out = new ArrayList<Term>(terms.size());
        for (var t : terms) out.add(t.equals(var) ? value : t);
        return out;
    }

    private static String args(List<Term> terms) {
        return terms.stream().map(Term::toString).collect(Collectors.joining(", ", "(", ")"));
    }
}
