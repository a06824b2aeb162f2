package dumb.wkrq;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

import static java.util.Objects.requireNonNull;

/**
 * One proof path. Signed formulas are kept in insertion order and indexed by canonical formula, so
 * that a clash between two definite signs is found on insertion without scanning the branch.
 * Formula objects are shared with the parent; the branch's own collections are copied on {@link #fork}.
 */
public class Branch {
    public final int id;
    @Nullable
    public final Branch parent;
    private final List<Branch> children = new ArrayList<>();
    private final UnaryOperator<Formula> canonical;
    private final List<SignedFormula> formulas;
    private final Set<SignedFormula> present;
    private final Map<Formula, EnumSet<Sign>> index;
    private final Set<Term.Const> constants;
    private final Set<SignedFormula> consumed;
    private final Set<SignedFormula> witnessed;
    private final Map<SignedFormula, Set<Term.Const>> instantiated;
    private final Set<Formula> consulted;
    private int depth;
    @Nullable
    private Contradiction contradiction;

    Branch(int id, UnaryOperator<Formula> canonical) {
        this.id = id;
        this.parent = null;
        this.canonical = requireNonNull(canonical);
        this.formulas = new ArrayList<>();
        this.present = new HashSet<>();
        this.index = new HashMap<>();
        this.constants = new LinkedHashSet<>();
        this.consumed = new HashSet<>();
        this.witnessed = new HashSet<>();
        this.instantiated = new HashMap<>();
        this.consulted = new HashSet<>();
    }

    private Branch(int id, Branch parent) {
        this.id = id;
        this.parent = parent;
        this.canonical = parent.canonical;
        this.formulas = new ArrayList<>(parent.formulas);
        this.present = new HashSet<>(parent.present);
        this.index = new HashMap<>(parent.index.size() * 2);
        parent.index.forEach((f, signs) -> index.put(f, EnumSet.copyOf(signs)));
        this.constants = new LinkedHashSet<>(parent.constants);
        this.consumed = new HashSet<>(parent.consumed);
        this.witnessed = new HashSet<>(parent.witnessed);
        this.instantiated = new HashMap<>(parent.instantiated.size() * 2);
        parent.instantiated.forEach((sf, cs) -> instantiated.put(sf, new HashSet<>(cs)));
        this.consulted = new HashSet<>(parent.consulted);
        this.depth = parent.depth;
    }

    Branch fork(int childId) {
        var child = new Branch(childId, this);
        children.add(child);
        return child;
    }

    /**
     * Adds {@code sf} unless the branch is closed or already holds it. Closes the branch when a second,
     * distinct definite sign arrives for one canonical formula. A formula whose canonical form already
     * carries the sign is still recorded, since its own syntax may have rules to contribute.
     *
     * @return whether the branch grew
     */
    public boolean add(SignedFormula sf) {
        if (closed()) return false;
        var sign = sf.sign();
        if (sign == Sign.V)
            throw new Rules.MalformedRuleApplication("Sign v cannot be placed on a branch: " + sf);
        if (!present.add(sf)) return false;
        formulas.add(sf);
        constants.addAll(sf.formula().constants());
        var key = canonical.apply(sf.formula());
        var signs = index.computeIfAbsent(key, k -> EnumSet.noneOf(Sign.class));
        if (signs.add(sign) && sign.definite()) {
            for (var other : signs) {
                if (other != sign && other.definite()) {
                    contradiction = new Contradiction(key, other, sign);
                    break;
                }
            }
        }
        return true;
    }

    public boolean has(Sign sign, Formula f) {
        var signs = index.get(canonical.apply(f));
        return signs != null && signs.contains(sign);
    }

    public Set<Sign> signs(Formula f) {
        var signs = index.get(canonical.apply(f));
        return signs == null ? Set.of() : Collections.unmodifiableSet(signs);
    }

    public Formula canonical(Formula f) {
        return canonical.apply(f);
    }

    public boolean closed() {
        return contradiction != null;
    }

    @Nullable
    public Contradiction contradiction() {
        return contradiction;
    }

    public List<SignedFormula> formulas() {
        return Collections.unmodifiableList(formulas);
    }

    public int size() {
        return formulas.size();
    }

    /** Canonical formula to signs seen, the branch's view used for closure and model extraction. */
    public Map<Formula, Set<Sign>> index() {
        return Collections.unmodifiableMap(index);
    }

    public Set<Term.Const> constants() {
        return Collections.unmodifiableSet(constants);
    }

    public List<Branch> children() {
        return Collections.unmodifiableList(children);
    }

    public boolean leaf() {
        return children.isEmpty();
    }

    public int depth() {
        return depth;
    }

    void deepen() {
        depth++;
    }

    void consume(SignedFormula sf) {
        consumed.add(sf);
    }

    public boolean consumed(SignedFormula sf) {
        return consumed.contains(sf);
    }

    void markWitnessed(SignedFormula sf) {
        witnessed.add(sf);
    }

    public boolean witnessed(SignedFormula sf) {
        return witnessed.contains(sf);
    }

    void markInstantiated(SignedFormula sf, Term.Const c) {
        instantiated.computeIfAbsent(sf, k -> new HashSet<>()).add(c);
    }

    public boolean instantiated(SignedFormula sf, Term.Const c) {
        var done = instantiated.get(sf);
        return done != null && done.contains(c);
    }

    void markConsulted(Formula atom) {
        consulted.add(canonical.apply(atom));
    }

    public boolean consulted(Formula atom) {
        return consulted.contains(canonical.apply(atom));
    }

    @Override
    public String toString() {
        return "Branch#" + id + (closed() ? "[closed " + contradiction + "]" : "") + formulas;
    }

    /** The two definite signs that met on one formula and closed the branch. */
    public record Contradiction(Formula formula, Sign first, Sign second) {
        @Override
        public String toString() {
            return first + ":" + formula + " / " + second + ":" + formula;
        }
    }
}
