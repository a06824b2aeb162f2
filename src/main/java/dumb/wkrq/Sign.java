package dumb.wkrq;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Tableau signs. {@code T}, {@code F}, {@code E} are definite truth values of V3; {@code M} ("meaningful",
 * t or f) and {@code N} ("nontrue", f or e) are branching instructions; {@code V} is a metavariable over
 * {t, f, e} used in rule notation and never stored in a branch.
 */
public enum Sign {
    T("t"), F("f"), E("e"), M("m"), N("n"), V("v");

    public static final Set<Sign> DEFINITE = EnumSet.of(T, F, E);

    public final String symbol;

    Sign(String symbol) {
        this.symbol = symbol;
    }

    public static Sign of(String symbol) {
        for (var s : values())
            if (s.symbol.equalsIgnoreCase(symbol)) return s;
        throw new IllegalArgumentException("Unknown sign: " + symbol);
    }

    public boolean definite() {
        return DEFINITE.contains(this);
    }

    public boolean meta() {
        return this == M || this == N;
    }

    /** The definite signs this sign stands for. */
    public List<Sign> alternatives() {
        return switch (this) {
            case T, F, E -> List.of(this);
            case M -> List.of(T, F);
            case N -> List.of(F, E);
            case V -> List.of(T, F, E);
        };
    }

    public boolean admits(Sign definite) {
        return alternatives().contains(definite);
    }

    /** Weak Kleene negation lifted to signs: t and f swap, e is fixed. */
    public Sign negate() {
        return switch (this) {
            case T -> F;
            case F -> T;
            case E -> E;
            default -> throw new IllegalArgumentException("Negation is defined on definite signs only: " + this);
        };
    }

    @Override
    public String toString() {
        return symbol;
    }
}
