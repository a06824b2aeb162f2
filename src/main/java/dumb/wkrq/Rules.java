package dumb.wkrq;

import org.jetbrains.annotations.Nullable;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * A tableau calculus: decides what a signed formula expands to on a given branch. Implementations
 * are pure with respect to the branch; the controller applies the returned {@link Expansion} and
 * performs its bookkeeping.
 */
public interface Rules {

    /**
     * @return the expansion of {@code sf} on {@code branch}, or {@code null} when no rule applies or
     * the formula has nothing new to contribute there
     */
    @Nullable
    Expansion expand(SignedFormula sf, Branch branch);

    /** The key a branch indexes formulas by when detecting contradictions. */
    Formula canonical(Formula f);

    /** What the controller records once an expansion has been applied. */
    enum Bookkeeping {
        /** One-shot rule: the premise is used up. */
        CONSUME,
        /** Reusable obligation applied to one more constant. */
        INSTANTIATE,
        /** Existential or counterexample witness, fired once per premise. */
        WITNESS,
        /** Bilateral evidence consulted for a ground atom. */
        EVIDENCE
    }

    /**
     * One rule application: a single conclusion set is an alpha expansion, several are beta
     * branches.
     */
    record Expansion(String rule, List<List<SignedFormula>> branches, Bookkeeping bookkeeping,
                     @Nullable Term.Const constant, @Nullable String note) {
        public Expansion {
            requireNonNull(rule);
            requireNonNull(bookkeeping);
            branches = branches.stream().map(List::copyOf).toList();
            if (branches.isEmpty())
                throw new MalformedRuleApplication("Expansion " + rule + " has no conclusions");
        }

        static Expansion alpha(String rule, SignedFormula... conclusions) {
            return new Expansion(rule, List.of(List.of(conclusions)), Bookkeeping.CONSUME, null, null);
        }

        @SafeVarargs
        static Expansion beta(String rule, List<SignedFormula>... branches) {
            return new Expansion(rule, List.of(branches), Bookkeeping.CONSUME, null, null);
        }

        public boolean isAlpha() {
            return branches.size() == 1;
        }
    }

    /** A rule was asked to do something the calculus does not define. */
    class MalformedRuleApplication extends IllegalStateException {
        public MalformedRuleApplication(String message) {
            super(message);
        }
    }
}
