package dumb.wkrq;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * External source of bilateral evidence for ground predicates. ACrQ consults it once per ground
 * atom and branch; the answer enters the branch as signed R and R* formulas.
 */
@FunctionalInterface
public interface EvidenceProvider {

    /**
     * @param name  predicate name, without the dual marker
     * @param terms ground arguments, empty for propositional atoms
     * @throws ProviderFailure when no answer can be given. The reasoner then treats both sides as
     *                         unknown, which signs R and R* false: a failure is a gap, so it can close a
     *                         branch that needs {@code t:R}. Callers wanting "no information" instead
     *                         should answer from their own fallback rather than throw.
     */
    BilateralEvidence evaluate(String name, List<Term.Const> terms);

    enum Evidence {
        SUPPORTED(Sign.T), REFUTED(Sign.F), UNKNOWN(Sign.F);

        public final Sign sign;

        Evidence(Sign sign) {
            this.sign = sign;
        }
    }

    /** Independent evidence for R (positive) and for R* (negative). */
    record BilateralEvidence(Evidence positive, Evidence negative) {
        public static final BilateralEvidence UNKNOWN = new BilateralEvidence(Evidence.UNKNOWN, Evidence.UNKNOWN);

        public BilateralEvidence {
            requireNonNull(positive);
            requireNonNull(negative);
        }

        public static BilateralEvidence of(boolean positive, boolean negative) {
            return new BilateralEvidence(positive ? Evidence.SUPPORTED : Evidence.REFUTED,
                    negative ? Evidence.SUPPORTED : Evidence.REFUTED);
        }

        @Override
        public String toString() {
            return "+" + positive + "/-" + negative;
        }
    }

    class ProviderFailure extends RuntimeException {
        public ProviderFailure(String message) {
            super(message);
        }

        public ProviderFailure(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
