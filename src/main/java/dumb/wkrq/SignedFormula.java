package dumb.wkrq;

import static java.util.Objects.requireNonNull;

public record SignedFormula(Sign sign, Formula formula) {
    public SignedFormula {
        requireNonNull(sign);
        requireNonNull(formula);
    }

    public static SignedFormula t(Formula f) {
        return new SignedFormula(Sign.T, f);
    }

    public static SignedFormula f(Formula f) {
        return new SignedFormula(Sign.F, f);
    }

    public static SignedFormula e(Formula f) {
        return new SignedFormula(Sign.E, f);
    }

    public static SignedFormula m(Formula f) {
        return new SignedFormula(Sign.M, f);
    }

    public static SignedFormula n(Formula f) {
        return new SignedFormula(Sign.N, f);
    }

    public int complexity() {
        return formula.complexity();
    }

    @Override
    public String toString() {
        return sign + ":" + formula;
    }
}
