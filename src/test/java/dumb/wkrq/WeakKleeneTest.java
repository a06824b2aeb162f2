package dumb.wkrq;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static dumb.wkrq.Sign.E;
import static dumb.wkrq.Sign.F;
import static dumb.wkrq.Sign.T;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class WeakKleeneTest {

    @ParameterizedTest
    @EnumSource(value = Sign.class, names = {"T", "F", "E"})
    void errorIsContagious(Sign other) {
        assertEquals(E, WeakKleene.and(E, other));
        assertEquals(E, WeakKleene.and(other, E));
        assertEquals(E, WeakKleene.or(E, other));
        assertEquals(E, WeakKleene.or(other, E));
        assertEquals(E, WeakKleene.implies(E, other));
        assertEquals(E, WeakKleene.implies(other, E));
    }

    @Test
    void classicalOnDefinedValues() {
        assertEquals(F, WeakKleene.not(T));
        assertEquals(T, WeakKleene.not(F));
        assertEquals(E, WeakKleene.not(E));
        assertEquals(T, WeakKleene.and(T, T));
        assertEquals(F, WeakKleene.and(T, F));
        assertEquals(T, WeakKleene.or(F, T));
        assertEquals(F, WeakKleene.or(F, F));
        assertEquals(T, WeakKleene.implies(F, F));
        assertEquals(F, WeakKleene.implies(T, F));
    }

    @Test
    void truthFunctionsRejectMetaSigns() {
        assertThrows(IllegalArgumentException.class, () -> WeakKleene.and(Sign.M, T));
        assertThrows(IllegalArgumentException.class, () -> WeakKleene.not(Sign.N));
    }

    @Test
    void restrictedUniversal() {
        assertEquals(T, WeakKleene.forall(Set.of(pair(T, T), pair(F, E))));
        assertEquals(F, WeakKleene.forall(Set.of(pair(T, T), pair(T, F))));
        assertEquals(E, WeakKleene.forall(Set.of(pair(T, F), pair(T, E))));
        assertEquals(E, WeakKleene.forall(Set.of(pair(E, T))));
        assertEquals(T, WeakKleene.forall(Set.of()));
    }

    @Test
    void restrictedExistential() {
        assertEquals(T, WeakKleene.exists(Set.of(pair(T, T), pair(F, E))));
        assertEquals(F, WeakKleene.exists(Set.of(pair(T, F), pair(F, T))));
        assertEquals(E, WeakKleene.exists(Set.of(pair(T, T), pair(T, E))));
        assertEquals(F, WeakKleene.exists(Set.of()));
    }

    @Test
    void evaluatesQuantifiersOverDomain() {
        var a = new Term.Const("a");
        var b = new Term.Const("b");
        Map<Formula, Sign> v = Map.of(
                Formula.pred("Human", "a"), T, Formula.pred("Mortal", "a"), T,
                Formula.pred("Human", "b"), F, Formula.pred("Mortal", "b"), E);
        var all = Formula.forall("X", Formula.pred("Human", "X"), Formula.pred("Mortal", "X"));
        var some = Formula.exists("X", Formula.pred("Human", "X"), Formula.pred("Mortal", "X"));
        assertEquals(T, WeakKleene.eval(all, v::get, List.of(a, b)));
        assertEquals(T, WeakKleene.eval(some, v::get, List.of(a, b)));
        assertEquals(E, WeakKleene.eval(Formula.or(Formula.pred("Mortal", "b"), Formula.pred("Human", "a")), v::get, List.of(a, b)));
    }

    private static WeakKleene.Pair pair(Sign r, Sign m) {
        return new WeakKleene.Pair(r, m);
    }
}
