package dumb.wkrq;

import dumb.wkrq.FormulaParser.ParseException;
import dumb.wkrq.FormulaParser.SyntaxMode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static dumb.wkrq.Formula.and;
import static dumb.wkrq.Formula.atom;
import static dumb.wkrq.Formula.implies;
import static dumb.wkrq.Formula.not;
import static dumb.wkrq.Formula.or;
import static dumb.wkrq.Formula.pred;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FormulaParserTest {

    @Test
    void precedence() throws ParseException {
        assertEquals(implies(or(atom("p"), and(atom("q"), atom("r"))), atom("s")), FormulaParser.parse("p | q & r -> s"));
        assertEquals(and(not(atom("p")), atom("q")), FormulaParser.parse("~p & q"));
        assertEquals(implies(atom("p"), implies(atom("q"), atom("r"))), FormulaParser.parse("p -> q -> r"));
        assertEquals(or(or(atom("p"), atom("q")), atom("r")), FormulaParser.parse("p | q | r"));
    }

    @Test
    void unicodeConnectives() throws ParseException {
        assertEquals(FormulaParser.parse("~p & q | r -> s"), FormulaParser.parse("¬p ∧ q ∨ r → s"));
    }

    @Test
    void biconditionalIsSugar() throws ParseException {
        assertEquals(and(implies(atom("p"), atom("q")), implies(atom("q"), atom("p"))), FormulaParser.parse("p <-> q"));
    }

    @Test
    void termsAndVariables() throws ParseException {
        var f = FormulaParser.parse("Loves(john, X)");
        var p = assertInstanceOf(Formula.Predicate.class, f);
        assertEquals(List.of(new Term.Const("john"), new Term.Var("X")), p.terms());
        assertEquals(pred("Loves", "john", "mary"), FormulaParser.parse("Loves( john ,mary )"));
    }

    @Test
    void quantifierSpellings() throws ParseException {
        var expected = Formula.forall("X", pred("Human", "X"), pred("Mortal", "X"));
        assertEquals(expected, FormulaParser.parse("[forall X Human(X)]Mortal(X)"));
        assertEquals(expected, FormulaParser.parse("[∀X Human(X)]Mortal(X)"));
        assertEquals(Formula.exists("Y", and(pred("P", "Y"), pred("Q", "Y")), pred("R", "Y")),
                FormulaParser.parse("[∃Y P(Y) & Q(Y)]R(Y)"));
    }

    @Test
    void matrixBindsTighterThanConnectives() throws ParseException {
        var f = FormulaParser.parse("[forall X P(X)]Q(X) & r");
        var c = assertInstanceOf(Formula.Compound.class, f);
        assertEquals(Formula.Connective.AND, c.op());
        assertInstanceOf(Formula.Quantified.class, c.left());
    }

    @Test
    void dualMarkerOnlyOutsideWkrqAndTransparentMode() throws ParseException {
        assertThrows(ParseException.class, () -> FormulaParser.parse("Human*(a)"));
        assertThrows(ParseException.class, () -> FormulaParser.parse("Human*(a)", SyntaxMode.TRANSPARENT));
        assertEquals(new Formula.Bilateral("Human", List.of(new Term.Const("a")), true),
                FormulaParser.parse("Human*(a)", SyntaxMode.BILATERAL));
        assertEquals(new Formula.Bilateral("Human", List.of(new Term.Const("a")), true),
                FormulaParser.parse("Human*(a)", SyntaxMode.MIXED));
    }

    @Test
    void negatedAtomsPerMode() throws ParseException {
        var dual = new Formula.Bilateral("Van", List.of(new Term.Var("X")), true);
        assertEquals(dual, FormulaParser.parse("~Van(X)", SyntaxMode.TRANSPARENT));
        assertEquals(dual, FormulaParser.parse("~Van(X)", SyntaxMode.MIXED));
        assertThrows(ParseException.class, () -> FormulaParser.parse("~Van(X)", SyntaxMode.BILATERAL));
        assertEquals(not(pred("Van", "X")), FormulaParser.parse("~Van(X)"));
        assertEquals(not(and(atom("p"), atom("q"))), FormulaParser.parse("~(p & q)", SyntaxMode.BILATERAL));
    }

    @Test
    void negationInsideQuantifierMatrix() throws ParseException {
        var f = (Formula.Quantified) FormulaParser.parse("[forall X Sedan(X)]~Van(X)", SyntaxMode.MIXED);
        assertEquals(new Formula.Bilateral("Van", List.of(new Term.Var("X")), true), f.matrix());
        assertEquals(f.matrix(), FormulaParser.parse(f.matrix().toString(), SyntaxMode.MIXED));
    }

    @Test
    void printedFormulasParseBack() throws ParseException {
        for (var text : List.of("((p & ~q) -> r)", "[∀X Human(X)](Mortal(X) | ~Young(X))", "~~p")) {
            var f = FormulaParser.parse(text);
            assertEquals(f, FormulaParser.parse(f.toString()));
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {"p &", "(p | q", "P(a,)", "[forall x P(x)]Q(x)", "[some X P(X)]Q(X)", "p q", ""})
    void malformedInput(String text) {
        assertThrows(ParseException.class, () -> FormulaParser.parse(text));
    }

    @Test
    void errorsCarryColumn() {
        var e = assertThrows(ParseException.class, () -> FormulaParser.parse("p & (q | )"));
        assertEquals(10, e.column());
        assertEquals("p & (q | )", e.input());
        assertTrue(e.getMessage().contains("column 10"));
    }

    @Test
    void inference() throws ParseException {
        var i = FormulaParser.parseInference("P(a, b), P(a, b) -> Q |- Q");
        assertEquals(List.of(pred("P", "a", "b"), implies(pred("P", "a", "b"), atom("Q"))), i.premises());
        assertEquals(atom("Q"), i.conclusion());
        assertTrue(FormulaParser.parseInference("|- p | ~p").premises().isEmpty());
    }

    @Test
    void inferenceErrorsPointIntoWholeInput() {
        assertThrows(ParseException.class, () -> FormulaParser.parseInference("p, q"));
        var e = assertThrows(ParseException.class, () -> FormulaParser.parseInference("p, q & |- r"));
        assertEquals(8, e.column());
        assertEquals("p, q & |- r", e.input());
        assertThrows(ParseException.class, () -> FormulaParser.parseInference("p, , q |- r"));
    }
}
