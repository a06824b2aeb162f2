package dumb.wkrq;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TracerTest extends AbstractTest {

    @Test
    void alphaStaysOnItsBranch() {
        solve("t", "p & q");
        var trace = recorder.record();
        assertEquals(1, trace.size());
        var a = trace.applications().get(0);
        assertEquals("t-and", a.rule());
        assertEquals(1, a.step());
        assertEquals(List.of(a.branch()), a.children());
        assertEquals(List.of(false), a.closed());
    }

    @Test
    void betaRecordsEveryChildAndClosure() {
        assertUnsatisfiable(solveAll("t:(p | q)", "f:p", "f:q"));
        var or = recorder.record().byRule("t-or");
        assertEquals(1, or.size());
        var a = or.get(0);
        assertEquals(0, a.branch());
        assertEquals(List.of(1, 2, 3), a.children());
        assertEquals(List.of(true, true, true), a.closed());
        assertEquals(3, a.conclusions().size());
    }

    @Test
    void quantifierStepsNameTheirConstant() {
        solveAll("t:[forall X Human(X)]Mortal(X)", "t:Human(socrates)");
        var instances = recorder.record().byRule("t-forall-instance");
        assertFalse(instances.isEmpty());
        assertEquals(new Term.Const("socrates"), instances.get(0).constant());
        assertTrue(instances.get(0).toJson().get("constant").asText().equals("socrates"));
    }

    @Test
    void stepsAreNumberedInOrder() {
        solve("t", "(p | q) & (r -> s)");
        var steps = recorder.record().applications().stream().map(Tracer.RuleApplication::step).toList();
        for (var i = 0; i < steps.size(); i++) assertEquals(i + 1, steps.get(i));
    }

    @Test
    void failingTracerDoesNotChangeTheResult() {
        Tracer broken = a -> {
            throw new IllegalStateException("observer bug");
        };
        var f = parse("(p -> q) & p & ~q");
        var quiet = new Wkrq().solve(f, Sign.T);
        var noisy = new Wkrq(Config.DEFAULT, null, broken).solve(f, Sign.T);
        assertEquals(quiet.status(), noisy.status());
        assertEquals(quiet.nodes(), noisy.nodes());
    }

    @Test
    void traceConfigAttachesRecordToResult() {
        assertNull(wkrq.solve(parse("p & q"), Sign.T).trace());
        var r = new Wkrq(Config.DEFAULT.withTrace(true)).solve(parse("p & q"), Sign.T);
        assertNotNull(r.trace());
        assertEquals(1, r.trace().size());
        var json = r.toJson();
        assertEquals("t-and", json.get("trace").get("applications").get(0).get("rule").asText());
        assertTrue(r.trace().render().contains("t-and"));
    }
}
