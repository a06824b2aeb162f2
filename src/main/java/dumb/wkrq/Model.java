package dumb.wkrq;

import com.fasterxml.jackson.databind.node.ObjectNode;
import dumb.wkrq.util.Json;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * A valuation read off an open, saturated branch: the definite sign of every ground atomic formula
 * on it. ACrQ models also pair each predicate instance with its dual.
 */
public record Model(SortedMap<Formula, Sign> valuation, List<Term.Const> domain,
                    SortedMap<Formula, Bilateral.Valuation> bilateral) {

    private static final Comparator<Formula> ORDER = Comparator.comparing(Formula::toString);

    public Model {
        valuation = Collections.unmodifiableSortedMap(valuation);
        domain = List.copyOf(domain);
        bilateral = Collections.unmodifiableSortedMap(bilateral);
    }

    static Model of(Branch branch, boolean acrq) {
        SortedMap<Formula, Sign> valuation = new TreeMap<>(ORDER);
        for (var e : branch.index().entrySet()) {
            var f = e.getKey();
            if (!f.isAtomic() || !f.isGround()) continue;
            for (var s : e.getValue())
                if (s.definite()) valuation.put(f, s);
        }
        SortedMap<Formula, Bilateral.Valuation> bilateral = new TreeMap<>(ORDER);
        if (acrq) {
            for (var f : valuation.keySet()) {
                var base = Bilateral.base(f);
                bilateral.computeIfAbsent(base, b -> new Bilateral.Valuation(
                        valuation.getOrDefault(b, Sign.F),
                        valuation.getOrDefault(Bilateral.negative(b), Sign.F)));
            }
        }
        return new Model(valuation, List.copyOf(branch.constants()), bilateral);
    }

    /** The sign this model gives a ground atomic formula, or {@code null} if it leaves it open. */
    @Nullable
    public Sign get(Formula atom) {
        return valuation.get(atom);
    }

    public boolean isGlut(Formula atom) {
        var v = bilateral.get(Bilateral.base(atom));
        return v != null && v.glut();
    }

    public boolean isGap(Formula atom) {
        var v = bilateral.get(Bilateral.base(atom));
        return v != null && v.gap();
    }

    public ObjectNode toJson() {
        var n = Json.node();
        var v = n.putObject("valuation");
        valuation.forEach((f, s) -> v.put(f.toString(), s.symbol));
        var d = n.putArray("domain");
        domain.forEach(c -> d.add(c.name()));
        if (!bilateral.isEmpty()) {
            var b = n.putObject("bilateral");
            bilateral.forEach((f, bv) -> {
                var pair = b.putObject(f.toString());
                pair.put("positive", bv.positive().symbol);
                pair.put("negative", bv.negative().symbol);
            });
        }
        return n;
    }

    @Override
    public String toString() {
        return valuation.toString();
    }
}
