package dumb.wkrq;

import com.fasterxml.jackson.databind.node.ObjectNode;
import dumb.wkrq.util.Json;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Observer of tableau construction. Called once per rule application, after the branches it
 * touched have been updated. It cannot influence the search; an exception it throws is logged and
 * dropped by the tableau.
 */
@FunctionalInterface
public interface Tracer {

    void applied(RuleApplication application);

    /**
     * @param children ids of the branches that received the conclusions; for an alpha expansion this
     *                 is the premise's own branch
     * @param closed   parallel to {@code children}: whether that branch is closed after the update
     */
    record RuleApplication(int step, int branch, String rule, SignedFormula premise,
                           List<List<SignedFormula>> conclusions, List<Integer> children, List<Boolean> closed,
                           @Nullable Term.Const constant, @Nullable String note) {
        public RuleApplication {
            conclusions = List.copyOf(conclusions);
            children = List.copyOf(children);
            closed = List.copyOf(closed);
        }

        public ObjectNode toJson() {
            var n = Json.node();
            n.put("step", step);
            n.put("branch", branch);
            n.put("rule", rule);
            n.put("premise", premise.toString());
            var cs = n.putArray("conclusions");
            for (var set : conclusions) {
                var a = cs.addArray();
                set.forEach(sf -> a.add(sf.toString()));
            }
            var ch = n.putArray("children");
            children.forEach(ch::add);
            var cl = n.putArray("closed");
            closed.forEach(cl::add);
            if (constant != null) n.put("constant", constant.name());
            if (note != null) n.put("note", note);
            return n;
        }

        @Override
        public String toString() {
            return "#" + step + " [" + branch + "] " + rule + " " + premise + " => " + conclusions
                    + " -> " + children + (closed.contains(true) ? " closed=" + closed : "")
                    + (note != null ? " (" + note + ")" : "");
        }
    }

    /** Keeps every application, in order. */
    class Recorder implements Tracer {
        private final List<RuleApplication> applications = new ArrayList<>();

        @Override
        public void applied(RuleApplication application) {
            applications.add(application);
        }

        public TraceRecord record() {
            return new TraceRecord(applications);
        }
    }

    record TraceRecord(List<RuleApplication> applications) {
        public TraceRecord {
            applications = Collections.unmodifiableList(new ArrayList<>(applications));
        }

        public int size() {
            return applications.size();
        }

        public List<RuleApplication> byRule(String rule) {
            return applications.stream().filter(a -> a.rule().equals(rule)).toList();
        }

        public ObjectNode toJson() {
            var n = Json.node();
            var a = n.putArray("applications");
            applications.forEach(x -> a.add(x.toJson()));
            return n;
        }

        public String render() {
            var sb = new StringBuilder();
            applications.forEach(x -> sb.append(x).append('\n'));
            return sb.toString();
        }
    }
}
