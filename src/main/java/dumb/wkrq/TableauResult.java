package dumb.wkrq;

import com.fasterxml.jackson.databind.node.ObjectNode;
import dumb.wkrq.util.Json;
import org.jetbrains.annotations.Nullable;

import java.util.List;

public record TableauResult(Status status, List<Model> models, int branches, int closedBranches, int openBranches,
                            int nodes, @Nullable String limit, @Nullable Tracer.TraceRecord trace) {

    public TableauResult {
        models = List.copyOf(models);
    }

    public boolean satisfiable() {
        return status == Status.SATISFIABLE;
    }

    public boolean unsatisfiable() {
        return status == Status.UNSATISFIABLE;
    }

    public ObjectNode toJson() {
        var n = Json.node();
        n.put("status", status.name());
        n.put("satisfiable", satisfiable());
        n.put("branches", branches);
        n.put("closedBranches", closedBranches);
        n.put("openBranches", openBranches);
        n.put("nodes", nodes);
        if (limit != null) n.put("limit", limit);
        var ms = n.putArray("models");
        models.forEach(m -> ms.add(m.toJson()));
        if (trace != null) n.set("trace", trace.toJson());
        return n;
    }

    @Override
    public String toString() {
        return status + (limit != null ? " (limit " + limit + ")" : "") + ", " + branches + " branches ("
                + closedBranches + " closed, " + openBranches + " open), " + nodes + " nodes"
                + (models.isEmpty() ? "" : ", models " + models);
    }

    public enum Status {
        SATISFIABLE, UNSATISFIABLE, UNDETERMINED
    }
}
