package dumb.wkrq;

import dumb.wkrq.Rules.Expansion;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.PriorityQueue;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Proof search for one set of signed formulas. Open branches wait in a frontier ordered by how much
 * unexpanded complexity they carry; within a branch alpha expansions run before beta expansions and
 * the least complex premise goes first. Construction stops at the first open saturated branch unless
 * {@link Config#allModels()} asks for all of them, and gives up with
 * {@link TableauResult.Status#UNDETERMINED} when a {@link Config} limit is reached.
 * <p>
 * A tableau is single-use and not thread-safe; instances share nothing.
 */
public class Tableau {
    private static final Logger logger = LoggerFactory.getLogger(Tableau.class);

    private static final Comparator<Pending> FRONTIER_ORDER =
            Comparator.comparingInt(Pending::weight).thenComparingInt(p -> p.branch.id);

    private final Config config;
    private final List<SignedFormula> initial;
    private final Instantiator instantiator = new Instantiator();
    private final Rules rules;
    @Nullable
    private final Tracer tracer;
    @Nullable
    private final Tracer.Recorder recorder;
    private final List<Branch> branches = new ArrayList<>();
    private final PriorityQueue<Pending> frontier = new PriorityQueue<>(FRONTIER_ORDER);
    private int nodes;
    private int step;
    @Nullable
    private TableauResult result;

    public Tableau(List<SignedFormula> initial, Config config) {
        this(initial, config, null, null);
    }

    /**
     * @throws Formula.InvalidFormulaException if a formula is not closed and well-formed, or is signed {@code v}
     */
    public Tableau(List<SignedFormula> initial, Config config, @Nullable EvidenceProvider evidence, @Nullable Tracer tracer) {
        this.config = requireNonNull(config);
        this.initial = List.copyOf(initial);
        this.tracer = tracer;
        this.recorder = config.trace() ? new Tracer.Recorder() : null;
        for (var sf : this.initial) {
            if (sf.sign() == Sign.V)
                throw new Formula.InvalidFormulaException("Sign v is rule notation and cannot start a tableau: " + sf);
            Formula.validate(sf.formula());
        }
        this.rules = config.acrq() ? new AcrqRules(instantiator, evidence) : new WkrqRules(instantiator);
    }

    public TableauResult construct() {
        if (result != null) return result;

        Set<Model> models = new LinkedHashSet<>();
        String limit = null;
        try {
            var root = newBranch(null);
            for (var sf : initial) add(root, sf);
            if (!root.closed()) enqueue(root);

            while (!frontier.isEmpty()) {
                var branch = frontier.poll().branch;
                checkLimits(branch);
                var next = select(branch);
                if (next == null) {
                    var model = Model.of(branch, config.acrq());
                    logger.debug("Branch {} saturated open: {}", branch.id, model);
                    models.add(model);
                    if (!config.allModels()) break;
                    continue;
                }
                apply(branch, next.premise, next.expansion);
            }
        } catch (ResourceLimitExceeded e) {
            limit = e.limit;
            logger.warn("Tableau construction stopped: {}", e.getMessage());
        }

        var status = !models.isEmpty() ? TableauResult.Status.SATISFIABLE
                : limit != null ? TableauResult.Status.UNDETERMINED
                : TableauResult.Status.UNSATISFIABLE;
        int closed = 0, open = 0;
        for (var b : branches) {
            if (!b.leaf()) continue;
            if (b.closed()) closed++;
            else open++;
        }
        result = new TableauResult(status, new ArrayList<>(models), branches.size(), closed, open, nodes, limit,
                recorder != null ? recorder.record() : null);
        logger.debug("Tableau {}", result);
        return result;
    }

    @Nullable
    private Selection select(Branch branch) {
        var candidates = new ArrayList<SignedFormula>();
        for (var sf : branch.formulas())
            if (!branch.consumed(sf)) candidates.add(sf);
        candidates.sort(Comparator.comparingInt(SignedFormula::complexity));

        Selection beta = null;
        for (var sf : candidates) {
            var x = rules.expand(sf, branch);
            if (x == null) continue;
            if (x.isAlpha()) return new Selection(sf, x);
            if (beta == null) beta = new Selection(sf, x);
        }
        return beta;
    }

    private void apply(Branch branch, SignedFormula premise, Expansion x) {
        step++;
        branch.deepen();
        bookkeeping(branch, premise, x);

        List<Integer> children = new ArrayList<>();
        List<Boolean> closed = new ArrayList<>();
        if (x.isAlpha()) {
            for (var sf : x.branches().get(0)) add(branch, sf);
            children.add(branch.id);
            closed.add(branch.closed());
            if (!branch.closed()) enqueue(branch);
        } else {
            for (var conclusions : x.branches()) {
                var child = newBranch(branch);
                for (var sf : conclusions) add(child, sf);
                children.add(child.id);
                closed.add(child.closed());
                if (!child.closed()) enqueue(child);
            }
        }
        instantiator.commit(x.constant());

        if (logger.isDebugEnabled())
            logger.debug("Step {}: branch {} {} on {} -> {}", step, branch.id, x.rule(), premise, x.branches());
        trace(new Tracer.RuleApplication(step, branch.id, x.rule(), premise, x.branches(), children, closed,
                x.constant(), x.note()));
    }

    private void bookkeeping(Branch branch, SignedFormula premise, Expansion x) {
        switch (x.bookkeeping()) {
            case CONSUME -> branch.consume(premise);
            case INSTANTIATE -> branch.markInstantiated(premise, requireNonNull(x.constant()));
            case WITNESS -> {
                branch.markWitnessed(premise);
                if (x.constant() != null) branch.markInstantiated(premise, x.constant());
            }
            case EVIDENCE -> branch.markConsulted(Bilateral.base(premise.formula()));
        }
    }

    private Branch newBranch(@Nullable Branch parent) {
        if (branches.size() >= config.maxBranches())
            throw new ResourceLimitExceeded("maxBranches", "more than " + config.maxBranches() + " branches");
        var id = branches.size();
        var b = parent == null ? new Branch(id, rules::canonical) : parent.fork(id);
        branches.add(b);
        return b;
    }

    private void add(Branch branch, SignedFormula sf) {
        if (!branch.add(sf)) return;
        if (++nodes > config.maxNodes())
            throw new ResourceLimitExceeded("maxNodes", "more than " + config.maxNodes() + " nodes");
    }

    private void checkLimits(Branch branch) {
        if (branch.depth() > config.maxDepth())
            throw new ResourceLimitExceeded("maxDepth", "branch " + branch.id + " deeper than " + config.maxDepth());
        if (branch.constants().size() > config.maxConstants())
            throw new ResourceLimitExceeded("maxConstants", "branch " + branch.id + " has more than " + config.maxConstants() + " constants");
    }

    private void enqueue(Branch branch) {
        var weight = 0;
        for (var sf : branch.formulas())
            if (!branch.consumed(sf) && (!sf.formula().isAtomic() || sf.sign().meta())) weight += sf.complexity();
        frontier.add(new Pending(branch, weight));
    }

    private void trace(Tracer.RuleApplication application) {
        if (recorder != null) recorder.applied(application);
        if (tracer == null) return;
        try {
            tracer.applied(application);
        } catch (RuntimeException e) {
            logger.error("Tracer failed at step {}: {}", application.step(), e.getMessage(), e);
        }
    }

    public List<Branch> branches() {
        return Collections.unmodifiableList(branches);
    }

    public Config config() {
        return config;
    }

    private record Pending(Branch branch, int weight) {
    }

    private record Selection(SignedFormula premise, Expansion expansion) {
    }

    static class ResourceLimitExceeded extends RuntimeException {
        final String limit;

        ResourceLimitExceeded(String limit, String message) {
            super(limit + ": " + message);
            this.limit = limit;
        }
    }
}
