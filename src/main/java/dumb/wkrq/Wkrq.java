package dumb.wkrq;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Entry point for satisfiability, validity and entailment checks in wKrQ or, with
 * {@link Config.Logic#ACRQ}, in ACrQ.
 */
public class Wkrq {
    private static final Logger logger = LoggerFactory.getLogger(Wkrq.class);

    private static final String USAGE = "Usage: wkrq [--sign t|f|e|m|n] [--acrq] [--mode transparent|bilateral|mixed] "
            + "[--all-models] [--trace] [--json] [--config file.json] (formula | --inference \"premises |- conclusion\")";

    private final Config config;
    @Nullable
    private final EvidenceProvider evidence;
    @Nullable
    private final Tracer tracer;

    public Wkrq() {
        this(Config.DEFAULT);
    }

    public Wkrq(Config config) {
        this(config, null, null);
    }

    public Wkrq(Config config, @Nullable EvidenceProvider evidence, @Nullable Tracer tracer) {
        this.config = requireNonNull(config);
        this.evidence = evidence;
        this.tracer = tracer;
    }

    public Config config() {
        return config;
    }

    public TableauResult solve(Formula formula, Sign sign) {
        return solve(List.of(new SignedFormula(sign, formula)));
    }

    public TableauResult solve(List<SignedFormula> signed) {
        return new Tableau(signed, config, evidence, tracer).construct();
    }

    /**
     * Whether {@code formula} can never be false, i.e. {@code f:formula} has no open branch. An
     * undetermined search counts as not valid.
     */
    public boolean valid(Formula formula) {
        var r = solve(formula, Sign.F);
        if (r.status() == TableauResult.Status.UNDETERMINED)
            logger.warn("Validity of {} undetermined ({}), reporting not valid", formula, r.limit());
        return r.unsatisfiable();
    }

    /** Premises true and conclusion not true is impossible. An undetermined search counts as no entailment. */
    public boolean entails(List<Formula> premises, Formula conclusion) {
        return checkInference(premises, conclusion).valid();
    }

    public InferenceResult checkInference(FormulaParser.Inference inference) {
        return checkInference(inference.premises(), inference.conclusion());
    }

    public InferenceResult checkInference(List<Formula> premises, Formula conclusion) {
        List<SignedFormula> signed = new ArrayList<>(premises.size() + 1);
        for (var p : premises) signed.add(SignedFormula.t(p));
        signed.add(SignedFormula.n(conclusion));
        var r = solve(signed);
        if (r.status() == TableauResult.Status.UNDETERMINED)
            logger.warn("Inference {} |- {} undetermined ({})", premises, conclusion, r.limit());
        return new InferenceResult(r.unsatisfiable(), r.status(), r.models(), r);
    }

    /**
     * @param countermodels models in which every premise is true and the conclusion is not
     */
    public record InferenceResult(boolean valid, TableauResult.Status status, List<Model> countermodels,
                                  TableauResult tableau) {
        public InferenceResult {
            countermodels = List.copyOf(countermodels);
        }

        @Override
        public String toString() {
            return (valid ? "valid" : status == TableauResult.Status.UNDETERMINED ? "undetermined" : "invalid")
                    + (countermodels.isEmpty() ? "" : ", countermodels " + countermodels);
        }
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        var sign = Sign.T;
        var acrq = false;
        FormulaParser.SyntaxMode mode = null;
        var allModels = false;
        var trace = false;
        var json = false;
        String configFile = null;
        String inference = null;
        String formula = null;

        for (var i = 0; i < args.length; i++) {
            try {
                switch (args[i]) {
                    case "-s", "--sign" -> sign = Sign.of(args[++i]);
                    case "-a", "--acrq" -> acrq = true;
                    case "-m", "--mode" -> mode = FormulaParser.SyntaxMode.valueOf(args[++i].toUpperCase());
                    case "--all-models" -> allModels = true;
                    case "-t", "--trace" -> trace = true;
                    case "-j", "--json" -> json = true;
                    case "-c", "--config" -> configFile = args[++i];
                    case "-i", "--inference" -> inference = args[++i];
                    default -> {
                        if (args[i].startsWith("-") || formula != null) {
                            err.println("Unknown option: " + args[i]);
                            err.println(USAGE);
                            return 1;
                        }
                        formula = args[i];
                    }
                }
            } catch (ArrayIndexOutOfBoundsException | IllegalArgumentException e) {
                err.println(String.format("Error parsing argument for %s: %s", (i > 0 ? args[i - 1] : args[i]), e.getMessage()));
                err.println(USAGE);
                return 1;
            }
        }
        if ((formula == null) == (inference == null)) {
            err.println(USAGE);
            return 1;
        }

        Config config;
        try {
            config = configFile != null ? Config.load(Path.of(configFile)) : Config.DEFAULT;
        } catch (IOException e) {
            err.println("Cannot read config " + configFile + ": " + e.getMessage());
            return 2;
        }
        if (acrq) config = config.withLogic(Config.Logic.ACRQ);
        if (mode != null) config = config.withLogic(Config.Logic.ACRQ).withSyntaxMode(mode);
        if (allModels) config = config.withAllModels(true);
        if (trace) config = config.withTrace(true);

        var syntax = config.acrq() ? config.syntaxMode() : null;
        var wkrq = new Wkrq(config);
        try {
            if (inference != null) {
                var parsed = FormulaParser.parseInference(inference, syntax);
                var r = wkrq.checkInference(parsed);
                if (json) {
                    var n = r.tableau().toJson();
                    n.put("inference", parsed.toString());
                    n.put("valid", r.valid());
                    out.println(n.toPrettyString());
                } else {
                    out.println(parsed + ": " + r);
                    print(r.tableau(), out);
                }
                return 0;
            }
            var parsed = FormulaParser.parse(formula, syntax);
            var r = wkrq.solve(parsed, sign);
            if (json) {
                var n = r.toJson();
                n.put("formula", sign + ":" + parsed);
                out.println(n.toPrettyString());
            } else {
                out.println(sign + ":" + parsed + ": " + r.status());
                print(r, out);
            }
            return 0;
        } catch (FormulaParser.ParseException e) {
            err.println("Parse error: " + e.reason() + " at column " + e.column());
            err.println("  " + e.input());
            err.println("  " + " ".repeat(Math.max(0, e.column() - 1)) + "^");
            return 1;
        } catch (Formula.InvalidFormulaException e) {
            err.println("Invalid formula: " + e.getMessage());
            return 1;
        }
    }

    private static void print(TableauResult r, PrintStream out) {
        out.println("  " + r);
        for (var m : r.models()) out.println("  model: " + m);
        if (r.trace() != null) out.print(r.trace().render());
    }
}
