package dumb.wkrq;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import dumb.wkrq.util.Json;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Tableau settings. Absent JSON fields take the defaults below; limits bound the search so that a
 * non-terminating construction ends as {@link TableauResult.Status#UNDETERMINED}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Config(Logic logic, FormulaParser.SyntaxMode syntaxMode, int maxDepth, int maxConstants, int maxNodes,
                     int maxBranches, boolean allModels, boolean trace) {
    public static final int DEFAULT_MAX_DEPTH = 1000;
    public static final int DEFAULT_MAX_CONSTANTS = 30;
    public static final int DEFAULT_MAX_NODES = 100_000;
    public static final int DEFAULT_MAX_BRANCHES = 10_000;

    public static final Config DEFAULT = new Config();

    @JsonCreator
    public Config(
            @JsonProperty("logic") Logic logic,
            @JsonProperty("syntaxMode") FormulaParser.SyntaxMode syntaxMode,
            @JsonProperty("maxDepth") Integer maxDepth,
            @JsonProperty("maxConstants") Integer maxConstants,
            @JsonProperty("maxNodes") Integer maxNodes,
            @JsonProperty("maxBranches") Integer maxBranches,
            @JsonProperty("allModels") Boolean allModels,
            @JsonProperty("trace") Boolean trace
    ) {
        this(
                logic != null ? logic : Logic.WKRQ,
                syntaxMode != null ? syntaxMode : FormulaParser.SyntaxMode.TRANSPARENT,
                maxDepth != null ? maxDepth : DEFAULT_MAX_DEPTH,
                maxConstants != null ? maxConstants : DEFAULT_MAX_CONSTANTS,
                maxNodes != null ? maxNodes : DEFAULT_MAX_NODES,
                maxBranches != null ? maxBranches : DEFAULT_MAX_BRANCHES,
                allModels != null && allModels,
                trace != null && trace
        );
    }

    public Config() {
        this(Logic.WKRQ, FormulaParser.SyntaxMode.TRANSPARENT, DEFAULT_MAX_DEPTH, DEFAULT_MAX_CONSTANTS,
                DEFAULT_MAX_NODES, DEFAULT_MAX_BRANCHES, false, false);
    }

    public Config {
        if (logic == null) throw new IllegalArgumentException("logic is required");
        if (syntaxMode == null) throw new IllegalArgumentException("syntaxMode is required");
        if (maxDepth <= 0 || maxConstants <= 0 || maxNodes <= 0 || maxBranches <= 0)
            throw new IllegalArgumentException("Limits must be positive");
    }

    public static Config parse(String json) throws JsonProcessingException {
        return Json.obj(json, Config.class);
    }

    public static Config load(Path file) throws IOException {
        return parse(Files.readString(file));
    }

    public Config withLogic(Logic logic) {
        return new Config(logic, syntaxMode, maxDepth, maxConstants, maxNodes, maxBranches, allModels, trace);
    }

    public Config withSyntaxMode(FormulaParser.SyntaxMode syntaxMode) {
        return new Config(logic, syntaxMode, maxDepth, maxConstants, maxNodes, maxBranches, allModels, trace);
    }

    public Config withLimits(int maxDepth, int maxConstants, int maxNodes, int maxBranches) {
        return new Config(logic, syntaxMode, maxDepth, maxConstants, maxNodes, maxBranches, allModels, trace);
    }

    public Config withAllModels(boolean allModels) {
        return new Config(logic, syntaxMode, maxDepth, maxConstants, maxNodes, maxBranches, allModels, trace);
    }

    public Config withTrace(boolean trace) {
        return new Config(logic, syntaxMode, maxDepth, maxConstants, maxNodes, maxBranches, allModels, trace);
    }

    public boolean acrq() {
        return logic == Logic.ACRQ;
    }

    public enum Logic {
        WKRQ, ACRQ
    }
}
