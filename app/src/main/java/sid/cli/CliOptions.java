package sid.cli;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import sid.engine.EngineConfig;
import sid.rewrite.RewriteRule;

/** Parsed command-line options shared by every sub-command. */
record CliOptions(
    List<String> arguments,
    int numNodes,
    double totalMass,
    int steps,
    double alpha,
    String diagramId,
    String ruleId,
    Map<String, String> ruleMetadata,
    boolean pretty) {

  static final int DEFAULT_STEPS = 10;
  static final double DEFAULT_ALPHA = 0.1;

  CliOptions {
    arguments = arguments == null ? List.of() : List.copyOf(arguments);
    ruleMetadata =
        ruleMetadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(ruleMetadata));
    if (numNodes <= 0) {
      throw new IllegalArgumentException("--num-nodes must be positive");
    }
    if (!(totalMass > 0.0)) {
      throw new IllegalArgumentException("--total-mass must be positive");
    }
    if (steps < 0) {
      throw new IllegalArgumentException("--steps must be non-negative");
    }
    if (!(alpha >= 0.0 && alpha <= 1.0)) {
      throw new IllegalArgumentException("--alpha must be in [0,1]");
    }
  }

  EngineConfig engineConfig() {
    return EngineConfig.of(numNodes, totalMass);
  }

  String argument(int index, String name) {
    if (index >= arguments.size()) {
      throw new IllegalArgumentException("Missing argument <" + name + ">");
    }
    return arguments.get(index);
  }

  static Builder builder() {
    return new Builder();
  }

  static final class Builder {
    private final List<String> arguments = new ArrayList<>();
    private int numNodes = EngineConfig.DEFAULT_NUM_NODES;
    private double totalMass = EngineConfig.DEFAULT_TOTAL_MASS;
    private int steps = DEFAULT_STEPS;
    private double alpha = DEFAULT_ALPHA;
    private String diagramId;
    private String ruleId = RewriteRule.DEFAULT_RULE_ID;
    private Map<String, String> ruleMetadata = Map.of();
    private boolean pretty;

    Builder argument(String value) {
      arguments.add(value);
      return this;
    }

    Builder numNodes(int numNodes) {
      this.numNodes = numNodes;
      return this;
    }

    Builder totalMass(double totalMass) {
      this.totalMass = totalMass;
      return this;
    }

    Builder steps(int steps) {
      this.steps = steps;
      return this;
    }

    Builder alpha(double alpha) {
      this.alpha = alpha;
      return this;
    }

    Builder diagramId(String diagramId) {
      this.diagramId = diagramId;
      return this;
    }

    Builder ruleId(String ruleId) {
      this.ruleId = ruleId;
      return this;
    }

    Builder ruleMetadata(Map<String, String> ruleMetadata) {
      if (ruleMetadata != null) {
        this.ruleMetadata = new LinkedHashMap<>(ruleMetadata);
      }
      return this;
    }

    Builder pretty(boolean pretty) {
      this.pretty = pretty;
      return this;
    }

    CliOptions build() {
      return new CliOptions(
          arguments, numNodes, totalMass, steps, alpha, diagramId, ruleId, ruleMetadata, pretty);
    }
  }
}
