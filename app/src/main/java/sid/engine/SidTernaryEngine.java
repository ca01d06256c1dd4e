package sid.engine;

import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sid.ast.Expression;
import sid.diagram.Diagram;
import sid.diagram.DiagramBuilder;
import sid.diagram.DiagramJson;
import sid.errors.ContractViolationException;
import sid.errors.SidException;
import sid.errors.StructuralException;
import sid.parse.ExpressionParser;
import sid.rewrite.RewriteEngine;
import sid.rewrite.RewriteResult;
import sid.rewrite.RewriteRule;
import sid.ssp.CollapseMask;
import sid.ssp.Mixer;
import sid.ssp.MixerMetrics;
import sid.ssp.Role;
import sid.ssp.SemanticProcessor;
import sid.ssp.StabilityTracker;

/**
 * Owns one diagram and the three I/N/U processors, and keeps their total mass at the configured
 * value across {@link #step} and {@link #collapse}.
 *
 * <p>Not thread-safe; one caller drives an engine at a time.
 */
public final class SidTernaryEngine {
  private static final Logger LOG = LoggerFactory.getLogger(SidTernaryEngine.class);

  public static final String DIAGRAM_ID = "sid_engine_diagram";
  public static final String DEFAULT_EXPR_RULE_ID = "init";

  private final int numNodes;
  private final double totalMass;
  private final Mixer mixer;
  private final SemanticProcessor included;
  private final SemanticProcessor negated;
  private final SemanticProcessor undecided;
  private final StabilityTracker gainTracker = new StabilityTracker();

  private Diagram diagram = new Diagram(DIAGRAM_ID);
  private long stepCount;
  private boolean lastRewriteApplied;
  private String lastRewriteMessage = "";

  public SidTernaryEngine(int numNodes, double totalMass) {
    this(EngineConfig.of(numNodes, totalMass));
  }

  public SidTernaryEngine(EngineConfig config) {
    Objects.requireNonNull(config, "config");
    if (config.numNodes() <= 0) {
      throw new ContractViolationException("num_nodes must be positive: " + config.numNodes());
    }
    if (!(config.totalMass() > 0.0) || Double.isInfinite(config.totalMass())) {
      throw new ContractViolationException("total_mass must be positive: " + config.totalMass());
    }
    this.numNodes = config.numNodes();
    this.totalMass = config.totalMass();
    this.mixer = new Mixer(totalMass, config.mixer());

    double perField = totalMass / 3.0;
    this.included = new SemanticProcessor(Role.I, numNodes, perField);
    this.negated = new SemanticProcessor(Role.N, numNodes, perField);
    this.undecided = new SemanticProcessor(Role.U, numNodes, perField);

    double perCell = totalMass / (3.0 * numNodes);
    included.addUniform(perCell);
    negated.addUniform(perCell);
    undecided.addUniform(perCell);
    commitAll();
    LOG.debug("Engine initialised: {} nodes, total mass {}", numNodes, totalMass);
  }

  /** Runs one mixer step; {@code alpha} is accepted for interface stability and not used. */
  public void step(double alpha) {
    if (Double.isNaN(alpha) || Double.isInfinite(alpha)) {
      throw new ContractViolationException("step alpha must be finite: " + alpha);
    }
    MixerMetrics metrics = mixer.step(included, negated, undecided);
    commitAll();
    gainTracker.record(metrics.loopGain());
    stepCount++;
  }

  /** Moves {@code U[i] * alpha * 0.5} into both I and N at every index; alpha is clamped. */
  public void collapse(double alpha) {
    if (Double.isNaN(alpha)) {
      throw new ContractViolationException("collapse alpha must be a number");
    }
    double clamped = Math.max(0.0, Math.min(1.0, alpha));
    double[] source = undecided.fieldSnapshot();
    double[] ones = new double[numNodes];
    Arrays.fill(ones, 1.0);

    included.routeFromField(source, ones, 0.5 * clamped);
    negated.routeFromField(source, ones, 0.5 * clamped);
    undecided.applyCollapseMask(CollapseMask.uniform(numNodes, 0.5, 0.5), clamped);

    commitAll();
    stepCount++;
  }

  public boolean applyRewrite(String pattern, String replacement, String ruleId) {
    return applyRewrite(pattern, replacement, ruleId, Map.of());
  }

  /**
   * Parses both expressions and rewrites the current diagram. The diagram is replaced only when
   * the rewrite applies; parse and contract failures are recorded, then rethrown.
   */
  public boolean applyRewrite(
      String pattern, String replacement, String ruleId, Map<String, Object> ruleMetadata) {
    try {
      Expression patternExpr = ExpressionParser.parse(pattern);
      Expression replacementExpr = ExpressionParser.parse(replacement);
      RewriteRule rule = new RewriteRule(ruleId, patternExpr, replacementExpr, ruleMetadata);
      RewriteResult result = RewriteEngine.apply(diagram, rule);
      if (result.applied()) {
        diagram = result.diagram();
      }
      record(result.applied(), result.message());
      LOG.info("{}", result.message());
      return result.applied();
    } catch (SidException ex) {
      record(false, ex.getMessage());
      throw ex;
    }
  }

  public void setDiagramExpr(String expr) {
    setDiagramExpr(expr, DEFAULT_EXPR_RULE_ID);
  }

  /** Replaces the diagram with one built from {@code expr}; its id is {@code ruleId}. */
  public void setDiagramExpr(String expr, String ruleId) {
    Objects.requireNonNull(expr, "expr");
    try {
      Diagram built = DiagramBuilder.build(ExpressionParser.parse(expr), ruleId, null);
      diagram = built;
      record(true, "Diagram set from expression: " + expr);
      LOG.info("Diagram {} set from expression ({} nodes)", built.id(), built.nodeCount());
    } catch (SidException ex) {
      record(false, ex.getMessage());
      throw ex;
    }
  }

  /** Replaces the diagram with a decoded, fully validated JSON document. */
  public void setDiagramJson(String json) {
    Diagram decoded;
    try {
      decoded = DiagramJson.fromJson(json);
    } catch (SidException ex) {
      record(false, ex.getMessage());
      throw ex;
    }
    setDiagram(decoded);
  }

  /**
   * Installs a copy of {@code replacement}. Dangling references and cycles are rejected and leave
   * the current diagram in place; the outcome is recorded as the last message.
   */
  public void setDiagram(Diagram replacement) {
    Objects.requireNonNull(replacement, "replacement");
    try {
      replacement.validateStructure();
      if (replacement.hasCycle()) {
        throw new StructuralException("Diagram " + replacement.id() + " contains a cycle");
      }
    } catch (SidException ex) {
      record(false, ex.getMessage());
      throw ex;
    }
    Diagram copy = replacement.copy();
    diagram = copy;
    record(
        true,
        "Diagram "
            + copy.id()
            + " loaded ("
            + copy.nodeCount()
            + " nodes, "
            + copy.edgeCount()
            + " edges)");
    LOG.info(
        "Diagram {} loaded ({} nodes, {} edges)", copy.id(), copy.nodeCount(), copy.edgeCount());
  }

  public String getDiagramJson() {
    return DiagramJson.toJson(diagram);
  }

  /** Independent copy of the current diagram. */
  public Diagram getDiagram() {
    return diagram.copy();
  }

  public double getIMass() {
    return included.totalMass();
  }

  public double getNMass() {
    return negated.totalMass();
  }

  public double getUMass() {
    return undecided.totalMass();
  }

  public double getTotalMass() {
    return totalMass;
  }

  public int getNumNodes() {
    return numNodes;
  }

  public double getInstantaneousGain() {
    return mixer.metrics().loopGain();
  }

  public boolean isConserved(double tolerance) {
    return getConservationError() < tolerance;
  }

  public double getConservationError() {
    return Math.abs(getIMass() + getNMass() + getUMass() - totalMass);
  }

  public MixerMetrics getMixerMetrics() {
    return mixer.metrics();
  }

  public long getStepCount() {
    return stepCount;
  }

  public boolean isTransportReady() {
    return mixer.metrics().transportReady();
  }

  /** True once two consecutive steps produced a loop gain within 1e-6 of each other. */
  public boolean isLoopGainConverged() {
    return gainTracker.converged(StabilityTracker.DEFAULT_EPSILON);
  }

  public double[] getIField() {
    return included.fieldSnapshot();
  }

  public double[] getNField() {
    return negated.fieldSnapshot();
  }

  public double[] getUField() {
    return undecided.fieldSnapshot();
  }

  public boolean isLastRewriteApplied() {
    return lastRewriteApplied;
  }

  public String getLastRewriteMessage() {
    return lastRewriteMessage;
  }

  public EngineMetrics metricsSnapshot() {
    return new EngineMetrics(
        getIMass(),
        getNMass(),
        getUMass(),
        getInstantaneousGain(),
        isConserved(mixer.config().epsConservation()),
        lastRewriteApplied,
        lastRewriteMessage,
        stepCount,
        isTransportReady());
  }

  /** Direct access for setup and tests; bypasses conservation. */
  SemanticProcessor processor(Role role) {
    return switch (role) {
      case I -> included;
      case N -> negated;
      case U -> undecided;
    };
  }

  private void record(boolean applied, String message) {
    lastRewriteApplied = applied;
    lastRewriteMessage = message == null ? "" : message;
  }

  private void commitAll() {
    included.commitStep();
    negated.commitStep();
    undecided.commitStep();
  }
}
