package sid.rewrite;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sid.ast.Expression;
import sid.diagram.Diagram;
import sid.diagram.Edge;
import sid.diagram.Node;

/**
 * Applies a {@link RewriteRule} to a diagram.
 *
 * <p>All work happens on a copy; the input diagram is never mutated. Commit wiring:
 *
 * <ul>
 *   <li>an edge entering a removed node from outside the match is redirected to the new root,
 *       unless the root already has an edge from that source;
 *   <li>an edge entering a removed node from inside the match is dropped, the replacement carries
 *       its own wiring;
 *   <li>an edge leaving a removed node toward a surviving node is re-sourced from the new root;
 *   <li>edges between removed nodes are dropped.
 * </ul>
 *
 * A commit that would leave a cycle is rejected and the original diagram is returned. That
 * includes a new root that itself consumes a removed node.
 */
public final class RewriteEngine {
  private static final Logger LOG = LoggerFactory.getLogger(RewriteEngine.class);

  private RewriteEngine() {}

  public static boolean isApplicable(Diagram diagram, Expression pattern) {
    return PatternMatcher.find(diagram, pattern).isPresent();
  }

  public static RewriteResult apply(Diagram diagram, RewriteRule rule) {
    Objects.requireNonNull(diagram, "diagram");
    Objects.requireNonNull(rule, "rule");

    Optional<PatternMatch> found = PatternMatcher.find(diagram, rule.pattern());
    if (found.isEmpty()) {
      LOG.debug("Rewrite {} found no match in {}", rule.ruleId(), diagram.id());
      return RewriteResult.notApplicable(diagram, rule.ruleId());
    }
    PatternMatch match = found.get();

    Diagram working = diagram.copy();
    String newRoot =
        ReplacementBuilder.build(
            working, rule.replacement(), match, rule.ruleId(), rule.metadata());

    Set<String> removed = new LinkedHashSet<>(match.matchedNodes());
    removed.removeAll(match.boundNodes());
    removed.remove(newRoot);
    if (feedsOnRemoved(working, newRoot, removed)) {
      LOG.info("Rewrite {} rejected: new root {} consumes a removed node", rule.ruleId(), newRoot);
      return RewriteResult.rejectedCycle(diagram, rule.ruleId());
    }
    commit(working, match, removed, newRoot);

    if (working.hasCycle()) {
      LOG.info("Rewrite {} rejected: result would contain a cycle", rule.ruleId());
      return RewriteResult.rejectedCycle(diagram, rule.ruleId());
    }
    working.validateStructure();
    LOG.debug(
        "Rewrite {} applied at {}: removed {} node(s), new root {}",
        rule.ruleId(),
        match.rootId(),
        removed.size(),
        newRoot);
    return RewriteResult.applied(working, rule.ruleId());
  }

  private static void commit(
      Diagram working, PatternMatch match, Set<String> removed, String newRoot) {
    Set<String> rootSources = new HashSet<>(working.getInputs(newRoot));
    int nextRootPort = nextPort(working, newRoot);
    List<String> redirectedSources = new ArrayList<>();
    List<Edge> kept = new ArrayList<>();

    for (Edge edge : working.edges()) {
      boolean fromRemoved = removed.contains(edge.from());
      boolean toRemoved = removed.contains(edge.to());
      if (!fromRemoved && !toRemoved) {
        kept.add(edge);
      } else if (toRemoved && !fromRemoved) {
        if (match.involves(edge.from())
            || edge.from().equals(newRoot)
            || !rootSources.add(edge.from())) {
          continue;
        }
        kept.add(edge.withTo(newRoot, nextRootPort++));
        redirectedSources.add(edge.from());
      } else if (fromRemoved && !toRemoved) {
        if (!edge.to().equals(newRoot)) {
          kept.add(edge.withFrom(newRoot));
        }
      }
    }
    working.replaceEdges(kept);

    for (Node node : List.copyOf(working.nodes())) {
      if (removed.contains(node.id())) {
        continue;
      }
      if (node.id().equals(newRoot)) {
        if (!redirectedSources.isEmpty()) {
          List<String> inputs = new ArrayList<>(node.inputs());
          inputs.addAll(redirectedSources);
          working.replaceNode(node.withInputs(inputs));
        }
        continue;
      }
      if (node.inputs().stream().anyMatch(removed::contains)) {
        List<String> inputs = new ArrayList<>(node.inputs().size());
        for (String input : node.inputs()) {
          inputs.add(removed.contains(input) ? newRoot : input);
        }
        working.replaceNode(node.withInputs(inputs));
      }
    }

    working.removeNodes(removed);
    working.invalidate();
  }

  /** A root that reads from a removed node would be re-sourced from itself. */
  private static boolean feedsOnRemoved(Diagram working, String newRoot, Set<String> removed) {
    boolean viaInputs =
        working
            .findNode(newRoot)
            .map(node -> node.inputs().stream().anyMatch(removed::contains))
            .orElse(false);
    return viaInputs
        || working.edges().stream()
            .anyMatch(edge -> edge.to().equals(newRoot) && removed.contains(edge.from()));
  }

  private static int nextPort(Diagram diagram, String nodeId) {
    int next = 0;
    for (Edge edge : diagram.edges()) {
      if (edge.to().equals(nodeId)) {
        next = Math.max(next, edge.port() + 1);
      }
    }
    return next;
  }
}
