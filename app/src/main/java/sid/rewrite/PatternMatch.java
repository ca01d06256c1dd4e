package sid.rewrite;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Successful anchoring of a pattern in a diagram.
 *
 * @param rootId node the pattern root matched
 * @param bindings variable name (without {@code $}) to node id
 * @param matchedNodes nodes matched by operator patterns
 * @param boundNodes nodes bound to variables; reused by the replacement
 * @param leafBoundVariables variables bound by {@code P($v)} directly to a leaf {@code P} node
 */
public record PatternMatch(
    String rootId,
    Map<String, String> bindings,
    Set<String> matchedNodes,
    Set<String> boundNodes,
    Set<String> leafBoundVariables) {

  public PatternMatch {
    Objects.requireNonNull(rootId, "rootId");
    bindings = Map.copyOf(bindings);
    matchedNodes = Set.copyOf(matchedNodes);
    boundNodes = Set.copyOf(boundNodes);
    leafBoundVariables = Set.copyOf(leafBoundVariables);
  }

  /** Nodes that take part in the match, whether matched or bound. */
  public boolean involves(String nodeId) {
    return matchedNodes.contains(nodeId) || boundNodes.contains(nodeId);
  }
}
