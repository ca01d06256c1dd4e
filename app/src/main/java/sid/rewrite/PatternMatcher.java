package sid.rewrite;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import sid.ast.Atom;
import sid.ast.Expression;
import sid.ast.Expressions;
import sid.ast.Op;
import sid.ast.OperatorTag;
import sid.diagram.Diagram;
import sid.diagram.Node;

/**
 * Anchors a pattern expression at diagram nodes.
 *
 * <p>Operator patterns match their arguments against the candidate's port-ordered inputs; a
 * candidate may carry more inputs than the pattern names, and the trailing ones are left
 * unmatched. A {@code P} pattern whose argument is an atom matches a leaf {@code P} node directly.
 */
public final class PatternMatcher {
  private final Diagram diagram;

  private final Map<String, String> bindings = new HashMap<>();
  private final Set<String> matched = new LinkedHashSet<>();
  private final Set<String> bound = new LinkedHashSet<>();
  private final Set<String> leafBound = new HashSet<>();

  private PatternMatcher(Diagram diagram) {
    this.diagram = diagram;
  }

  /** First match in node order, or empty. */
  public static Optional<PatternMatch> find(Diagram diagram, Expression pattern) {
    Objects.requireNonNull(diagram, "diagram");
    Objects.requireNonNull(pattern, "pattern");
    for (Node node : diagram.nodes()) {
      Optional<PatternMatch> match = matchAt(diagram, pattern, node.id());
      if (match.isPresent()) {
        return match;
      }
    }
    return Optional.empty();
  }

  public static Optional<PatternMatch> matchAt(Diagram diagram, Expression pattern, String nodeId) {
    PatternMatcher matcher = new PatternMatcher(diagram);
    if (!matcher.matches(pattern, nodeId)) {
      return Optional.empty();
    }
    return Optional.of(
        new PatternMatch(
            nodeId, matcher.bindings, matcher.matched, matcher.bound, matcher.leafBound));
  }

  private boolean matches(Expression pattern, String nodeId) {
    Optional<Node> candidate = diagram.findNode(nodeId);
    if (candidate.isEmpty()) {
      return false;
    }
    Node node = candidate.get();
    if (pattern instanceof Atom atom) {
      return atom.isVariable() ? bind(atom, nodeId) : carriesLiteral(node, atom.name());
    }

    Op op = (Op) pattern;
    if (node.operator() != op.operator()) {
      return false;
    }
    matched.add(nodeId);

    List<String> inputs = structuralInputs(node);
    if (!inputs.isEmpty()) {
      if (inputs.size() < op.args().size()) {
        return false;
      }
      for (int i = 0; i < op.args().size(); i++) {
        if (!matches(op.args().get(i), inputs.get(i))) {
          return false;
        }
      }
      return true;
    }
    return matchesLeaf(op, node);
  }

  private boolean matchesLeaf(Op op, Node node) {
    if (op.args().isEmpty()) {
      return true;
    }
    if (op.operator() == OperatorTag.P && op.args().size() == 1 && op.args().get(0).isAtom()) {
      Atom atom = (Atom) op.args().get(0);
      if (atom.isVariable()) {
        if (!bind(atom, node.id())) {
          return false;
        }
        leafBound.add(Expressions.variableName(atom.name()));
        return true;
      }
      return node.dofRefs().contains(atom.name());
    }
    for (Expression arg : op.args()) {
      if (!(arg instanceof Atom atom) || atom.isVariable() || !carriesLiteral(node, atom.name())) {
        return false;
      }
    }
    return true;
  }

  private boolean bind(Atom variable, String nodeId) {
    String key = Expressions.variableName(variable.name());
    String existing = bindings.get(key);
    if (existing != null) {
      return existing.equals(nodeId);
    }
    bindings.put(key, nodeId);
    bound.add(nodeId);
    return true;
  }

  private List<String> structuralInputs(Node node) {
    List<String> byPort = diagram.getInputs(node.id());
    return byPort.isEmpty() ? node.inputs() : byPort;
  }

  private static boolean carriesLiteral(Node node, String name) {
    return node.dofRefs().contains(name) || node.atomArgs().contains(name);
  }
}
