package sid.rewrite;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import sid.ast.Atom;
import sid.ast.Expression;
import sid.ast.Expressions;
import sid.ast.Op;
import sid.ast.OperatorTag;
import sid.diagram.Diagram;
import sid.diagram.DiagramBuilder;
import sid.diagram.Edge;
import sid.diagram.Node;
import sid.errors.ContractViolationException;

/**
 * Builds a replacement expression into a working diagram, reusing the nodes bound by a match.
 *
 * <p>New ids are {@code <rule>_n<k>} and {@code <rule>_e<k>}, with {@code k} skipping any id the
 * diagram already holds.
 */
final class ReplacementBuilder {
  private final Diagram target;
  private final PatternMatch match;
  private final String ruleId;
  private final Map<String, Object> provenance;
  private int counter;

  private ReplacementBuilder(
      Diagram target, PatternMatch match, String ruleId, Map<String, Object> ruleMetadata) {
    this.target = target;
    this.match = match;
    this.ruleId = ruleId;
    Map<String, Object> meta = new LinkedHashMap<>(ruleMetadata);
    meta.put(Node.RULE_ID, ruleId);
    this.provenance = meta;
  }

  /** Adds the replacement to {@code target} and returns the id of its root node. */
  static String build(
      Diagram target,
      Expression replacement,
      PatternMatch match,
      String ruleId,
      Map<String, Object> ruleMetadata) {
    ReplacementBuilder builder = new ReplacementBuilder(target, match, ruleId, ruleMetadata);
    if (replacement instanceof Atom atom) {
      if (atom.isVariable()) {
        return builder.resolveVariable(atom);
      }
      Node node =
          builder.decorate(Node.of(builder.nextId("_n"), OperatorTag.P))
              .withDofRefs(List.of(atom.name()));
      target.addNode(node);
      return node.id();
    }
    return builder.buildOp((Op) replacement);
  }

  private String buildOp(Op op) {
    if (reusesLeaf(op)) {
      return resolveVariable((Atom) op.args().get(0));
    }
    List<String> atoms = new ArrayList<>();
    List<String> inputIds = new ArrayList<>();
    List<Integer> ports = new ArrayList<>();
    for (int position = 0; position < op.args().size(); position++) {
      Expression arg = op.args().get(position);
      if (arg instanceof Atom atom) {
        if (atom.isVariable()) {
          inputIds.add(resolveVariable(atom));
          ports.add(position);
        } else {
          atoms.add(atom.name());
        }
      } else {
        inputIds.add(buildOp((Op) arg));
        ports.add(position);
      }
    }

    String nodeId = nextId("_n");
    Node node =
        DiagramBuilder.attachAtoms(
            decorate(Node.of(nodeId, op.operator())).withInputs(inputIds), atoms);
    target.addNode(node);
    for (int i = 0; i < inputIds.size(); i++) {
      target.addEdge(Edge.arg(nextId("_e"), inputIds.get(i), nodeId, ports.get(i)));
    }
    return nodeId;
  }

  /** {@code P($v)} where {@code $v} was bound to a leaf by {@code P($v)} stands for that leaf. */
  private boolean reusesLeaf(Op op) {
    if (op.operator() != OperatorTag.P || op.args().size() != 1) {
      return false;
    }
    if (!(op.args().get(0) instanceof Atom atom) || !atom.isVariable()) {
      return false;
    }
    return match.leafBoundVariables().contains(Expressions.variableName(atom.name()));
  }

  private String resolveVariable(Atom variable) {
    String nodeId = match.bindings().get(Expressions.variableName(variable.name()));
    if (nodeId == null) {
      throw new ContractViolationException("Unbound variable: " + variable.name());
    }
    return nodeId;
  }

  private Node decorate(Node node) {
    return node.withMetadata(provenance);
  }

  private String nextId(String suffix) {
    String candidate;
    do {
      counter++;
      candidate = ruleId + suffix + counter;
    } while (target.containsId(candidate));
    return candidate;
  }
}
