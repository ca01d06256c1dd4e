package sid.diagram;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import sid.ast.Atom;
import sid.ast.Expression;
import sid.ast.Op;
import sid.ast.OperatorTag;
import sid.errors.StructuralException;

/**
 * Compiles an expression tree into a {@link Diagram}.
 *
 * <p>Children are built before their parent, and nodes and edges draw ids from one shared
 * counter: {@code C(P(A), P(B))} yields nodes {@code n1, n2, n3} and edges {@code e4, e5}.
 */
public final class DiagramBuilder {
  public static final String DEFAULT_DIAGRAM_ID = "d_expr";

  private final Diagram diagram;
  private int counter;

  private DiagramBuilder(String diagramId) {
    this.diagram = new Diagram(diagramId);
  }

  public static Diagram build(Expression expression) {
    return build(expression, DEFAULT_DIAGRAM_ID, null);
  }

  public static Diagram build(Expression expression, String diagramId, String compartmentId) {
    Objects.requireNonNull(expression, "expression");
    String id = diagramId == null || diagramId.isBlank() ? DEFAULT_DIAGRAM_ID : diagramId;
    DiagramBuilder builder = new DiagramBuilder(id);
    if (expression instanceof Atom atom) {
      builder.diagram.addNode(
          Node.of(builder.nextId("n"), OperatorTag.P).withDofRefs(List.of(atom.name())));
    } else {
      builder.buildOp((Op) expression);
    }
    builder.diagram.setCompartmentId(compartmentId);

    builder.diagram.validateStructure();
    if (builder.diagram.hasCycle()) {
      throw new StructuralException("Built diagram " + builder.diagram.id() + " contains a cycle");
    }
    return builder.diagram;
  }

  private String buildOp(Op op) {
    List<String> atoms = new ArrayList<>();
    List<String> inputIds = new ArrayList<>();
    List<Integer> ports = new ArrayList<>();
    for (int position = 0; position < op.args().size(); position++) {
      Expression arg = op.args().get(position);
      if (arg instanceof Atom atom) {
        atoms.add(atom.name());
      } else {
        inputIds.add(buildOp((Op) arg));
        ports.add(position);
      }
    }

    String nodeId = nextId("n");
    Node node = attachAtoms(Node.of(nodeId, op.operator()).withInputs(inputIds), atoms);
    diagram.addNode(node);
    for (int i = 0; i < inputIds.size(); i++) {
      diagram.addEdge(Edge.arg(nextId("e"), inputIds.get(i), nodeId, ports.get(i)));
    }
    return nodeId;
  }

  private String nextId(String prefix) {
    counter++;
    return prefix + counter;
  }

  /**
   * Places literal atom arguments on {@code node}: as {@code dof_refs} for {@code P} and for
   * superpositions without structural inputs, otherwise under {@link Node#ATOM_ARGS}.
   */
  public static Node attachAtoms(Node node, List<String> atoms) {
    if (atoms.isEmpty()) {
      return node;
    }
    boolean dofCarrier =
        node.isLeaf()
            && (node.operator() == OperatorTag.P || node.operator().superposition());
    if (dofCarrier) {
      return node.withDofRefs(atoms);
    }
    Map<String, Object> metadata = new LinkedHashMap<>(node.metadata());
    metadata.put(Node.ATOM_ARGS, List.copyOf(atoms));
    return node.withMetadata(metadata);
  }
}
