package sid.diagram;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import sid.ast.OperatorTag;
import sid.parse.ExpressionParser;

final class DiagramBuilderTest {

  @Test
  void childrenAndEdgesShareOneCounter() {
    Diagram diagram = build("C(P(A), P(B))");

    assertEquals(List.of("n1", "n2", "n3"), nodeIds(diagram));
    assertEquals(
        List.of("e4", "e5"),
        diagram.edges().stream().map(Edge::id).collect(Collectors.toList()));
    Node root = diagram.findNode("n3").orElseThrow();
    assertEquals(OperatorTag.C, root.operator());
    assertEquals(List.of("n1", "n2"), root.inputs());
    assertEquals(List.of("n1", "n2"), diagram.getInputs("n3"));
    assertEquals(0, diagram.findEdge("e4").orElseThrow().port());
    assertEquals(1, diagram.findEdge("e5").orElseThrow().port());
    assertEquals(DiagramBuilder.DEFAULT_DIAGRAM_ID, diagram.id());
  }

  @Test
  void singlePrimitiveBecomesOneNode() {
    Diagram diagram = build("P(Freedom)");

    assertEquals(1, diagram.nodeCount());
    assertEquals(0, diagram.edgeCount());
    Node node = diagram.nodes().get(0);
    assertEquals(List.of("Freedom"), node.dofRefs());
    assertFalse(node.irreversible());
  }

  @Test
  void bareAtomIsWrappedInPrimitive() {
    Diagram diagram = build("Truth");

    Node node = diagram.nodes().get(0);
    assertEquals(OperatorTag.P, node.operator());
    assertEquals(List.of("Truth"), node.dofRefs());
  }

  @Test
  void superpositionOfAtomsKeepsThemAsDofRefs() {
    Node node = build("S+(A, B)").nodes().get(0);
    assertEquals(OperatorTag.S_PLUS, node.operator());
    assertEquals(List.of("A", "B"), node.dofRefs());
  }

  @Test
  void collapseOfAtomRecordsAtomArgsAndIsIrreversible() {
    Node node = build("O(Choice)").nodes().get(0);
    assertTrue(node.irreversible());
    assertTrue(node.dofRefs().isEmpty());
    assertEquals(List.of("Choice"), node.atomArgs());
  }

  @Test
  void mixedArgumentsKeepArgumentPorts() {
    Diagram diagram = build("S+(A, P(B))");

    Node root = diagram.findNode("n2").orElseThrow();
    assertEquals(List.of("A"), root.atomArgs(), "Atom args sit on non-leaf nodes");
    assertTrue(root.dofRefs().isEmpty());
    Edge edge = diagram.edges().get(0);
    assertEquals("n1", edge.from());
    assertEquals("n2", edge.to());
    assertEquals(1, edge.port(), "Port follows argument position");
  }

  @Test
  void customIdsAreApplied() {
    Diagram diagram =
        DiagramBuilder.build(ExpressionParser.parse("T(P(A))"), "init", "compartment-1");
    assertEquals("init", diagram.id());
    assertEquals("compartment-1", diagram.compartmentId().orElseThrow());
    assertFalse(diagram.hasCycle());
  }

  private static Diagram build(String expression) {
    return DiagramBuilder.build(ExpressionParser.parse(expression));
  }

  private static List<String> nodeIds(Diagram diagram) {
    return diagram.nodes().stream().map(Node::id).collect(Collectors.toList());
  }
}
