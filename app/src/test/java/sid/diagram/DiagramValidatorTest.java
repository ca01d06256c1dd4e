package sid.diagram;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import sid.ast.OperatorTag;

final class DiagramValidatorTest {

  @Test
  void builtDiagramsAreValid() {
    Diagram diagram = new Diagram("ok");
    diagram.addNode(Node.of("a", OperatorTag.P));
    diagram.addNode(Node.of("b", OperatorTag.O).withInputs(List.of("a")));
    diagram.addEdge(Edge.arg("e", "a", "b", 0));
    assertTrue(DiagramValidator.validate(diagram).isEmpty());
    assertTrue(DiagramValidator.isValid(diagram));
  }

  @Test
  void collectsEveryProblem() {
    Diagram diagram = new Diagram("bad");
    diagram.addNode(Node.of("a", OperatorTag.T).withInputs(List.of("ghost")));
    diagram.addNode(Node.of("a", OperatorTag.P));
    diagram.addNode(Node.of("b", OperatorTag.T));
    diagram.addEdge(Edge.arg("e1", "a", "b", 0));
    diagram.addEdge(Edge.arg("e2", "b", "a", 0));
    diagram.addEdge(Edge.arg("e3", "b", "missing", 0));

    Set<ValidationIssueKind> kinds =
        DiagramValidator.validate(diagram).stream()
            .map(ValidationIssue::kind)
            .collect(Collectors.toSet());
    assertEquals(
        EnumSet.of(
            ValidationIssueKind.DUPLICATE_ID,
            ValidationIssueKind.MISSING_REFERENCE,
            ValidationIssueKind.CYCLE),
        kinds);
    assertFalse(DiagramValidator.isValid(diagram));
  }

  @Test
  void nodeAndEdgeMayShareAnId() {
    Diagram diagram = new Diagram("shared");
    diagram.addNode(Node.of("a", OperatorTag.P));
    diagram.addNode(Node.of("b", OperatorTag.T).withInputs(List.of("a")));
    diagram.addEdge(Edge.arg("a", "a", "b", 0));
    assertTrue(DiagramValidator.validate(diagram).isEmpty(), "Separate id namespaces");

    diagram.addEdge(Edge.arg("a", "a", "b", 1));
    assertEquals(
        List.of(ValidationIssueKind.DUPLICATE_ID),
        DiagramValidator.validate(diagram).stream()
            .map(ValidationIssue::kind)
            .collect(Collectors.toList()));
  }

  @Test
  void reversibleCollapseIsOnlyAWarning() {
    Diagram diagram = new Diagram("warn");
    diagram.addNode(new Node("o", OperatorTag.O, List.of(), List.of(), false, Map.of()));

    List<ValidationIssue> issues = DiagramValidator.validate(diagram);
    assertEquals(1, issues.size());
    assertEquals(ValidationIssueKind.COLLAPSE_NOT_IRREVERSIBLE, issues.get(0).kind());
    assertFalse(issues.get(0).isError());
    assertTrue(DiagramValidator.isValid(diagram));
  }
}
