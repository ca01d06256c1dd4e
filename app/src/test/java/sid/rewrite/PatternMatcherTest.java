package sid.rewrite;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import sid.ast.OperatorTag;
import sid.diagram.Diagram;
import sid.diagram.DiagramBuilder;
import sid.diagram.Edge;
import sid.diagram.Node;
import sid.parse.ExpressionParser;

final class PatternMatcherTest {

  @Test
  void bindsLeafPrimitivesToVariables() {
    Diagram diagram = build("C(P(Freedom), P(Choice))");
    PatternMatch match =
        PatternMatcher.find(diagram, ExpressionParser.parse("C(P($x), P($y))")).orElseThrow();

    assertEquals("n3", match.rootId());
    assertEquals("n1", match.bindings().get("x"));
    assertEquals("n2", match.bindings().get("y"));
    assertTrue(match.leafBoundVariables().containsAll(List.of("x", "y")));
    assertTrue(match.involves("n1"));
    assertTrue(match.involves("n3"));
  }

  @Test
  void literalAtomsMustAppearInDofRefs() {
    Diagram diagram = build("P(Freedom)");
    assertTrue(PatternMatcher.find(diagram, ExpressionParser.parse("P(Freedom)")).isPresent());
    assertFalse(PatternMatcher.find(diagram, ExpressionParser.parse("P(Other)")).isPresent());
  }

  @Test
  void literalAtomsMatchAtomArgsOnCollapse() {
    Diagram diagram = build("O(Choice)");
    assertTrue(PatternMatcher.find(diagram, ExpressionParser.parse("O(Choice)")).isPresent());
    assertFalse(PatternMatcher.find(diagram, ExpressionParser.parse("O(Freedom)")).isPresent());
  }

  @Test
  void repeatedVariableRequiresSameNode() {
    assertFalse(
        PatternMatcher.find(build("C(P(A), P(B))"), ExpressionParser.parse("C($x, $x)"))
            .isPresent());

    Diagram shared = new Diagram("shared");
    shared.addNode(Node.of("a", OperatorTag.P));
    shared.addNode(Node.of("c", OperatorTag.C).withInputs(List.of("a", "a")));
    shared.addEdge(Edge.arg("e1", "a", "c", 0));
    shared.addEdge(Edge.arg("e2", "a", "c", 1));
    Optional<PatternMatch> match =
        PatternMatcher.find(shared, ExpressionParser.parse("C($x, $x)"));
    assertTrue(match.isPresent());
    assertEquals("a", match.get().bindings().get("x"));
  }

  @Test
  void extraInputsBeyondThePatternAreAllowed() {
    Diagram diagram = build("S+(P(A), P(B), P(D))");
    PatternMatch match =
        PatternMatcher.find(diagram, ExpressionParser.parse("S+(P($x))")).orElseThrow();
    assertEquals("n4", match.rootId());
    assertEquals("n1", match.bindings().get("x"));
  }

  @Test
  void operatorMismatchFails() {
    Diagram diagram = build("T(P(A))");
    assertTrue(PatternMatcher.matchAt(diagram, ExpressionParser.parse("O($x)"), "n2").isEmpty());
    assertTrue(PatternMatcher.matchAt(diagram, ExpressionParser.parse("T($x)"), "n2").isPresent());
    assertTrue(PatternMatcher.matchAt(diagram, ExpressionParser.parse("T($x)"), "zz").isEmpty());
  }

  private static Diagram build(String expression) {
    return DiagramBuilder.build(ExpressionParser.parse(expression));
  }
}
