package sid.diagram;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import sid.ast.OperatorTag;

/**
 * Collects every structural problem in a diagram instead of stopping at the first one. Node ids
 * and edge ids live in separate namespaces.
 */
public final class DiagramValidator {
  private DiagramValidator() {}

  public static List<ValidationIssue> validate(Diagram diagram) {
    Objects.requireNonNull(diagram, "diagram");
    List<ValidationIssue> issues = new ArrayList<>();
    Set<String> nodeIds = new HashSet<>();
    Set<String> edgeIds = new HashSet<>();

    for (Node node : diagram.nodes()) {
      if (node.id().isEmpty()) {
        issues.add(ValidationIssue.emptyId("Node"));
        continue;
      }
      if (!nodeIds.add(node.id())) {
        issues.add(ValidationIssue.duplicateId(node.id()));
      }
      if (node.operator() == OperatorTag.O && !node.irreversible()) {
        issues.add(ValidationIssue.collapseNotIrreversible(node.id()));
      }
    }
    for (Node node : diagram.nodes()) {
      for (String input : node.inputs()) {
        if (!nodeIds.contains(input)) {
          issues.add(ValidationIssue.missingReference(node.id(), "input", input));
        }
      }
    }
    for (Edge edge : diagram.edges()) {
      if (edge.id().isEmpty()) {
        issues.add(ValidationIssue.emptyId("Edge"));
      } else if (!edgeIds.add(edge.id())) {
        issues.add(ValidationIssue.duplicateId(edge.id()));
      }
      if (!nodeIds.contains(edge.from())) {
        issues.add(ValidationIssue.missingReference(edge.id(), "source", edge.from()));
      }
      if (!nodeIds.contains(edge.to())) {
        issues.add(ValidationIssue.missingReference(edge.id(), "target", edge.to()));
      }
    }
    if (diagram.hasCycle()) {
      issues.add(ValidationIssue.cycle());
    }
    return issues;
  }

  public static boolean isValid(Diagram diagram) {
    return validate(diagram).stream().noneMatch(ValidationIssue::isError);
  }
}
