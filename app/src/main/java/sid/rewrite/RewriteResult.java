package sid.rewrite;

import java.util.List;
import java.util.Objects;
import sid.diagram.Diagram;

/**
 * Result of {@link RewriteEngine#apply}. {@code diagram} is the rewritten diagram when applied,
 * otherwise the untouched input.
 */
public record RewriteResult(RewriteStatus status, Diagram diagram, List<String> messages) {

  public RewriteResult {
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(diagram, "diagram");
    messages = List.copyOf(messages);
  }

  static RewriteResult applied(Diagram diagram, String ruleId) {
    return new RewriteResult(
        RewriteStatus.APPLIED, diagram, List.of("Rewrite " + ruleId + " applied"));
  }

  static RewriteResult notApplicable(Diagram original, String ruleId) {
    return new RewriteResult(
        RewriteStatus.NOT_APPLICABLE,
        original,
        List.of("Rewrite " + ruleId + " not applicable"));
  }

  static RewriteResult rejectedCycle(Diagram original, String ruleId) {
    return new RewriteResult(
        RewriteStatus.REJECTED_CYCLE,
        original,
        List.of("ERROR: Rewrite " + ruleId + " would introduce cycle"));
  }

  public boolean applied() {
    return status == RewriteStatus.APPLIED;
  }

  public String message() {
    return String.join("; ", messages);
  }
}
