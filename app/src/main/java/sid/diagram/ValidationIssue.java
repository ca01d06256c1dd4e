package sid.diagram;

import java.util.Objects;

/** One problem found in a diagram; {@code subject} is the offending node or edge id. */
public record ValidationIssue(ValidationIssueKind kind, String subject, String message) {

  public ValidationIssue {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(message, "message");
  }

  public static ValidationIssue emptyId(String what) {
    return new ValidationIssue(ValidationIssueKind.EMPTY_ID, null, what + " has an empty id");
  }

  public static ValidationIssue duplicateId(String id) {
    return new ValidationIssue(ValidationIssueKind.DUPLICATE_ID, id, "Duplicate id " + id);
  }

  public static ValidationIssue missingReference(String subject, String role, String target) {
    return new ValidationIssue(
        ValidationIssueKind.MISSING_REFERENCE,
        subject,
        subject + " references missing " + role + " node " + target);
  }

  public static ValidationIssue cycle() {
    return new ValidationIssue(ValidationIssueKind.CYCLE, null, "Diagram contains cycle");
  }

  public static ValidationIssue collapseNotIrreversible(String nodeId) {
    return new ValidationIssue(
        ValidationIssueKind.COLLAPSE_NOT_IRREVERSIBLE,
        nodeId,
        "Collapse node " + nodeId + " is not marked irreversible");
  }

  public boolean isError() {
    return kind.severity() == ValidationIssueKind.Severity.ERROR;
  }
}
