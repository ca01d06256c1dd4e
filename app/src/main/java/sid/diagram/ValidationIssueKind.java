package sid.diagram;

/** Categories of structural problems reported by {@link DiagramValidator}. */
public enum ValidationIssueKind {
  EMPTY_ID(Severity.ERROR),
  DUPLICATE_ID(Severity.ERROR),
  MISSING_REFERENCE(Severity.ERROR),
  CYCLE(Severity.ERROR),
  COLLAPSE_NOT_IRREVERSIBLE(Severity.WARNING);

  private final Severity severity;

  ValidationIssueKind(Severity severity) {
    this.severity = severity;
  }

  public Severity severity() {
    return severity;
  }

  public enum Severity {
    ERROR,
    WARNING
  }
}
