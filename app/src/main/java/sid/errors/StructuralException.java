package sid.errors;

/** Raised when a diagram references missing nodes, contains a cycle, or is malformed. */
public final class StructuralException extends SidException {
  private static final long serialVersionUID = 1L;

  public StructuralException(String message) {
    super(ErrorCode.STRUCTURAL_ERROR, message);
  }

  public StructuralException(String message, Throwable cause) {
    super(ErrorCode.STRUCTURAL_ERROR, message, cause);
  }
}
