package sid.errors;

/** Machine-readable error categories reported at the command boundary. */
public enum ErrorCode {
  PARSE_ERROR,
  STRUCTURAL_ERROR,
  LOGIC_ERROR,
  CONSERVATION_VIOLATION,
  SCALE_CAP_EXCEEDED
}
