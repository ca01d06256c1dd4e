package sid.errors;

/** Raised when the I + N + U = C invariant cannot be restored. */
public final class ConservationViolationException extends SidException {
  private static final long serialVersionUID = 1L;

  private ConservationViolationException(ErrorCode code, String message) {
    super(code, message);
  }

  public static ConservationViolationException drift(double error, double tolerance) {
    return new ConservationViolationException(
        ErrorCode.CONSERVATION_VIOLATION,
        "Conservation violated: |I+N+U-C| = " + error + " exceeds " + tolerance);
  }

  public static ConservationViolationException scaleCap(double scale, double cap) {
    return new ConservationViolationException(
        ErrorCode.SCALE_CAP_EXCEEDED,
        "Deficit correction scale " + scale + " exceeds maximum " + cap);
  }
}
