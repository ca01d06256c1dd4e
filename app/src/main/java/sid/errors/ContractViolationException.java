package sid.errors;

/** Raised on caller misuse: wrong role, bad lengths, out-of-range arguments, unbound variables. */
public final class ContractViolationException extends SidException {
  private static final long serialVersionUID = 1L;

  public ContractViolationException(String message) {
    super(ErrorCode.LOGIC_ERROR, message);
  }
}
