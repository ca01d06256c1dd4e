package sid.errors;

import java.util.Objects;

/** Base type for every failure raised by the SID engine. */
public class SidException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final ErrorCode code;

  protected SidException(ErrorCode code, String message) {
    super(message);
    this.code = Objects.requireNonNull(code, "code");
  }

  protected SidException(ErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
  }

  public ErrorCode code() {
    return code;
  }
}
