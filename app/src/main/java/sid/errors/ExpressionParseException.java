package sid.errors;

/** Raised when a SID expression string cannot be tokenized or parsed. */
public final class ExpressionParseException extends SidException {
  private static final long serialVersionUID = 1L;

  /** Position reported for failures at the end of the input. */
  public static final int END_OF_INPUT = -1;

  private final int position;

  public ExpressionParseException(String message, int position) {
    super(ErrorCode.PARSE_ERROR, describe(message, position));
    this.position = position;
  }

  public int position() {
    return position;
  }

  private static String describe(String message, int position) {
    if (position == END_OF_INPUT) {
      return message + " at end of input";
    }
    return message + " at position " + position;
  }
}
