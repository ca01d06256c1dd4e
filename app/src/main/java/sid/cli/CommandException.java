package sid.cli;

import java.util.Objects;

/** Router-level request failure carrying the error code reported to the client. */
final class CommandException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  static final String MISSING_COMMAND = "MISSING_COMMAND";
  static final String UNKNOWN_COMMAND = "UNKNOWN_COMMAND";
  static final String MISSING_PARAMETER = "MISSING_PARAMETER";
  static final String INVALID_PARAMETER = "INVALID_PARAMETER";
  static final String ENGINE_NOT_FOUND = "ENGINE_NOT_FOUND";
  static final String PARSE_ERROR = "PARSE_ERROR";
  static final String EXECUTION_FAILED = "EXECUTION_FAILED";

  private final String errorCode;

  CommandException(String errorCode, String message) {
    super(message);
    this.errorCode = Objects.requireNonNull(errorCode, "errorCode");
  }

  String errorCode() {
    return errorCode;
  }

  static CommandException missing(String parameter) {
    return new CommandException(MISSING_PARAMETER, "Missing '" + parameter + "' parameter");
  }

  static CommandException invalid(String message) {
    return new CommandException(INVALID_PARAMETER, message);
  }
}
