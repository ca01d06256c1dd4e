package sid.ast;

import java.util.Arrays;
import java.util.Optional;

/** The closed set of SID operators together with their arity rules. */
public enum OperatorTag {
  P("P", 1, 1),
  S_PLUS("S+", 1, Integer.MAX_VALUE),
  S_MINUS("S-", 1, Integer.MAX_VALUE),
  O("O", 1, 1),
  C("C", 2, 2),
  T("T", 1, 1);

  private final String symbol;
  private final int minArity;
  private final int maxArity;

  OperatorTag(String symbol, int minArity, int maxArity) {
    this.symbol = symbol;
    this.minArity = minArity;
    this.maxArity = maxArity;
  }

  public String symbol() {
    return symbol;
  }

  public boolean acceptsArity(int argumentCount) {
    return argumentCount >= minArity && argumentCount <= maxArity;
  }

  /** Human-readable arity requirement, e.g. "exactly 2" or "at least 1". */
  public String arityDescription() {
    if (minArity == maxArity) {
      return "exactly " + minArity;
    }
    return "at least " + minArity;
  }

  /** Collapse is the only operator whose nodes are marked irreversible. */
  public boolean irreversible() {
    return this == O;
  }

  public boolean superposition() {
    return this == S_PLUS || this == S_MINUS;
  }

  public static Optional<OperatorTag> fromSymbol(String symbol) {
    if (symbol == null) {
      return Optional.empty();
    }
    return Arrays.stream(values()).filter(tag -> tag.symbol.equals(symbol)).findFirst();
  }

  @Override
  public String toString() {
    return symbol;
  }
}
