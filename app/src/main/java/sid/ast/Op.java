package sid.ast;

import java.util.List;
import java.util.Objects;

/** Operator application with ordered arguments. */
public record Op(OperatorTag operator, List<Expression> args) implements Expression {

  public Op {
    Objects.requireNonNull(operator, "operator");
    args = List.copyOf(Objects.requireNonNull(args, "args"));
  }

  public static Op of(OperatorTag operator, Expression... args) {
    return new Op(operator, List.of(args));
  }

  @Override
  public String toString() {
    return Expressions.format(this);
  }
}
