package sid.ast;

import java.util.Objects;
import java.util.stream.Collectors;

/** Formatting and variable helpers shared by the parser, builder and rewrite engine. */
public final class Expressions {
  private Expressions() {}

  /** Renders an expression in canonical {@code OP(arg, arg)} form; re-parses to an equal tree. */
  public static String format(Expression expression) {
    Objects.requireNonNull(expression, "expression");
    if (expression instanceof Atom atom) {
      return atom.name();
    }
    Op op = (Op) expression;
    String args = op.args().stream().map(Expressions::format).collect(Collectors.joining(", "));
    return op.operator().symbol() + "(" + args + ")";
  }

  /** A variable is {@code $}-prefixed, or a single lowercase letter. */
  public static boolean isVariable(String name) {
    if (name == null || name.isEmpty()) {
      return false;
    }
    if (name.charAt(0) == '$') {
      return true;
    }
    return name.length() == 1 && Character.isLowerCase(name.charAt(0));
  }

  /** Binding key of a variable: {@code $x} and {@code x} both bind under {@code x}. */
  public static String variableName(String name) {
    Objects.requireNonNull(name, "name");
    return name.startsWith("$") ? name.substring(1) : name;
  }
}
