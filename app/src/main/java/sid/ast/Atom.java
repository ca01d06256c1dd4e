package sid.ast;

import java.util.Objects;

/** Named leaf of an expression; a pattern variable when {@link Expressions#isVariable} holds. */
public record Atom(String name) implements Expression {

  public Atom {
    Objects.requireNonNull(name, "name");
    if (name.isBlank()) {
      throw new IllegalArgumentException("atom name must not be blank");
    }
  }

  public boolean isVariable() {
    return Expressions.isVariable(name);
  }

  @Override
  public String toString() {
    return name;
  }
}
