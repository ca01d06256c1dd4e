package sid.parse;

import java.util.Objects;

/** A lexeme together with its starting offset in the source string. */
public record Token(TokenKind kind, String text, int position) {

  public Token {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(text, "text");
  }

  public boolean is(TokenKind expected) {
    return kind == expected;
  }
}
