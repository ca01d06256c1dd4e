package sid.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import sid.errors.ExpressionParseException;

/**
 * Splits a SID expression into tokens.
 *
 * <p>{@code S+} and {@code S-} are matched before single-letter operators. A single operator letter
 * ({@code P}, {@code O}, {@code C}, {@code T}) is only an operator when the next character cannot
 * continue an identifier, so {@code Peace} and {@code Choice} lex as identifiers.
 */
public final class Tokenizer {
  private static final String SINGLE_OPERATORS = "POCT";

  private final String source;
  private int cursor;

  private Tokenizer(String source) {
    this.source = source;
  }

  public static List<Token> tokenize(String source) {
    Objects.requireNonNull(source, "source");
    return new Tokenizer(source).run();
  }

  private List<Token> run() {
    List<Token> tokens = new ArrayList<>();
    while (cursor < source.length()) {
      char c = source.charAt(cursor);
      if (Character.isWhitespace(c)) {
        cursor++;
        continue;
      }
      int start = cursor;
      switch (c) {
        case '(' -> tokens.add(single(TokenKind.LPAREN, start));
        case ')' -> tokens.add(single(TokenKind.RPAREN, start));
        case ',' -> tokens.add(single(TokenKind.COMMA, start));
        default -> tokens.add(wordToken(c, start));
      }
    }
    tokens.add(new Token(TokenKind.END, "", ExpressionParseException.END_OF_INPUT));
    return tokens;
  }

  private Token single(TokenKind kind, int start) {
    cursor++;
    return new Token(kind, source.substring(start, cursor), start);
  }

  private Token wordToken(char c, int start) {
    if (c == 'S' && cursor + 1 < source.length()) {
      char sign = source.charAt(cursor + 1);
      if (sign == '+' || sign == '-') {
        cursor += 2;
        return new Token(TokenKind.OPERATOR, source.substring(start, cursor), start);
      }
    }
    if (SINGLE_OPERATORS.indexOf(c) >= 0 && !continuesIdentifier(cursor + 1)) {
      cursor++;
      return new Token(TokenKind.OPERATOR, String.valueOf(c), start);
    }
    if (c == '$' || c == '_' || Character.isLetter(c)) {
      cursor++;
      while (continuesIdentifier(cursor)) {
        cursor++;
      }
      if (c == '$' && cursor == start + 1) {
        throw new ExpressionParseException("Expected variable name after '$'", start);
      }
      return new Token(TokenKind.IDENT, source.substring(start, cursor), start);
    }
    throw new ExpressionParseException("Unexpected character '" + c + "'", start);
  }

  private boolean continuesIdentifier(int index) {
    if (index >= source.length()) {
      return false;
    }
    char c = source.charAt(index);
    return c == '_' || Character.isLetterOrDigit(c);
  }
}
