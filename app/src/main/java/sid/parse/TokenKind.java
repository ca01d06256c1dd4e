package sid.parse;

/** Lexical categories of the SID expression language. */
public enum TokenKind {
  OPERATOR,
  IDENT,
  LPAREN,
  RPAREN,
  COMMA,
  END
}
