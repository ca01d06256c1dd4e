package sid.parse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import sid.errors.ExpressionParseException;

final class TokenizerTest {

  @Test
  void matchesSuperpositionOperatorsBeforeIdentifiers() {
    List<Token> tokens = Tokenizer.tokenize("S+(S-(x), Sa)");
    assertEquals(
        List.of(
            TokenKind.OPERATOR,
            TokenKind.LPAREN,
            TokenKind.OPERATOR,
            TokenKind.LPAREN,
            TokenKind.IDENT,
            TokenKind.RPAREN,
            TokenKind.COMMA,
            TokenKind.IDENT,
            TokenKind.RPAREN,
            TokenKind.END),
        kinds(tokens));
    assertEquals("S+", tokens.get(0).text());
    assertEquals("S-", tokens.get(2).text());
    assertEquals("Sa", tokens.get(7).text());
  }

  @Test
  void operatorLettersInsideWordsAreIdentifiers() {
    List<Token> tokens = Tokenizer.tokenize("P(Peace) C (Choice) T");
    assertEquals(TokenKind.OPERATOR, tokens.get(0).kind());
    assertEquals(TokenKind.IDENT, tokens.get(2).kind());
    assertEquals("Peace", tokens.get(2).text());
    assertEquals(TokenKind.OPERATOR, tokens.get(4).kind(), "C followed by a space is an operator");
    assertEquals("Choice", tokens.get(6).text());
    assertEquals(TokenKind.OPERATOR, tokens.get(8).kind(), "Trailing T is an operator");
  }

  @Test
  void variablesKeepTheirDollarPrefix() {
    List<Token> tokens = Tokenizer.tokenize("  $x_1 ");
    assertEquals(TokenKind.IDENT, tokens.get(0).kind());
    assertEquals("$x_1", tokens.get(0).text());
    assertEquals(2, tokens.get(0).position());
  }

  @Test
  void rejectsUnexpectedCharacterWithPosition() {
    ExpressionParseException ex =
        assertThrows(ExpressionParseException.class, () -> Tokenizer.tokenize("P(A) # B"));
    assertEquals(5, ex.position());
  }

  @Test
  void rejectsBareDollar() {
    assertThrows(ExpressionParseException.class, () -> Tokenizer.tokenize("P($)"));
  }

  private static List<TokenKind> kinds(List<Token> tokens) {
    return tokens.stream().map(Token::kind).collect(Collectors.toList());
  }
}
