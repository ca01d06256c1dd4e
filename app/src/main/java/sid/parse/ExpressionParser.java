package sid.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import sid.ast.Atom;
import sid.ast.Expression;
import sid.ast.Op;
import sid.ast.OperatorTag;
import sid.errors.ExpressionParseException;

/**
 * Recursive-descent parser for SID expressions.
 *
 * <pre>
 * Expr     := OPERATOR '(' ExprList ')' | OPERATOR | IDENT
 * ExprList := Expr (',' Expr)*
 * </pre>
 */
public final class ExpressionParser {
  private final List<Token> tokens;
  private int index;

  private ExpressionParser(List<Token> tokens) {
    this.tokens = tokens;
  }

  public static Expression parse(String source) {
    Objects.requireNonNull(source, "source");
    ExpressionParser parser = new ExpressionParser(Tokenizer.tokenize(source));
    if (parser.peek().is(TokenKind.END)) {
      throw new ExpressionParseException("Empty expression", ExpressionParseException.END_OF_INPUT);
    }
    Expression expression = parser.parseExpression();
    Token trailing = parser.peek();
    if (!trailing.is(TokenKind.END)) {
      throw new ExpressionParseException(
          "Unexpected trailing token '" + trailing.text() + "'", trailing.position());
    }
    return expression;
  }

  private Expression parseExpression() {
    Token token = advance();
    switch (token.kind()) {
      case IDENT:
        return new Atom(token.text());
      case OPERATOR:
        return parseOperator(token);
      default:
        throw new ExpressionParseException(
            "Expected operator or identifier but found " + describe(token), token.position());
    }
  }

  private Expression parseOperator(Token operatorToken) {
    OperatorTag tag =
        OperatorTag.fromSymbol(operatorToken.text())
            .orElseThrow(
                () ->
                    new ExpressionParseException(
                        "Unknown operator '" + operatorToken.text() + "'",
                        operatorToken.position()));
    List<Expression> args = new ArrayList<>();
    if (peek().is(TokenKind.LPAREN)) {
      advance();
      args.add(parseExpression());
      while (peek().is(TokenKind.COMMA)) {
        advance();
        args.add(parseExpression());
      }
      Token closing = advance();
      if (!closing.is(TokenKind.RPAREN)) {
        throw new ExpressionParseException(
            "Expected ')' but found " + describe(closing), closing.position());
      }
    }
    if (!tag.acceptsArity(args.size())) {
      throw new ExpressionParseException(
          "Operator "
              + tag.symbol()
              + " requires "
              + tag.arityDescription()
              + " argument(s), got "
              + args.size(),
          operatorToken.position());
    }
    return new Op(tag, args);
  }

  private Token peek() {
    return tokens.get(index);
  }

  private Token advance() {
    Token token = tokens.get(index);
    if (!token.is(TokenKind.END)) {
      index++;
    }
    return token;
  }

  private static String describe(Token token) {
    return token.is(TokenKind.END) ? "end of input" : "'" + token.text() + "'";
  }
}
