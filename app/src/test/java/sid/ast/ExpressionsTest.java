package sid.ast;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

final class ExpressionsTest {

  @Test
  void classifiesVariables() {
    assertTrue(Expressions.isVariable("$x"));
    assertTrue(Expressions.isVariable("$Long_name"));
    assertTrue(Expressions.isVariable("y"));
    assertFalse(Expressions.isVariable("Y"));
    assertFalse(Expressions.isVariable("xy"));
    assertFalse(Expressions.isVariable("Freedom"));
  }

  @Test
  void dollarAndBareFormsShareBindingKey() {
    assertEquals("x", Expressions.variableName("$x"));
    assertEquals("x", Expressions.variableName("x"));
  }

  @Test
  void formatsWithCanonicalSpacing() {
    Expression expr =
        Op.of(OperatorTag.S_MINUS, new Atom("A"), Op.of(OperatorTag.T, new Atom("$v")));
    assertEquals("S-(A, T($v))", Expressions.format(expr));
  }

  @Test
  void operatorArityRules() {
    assertTrue(OperatorTag.C.acceptsArity(2));
    assertFalse(OperatorTag.C.acceptsArity(1));
    assertTrue(OperatorTag.S_PLUS.acceptsArity(7));
    assertFalse(OperatorTag.S_MINUS.acceptsArity(0));
    assertTrue(OperatorTag.O.irreversible());
    assertFalse(OperatorTag.T.irreversible());
    assertEquals(OperatorTag.S_MINUS, OperatorTag.fromSymbol("S-").orElseThrow());
    assertTrue(OperatorTag.fromSymbol("X").isEmpty());
  }
}
