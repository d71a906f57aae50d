package leakcheck.ir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import leakcheck.diagnostics.SortMismatchException;
import leakcheck.ir.Operator.Opcode;
import org.junit.jupiter.api.Test;

final class ExpressionTest {

  @Test
  void constantsMustFitTheirWidth() {
    assertEquals(255L, Constant.bitVector(255, 8).longValue(), "0xFF fits in 8 bits");
    assertThrows(
        IllegalArgumentException.class,
        () -> Constant.bitVector(256, 8),
        "0x100 does not fit in 8 bits");
    assertEquals(
        Constant.zero(8), Constant.truncating(256, 8), "Truncation keeps the low bits only");
  }

  @Test
  void sortsRenderDeterministically() {
    assertEquals("0x2A:BitVec<8>", Constant.bitVector(42, 8).toString(), "Bit-vector display");
    assertEquals("$true:Bool", Constant.TRUE.toString(), "Boolean display");
    assertEquals("Bool", Sort.memory().toString(), "Memory displays like the Boolean sort");
    assertEquals("Memory", Sort.memory().describe(), "Diagnostics name the memory sort");
    assertEquals(Sort.bitVector(16), Sort.bitVector(16), "Sorts compare by kind and width");
  }

  @Test
  void checkedFactoriesRejectMismatchedOperands() {
    Expression flag = Variable.bool("flag").toExpression();
    Expression word = Variable.bitVector("word", 64).toExpression();
    assertThrows(
        SortMismatchException.class,
        () -> Expression.and(flag, word),
        "A Boolean operator must not accept a bit-vector");
    assertThrows(
        SortMismatchException.class,
        () -> Expression.add(word, Expression.bitVector(1, 8)),
        "Bit-vector operands must share a width");
  }

  @Test
  void uncheckedTermsFailValidation() throws SortMismatchException {
    Expression word = Variable.bitVector("word", 64).toExpression();
    Expression bad = Expression.apply(Opcode.AND, word, word);
    assertThrows(
        SortMismatchException.class, bad::validate, "`and` over bit-vectors is ill-sorted");

    Expression good = Expression.add(word, Expression.bitVector(1, 64));
    good.validate();
    good.validate();
    assertEquals(Sort.bitVector(64), good.sort(), "Validation leaves the term unchanged");
  }

  @Test
  void evaluationWrapsAroundTheWidth() throws SortMismatchException {
    Variable a = Variable.bitVector("a", 8);
    Assignment assignment = Assignment.of(Map.of(a, Constant.bitVector(0xFF, 8)));

    Expression sum = Expression.add(a.toExpression(), Expression.bitVector(1, 8));
    assertEquals(
        Constant.zero(8),
        ExpressionEvaluator.evaluate(sum, assignment).orElseThrow(),
        "0xFF + 1 wraps to 0");

    Expression shifted =
        Expression.ashr(Expression.bitVector(0x80, 8), Expression.bitVector(1, 8));
    assertEquals(
        Constant.bitVector(0xC0, 8),
        ExpressionEvaluator.evaluate(shifted, assignment).orElseThrow(),
        "Arithmetic shift keeps the sign bit");

    Expression quotient = Expression.udiv(a.toExpression(), Expression.bitVector(0, 8));
    assertEquals(
        Constant.bitVector(0xFF, 8),
        ExpressionEvaluator.evaluate(quotient, assignment).orElseThrow(),
        "Division by zero yields all ones");
  }

  @Test
  void evaluationOfUnboundVariablesIsUnknown() throws SortMismatchException {
    Expression test =
        Expression.ult(Variable.bitVector("free", 8).toExpression(), Expression.bitVector(4, 8));
    assertTrue(
        ExpressionEvaluator.evaluate(test, Assignment.empty()).isEmpty(),
        "A free variable leaves the value open");
    assertFalse(ExpressionEvaluator.holds(test, Assignment.empty()), "Unknown counts as false");
  }

  @Test
  void simplifierFoldsConstantsAndKeepsSorts() throws SortMismatchException {
    Expression x = Variable.bitVector("x", 32).toExpression();
    Expression folded =
        ExpressionSimplifier.simplify(
            Expression.add(Expression.bitVector(2, 32), Expression.bitVector(3, 32)));
    assertEquals(Expression.bitVector(5, 32), folded, "Constant sub-terms fold");

    Expression flag = Variable.bool("flag").toExpression();
    Expression choice = Expression.ite(Expression.bool(true), x, Expression.bitVector(0, 32));
    assertEquals(x, ExpressionSimplifier.simplify(choice), "ite with a constant condition");
    assertEquals(
        Expression.bool(false),
        ExpressionSimplifier.simplify(Expression.and(flag, Expression.bool(false))),
        "and with false is false");
    assertEquals(
        flag,
        ExpressionSimplifier.simplify(Expression.not(Expression.not(flag))),
        "Double negation cancels");

    Expression symbolic = Expression.add(x, Expression.bitVector(7, 32));
    assertEquals(
        symbolic.sort(),
        ExpressionSimplifier.simplify(symbolic).sort(),
        "Simplification preserves the sort");
  }

  @Test
  void substitutionReplacesVariables() throws SortMismatchException {
    Variable x = Variable.bitVector("x", 8);
    Expression term = Expression.add(x.toExpression(), x.toExpression());
    Expression replaced = term.substitute(Map.of(x, Expression.bitVector(3, 8)));
    assertTrue(replaced.variables().isEmpty(), "No free variables after substitution");
    assertEquals(
        Constant.bitVector(6, 8),
        ExpressionEvaluator.evaluate(replaced, Assignment.empty()).orElseThrow(),
        "3 + 3");
  }
}
