package leakcheck.ir;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import leakcheck.diagnostics.SortMismatchException;

/**
 * Evaluates expressions to constants with two's-complement bit-vector semantics.
 *
 * <p>Division by zero follows SMT-LIB: {@code bvudiv} yields all ones and {@code bvurem} yields the
 * dividend. Memory-sorted terms and unassigned variables have no value.
 */
public final class ExpressionEvaluator {

  private ExpressionEvaluator() {}

  public static Optional<Constant> evaluate(Expression expression, Assignment assignment) {
    return evaluate(expression, assignment::get);
  }

  /** Evaluates with variable values supplied by {@code lookup}. */
  public static Optional<Constant> evaluate(
      Expression expression, Function<Variable, Optional<Constant>> lookup) {
    if (expression.isConstant()) {
      return Optional.of(expression.constant());
    }
    if (expression.isVariable()) {
      return lookup.apply(expression.variable());
    }
    if (expression.sort().isMemory()) {
      return Optional.empty();
    }
    Operator operator = expression.operator();
    if (operator.opcode() == Operator.Opcode.LOAD) {
      return Optional.empty();
    }
    if (operator.opcode() == Operator.Opcode.ITE) {
      Optional<Constant> condition = evaluate(expression.operand(0), lookup);
      if (condition.isEmpty()) {
        return Optional.empty();
      }
      return evaluate(expression.operand(condition.get().booleanValue() ? 1 : 2), lookup);
    }
    List<Constant> values = new ArrayList<>(expression.operands().size());
    for (Expression operand : expression.operands()) {
      Optional<Constant> value = evaluate(operand, lookup);
      if (value.isEmpty()) {
        return Optional.empty();
      }
      values.add(value.get());
    }
    return Optional.of(fold(operator, values));
  }

  /** True when the term evaluates to {@code true}; unknown values count as false. */
  public static boolean holds(Expression expression, Assignment assignment) {
    return evaluate(expression, assignment).map(Constant::booleanValue).orElse(false);
  }

  /**
   * Applies {@code operator} to constant operands.
   *
   * @throws IllegalArgumentException when the operands do not fit the operator's signature or the
   *     operator has no constant semantics (memory operators)
   */
  public static Constant fold(Operator operator, List<Constant> operands) {
    List<Sort> sorts = new ArrayList<>(operands.size());
    for (Constant operand : operands) {
      sorts.add(operand.sort());
    }
    try {
      operator.checkOperands(sorts);
    } catch (SortMismatchException ex) {
      throw new IllegalArgumentException(ex.getMessage(), ex);
    }
    Constant a = operands.get(0);
    Constant b = operands.size() > 1 ? operands.get(1) : null;
    return switch (operator.opcode()) {
      case ITE -> a.booleanValue() ? b : operands.get(2);
      case EQUAL -> Constant.bool(a.equals(b));
      case UNEQUAL -> Constant.bool(!a.equals(b));
      case NOT -> Constant.bool(!a.booleanValue());
      case AND -> Constant.bool(a.booleanValue() && b.booleanValue());
      case OR -> Constant.bool(a.booleanValue() || b.booleanValue());
      case XOR -> Constant.bool(a.booleanValue() ^ b.booleanValue());
      case IMPLY -> Constant.bool(!a.booleanValue() || b.booleanValue());
      case BV_ADD -> wrap(a.value().add(b.value()), a);
      case BV_SUB -> wrap(a.value().subtract(b.value()), a);
      case BV_MUL -> wrap(a.value().multiply(b.value()), a);
      case BV_UDIV ->
          b.isZero() ? wrap(Constant.mask(a.width()), a) : wrap(a.value().divide(b.value()), a);
      case BV_UREM -> b.isZero() ? a : wrap(a.value().mod(b.value()), a);
      case BV_AND -> wrap(a.value().and(b.value()), a);
      case BV_OR -> wrap(a.value().or(b.value()), a);
      case BV_XOR -> wrap(a.value().xor(b.value()), a);
      case BV_NOT -> wrap(a.value().xor(Constant.mask(a.width())), a);
      case BV_NEG -> wrap(a.value().negate(), a);
      case BV_SHL -> wrap(a.value().shiftLeft(shiftAmount(b, a.width())), a);
      case BV_LSHR -> wrap(a.value().shiftRight(shiftAmount(b, a.width())), a);
      case BV_ASHR -> wrap(a.signedValue().shiftRight(shiftAmount(b, a.width())), a);
      case BV_ULT -> Constant.bool(a.value().compareTo(b.value()) < 0);
      case BV_ULE -> Constant.bool(a.value().compareTo(b.value()) <= 0);
      case BV_SLT -> Constant.bool(a.signedValue().compareTo(b.signedValue()) < 0);
      case BV_SLE -> Constant.bool(a.signedValue().compareTo(b.signedValue()) <= 0);
      case CONCAT -> concat(operands);
      case EXTRACT ->
          Constant.truncating(
              a.value().shiftRight(operator.lowestBit()),
              operator.highestBit() - operator.lowestBit() + 1);
      case ZERO_EXTEND -> a.zeroExtend(operator.width());
      case SIGN_EXTEND -> a.signExtend(operator.width());
      case TRUNCATE -> a.truncate(operator.width());
      case LOAD, STORE ->
          throw new IllegalArgumentException("`" + operator + "` has no constant semantics");
    };
  }

  private static Constant wrap(BigInteger value, Constant like) {
    return Constant.truncating(value, like.width());
  }

  // Shifting by the width or more clears every bit, so the amount is capped there.
  private static int shiftAmount(Constant amount, int width) {
    if (amount.value().compareTo(BigInteger.valueOf(width)) >= 0) {
      return width;
    }
    return amount.value().intValue();
  }

  private static Constant concat(List<Constant> operands) {
    BigInteger value = BigInteger.ZERO;
    int width = 0;
    for (Constant operand : operands) {
      value = value.shiftLeft(operand.width()).or(operand.value());
      width += operand.width();
    }
    return Constant.bitVector(value, width);
  }
}
