package leakcheck.ir;

import java.util.ArrayList;
import java.util.List;
import leakcheck.ir.Operator.Opcode;

/**
 * Bottom-up rewriting of well-typed expressions: folds constant sub-terms and removes neutral
 * operands. The result always has the sort of the input.
 */
public final class ExpressionSimplifier {

  private ExpressionSimplifier() {}

  public static Expression simplify(Expression expression) {
    if (!expression.isApplication()) {
      return expression;
    }
    List<Expression> operands = new ArrayList<>(expression.operands().size());
    boolean changed = false;
    boolean allConstant = true;
    for (Expression operand : expression.operands()) {
      Expression simplified = simplify(operand);
      changed |= simplified != operand;
      allConstant &= simplified.isConstant();
      operands.add(simplified);
    }
    Operator operator = expression.operator();
    Opcode opcode = operator.opcode();
    if (allConstant && opcode != Opcode.LOAD && opcode != Opcode.STORE) {
      List<Constant> values = new ArrayList<>(operands.size());
      for (Expression operand : operands) {
        values.add(operand.constant());
      }
      return Expression.constant(ExpressionEvaluator.fold(operator, values));
    }
    Expression rewritten = rewrite(opcode, operands);
    if (rewritten != null) {
      return rewritten;
    }
    return changed ? Expression.apply(operator, operands) : expression;
  }

  /** Identity rewrites; {@code null} when none applies. */
  private static Expression rewrite(Opcode opcode, List<Expression> operands) {
    Expression a = operands.get(0);
    Expression b = operands.size() > 1 ? operands.get(1) : null;
    switch (opcode) {
      case ITE -> {
        if (a.isConstant()) {
          return a.constant().booleanValue() ? b : operands.get(2);
        }
        if (b.equals(operands.get(2))) {
          return b;
        }
      }
      case NOT -> {
        if (a.hasOpcode(Opcode.NOT)) {
          return a.operand(0);
        }
      }
      case AND -> {
        if (isBool(a, false) || isBool(b, false)) {
          return Expression.bool(false);
        }
        if (isBool(a, true) || a.equals(b)) {
          return b;
        }
        if (isBool(b, true)) {
          return a;
        }
      }
      case OR -> {
        if (isBool(a, true) || isBool(b, true)) {
          return Expression.bool(true);
        }
        if (isBool(a, false) || a.equals(b)) {
          return b;
        }
        if (isBool(b, false)) {
          return a;
        }
      }
      case XOR -> {
        if (isBool(a, false)) {
          return b;
        }
        if (isBool(b, false)) {
          return a;
        }
        if (a.equals(b)) {
          return Expression.bool(false);
        }
      }
      case IMPLY -> {
        if (isBool(a, false) || isBool(b, true) || a.equals(b)) {
          return Expression.bool(true);
        }
        if (isBool(a, true)) {
          return b;
        }
      }
      case EQUAL -> {
        if (a.equals(b)) {
          return Expression.bool(true);
        }
      }
      case UNEQUAL -> {
        if (a.equals(b)) {
          return Expression.bool(false);
        }
      }
      case BV_ADD, BV_OR, BV_XOR -> {
        if (isZero(a)) {
          return b;
        }
        if (isZero(b)) {
          return a;
        }
      }
      case BV_SUB, BV_SHL, BV_LSHR, BV_ASHR -> {
        if (isZero(b)) {
          return a;
        }
      }
      case BV_MUL -> {
        if (isZero(a) || isZero(b)) {
          return Expression.constant(Constant.zero(a.sort().width()));
        }
        if (isOne(a)) {
          return b;
        }
        if (isOne(b)) {
          return a;
        }
      }
      case BV_AND -> {
        if (isZero(a) || isZero(b)) {
          return Expression.constant(Constant.zero(a.sort().width()));
        }
      }
      default -> {
        return null;
      }
    }
    return null;
  }

  private static boolean isBool(Expression expression, boolean value) {
    return expression.isConstant()
        && expression.constant().isBool()
        && expression.constant().booleanValue() == value;
  }

  private static boolean isZero(Expression expression) {
    return expression.isConstant() && expression.constant().isZero();
  }

  private static boolean isOne(Expression expression) {
    return expression.isConstant() && expression.constant().isOne();
  }
}
