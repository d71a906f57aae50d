package leakcheck.solver.z3;

import com.microsoft.z3.ArraySort;
import com.microsoft.z3.BitVecNum;
import com.microsoft.z3.BitVecSort;
import com.microsoft.z3.BoolSort;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.Model;
import com.microsoft.z3.Sort;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import leakcheck.ir.Assignment;
import leakcheck.ir.Constant;
import leakcheck.ir.Expression;
import leakcheck.ir.Operator;
import leakcheck.ir.Variable;

/**
 * Builds Z3 terms for IR expressions inside one {@link Context}.
 *
 * <p>Memory is an array from {@code addressWidth}-bit addresses to bytes. Multi-byte loads and
 * stores become little-endian {@code select}/{@code store} chains, and addresses of another width
 * are zero-extended or truncated to the memory's.
 */
final class Z3Terms {
  private final Context context;
  private final int addressWidth;
  private final ArraySort<BitVecSort, BitVecSort> memorySort;
  private final Map<Variable, Expr<?>> constants = new LinkedHashMap<>();

  Z3Terms(Context context, int addressWidth) {
    this.context = context;
    this.addressWidth = addressWidth;
    this.memorySort =
        context.mkArraySort(context.mkBitVecSort(addressWidth), context.mkBitVecSort(8));
  }

  Expr<BoolSort> assertion(Expression expression) {
    return bool(translate(expression));
  }

  /** Values of every non-memory variable seen so far; unconstrained ones get the model default. */
  Assignment assignment(Model model) {
    Map<Variable, Constant> values = new LinkedHashMap<>();
    constants.forEach(
        (variable, constant) -> {
          if (variable.sort().isMemory()) {
            return;
          }
          Expr<?> value = model.eval(constant, true);
          if (variable.sort().isBool()) {
            values.put(variable, Constant.bool(value.isTrue()));
          } else if (value instanceof BitVecNum number) {
            values.put(
                variable, Constant.bitVector(number.getBigInteger(), variable.sort().width()));
          }
        });
    return Assignment.of(values);
  }

  private Expr<?> translate(Expression expression) {
    if (expression.isConstant()) {
      Constant constant = expression.constant();
      if (constant.isBool()) {
        return context.mkBool(constant.booleanValue());
      }
      return context.mkBV(constant.value().toString(), constant.width());
    }
    if (expression.isVariable()) {
      return constants.computeIfAbsent(expression.variable(), this::declare);
    }
    Operator operator = expression.operator();
    List<Expr<?>> operands = new ArrayList<>(expression.operands().size());
    for (Expression operand : expression.operands()) {
      operands.add(translate(operand));
    }
    Expr<?> a = operands.get(0);
    Expr<?> b = operands.size() > 1 ? operands.get(1) : null;
    return switch (operator.opcode()) {
      case ITE -> context.mkITE(bool(a), any(b), any(operands.get(2)));
      case EQUAL -> context.mkEq(any(a), any(b));
      case UNEQUAL -> context.mkDistinct(a, b);
      case NOT -> context.mkNot(bool(a));
      case AND -> context.mkAnd(bool(a), bool(b));
      case OR -> context.mkOr(bool(a), bool(b));
      case XOR -> context.mkXor(bool(a), bool(b));
      case IMPLY -> context.mkImplies(bool(a), bool(b));
      case BV_ADD -> context.mkBVAdd(bits(a), bits(b));
      case BV_SUB -> context.mkBVSub(bits(a), bits(b));
      case BV_MUL -> context.mkBVMul(bits(a), bits(b));
      case BV_UDIV -> context.mkBVUDiv(bits(a), bits(b));
      case BV_UREM -> context.mkBVURem(bits(a), bits(b));
      case BV_AND -> context.mkBVAND(bits(a), bits(b));
      case BV_OR -> context.mkBVOR(bits(a), bits(b));
      case BV_XOR -> context.mkBVXOR(bits(a), bits(b));
      case BV_NOT -> context.mkBVNot(bits(a));
      case BV_NEG -> context.mkBVNeg(bits(a));
      case BV_SHL -> context.mkBVSHL(bits(a), bits(b));
      case BV_LSHR -> context.mkBVLSHR(bits(a), bits(b));
      case BV_ASHR -> context.mkBVASHR(bits(a), bits(b));
      case BV_ULT -> context.mkBVULT(bits(a), bits(b));
      case BV_ULE -> context.mkBVULE(bits(a), bits(b));
      case BV_SLT -> context.mkBVSLT(bits(a), bits(b));
      case BV_SLE -> context.mkBVSLE(bits(a), bits(b));
      case CONCAT -> concat(operands);
      case EXTRACT -> context.mkExtract(operator.highestBit(), operator.lowestBit(), bits(a));
      case ZERO_EXTEND ->
          context.mkZeroExt(operator.width() - expression.operand(0).sort().width(), bits(a));
      case SIGN_EXTEND ->
          context.mkSignExt(operator.width() - expression.operand(0).sort().width(), bits(a));
      case TRUNCATE -> context.mkExtract(operator.width() - 1, 0, bits(a));
      case LOAD -> load(operator.width() / 8, memory(a), address(b, expression.operand(1)));
      case STORE ->
          store(
              memory(a),
              address(b, expression.operand(1)),
              bits(operands.get(2)),
              expression.operand(2).sort().width() / 8);
    };
  }

  private Expr<?> declare(Variable variable) {
    return switch (variable.sort().kind()) {
      case BOOL -> context.mkBoolConst(variable.name());
      case BIT_VECTOR -> context.mkBVConst(variable.name(), variable.sort().width());
      case MEMORY -> context.mkConst(variable.name(), memorySort);
    };
  }

  private Expr<BitVecSort> concat(List<Expr<?>> operands) {
    Expr<BitVecSort> result = bits(operands.get(0));
    for (int i = 1; i < operands.size(); i++) {
      result = context.mkConcat(result, bits(operands.get(i)));
    }
    return result;
  }

  private Expr<BitVecSort> address(Expr<?> term, Expression address) {
    int width = address.sort().width();
    if (width < addressWidth) {
      return context.mkZeroExt(addressWidth - width, bits(term));
    }
    if (width > addressWidth) {
      return context.mkExtract(addressWidth - 1, 0, bits(term));
    }
    return bits(term);
  }

  private Expr<BitVecSort> byteAddress(Expr<BitVecSort> base, int offset) {
    if (offset == 0) {
      return base;
    }
    return context.mkBVAdd(base, context.mkBV(offset, addressWidth));
  }

  private Expr<BitVecSort> load(
      int bytes, Expr<ArraySort<BitVecSort, BitVecSort>> memory, Expr<BitVecSort> address) {
    Expr<BitVecSort> result = context.mkSelect(memory, byteAddress(address, bytes - 1));
    for (int i = bytes - 2; i >= 0; i--) {
      result = context.mkConcat(result, context.mkSelect(memory, byteAddress(address, i)));
    }
    return result;
  }

  private Expr<ArraySort<BitVecSort, BitVecSort>> store(
      Expr<ArraySort<BitVecSort, BitVecSort>> memory,
      Expr<BitVecSort> address,
      Expr<BitVecSort> value,
      int bytes) {
    Expr<ArraySort<BitVecSort, BitVecSort>> result = memory;
    for (int i = 0; i < bytes; i++) {
      result =
          context.mkStore(
              result, byteAddress(address, i), context.mkExtract(8 * i + 7, 8 * i, value));
    }
    return result;
  }

  @SuppressWarnings("unchecked")
  private static Expr<BoolSort> bool(Expr<?> term) {
    return (Expr<BoolSort>) term;
  }

  @SuppressWarnings("unchecked")
  private static Expr<BitVecSort> bits(Expr<?> term) {
    return (Expr<BitVecSort>) term;
  }

  @SuppressWarnings("unchecked")
  private static Expr<ArraySort<BitVecSort, BitVecSort>> memory(Expr<?> term) {
    return (Expr<ArraySort<BitVecSort, BitVecSort>>) term;
  }

  @SuppressWarnings("unchecked")
  private static Expr<Sort> any(Expr<?> term) {
    return (Expr<Sort>) term;
  }
}
