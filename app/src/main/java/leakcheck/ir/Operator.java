package leakcheck.ir;

import java.util.List;
import java.util.Objects;
import leakcheck.diagnostics.SortMismatchException;

/**
 * An operator of the expression language together with its static parameters.
 *
 * <p>Each operator knows its result sort (a total function of the operand sorts, so {@link
 * Expression#sort()} is defined even for ill-typed terms) and its operand signature, which {@link
 * #checkOperands} enforces.
 */
public final class Operator {

  public enum Opcode {
    ITE("ite", 3),
    EQUAL("=", 2),
    UNEQUAL("!=", 2),
    NOT("not", 1),
    AND("and", 2),
    OR("or", 2),
    XOR("xor", 2),
    IMPLY("=>", 2),
    BV_ADD("bvadd", 2),
    BV_SUB("bvsub", 2),
    BV_MUL("bvmul", 2),
    BV_UDIV("bvudiv", 2),
    BV_UREM("bvurem", 2),
    BV_AND("bvand", 2),
    BV_OR("bvor", 2),
    BV_XOR("bvxor", 2),
    BV_NOT("bvnot", 1),
    BV_NEG("bvneg", 1),
    BV_SHL("bvshl", 2),
    BV_LSHR("bvlshr", 2),
    BV_ASHR("bvashr", 2),
    BV_ULT("bvult", 2),
    BV_ULE("bvule", 2),
    BV_SLT("bvslt", 2),
    BV_SLE("bvsle", 2),
    CONCAT("concat", -1),
    EXTRACT("extract", 1),
    ZERO_EXTEND("zext", 1),
    SIGN_EXTEND("sext", 1),
    TRUNCATE("trunc", 1),
    LOAD("load", 2),
    STORE("store", 3);

    private final String symbol;
    private final int arity;

    Opcode(String symbol, int arity) {
      this.symbol = symbol;
      this.arity = arity;
    }

    public String symbol() {
      return symbol;
    }

    /** Number of operands, or {@code -1} for variadic operators. */
    public int arity() {
      return arity;
    }

    boolean isBooleanConnective() {
      return this == NOT || this == AND || this == OR || this == XOR || this == IMPLY;
    }

    boolean isBitVectorArithmetic() {
      return switch (this) {
        case BV_ADD, BV_SUB, BV_MUL, BV_UDIV, BV_UREM, BV_AND, BV_OR, BV_XOR, BV_NOT, BV_NEG,
            BV_SHL, BV_LSHR, BV_ASHR -> true;
        default -> false;
      };
    }

    boolean isBitVectorComparison() {
      return this == BV_ULT || this == BV_ULE || this == BV_SLT || this == BV_SLE;
    }
  }

  private final Opcode opcode;
  private final int first;
  private final int second;

  private Operator(Opcode opcode, int first, int second) {
    this.opcode = Objects.requireNonNull(opcode, "opcode");
    this.first = first;
    this.second = second;
  }

  /** Operator without static parameters. */
  public static Operator of(Opcode opcode) {
    boolean parameterized =
        switch (opcode) {
          case EXTRACT, ZERO_EXTEND, SIGN_EXTEND, TRUNCATE, LOAD -> true;
          default -> false;
        };
    if (parameterized) {
      throw new IllegalArgumentException(opcode + " takes static parameters");
    }
    return new Operator(opcode, 0, 0);
  }

  public static Operator extract(int highestBit, int lowestBit) {
    if (lowestBit < 0 || highestBit < lowestBit) {
      throw new IllegalArgumentException(
          "invalid extract range [" + highestBit + ":" + lowestBit + "]");
    }
    return new Operator(Opcode.EXTRACT, highestBit, lowestBit);
  }

  /** Zero-extends to {@code width} bits. */
  public static Operator zeroExtend(int width) {
    return new Operator(Opcode.ZERO_EXTEND, positive(width), 0);
  }

  /** Sign-extends to {@code width} bits. */
  public static Operator signExtend(int width) {
    return new Operator(Opcode.SIGN_EXTEND, positive(width), 0);
  }

  /** Keeps the low {@code width} bits. */
  public static Operator truncate(int width) {
    return new Operator(Opcode.TRUNCATE, positive(width), 0);
  }

  /** Reads {@code width} bits (a whole number of bytes) from memory. */
  public static Operator load(int width) {
    return new Operator(Opcode.LOAD, positive(width), 0);
  }

  private static int positive(int width) {
    if (width <= 0) {
      throw new IllegalArgumentException("width must be positive: " + width);
    }
    return width;
  }

  public Opcode opcode() {
    return opcode;
  }

  /** Target width of extend/truncate/load, or the highest bit of an extract. */
  public int width() {
    return first;
  }

  public int highestBit() {
    return first;
  }

  public int lowestBit() {
    return second;
  }

  /** Result sort for the given operand sorts; defined for every input. */
  public Sort resultSort(List<Sort> operands) {
    return switch (opcode) {
      case ITE -> operands.size() > 1 ? operands.get(1) : Sort.bool();
      case EQUAL, UNEQUAL, NOT, AND, OR, XOR, IMPLY, BV_ULT, BV_ULE, BV_SLT, BV_SLE -> Sort.bool();
      case CONCAT -> concatSort(operands);
      case EXTRACT -> Sort.bitVector(first - second + 1);
      case ZERO_EXTEND, SIGN_EXTEND, TRUNCATE, LOAD -> Sort.bitVector(first);
      case STORE -> Sort.memory();
      default -> operands.isEmpty() ? Sort.bool() : operands.get(0);
    };
  }

  private static Sort concatSort(List<Sort> operands) {
    int width = 0;
    for (Sort sort : operands) {
      if (!sort.isBitVector()) {
        return operands.get(0);
      }
      width += sort.width();
    }
    return width == 0 ? Sort.bool() : Sort.bitVector(width);
  }

  /** Checks the operand sorts against this operator's signature. */
  public void checkOperands(List<Sort> operands) throws SortMismatchException {
    int arity = opcode.arity();
    if (arity >= 0 && operands.size() != arity) {
      throw new SortMismatchException(
          "`" + this + "` expects " + arity + " operand(s) but got " + operands.size());
    }
    if (opcode.isBooleanConnective()) {
      for (int i = 0; i < operands.size(); i++) {
        expect(operands.get(i).isBool(), i, "Bool", operands.get(i));
      }
      return;
    }
    if (opcode.isBitVectorArithmetic() || opcode.isBitVectorComparison()) {
      Sort head = operands.get(0);
      expect(head.isBitVector(), 0, "a bit-vector", head);
      for (int i = 1; i < operands.size(); i++) {
        expect(operands.get(i).equals(head), i, head.describe(), operands.get(i));
      }
      return;
    }
    switch (opcode) {
      case ITE -> {
        expect(operands.get(0).isBool(), 0, "Bool", operands.get(0));
        Sort then = operands.get(1);
        expect(operands.get(2).equals(then), 2, then.describe(), operands.get(2));
      }
      case EQUAL, UNEQUAL ->
          expect(
              operands.get(1).equals(operands.get(0)),
              1,
              operands.get(0).describe(),
              operands.get(1));
      case CONCAT -> {
        if (operands.size() < 2) {
          throw new SortMismatchException("`concat` expects at least two operands");
        }
        for (int i = 0; i < operands.size(); i++) {
          expect(operands.get(i).isBitVector(), i, "a bit-vector", operands.get(i));
        }
      }
      case EXTRACT -> {
        Sort operand = operands.get(0);
        expect(operand.isBitVector(), 0, "a bit-vector", operand);
        expect(first < operand.width(), 0, "at least " + (first + 1) + " bits", operand);
      }
      case ZERO_EXTEND, SIGN_EXTEND -> {
        Sort operand = operands.get(0);
        expect(operand.isBitVector(), 0, "a bit-vector", operand);
        expect(operand.width() < first, 0, "fewer than " + first + " bits", operand);
      }
      case TRUNCATE -> {
        Sort operand = operands.get(0);
        expect(operand.isBitVector(), 0, "a bit-vector", operand);
        expect(operand.width() > first, 0, "more than " + first + " bits", operand);
      }
      case LOAD -> {
        if (first % 8 != 0) {
          throw new SortMismatchException("`" + this + "` must read whole bytes");
        }
        expect(operands.get(0).isMemory(), 0, "Memory", operands.get(0));
        expect(operands.get(1).isBitVector(), 1, "a bit-vector address", operands.get(1));
      }
      case STORE -> {
        expect(operands.get(0).isMemory(), 0, "Memory", operands.get(0));
        expect(operands.get(1).isBitVector(), 1, "a bit-vector address", operands.get(1));
        Sort value = operands.get(2);
        expect(value.isBitVector() && value.width() % 8 == 0, 2, "whole-byte bit-vector", value);
      }
      default -> throw new IllegalStateException("unhandled operator " + opcode);
    }
  }

  private void expect(boolean condition, int index, String expected, Sort actual)
      throws SortMismatchException {
    if (!condition) {
      throw new SortMismatchException(
          "operand "
              + index
              + " of `"
              + this
              + "` must be "
              + expected
              + " but is "
              + actual.describe());
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Operator other)) {
      return false;
    }
    return opcode == other.opcode && first == other.first && second == other.second;
  }

  @Override
  public int hashCode() {
    return Objects.hash(opcode, first, second);
  }

  @Override
  public String toString() {
    return switch (opcode) {
      case EXTRACT -> "extract[" + first + ":" + second + "]";
      case ZERO_EXTEND, SIGN_EXTEND, TRUNCATE, LOAD -> opcode.symbol() + "[" + first + "]";
      default -> opcode.symbol();
    };
  }
}
