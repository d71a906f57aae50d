package leakcheck.ir;

import java.math.BigInteger;
import java.util.Locale;
import java.util.Objects;

/**
 * A literal Boolean or bit-vector value.
 *
 * <p>A bit-vector constant always satisfies {@code 0 <= value < 2^width}; Boolean constants store
 * {@code 0} or {@code 1}. Out-of-range values are rejected when the constant is built, since they
 * indicate a bug in whatever produced them.
 */
public record Constant(BigInteger value, Sort sort) {

  public static final Constant TRUE = new Constant(BigInteger.ONE, Sort.bool());
  public static final Constant FALSE = new Constant(BigInteger.ZERO, Sort.bool());

  public Constant {
    Objects.requireNonNull(value, "value");
    Objects.requireNonNull(sort, "sort");
    if (sort.isMemory()) {
      throw new IllegalArgumentException("memory has no literal constants");
    }
    if (value.signum() < 0) {
      throw new IllegalArgumentException("constant value must be non-negative: " + value);
    }
    if (sort.isBool() && value.compareTo(BigInteger.ONE) > 0) {
      throw new IllegalArgumentException("Boolean constant must be 0 or 1: " + value);
    }
    if (sort.isBitVector() && value.bitLength() > sort.width()) {
      throw new IllegalArgumentException(
          "value 0x"
              + value.toString(16).toUpperCase(Locale.ROOT)
              + " does not fit in "
              + sort.describe());
    }
  }

  public static Constant bool(boolean value) {
    return value ? TRUE : FALSE;
  }

  public static Constant bitVector(long value, int width) {
    if (value < 0) {
      throw new IllegalArgumentException("constant value must be non-negative: " + value);
    }
    return new Constant(BigInteger.valueOf(value), Sort.bitVector(width));
  }

  public static Constant bitVector(BigInteger value, int width) {
    return new Constant(value, Sort.bitVector(width));
  }

  /** Builds a bit-vector constant from the low {@code width} bits of {@code value}. */
  public static Constant truncating(BigInteger value, int width) {
    return new Constant(value.and(mask(width)), Sort.bitVector(width));
  }

  public static Constant truncating(long value, int width) {
    return truncating(BigInteger.valueOf(value), width);
  }

  public static Constant zero(int width) {
    return new Constant(BigInteger.ZERO, Sort.bitVector(width));
  }

  static BigInteger mask(int width) {
    return BigInteger.ONE.shiftLeft(width).subtract(BigInteger.ONE);
  }

  public boolean isBool() {
    return sort.isBool();
  }

  public boolean isBitVector() {
    return sort.isBitVector();
  }

  public int width() {
    return sort.width();
  }

  public boolean booleanValue() {
    if (!isBool()) {
      throw new IllegalStateException(this + " is not a Boolean constant");
    }
    return value.signum() != 0;
  }

  /** Unsigned value as a {@code long}; fails for values wider than 63 bits. */
  public long longValue() {
    if (value.bitLength() > 63) {
      throw new ArithmeticException(this + " does not fit in a long");
    }
    return value.longValue();
  }

  /** Two's-complement interpretation of a bit-vector constant. */
  public BigInteger signedValue() {
    int width = width();
    if (value.testBit(width - 1)) {
      return value.subtract(BigInteger.ONE.shiftLeft(width));
    }
    return value;
  }

  public boolean isZero() {
    return value.signum() == 0;
  }

  public boolean isOne() {
    return value.equals(BigInteger.ONE);
  }

  public Constant zeroExtend(int width) {
    if (width <= width()) {
      throw new IllegalArgumentException("cannot zero-extend " + this + " to " + width + " bits");
    }
    return new Constant(value, Sort.bitVector(width));
  }

  public Constant signExtend(int width) {
    if (width <= width()) {
      throw new IllegalArgumentException("cannot sign-extend " + this + " to " + width + " bits");
    }
    return truncating(signedValue(), width);
  }

  public Constant truncate(int width) {
    if (width >= width()) {
      throw new IllegalArgumentException("cannot truncate " + this + " to " + width + " bits");
    }
    return truncating(value, width);
  }

  public Expression toExpression() {
    return Expression.constant(this);
  }

  @Override
  public String toString() {
    if (isBool()) {
      return "$" + booleanValue() + ":" + sort;
    }
    return "0x" + value.toString(16).toUpperCase(Locale.ROOT) + ":" + sort;
  }
}
