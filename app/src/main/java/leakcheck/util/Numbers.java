package leakcheck.util;

import java.util.function.BinaryOperator;

/** Small numeric helpers. */
public final class Numbers {
  private Numbers() {}

  /** {@code |a - b|} for any ordered type with a subtraction that is valid when {@code a >= b}. */
  public static <T extends Comparable<? super T>> T absoluteDifference(
      T a, T b, BinaryOperator<T> subtract) {
    return a.compareTo(b) >= 0 ? subtract.apply(a, b) : subtract.apply(b, a);
  }

  /** {@code |a - b|} for non-negative operands such as addresses. */
  public static long absoluteDifference(long a, long b) {
    return a >= b ? a - b : b - a;
  }
}
