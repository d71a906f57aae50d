package leakcheck.ir;

import java.util.Objects;
import leakcheck.diagnostics.SortMismatchException;

/**
 * The type of a symbolic value: Boolean, fixed-width bit-vector, or memory.
 *
 * <p>Memory keeps its own tag everywhere except {@link #toString()}, which renders it as {@code
 * Bool} because memory is only ever reasoned about through Boolean assertions over its reads and
 * writes. Diagnostics use {@link #describe()} so the two never get confused there.
 */
public final class Sort {

  public enum Kind {
    BOOL,
    BIT_VECTOR,
    MEMORY
  }

  private static final Sort BOOL = new Sort(Kind.BOOL, 0);
  private static final Sort MEMORY = new Sort(Kind.MEMORY, 0);

  private final Kind kind;
  private final int width;

  private Sort(Kind kind, int width) {
    this.kind = kind;
    this.width = width;
  }

  public static Sort bool() {
    return BOOL;
  }

  public static Sort memory() {
    return MEMORY;
  }

  public static Sort bitVector(int width) {
    if (width <= 0) {
      throw new IllegalArgumentException("bit-vector width must be positive: " + width);
    }
    return new Sort(Kind.BIT_VECTOR, width);
  }

  public Kind kind() {
    return kind;
  }

  public boolean isBool() {
    return kind == Kind.BOOL;
  }

  public boolean isBitVector() {
    return kind == Kind.BIT_VECTOR;
  }

  public boolean isMemory() {
    return kind == Kind.MEMORY;
  }

  /** Width of a bit-vector sort. */
  public int width() {
    if (kind != Kind.BIT_VECTOR) {
      throw new IllegalStateException(describe() + " has no width");
    }
    return width;
  }

  public void expectBool() throws SortMismatchException {
    if (!isBool()) {
      throw new SortMismatchException("expected Bool but found " + describe());
    }
  }

  public void expectBitVector() throws SortMismatchException {
    if (!isBitVector()) {
      throw new SortMismatchException("expected a bit-vector but found " + describe());
    }
  }

  public void expectMemory() throws SortMismatchException {
    if (!isMemory()) {
      throw new SortMismatchException("expected Memory but found " + describe());
    }
  }

  public void expectSame(Sort other) throws SortMismatchException {
    if (!equals(other)) {
      throw new SortMismatchException(
          "expected " + other.describe() + " but found " + describe());
    }
  }

  /** Unambiguous rendering used in diagnostics. */
  public String describe() {
    return switch (kind) {
      case BOOL -> "Bool";
      case BIT_VECTOR -> "BitVec<" + width + ">";
      case MEMORY -> "Memory";
    };
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Sort other)) {
      return false;
    }
    return kind == other.kind && width == other.width;
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, width);
  }

  @Override
  public String toString() {
    return kind == Kind.MEMORY ? "Bool" : describe();
  }
}
