package leakcheck.uarch;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import leakcheck.diagnostics.SortMismatchException;
import leakcheck.ir.Expression;
import leakcheck.ir.ExpressionSimplifier;
import leakcheck.ir.Sort;
import leakcheck.ir.Variable;

/**
 * Byte-addressed symbolic memory with little-endian multi-byte accesses.
 *
 * <p>Writes to concrete addresses live in a sorted map; writes to symbolic addresses are kept in
 * program order. A read resolves each byte to the newest matching write, wrapping it in {@code
 * ite} terms for every newer write that may alias. Bytes never written come from the configured
 * default byte or, without one, are inputs: a variable named after the address for concrete
 * addresses and a {@code load} of the initial memory variable for symbolic ones.
 */
public final class Memory {
  public static final Variable INITIAL = new Variable("_memory", Sort.memory());

  /** Name prefix of the input variables standing for initial bytes at concrete addresses. */
  public static final String BYTE_PREFIX = "mem_";

  private record ByteWrite(long sequence, Expression address, Expression value) {}

  private final int addressWidth;
  private final Optional<Integer> defaultByte;
  private final TreeMap<Long, ByteWrite> concrete = new TreeMap<>();
  private final List<ByteWrite> symbolic = new ArrayList<>();
  private long sequence;

  public Memory(int addressWidth, Optional<Integer> defaultByte) {
    if (addressWidth < 1 || addressWidth > 64) {
      throw new IllegalArgumentException("address width must be in [1, 64]: " + addressWidth);
    }
    defaultByte.ifPresent(
        value -> {
          if (value < 0 || value > 0xFF) {
            throw new IllegalArgumentException("default byte out of range: " + value);
          }
        });
    this.addressWidth = addressWidth;
    this.defaultByte = defaultByte;
  }

  public int addressWidth() {
    return addressWidth;
  }

  /** Stores a whole-byte bit-vector at {@code address}, least significant byte first. */
  public void store(Expression address, Expression value) throws SortMismatchException {
    value.sort().expectBitVector();
    if (value.sort().width() % 8 != 0) {
      throw new SortMismatchException(
          "stored value " + value + " must be a whole number of bytes");
    }
    Expression base = normalizeAddress(address);
    for (int i = 0; i < value.sort().width() / 8; i++) {
      Expression byteAddress = offset(base, i);
      Expression byteValue =
          ExpressionSimplifier.simplify(Expression.extract(8 * i + 7, 8 * i, value));
      ByteWrite write = new ByteWrite(sequence++, byteAddress, byteValue);
      if (byteAddress.isConstant()) {
        concrete.put(byteAddress.constant().value().longValue(), write);
      } else {
        symbolic.add(write);
      }
    }
  }

  /** Reads {@code width} bits (a whole number of bytes) starting at {@code address}. */
  public Expression load(Expression address, int width) throws SortMismatchException {
    if (width <= 0 || width % 8 != 0) {
      throw new IllegalArgumentException("load width must be a positive multiple of 8: " + width);
    }
    Expression base = normalizeAddress(address);
    List<Expression> bytes = new ArrayList<>(width / 8);
    for (int i = width / 8 - 1; i >= 0; i--) {
      bytes.add(loadByte(offset(base, i)));
    }
    Expression result = bytes.size() == 1 ? bytes.get(0) : Expression.concat(bytes);
    return ExpressionSimplifier.simplify(result);
  }

  private Expression loadByte(Expression address) throws SortMismatchException {
    List<ByteWrite> candidates = new ArrayList<>();
    long newerThan = -1;
    Expression result;
    if (address.isConstant()) {
      ByteWrite exact = concrete.get(address.constant().value().longValue());
      result = exact == null ? initialByte(address) : exact.value();
      newerThan = exact == null ? -1 : exact.sequence();
    } else {
      result = initialByte(address);
      candidates.addAll(concrete.values());
    }
    for (ByteWrite write : symbolic) {
      if (write.sequence() > newerThan) {
        candidates.add(write);
      }
    }
    candidates.sort((a, b) -> Long.compare(a.sequence(), b.sequence()));
    for (ByteWrite write : candidates) {
      Expression aliases =
          ExpressionSimplifier.simplify(Expression.equal(address, write.address()));
      result = ExpressionSimplifier.simplify(Expression.ite(aliases, write.value(), result));
    }
    return result;
  }

  private Expression initialByte(Expression address) throws SortMismatchException {
    if (defaultByte.isPresent()) {
      return Expression.bitVector(defaultByte.get(), 8);
    }
    if (address.isConstant()) {
      return byteVariable(address.constant().value().longValue()).toExpression();
    }
    return Expression.load(8, INITIAL.toExpression(), address);
  }

  public static Variable byteVariable(long address) {
    return Variable.bitVector(
        BYTE_PREFIX + "0x" + Long.toHexString(address).toUpperCase(Locale.ROOT), 8);
  }

  private Expression normalizeAddress(Expression address) throws SortMismatchException {
    address.sort().expectBitVector();
    return ExpressionSimplifier.simplify(Expression.resize(addressWidth, address));
  }

  private Expression offset(Expression base, int bytes) throws SortMismatchException {
    if (bytes == 0) {
      return base;
    }
    return ExpressionSimplifier.simplify(
        Expression.add(base, Expression.bitVector(bytes, addressWidth)));
  }

  /** Concretely addressed bytes in address order. */
  public Map<Long, Expression> concreteBytes() {
    Map<Long, Expression> result = new TreeMap<>();
    concrete.forEach((address, write) -> result.put(address, write.value()));
    return result;
  }

  public Memory copy() {
    Memory copy = new Memory(addressWidth, defaultByte);
    copy.concrete.putAll(concrete);
    copy.symbolic.addAll(symbolic);
    copy.sequence = sequence;
    return copy;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Memory other)) {
      return false;
    }
    return addressWidth == other.addressWidth
        && defaultByte.equals(other.defaultByte)
        && concreteBytes().equals(other.concreteBytes())
        && symbolicWrites().equals(other.symbolicWrites());
  }

  private List<List<Expression>> symbolicWrites() {
    List<List<Expression>> writes = new ArrayList<>(symbolic.size());
    for (ByteWrite write : symbolic) {
      writes.add(List.of(write.address(), write.value()));
    }
    return writes;
  }

  @Override
  public int hashCode() {
    return Objects.hash(addressWidth, defaultByte, concreteBytes(), symbolicWrites());
  }

  @Override
  public String toString() {
    return "memory{concrete=" + concreteBytes() + ", symbolic=" + symbolicWrites() + "}";
  }
}
