package leakcheck.program;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.UnaryOperator;
import leakcheck.diagnostics.SortMismatchException;
import leakcheck.ir.Expression;
import leakcheck.ir.Sort;
import leakcheck.ir.Variable;
import leakcheck.pass.Validate;

/** A single statement of a block. */
public final class Operation implements Validate {

  public enum Kind {
    LET,
    ASSUME,
    ASSERT,
    LOAD,
    STORE,
    BARRIER,
    FLUSH
  }

  private static final Operation BARRIER = new Operation(Kind.BARRIER, null, null, null);
  private static final Operation FLUSH = new Operation(Kind.FLUSH, null, null, null);

  private final Kind kind;
  private final Variable target;
  private final Expression first;
  private final Expression second;

  private Operation(Kind kind, Variable target, Expression first, Expression second) {
    this.kind = kind;
    this.target = target;
    this.first = first;
    this.second = second;
  }

  /** {@code let target = value}. */
  public static Operation let(Variable target, Expression value) throws SortMismatchException {
    Operation operation =
        new Operation(
            Kind.LET,
            Objects.requireNonNull(target, "target"),
            Objects.requireNonNull(value, "value"),
            null);
    operation.checkSignature();
    return operation;
  }

  public static Operation assume(Expression condition) throws SortMismatchException {
    Operation operation =
        new Operation(Kind.ASSUME, null, Objects.requireNonNull(condition, "condition"), null);
    operation.checkSignature();
    return operation;
  }

  public static Operation assertion(Expression condition) throws SortMismatchException {
    Operation operation =
        new Operation(Kind.ASSERT, null, Objects.requireNonNull(condition, "condition"), null);
    operation.checkSignature();
    return operation;
  }

  /** {@code load target <- [address]}; reads {@code target}'s width from memory. */
  public static Operation load(Variable target, Expression address) throws SortMismatchException {
    Operation operation =
        new Operation(
            Kind.LOAD,
            Objects.requireNonNull(target, "target"),
            Objects.requireNonNull(address, "address"),
            null);
    operation.checkSignature();
    return operation;
  }

  /** {@code store [address] <- value}. */
  public static Operation store(Expression address, Expression value)
      throws SortMismatchException {
    Operation operation =
        new Operation(
            Kind.STORE,
            null,
            Objects.requireNonNull(address, "address"),
            Objects.requireNonNull(value, "value"));
    operation.checkSignature();
    return operation;
  }

  public static Operation barrier() {
    return BARRIER;
  }

  public static Operation flush() {
    return FLUSH;
  }

  private void checkSignature() throws SortMismatchException {
    switch (kind) {
      case LET -> {
        if (!first.sort().equals(target.sort())) {
          throw new SortMismatchException(
              "`"
                  + this
                  + "` assigns "
                  + first.sort().describe()
                  + " to a variable of sort "
                  + target.sort().describe());
        }
      }
      case ASSUME, ASSERT -> expect(first.sort().isBool(), "condition", "Bool", first.sort());
      case LOAD -> {
        expect(first.sort().isBitVector(), "address", "a bit-vector", first.sort());
        expect(wholeBytes(target.sort()), "target", "a whole-byte bit-vector", target.sort());
      }
      case STORE -> {
        expect(first.sort().isBitVector(), "address", "a bit-vector", first.sort());
        expect(wholeBytes(second.sort()), "value", "a whole-byte bit-vector", second.sort());
      }
      case BARRIER, FLUSH -> {}
    }
  }

  private static boolean wholeBytes(Sort sort) {
    return sort.isBitVector() && sort.width() % 8 == 0;
  }

  private void expect(boolean condition, String role, String expected, Sort actual)
      throws SortMismatchException {
    if (!condition) {
      throw new SortMismatchException(
          role + " of `" + this + "` must be " + expected + " but is " + actual.describe());
    }
  }

  /** Validates the contained expressions, then the operation's own signature. */
  @Override
  public void validate() throws SortMismatchException {
    for (Expression expression : expressions()) {
      expression.validate();
    }
    checkSignature();
  }

  public Kind kind() {
    return kind;
  }

  /** Variable written by {@code let} and {@code load}. */
  public Optional<Variable> target() {
    return Optional.ofNullable(target);
  }

  /** Assigned value of a {@code let}, condition of an assumption or assertion. */
  public Expression expression() {
    if (kind != Kind.LET && kind != Kind.ASSUME && kind != Kind.ASSERT) {
      throw new IllegalStateException("`" + this + "` has no expression");
    }
    return first;
  }

  public Expression address() {
    if (kind != Kind.LOAD && kind != Kind.STORE) {
      throw new IllegalStateException("`" + this + "` does not access memory");
    }
    return first;
  }

  /** Stored value of a {@code store}. */
  public Expression value() {
    if (kind != Kind.STORE) {
      throw new IllegalStateException("`" + this + "` is not a store");
    }
    return second;
  }

  public boolean accessesMemory() {
    return kind == Kind.LOAD || kind == Kind.STORE;
  }

  public List<Expression> expressions() {
    List<Expression> result = new ArrayList<>(2);
    if (first != null) {
      result.add(first);
    }
    if (second != null) {
      result.add(second);
    }
    return result;
  }

  /** Variables read by this operation. */
  public Set<Variable> usedVariables() {
    Set<Variable> used = new TreeSet<>();
    for (Expression expression : expressions()) {
      used.addAll(expression.variables());
    }
    return used;
  }

  /** Rewrites every contained expression; the rewriter must preserve sorts. */
  public Operation mapExpressions(UnaryOperator<Expression> rewriter) {
    if (first == null) {
      return this;
    }
    Expression newFirst = rewriter.apply(first);
    Expression newSecond = second == null ? null : rewriter.apply(second);
    if (!newFirst.sort().equals(first.sort())
        || (second != null && !newSecond.sort().equals(second.sort()))) {
      throw new IllegalArgumentException("rewriting `" + this + "` changed an operand sort");
    }
    if (newFirst.equals(first) && Objects.equals(newSecond, second)) {
      return this;
    }
    return new Operation(kind, target, newFirst, newSecond);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Operation other)) {
      return false;
    }
    return kind == other.kind
        && Objects.equals(target, other.target)
        && Objects.equals(first, other.first)
        && Objects.equals(second, other.second);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, target, first, second);
  }

  @Override
  public String toString() {
    return switch (kind) {
      case LET -> "let " + target + " = " + first;
      case ASSUME -> "assume " + first;
      case ASSERT -> "assert " + first;
      case LOAD -> "load " + target + " <- [" + first + "]";
      case STORE -> "store [" + first + "] <- " + second;
      case BARRIER -> "barrier";
      case FLUSH -> "flush";
    };
  }
}
