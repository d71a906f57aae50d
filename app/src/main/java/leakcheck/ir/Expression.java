package leakcheck.ir;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Predicate;
import leakcheck.diagnostics.SortMismatchException;
import leakcheck.ir.Operator.Opcode;
import leakcheck.pass.Validate;

/**
 * Immutable symbolic term: a constant, a variable, or an operator applied to operands.
 *
 * <p>The static factories ({@link #and}, {@link #add}, ...) type-check their operands and throw
 * {@link SortMismatchException} right away. {@link #apply} builds a term without checking; such
 * terms are rejected later by {@link #validate()}.
 */
public final class Expression implements Validate {
  private final Operator operator;
  private final List<Expression> operands;
  private final Constant constant;
  private final Variable variable;
  private final Sort sort;
  private final int hash;

  private Expression(
      Operator operator, List<Expression> operands, Constant constant, Variable variable) {
    this.operator = operator;
    this.operands = operands;
    this.constant = constant;
    this.variable = variable;
    if (constant != null) {
      this.sort = constant.sort();
    } else if (variable != null) {
      this.sort = variable.sort();
    } else {
      List<Sort> operandSorts = new ArrayList<>(operands.size());
      for (Expression operand : operands) {
        operandSorts.add(operand.sort());
      }
      this.sort = operator.resultSort(operandSorts);
    }
    this.hash = Objects.hash(operator, operands, constant, variable);
  }

  public static Expression constant(Constant constant) {
    return new Expression(null, List.of(), Objects.requireNonNull(constant, "constant"), null);
  }

  public static Expression variable(Variable variable) {
    return new Expression(null, List.of(), null, Objects.requireNonNull(variable, "variable"));
  }

  public static Expression bool(boolean value) {
    return constant(Constant.bool(value));
  }

  public static Expression bitVector(long value, int width) {
    return constant(Constant.bitVector(value, width));
  }

  /** Applies {@code operator} without checking operand sorts. */
  public static Expression apply(Operator operator, List<Expression> operands) {
    Objects.requireNonNull(operator, "operator");
    Objects.requireNonNull(operands, "operands");
    if (operands.isEmpty()) {
      throw new IllegalArgumentException("operator `" + operator + "` needs operands");
    }
    return new Expression(operator, List.copyOf(operands), null, null);
  }

  public static Expression apply(Opcode opcode, Expression... operands) {
    return apply(Operator.of(opcode), Arrays.asList(operands));
  }

  /** Applies {@code operator} after checking operand sorts against its signature. */
  public static Expression checked(Operator operator, List<Expression> operands)
      throws SortMismatchException {
    Expression expression = apply(operator, operands);
    expression.checkOwnSignature();
    return expression;
  }

  private static Expression checked(Opcode opcode, Expression... operands)
      throws SortMismatchException {
    return checked(Operator.of(opcode), Arrays.asList(operands));
  }

  public static Expression ite(Expression condition, Expression then, Expression otherwise)
      throws SortMismatchException {
    return checked(Opcode.ITE, condition, then, otherwise);
  }

  public static Expression equal(Expression lhs, Expression rhs) throws SortMismatchException {
    return checked(Opcode.EQUAL, lhs, rhs);
  }

  public static Expression unequal(Expression lhs, Expression rhs) throws SortMismatchException {
    return checked(Opcode.UNEQUAL, lhs, rhs);
  }

  public static Expression not(Expression operand) throws SortMismatchException {
    return checked(Opcode.NOT, operand);
  }

  public static Expression and(Expression lhs, Expression rhs) throws SortMismatchException {
    return checked(Opcode.AND, lhs, rhs);
  }

  public static Expression or(Expression lhs, Expression rhs) throws SortMismatchException {
    return checked(Opcode.OR, lhs, rhs);
  }

  public static Expression xor(Expression lhs, Expression rhs) throws SortMismatchException {
    return checked(Opcode.XOR, lhs, rhs);
  }

  public static Expression imply(Expression lhs, Expression rhs) throws SortMismatchException {
    return checked(Opcode.IMPLY, lhs, rhs);
  }

  /** Conjunction of all operands; {@code true} when empty. */
  public static Expression conjunction(List<Expression> operands) throws SortMismatchException {
    Expression result = null;
    for (Expression operand : operands) {
      result = result == null ? checkedBool(operand) : and(result, operand);
    }
    return result == null ? bool(true) : result;
  }

  private static Expression checkedBool(Expression operand) throws SortMismatchException {
    operand.sort().expectBool();
    return operand;
  }

  public static Expression add(Expression lhs, Expression rhs) throws SortMismatchException {
    return checked(Opcode.BV_ADD, lhs, rhs);
  }

  public static Expression sub(Expression lhs, Expression rhs) throws SortMismatchException {
    return checked(Opcode.BV_SUB, lhs, rhs);
  }

  public static Expression mul(Expression lhs, Expression rhs) throws SortMismatchException {
    return checked(Opcode.BV_MUL, lhs, rhs);
  }

  public static Expression udiv(Expression lhs, Expression rhs) throws SortMismatchException {
    return checked(Opcode.BV_UDIV, lhs, rhs);
  }

  public static Expression urem(Expression lhs, Expression rhs) throws SortMismatchException {
    return checked(Opcode.BV_UREM, lhs, rhs);
  }

  public static Expression bvAnd(Expression lhs, Expression rhs) throws SortMismatchException {
    return checked(Opcode.BV_AND, lhs, rhs);
  }

  public static Expression bvOr(Expression lhs, Expression rhs) throws SortMismatchException {
    return checked(Opcode.BV_OR, lhs, rhs);
  }

  public static Expression bvXor(Expression lhs, Expression rhs) throws SortMismatchException {
    return checked(Opcode.BV_XOR, lhs, rhs);
  }

  public static Expression bvNot(Expression operand) throws SortMismatchException {
    return checked(Opcode.BV_NOT, operand);
  }

  public static Expression neg(Expression operand) throws SortMismatchException {
    return checked(Opcode.BV_NEG, operand);
  }

  public static Expression shl(Expression lhs, Expression rhs) throws SortMismatchException {
    return checked(Opcode.BV_SHL, lhs, rhs);
  }

  public static Expression lshr(Expression lhs, Expression rhs) throws SortMismatchException {
    return checked(Opcode.BV_LSHR, lhs, rhs);
  }

  public static Expression ashr(Expression lhs, Expression rhs) throws SortMismatchException {
    return checked(Opcode.BV_ASHR, lhs, rhs);
  }

  public static Expression ult(Expression lhs, Expression rhs) throws SortMismatchException {
    return checked(Opcode.BV_ULT, lhs, rhs);
  }

  public static Expression ule(Expression lhs, Expression rhs) throws SortMismatchException {
    return checked(Opcode.BV_ULE, lhs, rhs);
  }

  public static Expression slt(Expression lhs, Expression rhs) throws SortMismatchException {
    return checked(Opcode.BV_SLT, lhs, rhs);
  }

  public static Expression sle(Expression lhs, Expression rhs) throws SortMismatchException {
    return checked(Opcode.BV_SLE, lhs, rhs);
  }

  /** Concatenates operands, the first one ending up in the most significant bits. */
  public static Expression concat(List<Expression> operands) throws SortMismatchException {
    return checked(Operator.of(Opcode.CONCAT), operands);
  }

  public static Expression extract(int highestBit, int lowestBit, Expression operand)
      throws SortMismatchException {
    return checked(Operator.extract(highestBit, lowestBit), List.of(operand));
  }

  public static Expression zeroExtend(int width, Expression operand) throws SortMismatchException {
    return checked(Operator.zeroExtend(width), List.of(operand));
  }

  public static Expression signExtend(int width, Expression operand) throws SortMismatchException {
    return checked(Operator.signExtend(width), List.of(operand));
  }

  public static Expression truncate(int width, Expression operand) throws SortMismatchException {
    return checked(Operator.truncate(width), List.of(operand));
  }

  /** Resizes a bit-vector to {@code width} bits by zero-extending or truncating as needed. */
  public static Expression resize(int width, Expression operand) throws SortMismatchException {
    operand.sort().expectBitVector();
    int current = operand.sort().width();
    if (current == width) {
      return operand;
    }
    return current < width ? zeroExtend(width, operand) : truncate(width, operand);
  }

  public static Expression load(int width, Expression memory, Expression address)
      throws SortMismatchException {
    return checked(Operator.load(width), List.of(memory, address));
  }

  public static Expression store(Expression memory, Expression address, Expression value)
      throws SortMismatchException {
    return checked(Operator.of(Opcode.STORE), List.of(memory, address, value));
  }

  public Sort sort() {
    return sort;
  }

  public boolean isConstant() {
    return constant != null;
  }

  public boolean isVariable() {
    return variable != null;
  }

  /** The literal of a constant leaf. */
  public Constant constant() {
    if (constant == null) {
      throw new IllegalStateException(this + " is not a constant");
    }
    return constant;
  }

  /** The variable of a variable leaf. */
  public Variable variable() {
    if (variable == null) {
      throw new IllegalStateException(this + " is not a variable");
    }
    return variable;
  }

  public boolean isApplication() {
    return operator != null;
  }

  public Operator operator() {
    if (operator == null) {
      throw new IllegalStateException(this + " is a leaf");
    }
    return operator;
  }

  public boolean hasOpcode(Opcode opcode) {
    return operator != null && operator.opcode() == opcode;
  }

  public List<Expression> operands() {
    return operands;
  }

  public Expression operand(int index) {
    return operands.get(index);
  }

  /** Checks every operator application in this term, innermost first. */
  @Override
  public void validate() throws SortMismatchException {
    for (Expression operand : operands) {
      operand.validate();
    }
    if (operator != null) {
      checkOwnSignature();
    }
  }

  private void checkOwnSignature() throws SortMismatchException {
    List<Sort> operandSorts = new ArrayList<>(operands.size());
    for (Expression operand : operands) {
      operandSorts.add(operand.sort());
    }
    try {
      operator.checkOperands(operandSorts);
    } catch (SortMismatchException ex) {
      throw new SortMismatchException("in " + this + ": " + ex.getMessage());
    }
  }

  /** Free variables in name order. */
  public SortedSet<Variable> variables() {
    SortedSet<Variable> result = new TreeSet<>();
    collectVariables(result);
    return Collections.unmodifiableSortedSet(result);
  }

  private void collectVariables(Set<Variable> into) {
    if (variable != null) {
      into.add(variable);
      return;
    }
    for (Expression operand : operands) {
      operand.collectVariables(into);
    }
  }

  public boolean dependsOn(Predicate<Variable> predicate) {
    if (variable != null) {
      return predicate.test(variable);
    }
    for (Expression operand : operands) {
      if (operand.dependsOn(predicate)) {
        return true;
      }
    }
    return false;
  }

  public boolean dependsOn(Set<Variable> variables) {
    return dependsOn(variables::contains);
  }

  /** Replaces variables by the mapped terms; the replacement must have the variable's sort. */
  public Expression substitute(Map<Variable, Expression> replacements) {
    if (replacements.isEmpty()) {
      return this;
    }
    if (variable != null) {
      Expression replacement = replacements.get(variable);
      if (replacement == null) {
        return this;
      }
      if (!replacement.sort().equals(variable.sort())) {
        throw new IllegalArgumentException(
            "cannot replace " + variable + " by " + replacement + " of another sort");
      }
      return replacement;
    }
    if (operator == null) {
      return this;
    }
    List<Expression> replaced = new ArrayList<>(operands.size());
    boolean changed = false;
    for (Expression operand : operands) {
      Expression next = operand.substitute(replacements);
      changed |= next != operand;
      replaced.add(next);
    }
    return changed ? new Expression(operator, List.copyOf(replaced), null, null) : this;
  }

  /** Number of nodes in the term tree. */
  public int size() {
    int size = 1;
    for (Expression operand : operands) {
      size += operand.size();
    }
    return size;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Expression other)) {
      return false;
    }
    return hash == other.hash
        && Objects.equals(operator, other.operator)
        && Objects.equals(constant, other.constant)
        && Objects.equals(variable, other.variable)
        && operands.equals(other.operands);
  }

  @Override
  public int hashCode() {
    return hash;
  }

  @Override
  public String toString() {
    if (constant != null) {
      return constant.toString();
    }
    if (variable != null) {
      return variable.toString();
    }
    StringBuilder sb = new StringBuilder("(").append(operator);
    for (Expression operand : operands) {
      sb.append(' ').append(operand);
    }
    return sb.append(')').toString();
  }
}
