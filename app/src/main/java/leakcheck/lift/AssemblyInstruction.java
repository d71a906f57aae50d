package leakcheck.lift;

import java.util.Objects;
import java.util.Optional;
import leakcheck.ir.Expression;
import leakcheck.ir.Variable;

/**
 * One parsed µASM instruction. Registers and expressions are 64-bit bit-vectors.
 *
 * @param address position of the instruction in the program, starting at 0
 * @param line source line the instruction was parsed from
 * @param target jump target as written: a label or an instruction address
 */
public record AssemblyInstruction(
    int address,
    int line,
    Opcode opcode,
    Optional<Variable> register,
    Optional<Expression> expression,
    Optional<Expression> condition,
    Optional<String> target) {

  /** The µASM instruction set. */
  public enum Opcode {
    SKIP,
    BARRIER,
    FLUSH,
    ASSIGN,
    CONDITIONAL_ASSIGN,
    LOAD,
    STORE,
    JUMP,
    BRANCH_IF_ZERO
  }

  public AssemblyInstruction {
    Objects.requireNonNull(opcode, "opcode");
    Objects.requireNonNull(register, "register");
    Objects.requireNonNull(expression, "expression");
    Objects.requireNonNull(condition, "condition");
    Objects.requireNonNull(target, "target");
  }

  static AssemblyInstruction simple(int address, int line, Opcode opcode) {
    return new AssemblyInstruction(
        address,
        line,
        opcode,
        Optional.empty(),
        Optional.empty(),
        Optional.empty(),
        Optional.empty());
  }

  /** {@code register <- expression}, or {@code load}/{@code store} of register at address. */
  static AssemblyInstruction withRegister(
      int address, int line, Opcode opcode, Variable register, Expression expression) {
    return new AssemblyInstruction(
        address,
        line,
        opcode,
        Optional.of(register),
        Optional.of(expression),
        Optional.empty(),
        Optional.empty());
  }

  static AssemblyInstruction conditionalAssign(
      int address, int line, Expression condition, Variable register, Expression expression) {
    return new AssemblyInstruction(
        address,
        line,
        Opcode.CONDITIONAL_ASSIGN,
        Optional.of(register),
        Optional.of(expression),
        Optional.of(condition),
        Optional.empty());
  }

  static AssemblyInstruction jump(int address, int line, String target) {
    return new AssemblyInstruction(
        address,
        line,
        Opcode.JUMP,
        Optional.empty(),
        Optional.empty(),
        Optional.empty(),
        Optional.of(target));
  }

  static AssemblyInstruction branchIfZero(int address, int line, Variable register, String target) {
    return new AssemblyInstruction(
        address,
        line,
        Opcode.BRANCH_IF_ZERO,
        Optional.of(register),
        Optional.empty(),
        Optional.empty(),
        Optional.of(target));
  }

  @Override
  public String toString() {
    String reg = register.map(Variable::name).orElse("");
    String expr = expression.map(Expression::toString).orElse("");
    return switch (opcode) {
      case SKIP -> "skip";
      case BARRIER -> "spbarr";
      case FLUSH -> "flush";
      case ASSIGN -> reg + " <- " + expr;
      case CONDITIONAL_ASSIGN -> "cmov " + condition.orElseThrow() + ", " + reg + " <- " + expr;
      case LOAD -> "load " + reg + ", " + expr;
      case STORE -> "store " + reg + ", " + expr;
      case JUMP -> "jmp " + target.orElseThrow();
      case BRANCH_IF_ZERO -> "beqz " + reg + ", " + target.orElseThrow();
    };
  }
}
