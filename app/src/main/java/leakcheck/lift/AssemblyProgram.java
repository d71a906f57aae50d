package leakcheck.lift;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import leakcheck.diagnostics.SortMismatchException;
import leakcheck.diagnostics.TranslationException;
import leakcheck.ir.Expression;
import leakcheck.ir.Variable;
import leakcheck.pass.TryTranslateInto;
import leakcheck.program.Block;
import leakcheck.program.BlockGraph;
import leakcheck.program.Operation;
import leakcheck.program.Program;

/**
 * A parsed µASM program: instructions in address order plus the labels pointing into them.
 *
 * <p>Translation gives every instruction its own block, keyed and addressed by the instruction
 * address, and appends one empty exit block right after the last instruction. Labels that close
 * the program and fall-through from the last instruction lead to that exit block.
 */
public final class AssemblyProgram implements TryTranslateInto<Program> {
  /** Register width in bits. */
  public static final int WORD_SIZE = 64;

  private final String name;
  private final List<AssemblyInstruction> instructions;
  private final Map<String, Integer> labels;

  public AssemblyProgram(
      String name, List<AssemblyInstruction> instructions, Map<String, Integer> labels) {
    this.name = Objects.requireNonNull(name, "name");
    this.instructions = List.copyOf(instructions);
    this.labels = Collections.unmodifiableMap(new LinkedHashMap<>(labels));
  }

  public String name() {
    return name;
  }

  public List<AssemblyInstruction> instructions() {
    return instructions;
  }

  public Map<String, Integer> labels() {
    return labels;
  }

  @Override
  public Program tryTranslateInto() throws TranslationException {
    int exit = instructions.size();
    BlockGraph graph = new BlockGraph();
    try {
      for (AssemblyInstruction instruction : instructions) {
        int address = instruction.address();
        graph.addBlock(new Block(address, address, operations(instruction)));
      }
      graph.addBlock(Block.of(exit));
      for (AssemblyInstruction instruction : instructions) {
        int address = instruction.address();
        switch (instruction.opcode()) {
          case JUMP -> graph.addEdge(address, resolve(instruction));
          case BRANCH_IF_ZERO -> {
            Expression register = instruction.register().orElseThrow().toExpression();
            Expression isZero =
                Expression.equal(register, Expression.bitVector(0, WORD_SIZE));
            graph.addBranch(address, resolve(instruction), address + 1, isZero);
          }
          default -> graph.addEdge(address, address + 1);
        }
      }
    } catch (SortMismatchException ex) {
      throw new TranslationException("program " + name + ": " + ex.getMessage(), ex);
    }
    graph.setEntry(0);
    graph.addExit(exit);
    return new Program(name, graph);
  }

  private static List<Operation> operations(AssemblyInstruction instruction)
      throws SortMismatchException {
    List<Operation> operations = new ArrayList<>();
    switch (instruction.opcode()) {
      case BARRIER -> operations.add(Operation.barrier());
      case FLUSH -> operations.add(Operation.flush());
      case ASSIGN ->
          operations.add(
              Operation.let(
                  instruction.register().orElseThrow(), instruction.expression().orElseThrow()));
      case CONDITIONAL_ASSIGN -> {
        Variable register = instruction.register().orElseThrow();
        Expression condition =
            Expression.unequal(
                instruction.condition().orElseThrow(), Expression.bitVector(0, WORD_SIZE));
        operations.add(
            Operation.let(
                register,
                Expression.ite(
                    condition, instruction.expression().orElseThrow(), register.toExpression())));
      }
      case LOAD ->
          operations.add(
              Operation.load(
                  instruction.register().orElseThrow(), instruction.expression().orElseThrow()));
      case STORE ->
          operations.add(
              Operation.store(
                  instruction.expression().orElseThrow(),
                  instruction.register().orElseThrow().toExpression()));
      default -> {
        // skip and control flow carry no operations
      }
    }
    return operations;
  }

  private int resolve(AssemblyInstruction instruction) throws TranslationException {
    String target = instruction.target().orElseThrow();
    Integer address = labels.get(target);
    if (address == null) {
      address = parseAddress(target);
    }
    if (address == null) {
      throw new TranslationException(
          "line "
              + instruction.line()
              + ": unknown label `"
              + target
              + "` in `"
              + instruction
              + "`");
    }
    if (address < 0 || address > instructions.size()) {
      throw new TranslationException(
          "line "
              + instruction.line()
              + ": jump target "
              + address
              + " is outside the program in `"
              + instruction
              + "`");
    }
    return address;
  }

  private static Integer parseAddress(String target) {
    try {
      return Integer.decode(target);
    } catch (NumberFormatException ex) {
      return null;
    }
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    Map<Integer, List<String>> labelsAt = new LinkedHashMap<>();
    labels.forEach(
        (label, address) -> labelsAt.computeIfAbsent(address, a -> new ArrayList<>()).add(label));
    for (AssemblyInstruction instruction : instructions) {
      for (String label : labelsAt.getOrDefault(instruction.address(), List.of())) {
        sb.append(label).append(":\n");
      }
      sb.append("  ").append(instruction).append('\n');
    }
    for (String label : labelsAt.getOrDefault(instructions.size(), List.of())) {
      sb.append(label).append(":\n");
    }
    return sb.toString();
  }
}
